package org.calclite.formula.analysis;

/**
 * Coarse difficulty class of a formula.
 */
public enum Complexity {
    /** Literals, field references and operators over them */
    SIMPLE,
    /** A conditional, a CASE or a function call */
    MEDIUM,
    /** Level of detail, table calculations, nested CASE, unparsed parts or deep nesting */
    COMPLEX
}
