package org.calclite.formula.dsl;

/**
 * Sealed interface representing nodes of a parsed calculation formula.
 * 
 * Type hierarchy:
 * FormulaNode
 * ├── Literal, FieldRef (leaves)
 * ├── Arithmetic, Comparison, Logical, Negation (operators)
 * ├── Conditional, Case (control flow)
 * ├── FunctionCall, WindowCall (calls)
 * ├── ScopedAggregate (level of detail expressions)
 * └── Fallback (source text that could not be parsed)
 * 
 * Nodes are immutable; a tree is only ever changed by building a new parent.
 */
public sealed interface FormulaNode
        permits Literal, FieldRef, Arithmetic, Comparison, Logical, Negation,
        Conditional, Case, FunctionCall, ScopedAggregate, WindowCall, Fallback {

    /**
     * Accept method for the node visitor pattern.
     * 
     * @param visitor The visitor to accept
     * @param <R>     The return type of the visitor
     * @return The result of visiting this node
     */
    <R> R accept(FormulaNodeVisitor<R> visitor);
}
