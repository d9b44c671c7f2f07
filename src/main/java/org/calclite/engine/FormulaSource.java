package org.calclite.engine;

import java.util.Objects;

/**
 * One calculated field as extracted from a workbook: its name and the exact
 * formula text.
 */
public record FormulaSource(String fieldName, String formulaText) {

    public FormulaSource {
        Objects.requireNonNull(fieldName, "Field name cannot be null");
        Objects.requireNonNull(formulaText, "Formula text cannot be null");
    }
}
