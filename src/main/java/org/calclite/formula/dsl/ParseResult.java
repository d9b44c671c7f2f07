package org.calclite.formula.dsl;

import org.eclipse.collections.api.list.ImmutableList;

import java.util.Objects;

/**
 * Output of the parser: always a root node, plus whatever went wrong.
 */
public record ParseResult(FormulaNode root, ImmutableList<Diagnostic> diagnostics) {

    public ParseResult {
        Objects.requireNonNull(root, "Root cannot be null");
        Objects.requireNonNull(diagnostics, "Diagnostics cannot be null");
    }

    public boolean hasErrors() {
        return diagnostics.anySatisfy(d -> d.severity() == Diagnostic.Severity.ERROR);
    }
}
