package org.calclite.engine.transpiler;

import org.calclite.formula.dsl.Diagnostic;
import org.eclipse.collections.api.list.ImmutableList;

import java.util.Objects;

/**
 * A generated SQL expression plus the warnings raised while rendering it.
 */
public record GenerationResult(String expression, ImmutableList<Diagnostic> warnings) {

    public GenerationResult {
        Objects.requireNonNull(expression, "Expression cannot be null");
        Objects.requireNonNull(warnings, "Warnings cannot be null");
        if (expression.isBlank()) {
            throw new IllegalArgumentException("Generated expression must not be blank");
        }
    }

    public boolean isDegraded() {
        return warnings.anySatisfy(w -> w.severity() == Diagnostic.Severity.WARNING);
    }
}
