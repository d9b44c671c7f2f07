package org.calclite.engine;

import org.calclite.formula.analysis.Complexity;
import org.calclite.formula.dsl.Diagnostic;
import org.calclite.formula.dsl.FormulaNode;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.set.sorted.ImmutableSortedSet;

import java.util.Objects;

/**
 * Everything known about one compiled calculated field.
 *
 * @param name                Field name
 * @param originalFormula     Formula text exactly as given
 * @param ast                 Parsed tree; may contain Fallback nodes
 * @param dependencies        Normalized names of the referenced fields
 * @param complexity          Difficulty class
 * @param confidence          Trust in the translation, in [0, 1]
 * @param diagnostics         Parser diagnostics followed by generator warnings
 * @param generatedExpression SQL expression; never blank
 */
public record CompiledField(
        String name,
        String originalFormula,
        FormulaNode ast,
        ImmutableSortedSet<String> dependencies,
        Complexity complexity,
        double confidence,
        ImmutableList<Diagnostic> diagnostics,
        String generatedExpression) {

    public CompiledField {
        Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(originalFormula, "Original formula cannot be null");
        Objects.requireNonNull(ast, "AST cannot be null");
        Objects.requireNonNull(dependencies, "Dependencies cannot be null");
        Objects.requireNonNull(complexity, "Complexity cannot be null");
        Objects.requireNonNull(diagnostics, "Diagnostics cannot be null");
        Objects.requireNonNull(generatedExpression, "Generated expression cannot be null");
    }

    public boolean hasErrors() {
        return diagnostics.anySatisfy(d -> d.severity() == Diagnostic.Severity.ERROR);
    }

    /**
     * A field is degraded when part of it could not be translated.
     */
    public boolean isDegraded() {
        return diagnostics.anySatisfy(d -> d.severity() != Diagnostic.Severity.INFO);
    }
}
