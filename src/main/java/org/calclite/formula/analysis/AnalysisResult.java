package org.calclite.formula.analysis;

import org.eclipse.collections.api.set.sorted.ImmutableSortedSet;

import java.util.Objects;

/**
 * Facts about one formula AST.
 *
 * @param dependencies              Normalized names of every referenced field, sorted
 * @param complexity                Difficulty class
 * @param confidence                How much of the translation can be trusted, in [0, 1]
 * @param depth                     Height of the tree; a lone leaf has depth 1
 * @param nodeCount                 Number of nodes, dimension references included
 * @param fallbackCount             Number of unparsed fragments
 * @param unsupportedCallCount      Calls the generator cannot render: unknown names,
 *                                  wrong argument counts, unusable date parts
 */
public record AnalysisResult(
        ImmutableSortedSet<String> dependencies,
        Complexity complexity,
        double confidence,
        int depth,
        int nodeCount,
        int fallbackCount,
        int unsupportedCallCount) {

    public AnalysisResult {
        Objects.requireNonNull(dependencies, "Dependencies cannot be null");
        Objects.requireNonNull(complexity, "Complexity cannot be null");
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("Confidence must be within [0, 1]: " + confidence);
        }
    }
}
