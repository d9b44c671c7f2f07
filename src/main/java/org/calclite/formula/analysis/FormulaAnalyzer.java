package org.calclite.formula.analysis;

import org.calclite.engine.transpiler.FunctionRegistry;
import org.calclite.formula.dsl.Arithmetic;
import org.calclite.formula.dsl.Case;
import org.calclite.formula.dsl.Comparison;
import org.calclite.formula.dsl.Conditional;
import org.calclite.formula.dsl.Fallback;
import org.calclite.formula.dsl.FieldRef;
import org.calclite.formula.dsl.FormulaNode;
import org.calclite.formula.dsl.FormulaNodeVisitor;
import org.calclite.formula.dsl.FunctionCall;
import org.calclite.formula.dsl.Literal;
import org.calclite.formula.dsl.Logical;
import org.calclite.formula.dsl.Negation;
import org.calclite.formula.dsl.ScopedAggregate;
import org.calclite.formula.dsl.WindowCall;
import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.factory.SortedSets;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.sorted.MutableSortedSet;

import java.util.Objects;

/**
 * Walks a formula AST and reports its field dependencies, complexity and
 * confidence. Analysis is read-only and an analyzer can be shared between
 * threads.
 */
public final class FormulaAnalyzer {

    public static final int DEFAULT_MAX_SIMPLE_DEPTH = 3;
    public static final int DEFAULT_MAX_MEDIUM_DEPTH = 6;
    public static final double DEFAULT_FALLBACK_PENALTY = 0.3;
    public static final double DEFAULT_UNKNOWN_FUNCTION_PENALTY = 0.1;

    private final FunctionRegistry registry;
    private final int maxSimpleDepth;
    private final int maxMediumDepth;
    private final double fallbackPenalty;
    private final double unknownFunctionPenalty;

    public FormulaAnalyzer(
            FunctionRegistry registry,
            int maxSimpleDepth,
            int maxMediumDepth,
            double fallbackPenalty,
            double unknownFunctionPenalty) {
        this.registry = Objects.requireNonNull(registry, "Function registry cannot be null");
        if (maxSimpleDepth < 1 || maxMediumDepth < maxSimpleDepth) {
            throw new IllegalArgumentException("Depth thresholds must satisfy 1 <= simple <= medium, got "
                    + maxSimpleDepth + " and " + maxMediumDepth);
        }
        if (!isPenalty(fallbackPenalty) || !isPenalty(unknownFunctionPenalty)) {
            throw new IllegalArgumentException("Penalties must be within [0, 1], got "
                    + fallbackPenalty + " and " + unknownFunctionPenalty);
        }
        this.maxSimpleDepth = maxSimpleDepth;
        this.maxMediumDepth = maxMediumDepth;
        this.fallbackPenalty = fallbackPenalty;
        this.unknownFunctionPenalty = unknownFunctionPenalty;
    }

    public FormulaAnalyzer(FunctionRegistry registry) {
        this(registry, DEFAULT_MAX_SIMPLE_DEPTH, DEFAULT_MAX_MEDIUM_DEPTH,
                DEFAULT_FALLBACK_PENALTY, DEFAULT_UNKNOWN_FUNCTION_PENALTY);
    }

    private static boolean isPenalty(double value) {
        return value >= 0.0 && value <= 1.0;
    }

    /**
     * Analyzes a formula AST.
     *
     * @param root The root node
     * @return Dependencies, complexity and confidence of the tree
     */
    public AnalysisResult analyze(FormulaNode root) {
        Objects.requireNonNull(root, "Formula node cannot be null");
        Walker walker = new Walker();
        int depth = root.accept(walker);

        return new AnalysisResult(
                walker.dependencies.toImmutable(),
                classify(walker, depth),
                confidence(walker),
                depth,
                walker.nodeCount,
                walker.fallbackCount,
                walker.unsupportedCallCount);
    }

    private Complexity classify(Walker walker, int depth) {
        if (walker.hasScopedAggregate || walker.hasWindowCall || walker.hasNestedCase
                || walker.fallbackCount > 0 || depth > maxMediumDepth) {
            return Complexity.COMPLEX;
        }
        if (walker.hasConditional || walker.hasCase || walker.hasFunctionCall || depth > maxSimpleDepth) {
            return Complexity.MEDIUM;
        }
        return Complexity.SIMPLE;
    }

    /**
     * 1.0, minus a fixed penalty per fallback, minus the fallback share of the
     * tree scaled by what the fixed penalty left over, minus a smaller penalty
     * per call the generator cannot render; clamped to [0, 1].
     */
    private double confidence(Walker walker) {
        double fallbackFraction = (double) walker.fallbackCount / walker.nodeCount;
        double score = 1.0
                - fallbackPenalty * walker.fallbackCount
                - fallbackFraction * (1.0 - fallbackPenalty)
                - unknownFunctionPenalty * walker.unsupportedCallCount;
        return Math.max(0.0, Math.min(1.0, score));
    }

    /**
     * Collects facts in one pass; each visit returns the depth of its subtree.
     */
    private final class Walker implements FormulaNodeVisitor<Integer> {

        private final MutableSortedSet<String> dependencies = SortedSets.mutable.empty();
        private int nodeCount;
        private int fallbackCount;
        private int unsupportedCallCount;
        private int caseNesting;

        private boolean hasConditional;
        private boolean hasCase;
        private boolean hasNestedCase;
        private boolean hasFunctionCall;
        private boolean hasScopedAggregate;
        private boolean hasWindowCall;

        private int depthOf(FormulaNode node) {
            return node == null ? 0 : node.accept(this);
        }

        @Override
        public Integer visitLiteral(Literal literal) {
            nodeCount++;
            return 1;
        }

        @Override
        public Integer visitFieldRef(FieldRef fieldRef) {
            nodeCount++;
            dependencies.add(fieldRef.normalizedName());
            return 1;
        }

        @Override
        public Integer visitArithmetic(Arithmetic arithmetic) {
            nodeCount++;
            return 1 + Math.max(depthOf(arithmetic.left()), depthOf(arithmetic.right()));
        }

        @Override
        public Integer visitComparison(Comparison comparison) {
            nodeCount++;
            return 1 + Math.max(depthOf(comparison.left()), depthOf(comparison.right()));
        }

        @Override
        public Integer visitLogical(Logical logical) {
            nodeCount++;
            return 1 + Math.max(depthOf(logical.left()), depthOf(logical.right()));
        }

        @Override
        public Integer visitNegation(Negation negation) {
            nodeCount++;
            return 1 + depthOf(negation.operand());
        }

        /**
         * ELSEIF chains nest through the else branch and can be long, so the
         * chain is walked in a loop and its depths are folded from the end.
         */
        @Override
        public Integer visitConditional(Conditional conditional) {
            hasConditional = true;
            MutableList<Conditional> chain = Lists.mutable.empty();
            FormulaNode current = conditional;
            while (current instanceof Conditional link) {
                chain.add(link);
                current = link.elseBranch();
            }
            nodeCount += chain.size();

            int depth = depthOf(current);
            for (Conditional link : chain.asReversed()) {
                depth = 1 + Math.max(depth, Math.max(depthOf(link.condition()), depthOf(link.thenBranch())));
            }
            return depth;
        }

        @Override
        public Integer visitCase(Case caseNode) {
            nodeCount++;
            hasCase = true;
            if (caseNesting > 0) {
                hasNestedCase = true;
            }
            caseNesting++;
            int deepest = depthOf(caseNode.subject());
            for (Case.WhenClause clause : caseNode.whenClauses()) {
                deepest = Math.max(deepest, Math.max(depthOf(clause.match()), depthOf(clause.result())));
            }
            deepest = Math.max(deepest, depthOf(caseNode.elseBranch()));
            caseNesting--;
            return 1 + deepest;
        }

        @Override
        public Integer visitFunctionCall(FunctionCall call) {
            nodeCount++;
            hasFunctionCall = true;
            if (registry.problemWith(call) != null) {
                unsupportedCallCount++;
            }
            int deepest = 0;
            for (FormulaNode argument : call.arguments()) {
                deepest = Math.max(deepest, depthOf(argument));
            }
            return 1 + deepest;
        }

        @Override
        public Integer visitScopedAggregate(ScopedAggregate aggregate) {
            nodeCount++;
            hasScopedAggregate = true;
            int deepest = depthOf(aggregate.expression());
            for (FieldRef dimension : aggregate.dimensions()) {
                deepest = Math.max(deepest, depthOf(dimension));
            }
            return 1 + deepest;
        }

        @Override
        public Integer visitWindowCall(WindowCall window) {
            nodeCount++;
            hasWindowCall = true;
            if (!registry.isKnown(window.name())) {
                unsupportedCallCount++;
            }
            int deepest = depthOf(window.argument());
            for (FormulaNode extra : window.extraArgs()) {
                deepest = Math.max(deepest, depthOf(extra));
            }
            return 1 + deepest;
        }

        @Override
        public Integer visitFallback(Fallback fallback) {
            nodeCount++;
            fallbackCount++;
            return 1;
        }
    }
}
