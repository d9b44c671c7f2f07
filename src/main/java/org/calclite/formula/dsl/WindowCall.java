package org.calclite.formula.dsl;

import org.eclipse.collections.api.list.ImmutableList;

import java.util.Objects;

/**
 * Table calculation: RUNNING_SUM(SUM([Sales])), WINDOW_AVG([x], -2, 0),
 * RANK([Sales], 'desc'), LAG([x], 1, 0).
 * 
 * @param name      Canonical upper-case function name
 * @param argument  The ordered/aggregated expression; null only for
 *                  argument-less ranking calls such as ROW_NUMBER()
 * @param orderMode Ordering direction of the OVER clause
 * @param frame     Row frame, or null when the function takes none
 * @param extraArgs Remaining arguments (LAG/LEAD offset and default)
 */
public record WindowCall(
        String name,
        FormulaNode argument,
        OrderMode orderMode,
        WindowFrame frame,
        ImmutableList<FormulaNode> extraArgs) implements FormulaNode {

    public enum OrderMode {
        ASC, DESC
    }

    /**
     * Row frame relative to the current row. A null bound is unbounded;
     * negative offsets precede the current row, positive ones follow it.
     */
    public record WindowFrame(Integer startOffset, Integer endOffset) {

        public static final WindowFrame UNBOUNDED_TO_CURRENT = new WindowFrame(null, 0);

        public WindowFrame {
            if (startOffset != null && endOffset != null && startOffset > endOffset) {
                throw new IllegalArgumentException(
                        "Frame start " + startOffset + " is after frame end " + endOffset);
            }
        }
    }

    public WindowCall {
        Objects.requireNonNull(name, "Window function name cannot be null");
        Objects.requireNonNull(orderMode, "Order mode cannot be null");
        Objects.requireNonNull(extraArgs, "Extra arguments cannot be null");
    }

    @Override
    public <R> R accept(FormulaNodeVisitor<R> visitor) {
        return visitor.visitWindowCall(this);
    }
}
