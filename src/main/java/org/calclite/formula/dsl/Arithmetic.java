package org.calclite.formula.dsl;

import java.util.Objects;

/**
 * Binary arithmetic expression: left op right
 */
public record Arithmetic(Operator operator, FormulaNode left, FormulaNode right) implements FormulaNode {

    public enum Operator {
        ADD("+"), SUBTRACT("-"), MULTIPLY("*"), DIVIDE("/"), MODULO("%"), POWER("^");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    public Arithmetic {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
    }

    @Override
    public <R> R accept(FormulaNodeVisitor<R> visitor) {
        return visitor.visitArithmetic(this);
    }
}
