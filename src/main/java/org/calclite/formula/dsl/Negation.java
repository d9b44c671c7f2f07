package org.calclite.formula.dsl;

import java.util.Objects;

/**
 * Unary minus on a non-literal operand: -[Profit], -(2 ^ 2)
 */
public record Negation(FormulaNode operand) implements FormulaNode {

    public Negation {
        Objects.requireNonNull(operand, "Operand cannot be null");
    }

    @Override
    public <R> R accept(FormulaNodeVisitor<R> visitor) {
        return visitor.visitNegation(this);
    }
}
