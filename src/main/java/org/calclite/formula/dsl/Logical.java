package org.calclite.formula.dsl;

import java.util.Objects;

/**
 * Boolean expression: a AND b, a OR b, NOT a.
 * 
 * @param right The right operand; null for NOT
 */
public record Logical(Operator operator, FormulaNode left, FormulaNode right) implements FormulaNode {

    public enum Operator {
        AND, OR, NOT
    }

    public Logical {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(left, "Operand cannot be null");
        if ((operator == Operator.NOT) != (right == null)) {
            throw new IllegalArgumentException(operator + " has the wrong number of operands");
        }
    }

    public static Logical and(FormulaNode left, FormulaNode right) {
        return new Logical(Operator.AND, left, right);
    }

    public static Logical or(FormulaNode left, FormulaNode right) {
        return new Logical(Operator.OR, left, right);
    }

    public static Logical not(FormulaNode operand) {
        return new Logical(Operator.NOT, operand, null);
    }

    @Override
    public <R> R accept(FormulaNodeVisitor<R> visitor) {
        return visitor.visitLogical(this);
    }
}
