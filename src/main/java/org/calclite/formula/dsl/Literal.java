package org.calclite.formula.dsl;

import java.util.Objects;

/**
 * Literal constant: 'East', 42, 3.5, TRUE, NULL.
 * 
 * @param value    Long for INTEGER, Double for REAL, Boolean for BOOLEAN,
 *                 String for STRING, null for NULL
 * @param dataType The literal type
 */
public record Literal(Object value, DataType dataType) implements FormulaNode {

    public enum DataType {
        STRING, INTEGER, REAL, BOOLEAN, NULL
    }

    public static final Literal NULL = new Literal(null, DataType.NULL);

    public Literal {
        Objects.requireNonNull(dataType, "Data type cannot be null");
        if (dataType == DataType.NULL && value != null) {
            throw new IllegalArgumentException("NULL literal cannot carry a value");
        }
        if (dataType != DataType.NULL && value == null) {
            throw new IllegalArgumentException(dataType + " literal requires a value");
        }
    }

    public static Literal string(String value) {
        return new Literal(value, DataType.STRING);
    }

    public static Literal integer(long value) {
        return new Literal(value, DataType.INTEGER);
    }

    public static Literal real(double value) {
        return new Literal(value, DataType.REAL);
    }

    public static Literal bool(boolean value) {
        return new Literal(value, DataType.BOOLEAN);
    }

    public boolean isNumeric() {
        return dataType == DataType.INTEGER || dataType == DataType.REAL;
    }

    public boolean isZero() {
        return isNumeric() && ((Number) value).doubleValue() == 0.0;
    }

    @Override
    public <R> R accept(FormulaNodeVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}
