package org.calclite.engine.transpiler;

/**
 * Interface defining SQL dialect-specific behavior.
 * Implementations handle differences between target warehouses.
 */
public interface SQLDialect {

    /**
     * Target types for the INT/FLOAT/STR conversion functions.
     */
    enum CastTarget {
        INTEGER, FLOAT, STRING
    }

    /**
     * @return The dialect name (e.g., "BigQuery", "DuckDB")
     */
    String name();

    /**
     * Quote a string literal value.
     *
     * @param value The string value to quote
     * @return The quoted string literal
     */
    String quoteStringLiteral(String value);

    /**
     * Format a boolean literal.
     *
     * @param value The boolean value
     * @return The SQL boolean representation
     */
    default String formatBoolean(boolean value) {
        return value ? "TRUE" : "FALSE";
    }

    /**
     * Format a NULL literal.
     *
     * @return The SQL NULL representation
     */
    default String formatNull() {
        return "NULL";
    }

    /**
     * @return The function used for {@code base ^ exponent}
     */
    String powerFunction();

    /**
     * @return The SQL type name for a conversion target
     */
    String castType(CastTarget target);

    /**
     * Date arithmetic: DATEADD('month', 3, [Order Date]).
     *
     * @param unit   Upper-case date part (YEAR, MONTH, DAY, HOUR, ...)
     * @param amount Rendered amount expression
     * @param date   Rendered date expression
     */
    String dateAdd(String unit, String amount, String date);

    /**
     * Whole units between two dates: DATEDIFF('day', [Start], [End]).
     */
    String dateDiff(String unit, String start, String end);

    /**
     * Truncates a date to the start of its unit: DATETRUNC('month', [Order Date]).
     */
    String dateTrunc(String unit, String date);

    /**
     * Extracts one part of a date: DATEPART('year', [Order Date]).
     */
    default String datePart(String unit, String date) {
        return "EXTRACT(" + unit + " FROM " + date + ")";
    }

    /**
     * Logarithm of {@code value}; a null base means base 10.
     */
    String logarithm(String value, String base);
}
