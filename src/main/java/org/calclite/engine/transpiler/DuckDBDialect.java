package org.calclite.engine.transpiler;

import java.util.Locale;

/**
 * SQL dialect implementation for DuckDB.
 * DuckDB doubles single quotes inside string literals and takes date parts as
 * string arguments.
 */
public final class DuckDBDialect implements SQLDialect {

    public static final DuckDBDialect INSTANCE = new DuckDBDialect();

    private DuckDBDialect() {
        // Singleton
    }

    @Override
    public String name() {
        return "DuckDB";
    }

    @Override
    public String quoteStringLiteral(String value) {
        // Escape any existing single quotes by doubling them
        return "'" + value.replace("'", "''") + "'";
    }

    @Override
    public String powerFunction() {
        return "POWER";
    }

    @Override
    public String castType(CastTarget target) {
        return switch (target) {
            case INTEGER -> "BIGINT";
            case FLOAT -> "DOUBLE";
            case STRING -> "VARCHAR";
        };
    }

    @Override
    public String dateAdd(String unit, String amount, String date) {
        return "(" + date + " + INTERVAL (" + amount + ") " + unit + ")";
    }

    @Override
    public String dateDiff(String unit, String start, String end) {
        return "DATE_DIFF(" + part(unit) + ", " + start + ", " + end + ")";
    }

    @Override
    public String dateTrunc(String unit, String date) {
        return "DATE_TRUNC(" + part(unit) + ", " + date + ")";
    }

    private static String part(String unit) {
        return "'" + unit.toLowerCase(Locale.ROOT) + "'";
    }

    @Override
    public String logarithm(String value, String base) {
        if (base == null) {
            return "LOG10(" + value + ")";
        }
        return "(LN(" + value + ") / LN(" + base + "))";
    }
}
