package org.calclite.engine.transpiler;

import org.eclipse.collections.api.factory.Sets;
import org.eclipse.collections.api.set.ImmutableSet;

/**
 * SQL dialect implementation for BigQuery, the default target.
 * BigQuery string literals use backslash escapes; time-of-day units need the
 * DATETIME_ family of functions.
 */
public final class BigQueryDialect implements SQLDialect {

    public static final BigQueryDialect INSTANCE = new BigQueryDialect();

    private static final ImmutableSet<String> TIME_UNITS = Sets.immutable.of("HOUR", "MINUTE", "SECOND");

    private BigQueryDialect() {
        // Singleton
    }

    @Override
    public String name() {
        return "BigQuery";
    }

    @Override
    public String quoteStringLiteral(String value) {
        String escaped = value
                .replace("\\", "\\\\")
                .replace("'", "\\'")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
        return "'" + escaped + "'";
    }

    @Override
    public String powerFunction() {
        return "POW";
    }

    @Override
    public String castType(CastTarget target) {
        return switch (target) {
            case INTEGER -> "INT64";
            case FLOAT -> "FLOAT64";
            case STRING -> "STRING";
        };
    }

    @Override
    public String dateAdd(String unit, String amount, String date) {
        String function = TIME_UNITS.contains(unit) ? "DATETIME_ADD" : "DATE_ADD";
        return function + "(" + date + ", INTERVAL " + amount + " " + unit + ")";
    }

    @Override
    public String dateDiff(String unit, String start, String end) {
        String function = TIME_UNITS.contains(unit) ? "DATETIME_DIFF" : "DATE_DIFF";
        return function + "(" + end + ", " + start + ", " + unit + ")";
    }

    @Override
    public String dateTrunc(String unit, String date) {
        String function = TIME_UNITS.contains(unit) ? "DATETIME_TRUNC" : "DATE_TRUNC";
        return function + "(" + date + ", " + unit + ")";
    }

    @Override
    public String logarithm(String value, String base) {
        return "LOG(" + value + ", " + (base == null ? "10" : base) + ")";
    }
}
