package org.calclite.engine;

import org.calclite.engine.transpiler.BigQueryDialect;
import org.calclite.engine.transpiler.DuckDBDialect;
import org.calclite.engine.transpiler.GenerationContext;
import org.calclite.engine.transpiler.SQLDialect;
import org.calclite.formula.analysis.FormulaAnalyzer;
import org.calclite.formula.dsl.FormulaParser;
import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings for a {@link FieldCompiler}.
 *
 * Values come from the classpath resource {@value #RESOURCE} when present,
 * and each key can be overridden by a system property of the same name.
 *
 * @param maxSimpleDepth         Deepest tree still classed SIMPLE
 * @param maxMediumDepth         Deepest tree still classed MEDIUM
 * @param fallbackPenalty        Confidence lost per unparsed fragment
 * @param unknownFunctionPenalty Confidence lost per unknown function
 * @param tableReference         Qualifier for outer columns
 * @param sourceTable            FROM target of level of detail subqueries
 * @param ambientDimensions      Grouping of the surrounding query
 * @param dialect                Target SQL dialect
 * @param maxNestingDepth        Deepest nesting the parser accepts before the
 *                               formula degrades to a fallback
 */
public record CompilerConfig(
        int maxSimpleDepth,
        int maxMediumDepth,
        double fallbackPenalty,
        double unknownFunctionPenalty,
        String tableReference,
        String sourceTable,
        ImmutableList<String> ambientDimensions,
        SQLDialect dialect,
        int maxNestingDepth) {

    public static final String RESOURCE = "calc-lite.properties";

    static final String MAX_SIMPLE_DEPTH = "calclite.analysis.maxSimpleDepth";
    static final String MAX_MEDIUM_DEPTH = "calclite.analysis.maxMediumDepth";
    static final String FALLBACK_PENALTY = "calclite.analysis.fallbackPenalty";
    static final String UNKNOWN_FUNCTION_PENALTY = "calclite.analysis.unknownFunctionPenalty";
    static final String TABLE_REFERENCE = "calclite.sql.tableReference";
    static final String SOURCE_TABLE = "calclite.sql.sourceTable";
    static final String AMBIENT_DIMENSIONS = "calclite.sql.ambientDimensions";
    static final String DIALECT = "calclite.sql.dialect";
    static final String MAX_NESTING_DEPTH = "calclite.parser.maxNestingDepth";

    public CompilerConfig {
        Objects.requireNonNull(tableReference, "Table reference cannot be null");
        Objects.requireNonNull(sourceTable, "Source table cannot be null");
        Objects.requireNonNull(ambientDimensions, "Ambient dimensions cannot be null");
        Objects.requireNonNull(dialect, "Dialect cannot be null");
        if (maxSimpleDepth < 1 || maxMediumDepth < maxSimpleDepth) {
            throw new IllegalArgumentException("Depth thresholds must satisfy 1 <= simple <= medium, got "
                    + maxSimpleDepth + " and " + maxMediumDepth);
        }
        if (fallbackPenalty < 0.0 || fallbackPenalty > 1.0
                || unknownFunctionPenalty < 0.0 || unknownFunctionPenalty > 1.0) {
            throw new IllegalArgumentException("Penalties must be within [0, 1], got "
                    + fallbackPenalty + " and " + unknownFunctionPenalty);
        }
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("Maximum nesting depth must be at least 1, got " + maxNestingDepth);
        }
    }

    public static CompilerConfig defaults() {
        return new CompilerConfig(
                FormulaAnalyzer.DEFAULT_MAX_SIMPLE_DEPTH,
                FormulaAnalyzer.DEFAULT_MAX_MEDIUM_DEPTH,
                FormulaAnalyzer.DEFAULT_FALLBACK_PENALTY,
                FormulaAnalyzer.DEFAULT_UNKNOWN_FUNCTION_PENALTY,
                GenerationContext.DEFAULT_TABLE_REFERENCE,
                GenerationContext.DEFAULT_TABLE_REFERENCE,
                Lists.immutable.empty(),
                BigQueryDialect.INSTANCE,
                FormulaParser.DEFAULT_MAX_DEPTH);
    }

    /**
     * Loads the classpath resource, then applies system property overrides.
     *
     * @throws IllegalArgumentException if a value is malformed or out of range
     */
    public static CompilerConfig load() {
        Properties properties = new Properties();
        try (InputStream in = CompilerConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("calclite.")) {
                properties.setProperty(key, System.getProperty(key));
            }
        }
        return fromProperties(properties);
    }

    /**
     * Builds a config from properties; missing keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value is malformed or out of range
     */
    public static CompilerConfig fromProperties(Properties properties) {
        CompilerConfig defaults = defaults();
        String tableReference = properties.getProperty(TABLE_REFERENCE, defaults.tableReference()).trim();
        return new CompilerConfig(
                intValue(properties, MAX_SIMPLE_DEPTH, defaults.maxSimpleDepth()),
                intValue(properties, MAX_MEDIUM_DEPTH, defaults.maxMediumDepth()),
                doubleValue(properties, FALLBACK_PENALTY, defaults.fallbackPenalty()),
                doubleValue(properties, UNKNOWN_FUNCTION_PENALTY, defaults.unknownFunctionPenalty()),
                tableReference,
                properties.getProperty(SOURCE_TABLE, tableReference).trim(),
                dimensions(properties.getProperty(AMBIENT_DIMENSIONS, "")),
                dialect(properties.getProperty(DIALECT, defaults.dialect().name())),
                intValue(properties, MAX_NESTING_DEPTH, defaults.maxNestingDepth()));
    }

    /**
     * @param name Dialect name, any case
     * @throws IllegalArgumentException for an unsupported dialect
     */
    public static SQLDialect dialect(String name) {
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "bigquery" -> BigQueryDialect.INSTANCE;
            case "duckdb" -> DuckDBDialect.INSTANCE;
            default -> throw new IllegalArgumentException("Unsupported SQL dialect: " + name);
        };
    }

    public GenerationContext generationContext() {
        return new GenerationContext(tableReference, sourceTable, ambientDimensions, dialect);
    }

    public CompilerConfig withDialect(SQLDialect newDialect) {
        return new CompilerConfig(maxSimpleDepth, maxMediumDepth, fallbackPenalty, unknownFunctionPenalty,
                tableReference, sourceTable, ambientDimensions, newDialect, maxNestingDepth);
    }

    public CompilerConfig withAmbientDimensions(String... names) {
        return new CompilerConfig(maxSimpleDepth, maxMediumDepth, fallbackPenalty, unknownFunctionPenalty,
                tableReference, sourceTable, Lists.immutable.of(names), dialect, maxNestingDepth);
    }

    private static ImmutableList<String> dimensions(String value) {
        return Lists.immutable.of(value.split(","))
                .collect(String::trim)
                .reject(String::isEmpty);
    }

    private static int intValue(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private static double doubleValue(Properties properties, String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + value, e);
        }
    }
}
