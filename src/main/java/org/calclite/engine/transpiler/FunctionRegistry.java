package org.calclite.engine.transpiler;

import org.calclite.engine.transpiler.FunctionSpec.Category;
import org.calclite.formula.dsl.FunctionCall;
import org.calclite.formula.dsl.WindowFunctions;
import org.eclipse.collections.api.factory.Maps;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;

import java.util.Locale;
import java.util.Objects;

/**
 * Read-only table of the functions the generator knows how to render.
 *
 * A registry is built once and never changes; {@link #with(FunctionSpec)} and
 * {@link #without(String)} return new registries.
 */
public final class FunctionRegistry {

    private static final FunctionRegistry DEFAULTS = buildDefaults();

    private final ImmutableMap<String, FunctionSpec> functions;

    private FunctionRegistry(ImmutableMap<String, FunctionSpec> functions) {
        this.functions = functions;
    }

    /**
     * @return The built-in mapping table
     */
    public static FunctionRegistry defaults() {
        return DEFAULTS;
    }

    /**
     * @param name Function name, any case
     * @return The registered function, or null when the function is not registered
     */
    public FunctionSpec lookup(String name) {
        return functions.get(name.toUpperCase(Locale.ROOT));
    }

    public boolean isKnown(String name) {
        return lookup(name) != null;
    }

    /**
     * Checks a call against its registered function: the name, the argument
     * count and, for date functions, the date part.
     *
     * @return Why the call cannot be rendered, or null when it can
     */
    public String problemWith(FunctionCall call) {
        FunctionSpec spec = lookup(call.name());
        if (spec == null || spec.rendering() == FunctionSpec.Rendering.WINDOW) {
            return "Unknown function " + call.name();
        }
        int count = call.arguments().size();
        if (!spec.accepts(count)) {
            return call.name() + " expects " + spec.arityDescription() + ", got " + count;
        }
        if (spec.rendering() == FunctionSpec.Rendering.SPECIAL && DateParts.FUNCTIONS.contains(spec.name())) {
            return DateParts.problemWith(call);
        }
        return null;
    }

    public FunctionRegistry with(FunctionSpec spec) {
        Objects.requireNonNull(spec, "Function spec cannot be null");
        return new FunctionRegistry(functions.newWithKeyValue(spec.name(), spec));
    }

    public FunctionRegistry without(String name) {
        return new FunctionRegistry(functions.newWithoutKey(name.toUpperCase(Locale.ROOT)));
    }

    public int size() {
        return functions.size();
    }

    @Override
    public String toString() {
        return "FunctionRegistry[" + functions.size() + " functions]";
    }

    // ==================== Built-in table ====================

    private static FunctionRegistry buildDefaults() {
        MutableMap<String, FunctionSpec> map = Maps.mutable.empty();

        // Aggregates; MIN/MAX with two arguments are row-level LEAST/GREATEST
        put(map, FunctionSpec.rename("SUM", Category.AGGREGATE, 1, 1, "SUM"));
        put(map, FunctionSpec.rename("COUNT", Category.AGGREGATE, 1, 1, "COUNT"));
        put(map, FunctionSpec.rename("AVG", Category.AGGREGATE, 1, 1, "AVG"));
        put(map, FunctionSpec.special("MIN", Category.AGGREGATE, 1, 2));
        put(map, FunctionSpec.special("MAX", Category.AGGREGATE, 1, 2));
        put(map, FunctionSpec.rename("MEDIAN", Category.AGGREGATE, 1, 1, "MEDIAN"));
        put(map, FunctionSpec.template("COUNTD", Category.AGGREGATE, 1, 1, "COUNT(DISTINCT {0})"));
        put(map, FunctionSpec.rename("STDEV", Category.AGGREGATE, 1, 1, "STDDEV_SAMP"));
        put(map, FunctionSpec.rename("STDEVP", Category.AGGREGATE, 1, 1, "STDDEV_POP"));
        put(map, FunctionSpec.rename("VAR", Category.AGGREGATE, 1, 1, "VAR_SAMP"));
        put(map, FunctionSpec.rename("VARP", Category.AGGREGATE, 1, 1, "VAR_POP"));
        put(map, FunctionSpec.rename("CORR", Category.AGGREGATE, 2, 2, "CORR"));
        put(map, FunctionSpec.rename("COVAR", Category.AGGREGATE, 2, 2, "COVAR_SAMP"));
        put(map, FunctionSpec.rename("COVARP", Category.AGGREGATE, 2, 2, "COVAR_POP"));

        // Strings
        put(map, FunctionSpec.rename("UPPER", Category.STRING, 1, 1, "UPPER"));
        put(map, FunctionSpec.rename("LOWER", Category.STRING, 1, 1, "LOWER"));
        put(map, FunctionSpec.rename("LEN", Category.STRING, 1, 1, "LENGTH"));
        put(map, FunctionSpec.rename("TRIM", Category.STRING, 1, 1, "TRIM"));
        put(map, FunctionSpec.rename("LTRIM", Category.STRING, 1, 1, "LTRIM"));
        put(map, FunctionSpec.rename("RTRIM", Category.STRING, 1, 1, "RTRIM"));
        put(map, FunctionSpec.rename("LEFT", Category.STRING, 2, 2, "LEFT"));
        put(map, FunctionSpec.rename("RIGHT", Category.STRING, 2, 2, "RIGHT"));
        put(map, FunctionSpec.rename("MID", Category.STRING, 2, 3, "SUBSTR"));
        put(map, FunctionSpec.rename("REPLACE", Category.STRING, 3, 3, "REPLACE"));
        put(map, FunctionSpec.rename("ASCII", Category.STRING, 1, 1, "ASCII"));
        put(map, FunctionSpec.rename("CHAR", Category.STRING, 1, 1, "CHR"));
        put(map, FunctionSpec.rename("PROPER", Category.STRING, 1, 1, "INITCAP"));
        put(map, FunctionSpec.template("CONTAINS", Category.STRING, 2, 2, "(STRPOS({0}, {1}) > 0)"));
        put(map, FunctionSpec.template("STARTSWITH", Category.STRING, 2, 2, "STARTS_WITH({0}, {1})"));
        put(map, FunctionSpec.template("ENDSWITH", Category.STRING, 2, 2, "ENDS_WITH({0}, {1})"));
        put(map, FunctionSpec.template("SPACE", Category.STRING, 1, 1, "REPEAT(' ', {0})"));
        put(map, FunctionSpec.template("SPLIT", Category.STRING, 3, 3,
                "SPLIT({0}, {1})[SAFE_OFFSET(CASE WHEN {2} < 0 THEN ARRAY_LENGTH(SPLIT({0}, {1})) + {2} ELSE {2} - 1 END)]"));
        put(map, FunctionSpec.special("FIND", Category.STRING, 2, 3));

        // Math
        put(map, FunctionSpec.rename("ABS", Category.MATH, 1, 1, "ABS"));
        put(map, FunctionSpec.rename("ROUND", Category.MATH, 1, 2, "ROUND"));
        put(map, FunctionSpec.rename("CEILING", Category.MATH, 1, 1, "CEIL"));
        put(map, FunctionSpec.rename("FLOOR", Category.MATH, 1, 1, "FLOOR"));
        put(map, FunctionSpec.rename("SQRT", Category.MATH, 1, 1, "SQRT"));
        put(map, FunctionSpec.rename("EXP", Category.MATH, 1, 1, "EXP"));
        put(map, FunctionSpec.rename("LN", Category.MATH, 1, 1, "LN"));
        put(map, FunctionSpec.rename("SIGN", Category.MATH, 1, 1, "SIGN"));
        put(map, FunctionSpec.rename("DIV", Category.MATH, 2, 2, "DIV"));
        put(map, FunctionSpec.rename("SIN", Category.MATH, 1, 1, "SIN"));
        put(map, FunctionSpec.rename("COS", Category.MATH, 1, 1, "COS"));
        put(map, FunctionSpec.rename("TAN", Category.MATH, 1, 1, "TAN"));
        put(map, FunctionSpec.rename("ASIN", Category.MATH, 1, 1, "ASIN"));
        put(map, FunctionSpec.rename("ACOS", Category.MATH, 1, 1, "ACOS"));
        put(map, FunctionSpec.rename("ATAN", Category.MATH, 1, 1, "ATAN"));
        put(map, FunctionSpec.rename("ATAN2", Category.MATH, 2, 2, "ATAN2"));
        put(map, FunctionSpec.template("COT", Category.MATH, 1, 1, "(1 / NULLIF(TAN({0}), 0))"));
        put(map, FunctionSpec.template("SQUARE", Category.MATH, 1, 1, "({0} * {0})"));
        put(map, FunctionSpec.template("PI", Category.MATH, 0, 0, "ACOS(-1)"));
        put(map, FunctionSpec.special("POWER", Category.MATH, 2, 2));
        put(map, FunctionSpec.special("LOG", Category.MATH, 1, 2));

        // Dates
        put(map, FunctionSpec.template("YEAR", Category.DATE, 1, 1, "EXTRACT(YEAR FROM {0})"));
        put(map, FunctionSpec.template("QUARTER", Category.DATE, 1, 1, "EXTRACT(QUARTER FROM {0})"));
        put(map, FunctionSpec.template("MONTH", Category.DATE, 1, 1, "EXTRACT(MONTH FROM {0})"));
        put(map, FunctionSpec.template("WEEK", Category.DATE, 1, 1, "EXTRACT(WEEK FROM {0})"));
        put(map, FunctionSpec.template("DAY", Category.DATE, 1, 1, "EXTRACT(DAY FROM {0})"));
        put(map, FunctionSpec.template("NOW", Category.DATE, 0, 0, "CURRENT_TIMESTAMP"));
        put(map, FunctionSpec.template("TODAY", Category.DATE, 0, 0, "CURRENT_DATE"));
        put(map, FunctionSpec.rename("DATE", Category.DATE, 1, 1, "DATE"));
        put(map, FunctionSpec.rename("DATETIME", Category.DATE, 1, 1, "DATETIME"));
        put(map, FunctionSpec.special("DATEADD", Category.DATE, 3, 3));
        put(map, FunctionSpec.special("DATEDIFF", Category.DATE, 3, 3));
        put(map, FunctionSpec.special("DATETRUNC", Category.DATE, 2, 2));
        put(map, FunctionSpec.special("DATEPART", Category.DATE, 2, 2));

        // Conversion
        put(map, FunctionSpec.special("INT", Category.CONVERSION, 1, 1));
        put(map, FunctionSpec.special("FLOAT", Category.CONVERSION, 1, 1));
        put(map, FunctionSpec.special("STR", Category.CONVERSION, 1, 1));

        // Null handling
        put(map, FunctionSpec.rename("IFNULL", Category.LOGICAL, 2, 2, "IFNULL"));
        put(map, FunctionSpec.template("ISNULL", Category.LOGICAL, 1, 1, "({0} IS NULL)"));
        put(map, FunctionSpec.template("ZN", Category.LOGICAL, 1, 1, "IFNULL({0}, 0)"));

        // Spatial
        put(map, FunctionSpec.template("MAKEPOINT", Category.SPATIAL, 2, 2, "ST_GEOGPOINT({1}, {0})"));
        put(map, FunctionSpec.template("MAKELINE", Category.SPATIAL, 2, 2, "ST_MAKELINE({0}, {1})"));

        // Table calculations
        for (String name : WindowFunctions.names()) {
            put(map, FunctionSpec.window(name));
        }

        return new FunctionRegistry(map.toImmutable());
    }

    private static void put(MutableMap<String, FunctionSpec> map, FunctionSpec spec) {
        if (map.put(spec.name(), spec) != null) {
            throw new IllegalStateException("Duplicate function registration: " + spec.name());
        }
    }
}
