package org.calclite.engine.transpiler;

import org.calclite.formula.dsl.FormulaNode;
import org.calclite.formula.dsl.FunctionCall;
import org.calclite.formula.dsl.Literal;
import org.eclipse.collections.api.factory.Maps;
import org.eclipse.collections.api.factory.Sets;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.set.ImmutableSet;

import java.util.Locale;

/**
 * Date part arguments of DATEADD(part, n, date), DATEDIFF(part, start, end),
 * DATETRUNC(part, date) and DATEPART(part, date). The part must be a string
 * literal.
 */
final class DateParts {

    static final ImmutableSet<String> FUNCTIONS = Sets.immutable.of("DATEADD", "DATEDIFF", "DATETRUNC", "DATEPART");

    /** Tableau date part names and the SQL date part each becomes. */
    private static final ImmutableMap<String, String> PARTS = Maps.mutable.<String, String>empty()
            .withKeyValue("YEAR", "YEAR")
            .withKeyValue("QUARTER", "QUARTER")
            .withKeyValue("MONTH", "MONTH")
            .withKeyValue("WEEK", "WEEK")
            .withKeyValue("DAY", "DAY")
            .withKeyValue("HOUR", "HOUR")
            .withKeyValue("MINUTE", "MINUTE")
            .withKeyValue("SECOND", "SECOND")
            .withKeyValue("DAYOFYEAR", "DAYOFYEAR")
            .withKeyValue("WEEKDAY", "DAYOFWEEK")
            .toImmutable();

    /** Parts that can be added, diffed or truncated. */
    private static final ImmutableSet<String> INTERVAL_UNITS =
            Sets.immutable.of("YEAR", "QUARTER", "MONTH", "WEEK", "DAY", "HOUR", "MINUTE", "SECOND");

    private DateParts() {
    }

    /**
     * @return Why the call's date part cannot be rendered, or null when it can
     */
    static String problemWith(FunctionCall call) {
        FormulaNode partNode = call.arguments().get(0);
        if (!(partNode instanceof Literal literal) || literal.dataType() != Literal.DataType.STRING) {
            return call.name() + " needs a literal date part";
        }
        if (unitFor(call) == null) {
            return "Unsupported date part '" + literal.value() + "' for " + call.name();
        }
        return null;
    }

    /**
     * @return The SQL unit for the call's date part, or null when it has none
     */
    static String unitFor(FunctionCall call) {
        if (!(call.arguments().get(0) instanceof Literal literal) || literal.dataType() != Literal.DataType.STRING) {
            return null;
        }
        String unit = PARTS.get(((String) literal.value()).trim().toUpperCase(Locale.ROOT));
        if (unit == null || (!"DATEPART".equals(call.name()) && !INTERVAL_UNITS.contains(unit))) {
            return null;
        }
        return unit;
    }
}
