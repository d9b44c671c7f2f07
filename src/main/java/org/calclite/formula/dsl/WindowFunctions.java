package org.calclite.formula.dsl;

import org.eclipse.collections.api.factory.Maps;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.api.set.ImmutableSet;

import java.util.Locale;

/**
 * Names of the table calculations the parser turns into {@link WindowCall}
 * nodes, with the argument shape each family expects.
 */
public final class WindowFunctions {

    public enum Family {
        /** RANK(expr [, 'asc'|'desc']) */
        RANKING,
        /** RUNNING_SUM(expr) */
        RUNNING,
        /** WINDOW_SUM(expr [, start, end]) */
        WINDOW,
        /** LAG(expr [, offset [, default]]) */
        OFFSET
    }

    private static final ImmutableMap<String, String> ALIASES = Maps.immutable.of(
            "RANK_DENSE", "DENSE_RANK",
            "RANK_UNIQUE", "ROW_NUMBER",
            "RANK_PERCENTILE", "PERCENT_RANK",
            "INDEX", "ROW_NUMBER");

    private static final ImmutableMap<String, Family> FAMILIES;

    static {
        MutableMap<String, Family> families = Maps.mutable.empty();
        for (String name : new String[] { "RANK", "DENSE_RANK", "ROW_NUMBER", "PERCENT_RANK" }) {
            families.put(name, Family.RANKING);
        }
        for (String aggregate : new String[] { "SUM", "AVG", "COUNT", "MIN", "MAX" }) {
            families.put("RUNNING_" + aggregate, Family.RUNNING);
            families.put("WINDOW_" + aggregate, Family.WINDOW);
        }
        families.put("WINDOW_MEDIAN", Family.WINDOW);
        families.put("LAG", Family.OFFSET);
        families.put("LEAD", Family.OFFSET);
        FAMILIES = families.toImmutable();
    }

    private WindowFunctions() {
    }

    /**
     * Resolves spelling variants (RANK_DENSE, INDEX, ...) to the name stored in
     * the tree.
     */
    public static String canonicalName(String name) {
        String upper = name.toUpperCase(Locale.ROOT);
        return ALIASES.getIfAbsentValue(upper, upper);
    }

    /**
     * @return The family of a canonical window function name, or null when the
     *         name is not a table calculation
     */
    public static Family familyOf(String canonicalName) {
        return FAMILIES.get(canonicalName);
    }

    public static boolean isWindowFunction(String name) {
        return familyOf(canonicalName(name)) != null;
    }

    /**
     * The plain SQL aggregate behind RUNNING_x and WINDOW_x functions.
     */
    public static String aggregateOf(String canonicalName) {
        int underscore = canonicalName.indexOf('_');
        return underscore < 0 ? canonicalName : canonicalName.substring(underscore + 1);
    }

    /**
     * @return Every canonical table calculation name
     */
    public static ImmutableSet<String> names() {
        return FAMILIES.keysView().toSet().toImmutable();
    }
}
