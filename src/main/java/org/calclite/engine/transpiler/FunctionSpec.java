package org.calclite.engine.transpiler;

import org.eclipse.collections.api.factory.Sets;
import org.eclipse.collections.api.set.ImmutableSet;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * How one calculation-language function maps to SQL.
 *
 * @param name      Upper-case source function name
 * @param category  Function family
 * @param minArgs   Fewest arguments accepted
 * @param maxArgs   Most arguments accepted
 * @param rendering How the generator renders a call
 * @param target    SQL function name for {@link Rendering#RENAME}, the pattern for
 *                  {@link Rendering#TEMPLATE} ({0}, {1}, ... are the rendered
 *                  arguments), unused otherwise
 */
public record FunctionSpec(
        String name,
        Category category,
        int minArgs,
        int maxArgs,
        Rendering rendering,
        String target) {

    static final Pattern TEMPLATE_SLOT = Pattern.compile("\\{(\\d+)}");

    /** Functions the generator renders itself. */
    static final ImmutableSet<String> SPECIAL_FUNCTIONS = Sets.immutable.of(
            "MIN", "MAX", "POWER", "LOG", "FIND", "INT", "FLOAT", "STR",
            "DATEADD", "DATEDIFF", "DATETRUNC", "DATEPART");

    public enum Category {
        AGGREGATE, STRING, MATH, DATE, CONVERSION, LOGICAL, SPATIAL, TABLE_CALCULATION
    }

    public enum Rendering {
        /** NAME(args) with a possibly different SQL name */
        RENAME,
        /** Positional substitution into a SQL pattern */
        TEMPLATE,
        /** Rendered by the generator with help from the dialect */
        SPECIAL,
        /** Parsed into a WindowCall; registered so it counts as known */
        WINDOW
    }

    public FunctionSpec {
        Objects.requireNonNull(name, "Function name cannot be null");
        Objects.requireNonNull(category, "Category cannot be null");
        Objects.requireNonNull(rendering, "Rendering cannot be null");
        if (minArgs < 0 || maxArgs < minArgs) {
            throw new IllegalArgumentException(
                    "Invalid argument range [" + minArgs + ", " + maxArgs + "] for " + name);
        }
        if ((rendering == Rendering.RENAME || rendering == Rendering.TEMPLATE) && target == null) {
            throw new IllegalArgumentException(rendering + " function " + name + " needs a target");
        }
        if (rendering == Rendering.TEMPLATE) {
            Matcher slots = TEMPLATE_SLOT.matcher(target);
            while (slots.find()) {
                if (Integer.parseInt(slots.group(1)) >= minArgs) {
                    throw new IllegalArgumentException("Template for " + name + " uses " + slots.group()
                            + " but only " + minArgs + " argument(s) are guaranteed");
                }
            }
        }
        if (rendering == Rendering.SPECIAL && !SPECIAL_FUNCTIONS.contains(name)) {
            throw new IllegalArgumentException("No built-in rendering for " + name);
        }
    }

    public static FunctionSpec rename(String name, Category category, int minArgs, int maxArgs, String sqlName) {
        return new FunctionSpec(name, category, minArgs, maxArgs, Rendering.RENAME, sqlName);
    }

    public static FunctionSpec template(String name, Category category, int minArgs, int maxArgs, String pattern) {
        return new FunctionSpec(name, category, minArgs, maxArgs, Rendering.TEMPLATE, pattern);
    }

    public static FunctionSpec special(String name, Category category, int minArgs, int maxArgs) {
        return new FunctionSpec(name, category, minArgs, maxArgs, Rendering.SPECIAL, null);
    }

    public static FunctionSpec window(String name) {
        return new FunctionSpec(name, Category.TABLE_CALCULATION, 0, 3, Rendering.WINDOW, null);
    }

    public boolean accepts(int argumentCount) {
        return argumentCount >= minArgs && argumentCount <= maxArgs;
    }

    public String arityDescription() {
        if (minArgs == maxArgs) {
            return minArgs + (minArgs == 1 ? " argument" : " arguments");
        }
        return minArgs + " to " + maxArgs + " arguments";
    }
}
