package org.calclite.engine.transpiler;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;

import java.util.Locale;
import java.util.Objects;

/**
 * Where a generated expression will live.
 *
 * @param tableReference    Qualifier for outer-level columns, e.g. {@code ${TABLE}}
 * @param sourceTable       Table named in the FROM of level of detail subqueries
 * @param ambientDimensions Grouping of the query the expression is used in, as
 *                          normalized field names; INCLUDE and EXCLUDE are
 *                          computed relative to it
 * @param dialect           Target SQL dialect
 */
public record GenerationContext(
        String tableReference,
        String sourceTable,
        ImmutableList<String> ambientDimensions,
        SQLDialect dialect) {

    public static final String DEFAULT_TABLE_REFERENCE = "${TABLE}";

    public GenerationContext {
        Objects.requireNonNull(tableReference, "Table reference cannot be null");
        Objects.requireNonNull(sourceTable, "Source table cannot be null");
        Objects.requireNonNull(ambientDimensions, "Ambient dimensions cannot be null");
        Objects.requireNonNull(dialect, "Dialect cannot be null");
        if (tableReference.isBlank() || sourceTable.isBlank()) {
            throw new IllegalArgumentException("Table reference and source table must not be blank");
        }
        ambientDimensions = ambientDimensions
                .collect(name -> name.toLowerCase(Locale.ROOT))
                .distinct();
    }

    public static GenerationContext defaults() {
        return new GenerationContext(DEFAULT_TABLE_REFERENCE, DEFAULT_TABLE_REFERENCE,
                Lists.immutable.empty(), BigQueryDialect.INSTANCE);
    }

    public GenerationContext withDialect(SQLDialect newDialect) {
        return new GenerationContext(tableReference, sourceTable, ambientDimensions, newDialect);
    }

    public GenerationContext withAmbientDimensions(String... names) {
        return new GenerationContext(tableReference, sourceTable, Lists.immutable.of(names), dialect);
    }
}
