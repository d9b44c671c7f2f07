package org.calclite.formula.dsl;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.set.ImmutableSet;

import java.util.Objects;

/**
 * Level of detail expression: {FIXED [Region], [Segment] : SUM([Sales])}
 * 
 * @param scope      FIXED, INCLUDE or EXCLUDE
 * @param dimensions Distinct dimensions in source order
 * @param expression The aggregated expression
 */
public record ScopedAggregate(Scope scope, ImmutableList<FieldRef> dimensions, FormulaNode expression)
        implements FormulaNode {

    public enum Scope {
        /** Aggregate at exactly the listed dimensions. */
        FIXED,
        /** Aggregate at the view's dimensions plus the listed ones. */
        INCLUDE,
        /** Aggregate at the view's dimensions minus the listed ones. */
        EXCLUDE
    }

    public ScopedAggregate {
        Objects.requireNonNull(scope, "Scope cannot be null");
        Objects.requireNonNull(dimensions, "Dimensions cannot be null");
        Objects.requireNonNull(expression, "Expression cannot be null");
        if (dimensions.collect(FieldRef::normalizedName).toSet().size() != dimensions.size()) {
            throw new IllegalArgumentException("Dimensions must be distinct: " + dimensions);
        }
    }

    public ImmutableSet<String> dimensionNames() {
        return dimensions.collect(FieldRef::normalizedName).toSet().toImmutable();
    }

    @Override
    public <R> R accept(FormulaNodeVisitor<R> visitor) {
        return visitor.visitScopedAggregate(this);
    }
}
