package org.calclite.formula.dsl;

import org.eclipse.collections.api.list.ImmutableList;

import java.util.Objects;

/**
 * CASE expression.
 * 
 * Simple form: CASE [Region] WHEN 'East' THEN 1 ... END (subject present,
 * each clause holds a value to compare against).
 * Searched form: CASE WHEN [Sales] > 10 THEN 1 ... END (subject null, each
 * clause holds a condition).
 * 
 * @param subject     The compared expression, or null for the searched form
 * @param whenClauses Clauses in source order; the first match wins
 * @param elseBranch  The ELSE result, or null when absent
 */
public record Case(FormulaNode subject, ImmutableList<WhenClause> whenClauses, FormulaNode elseBranch)
        implements FormulaNode {

    public record WhenClause(FormulaNode match, FormulaNode result) {
        public WhenClause {
            Objects.requireNonNull(match, "WHEN match cannot be null");
            Objects.requireNonNull(result, "WHEN result cannot be null");
        }
    }

    public Case {
        Objects.requireNonNull(whenClauses, "WHEN clauses cannot be null");
        if (whenClauses.isEmpty()) {
            throw new IllegalArgumentException("CASE requires at least one WHEN clause");
        }
    }

    public boolean isSearched() {
        return subject == null;
    }

    @Override
    public <R> R accept(FormulaNodeVisitor<R> visitor) {
        return visitor.visitCase(this);
    }
}
