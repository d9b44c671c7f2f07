package org.calclite.formula.dsl;

import java.util.Objects;

/**
 * IF condition THEN thenBranch ELSE elseBranch END.
 * An ELSEIF chain is a Conditional nested in the else branch.
 */
public record Conditional(FormulaNode condition, FormulaNode thenBranch, FormulaNode elseBranch)
        implements FormulaNode {

    public Conditional {
        Objects.requireNonNull(condition, "Condition cannot be null");
        Objects.requireNonNull(thenBranch, "Then branch cannot be null");
        Objects.requireNonNull(elseBranch, "Else branch cannot be null");
    }

    @Override
    public <R> R accept(FormulaNodeVisitor<R> visitor) {
        return visitor.visitConditional(this);
    }
}
