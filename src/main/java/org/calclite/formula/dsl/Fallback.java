package org.calclite.formula.dsl;

import java.util.Objects;

/**
 * Source text the parser could not turn into a tree.
 * The text is kept verbatim so it can be carried into generated output.
 */
public record Fallback(String originalText, String reason) implements FormulaNode {

    public Fallback {
        Objects.requireNonNull(originalText, "Original text cannot be null");
        Objects.requireNonNull(reason, "Reason cannot be null");
    }

    @Override
    public <R> R accept(FormulaNodeVisitor<R> visitor) {
        return visitor.visitFallback(this);
    }
}
