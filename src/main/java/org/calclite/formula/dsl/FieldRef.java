package org.calclite.formula.dsl;

import java.util.Locale;
import java.util.Objects;

/**
 * Field reference: [Order Date]
 * 
 * @param normalizedName The bracket content, lower-cased
 * @param originalText   The reference as written, brackets included
 */
public record FieldRef(String normalizedName, String originalText) implements FormulaNode {

    public FieldRef {
        Objects.requireNonNull(normalizedName, "Field name cannot be null");
        Objects.requireNonNull(originalText, "Original text cannot be null");
    }

    /**
     * Creates a reference from the unbracketed field name as the user wrote it.
     */
    public static FieldRef of(String name) {
        return new FieldRef(name.toLowerCase(Locale.ROOT), "[" + name.replace("]", "]]") + "]");
    }

    @Override
    public <R> R accept(FormulaNodeVisitor<R> visitor) {
        return visitor.visitFieldRef(this);
    }
}
