package org.calclite.formula.dsl;

import org.eclipse.collections.api.list.ImmutableList;

import java.util.Objects;

/**
 * Function call expression: NAME(arg1, arg2, ...)
 * The name is stored upper-cased.
 */
public record FunctionCall(String name, ImmutableList<FormulaNode> arguments) implements FormulaNode {

    public FunctionCall {
        Objects.requireNonNull(name, "Function name cannot be null");
        Objects.requireNonNull(arguments, "Arguments cannot be null");
    }

    @Override
    public <R> R accept(FormulaNodeVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }
}
