package org.calclite.formula.dsl;

/**
 * Visitor interface for traversing formula trees.
 * 
 * @param <R> The return type of the visitor methods
 */
public interface FormulaNodeVisitor<R> {

    R visitLiteral(Literal literal);

    R visitFieldRef(FieldRef fieldRef);

    R visitArithmetic(Arithmetic arithmetic);

    R visitComparison(Comparison comparison);

    R visitLogical(Logical logical);

    R visitNegation(Negation negation);

    /**
     * Visit an IF/ELSEIF/ELSE expression.
     */
    R visitConditional(Conditional conditional);

    /**
     * Visit a CASE expression (simple or searched form).
     */
    R visitCase(Case caseExpr);

    R visitFunctionCall(FunctionCall functionCall);

    /**
     * Visit a FIXED/INCLUDE/EXCLUDE level of detail expression.
     */
    R visitScopedAggregate(ScopedAggregate aggregate);

    /**
     * Visit a table calculation (running, window, ranking, offset).
     */
    R visitWindowCall(WindowCall windowCall);

    R visitFallback(Fallback fallback);
}
