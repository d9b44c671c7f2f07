package org.calclite.formula.dsl;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.MutableList;

import java.math.BigDecimal;

/**
 * Renders an AST back into calculation-language text.
 *
 * Every binary operation is parenthesized, so the output re-parses into a tree
 * of the same shape. Field references print their original bracketed text.
 */
public final class FormulaPrinter implements FormulaNodeVisitor<String> {

    public static final FormulaPrinter INSTANCE = new FormulaPrinter();

    private FormulaPrinter() {
    }

    public static String print(FormulaNode node) {
        return node.accept(INSTANCE);
    }

    @Override
    public String visitLiteral(Literal literal) {
        return switch (literal.dataType()) {
            case STRING -> "'" + ((String) literal.value()).replace("\\", "\\\\").replace("'", "''") + "'";
            case INTEGER -> signed(Long.toString((Long) literal.value()));
            case REAL -> signed(printReal((Double) literal.value()));
            case BOOLEAN -> ((Boolean) literal.value()) ? "TRUE" : "FALSE";
            case NULL -> "NULL";
        };
    }

    // A bare negative number would re-parse as a negation when it is a power base
    private static String signed(String number) {
        return number.startsWith("-") ? "(" + number + ")" : number;
    }

    private static String printReal(double value) {
        String text = Double.toString(value);
        if (!text.contains("E")) {
            return text;
        }
        // Scientific notation does not lex back into a single REAL token
        String plain = new BigDecimal(text).toPlainString();
        return plain.contains(".") ? plain : plain + ".0";
    }

    @Override
    public String visitFieldRef(FieldRef fieldRef) {
        return fieldRef.originalText();
    }

    @Override
    public String visitArithmetic(Arithmetic arithmetic) {
        return "(" + arithmetic.left().accept(this) + " " + arithmetic.operator().symbol() + " "
                + arithmetic.right().accept(this) + ")";
    }

    @Override
    public String visitComparison(Comparison comparison) {
        return "(" + comparison.left().accept(this) + " " + comparison.operator().symbol() + " "
                + comparison.right().accept(this) + ")";
    }

    @Override
    public String visitLogical(Logical logical) {
        if (logical.operator() == Logical.Operator.NOT) {
            return "NOT " + logical.left().accept(this);
        }
        return "(" + logical.left().accept(this) + " " + logical.operator() + " "
                + logical.right().accept(this) + ")";
    }

    @Override
    public String visitNegation(Negation negation) {
        return "-(" + negation.operand().accept(this) + ")";
    }

    @Override
    public String visitConditional(Conditional conditional) {
        var sb = new StringBuilder("IF ");
        sb.append(conditional.condition().accept(this))
                .append(" THEN ")
                .append(conditional.thenBranch().accept(this));

        FormulaNode rest = conditional.elseBranch();
        while (rest instanceof Conditional chained) {
            sb.append(" ELSEIF ").append(chained.condition().accept(this))
                    .append(" THEN ").append(chained.thenBranch().accept(this));
            rest = chained.elseBranch();
        }
        if (!Literal.NULL.equals(rest)) {
            sb.append(" ELSE ").append(rest.accept(this));
        }
        return sb.append(" END").toString();
    }

    @Override
    public String visitCase(Case caseNode) {
        var sb = new StringBuilder("CASE");
        if (!caseNode.isSearched()) {
            sb.append(' ').append(caseNode.subject().accept(this));
        }
        for (Case.WhenClause clause : caseNode.whenClauses()) {
            sb.append(" WHEN ").append(clause.match().accept(this))
                    .append(" THEN ").append(clause.result().accept(this));
        }
        if (caseNode.elseBranch() != null) {
            sb.append(" ELSE ").append(caseNode.elseBranch().accept(this));
        }
        return sb.append(" END").toString();
    }

    @Override
    public String visitFunctionCall(FunctionCall call) {
        return call.name() + "(" + call.arguments().collect(arg -> arg.accept(this)).makeString(", ") + ")";
    }

    @Override
    public String visitScopedAggregate(ScopedAggregate aggregate) {
        String dims = aggregate.dimensions().collect(FieldRef::originalText).makeString(", ");
        return "{" + aggregate.scope() + (dims.isEmpty() ? "" : " " + dims) + " : "
                + aggregate.expression().accept(this) + "}";
    }

    @Override
    public String visitWindowCall(WindowCall window) {
        MutableList<String> args = Lists.mutable.empty();
        if (window.argument() != null) {
            args.add(window.argument().accept(this));
        }
        if (WindowFunctions.familyOf(window.name()) == WindowFunctions.Family.RANKING
                && window.argument() != null && window.orderMode() == WindowCall.OrderMode.DESC) {
            args.add("'desc'");
        }
        if (WindowFunctions.familyOf(window.name()) == WindowFunctions.Family.WINDOW && window.frame() != null) {
            WindowCall.WindowFrame frame = window.frame();
            args.add(frame.startOffset() == null ? "FIRST()" : frame.startOffset().toString());
            args.add(frame.endOffset() == null ? "LAST()" : frame.endOffset().toString());
        }
        args.addAllIterable(window.extraArgs().collect(arg -> arg.accept(this)));
        return window.name() + "(" + args.makeString(", ") + ")";
    }

    @Override
    public String visitFallback(Fallback fallback) {
        return fallback.originalText();
    }
}
