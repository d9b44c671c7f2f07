package org.calclite.engine.transpiler;

import org.calclite.formula.dsl.Arithmetic;
import org.calclite.formula.dsl.Case;
import org.calclite.formula.dsl.Comparison;
import org.calclite.formula.dsl.Conditional;
import org.calclite.formula.dsl.Diagnostic;
import org.calclite.formula.dsl.Fallback;
import org.calclite.formula.dsl.FieldRef;
import org.calclite.formula.dsl.FormulaNode;
import org.calclite.formula.dsl.FormulaNodeVisitor;
import org.calclite.formula.dsl.FormulaPrinter;
import org.calclite.formula.dsl.FunctionCall;
import org.calclite.formula.dsl.Literal;
import org.calclite.formula.dsl.Logical;
import org.calclite.formula.dsl.Negation;
import org.calclite.formula.dsl.ScopedAggregate;
import org.calclite.formula.dsl.WindowCall;
import org.calclite.formula.dsl.WindowFunctions;
import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Transpiles a formula AST into a SQL expression fragment.
 *
 * Field references render as {@code ${TABLE}.column}; level of detail
 * expressions become correlated subqueries; table calculations become window
 * functions. Anything that cannot be rendered becomes a NULL placeholder with
 * the original text in a comment, plus a warning, so the output is always a
 * valid expression.
 *
 * The generator itself is immutable and may be shared between threads; each
 * call to {@link #generate(FormulaNode)} renders with its own state.
 */
public final class FormulaSQLGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(FormulaSQLGenerator.class);

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}_]+");

    private final FunctionRegistry registry;
    private final GenerationContext context;

    public FormulaSQLGenerator(FunctionRegistry registry, GenerationContext context) {
        this.registry = Objects.requireNonNull(registry, "Function registry cannot be null");
        this.context = Objects.requireNonNull(context, "Generation context cannot be null");
    }

    public FormulaSQLGenerator() {
        this(FunctionRegistry.defaults(), GenerationContext.defaults());
    }

    /**
     * Generates SQL for a formula AST.
     *
     * @param root The root node
     * @return The expression and any warnings raised while rendering
     */
    public GenerationResult generate(FormulaNode root) {
        Objects.requireNonNull(root, "Formula node cannot be null");
        Renderer renderer = new Renderer();
        String sql = root.accept(renderer);
        LOGGER.debug("Generated {} SQL: {}", context.dialect().name(), sql);
        return new GenerationResult(sql, renderer.warnings.toImmutable());
    }

    /**
     * Column name for a normalized field name: runs of characters that are
     * not letters, digits or underscores collapse to one underscore. Letters
     * and digits of any script are kept.
     */
    public static String columnName(String normalizedName) {
        String cleaned = NON_WORD.matcher(normalizedName).replaceAll("_");
        int start = 0;
        int end = cleaned.length();
        while (start < end && cleaned.charAt(start) == '_') {
            start++;
        }
        while (end > start && cleaned.charAt(end - 1) == '_') {
            end--;
        }
        return start == end ? "_" : cleaned.substring(start, end);
    }

    /**
     * A query level: the qualifier its columns use and the dimensions it is
     * grouped by.
     */
    private record Scope(String qualifier, ImmutableList<String> grouping) {
    }

    /**
     * Per-call rendering state.
     */
    private final class Renderer implements FormulaNodeVisitor<String> {

        private final MutableList<Diagnostic> warnings = Lists.mutable.empty();
        private final Deque<Scope> scopes = new ArrayDeque<>();
        private int aliasCounter;

        Renderer() {
            scopes.push(new Scope(context.tableReference(), context.ambientDimensions()));
        }

        private SQLDialect dialect() {
            return context.dialect();
        }

        // ==================== Leaves ====================

        @Override
        public String visitLiteral(Literal literal) {
            return switch (literal.dataType()) {
                case STRING -> dialect().quoteStringLiteral((String) literal.value());
                case INTEGER -> Long.toString((Long) literal.value());
                case REAL -> Double.toString((Double) literal.value());
                case BOOLEAN -> dialect().formatBoolean((Boolean) literal.value());
                case NULL -> dialect().formatNull();
            };
        }

        @Override
        public String visitFieldRef(FieldRef fieldRef) {
            return scopes.peek().qualifier() + "." + columnName(fieldRef.normalizedName());
        }

        // ==================== Operators ====================

        @Override
        public String visitArithmetic(Arithmetic arithmetic) {
            String left = arithmetic.left().accept(this);
            String right = arithmetic.right().accept(this);

            return switch (arithmetic.operator()) {
                case DIVIDE -> isNonZeroNumber(arithmetic.right())
                        ? "(" + left + " / " + right + ")"
                        : "(" + left + " / NULLIF(" + right + ", 0))";
                case MODULO -> "MOD(" + left + ", " + right + ")";
                case POWER -> dialect().powerFunction() + "(" + left + ", " + right + ")";
                default -> "(" + left + " " + arithmetic.operator().symbol() + " " + right + ")";
            };
        }

        private boolean isNonZeroNumber(FormulaNode node) {
            return node instanceof Literal literal && literal.isNumeric() && !literal.isZero();
        }

        @Override
        public String visitComparison(Comparison comparison) {
            return "(" + comparison.left().accept(this) + " " + comparison.operator().symbol() + " "
                    + comparison.right().accept(this) + ")";
        }

        @Override
        public String visitLogical(Logical logical) {
            if (logical.operator() == Logical.Operator.NOT) {
                return "NOT (" + logical.left().accept(this) + ")";
            }
            return "(" + logical.left().accept(this) + " " + logical.operator() + " "
                    + logical.right().accept(this) + ")";
        }

        @Override
        public String visitNegation(Negation negation) {
            // The space keeps a negative operand from forming a "--" comment
            return "(- " + negation.operand().accept(this) + ")";
        }

        // ==================== Conditionals ====================

        @Override
        public String visitConditional(Conditional conditional) {
            var sb = new StringBuilder("CASE");
            FormulaNode current = conditional;
            while (current instanceof Conditional branch) {
                sb.append(" WHEN ").append(branch.condition().accept(this))
                        .append(" THEN ").append(branch.thenBranch().accept(this));
                current = branch.elseBranch();
            }
            sb.append(" ELSE ").append(current.accept(this));
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

        // ==================== Functions ====================

        @Override
        public String visitFunctionCall(FunctionCall call) {
            String problem = registry.problemWith(call);
            if (problem != null) {
                return unsupported(call, problem);
            }
            FunctionSpec spec = registry.lookup(call.name());

            return switch (spec.rendering()) {
                case RENAME -> spec.target() + "(" + renderArguments(call.arguments()).makeString(", ") + ")";
                case TEMPLATE -> renderTemplate(call, spec.target());
                case SPECIAL -> renderSpecial(call);
                case WINDOW -> throw new IllegalStateException("Window function " + call.name() + " passed the check");
            };
        }

        private MutableList<String> renderArguments(ImmutableList<FormulaNode> arguments) {
            return arguments.collect(arg -> arg.accept(this)).toList();
        }

        private String renderTemplate(FunctionCall call, String template) {
            MutableList<String> args = renderArguments(call.arguments());
            // Slots never exceed the minimum argument count, see FunctionSpec
            Matcher matcher = FunctionSpec.TEMPLATE_SLOT.matcher(template);
            var sb = new StringBuilder();
            while (matcher.find()) {
                matcher.appendReplacement(sb, Matcher.quoteReplacement(args.get(Integer.parseInt(matcher.group(1)))));
            }
            matcher.appendTail(sb);
            return sb.toString();
        }

        /**
         * Functions whose rendering depends on the dialect or on literal
         * arguments.
         */
        private String renderSpecial(FunctionCall call) {
            ImmutableList<FormulaNode> arguments = call.arguments();
            switch (call.name()) {
                case "MIN", "MAX" -> {
                    MutableList<String> args = renderArguments(arguments);
                    if (args.size() == 1) {
                        return call.name() + "(" + args.get(0) + ")";
                    }
                    String function = "MIN".equals(call.name()) ? "LEAST" : "GREATEST";
                    return function + "(" + args.makeString(", ") + ")";
                }
                case "POWER" -> {
                    MutableList<String> args = renderArguments(arguments);
                    return dialect().powerFunction() + "(" + args.get(0) + ", " + args.get(1) + ")";
                }
                case "LOG" -> {
                    MutableList<String> args = renderArguments(arguments);
                    return dialect().logarithm(args.get(0), args.size() == 2 ? args.get(1) : null);
                }
                case "FIND" -> {
                    MutableList<String> args = renderArguments(arguments);
                    if (args.size() == 2) {
                        return "STRPOS(" + args.get(0) + ", " + args.get(1) + ")";
                    }
                    String start = args.get(2);
                    return "(STRPOS(SUBSTR(" + args.get(0) + ", " + start + "), " + args.get(1) + ") + "
                            + start + " - 1)";
                }
                case "INT" -> {
                    return cast(arguments.get(0), SQLDialect.CastTarget.INTEGER);
                }
                case "FLOAT" -> {
                    return cast(arguments.get(0), SQLDialect.CastTarget.FLOAT);
                }
                case "STR" -> {
                    return cast(arguments.get(0), SQLDialect.CastTarget.STRING);
                }
                case "DATEADD", "DATEDIFF", "DATETRUNC", "DATEPART" -> {
                    return renderDateFunction(call);
                }
                default -> throw new IllegalStateException("No rendering for special function " + call.name());
            }
        }

        private String cast(FormulaNode argument, SQLDialect.CastTarget target) {
            return "CAST(" + argument.accept(this) + " AS " + dialect().castType(target) + ")";
        }

        /**
         * DATEADD(part, n, date), DATEDIFF(part, start, end), DATETRUNC(part, date)
         * and DATEPART(part, date); the registry has already checked the part.
         */
        private String renderDateFunction(FunctionCall call) {
            String unit = DateParts.unitFor(call);

            ImmutableList<FormulaNode> rest = Lists.immutable.withAll(
                    call.arguments().castToList().subList(1, call.arguments().size()));
            MutableList<String> args = renderArguments(rest);
            return switch (call.name()) {
                case "DATEADD" -> dialect().dateAdd(unit, args.get(0), args.get(1));
                case "DATEDIFF" -> dialect().dateDiff(unit, args.get(0), args.get(1));
                case "DATETRUNC" -> dialect().dateTrunc(unit, args.get(0));
                default -> dialect().datePart(unit, args.get(0));
            };
        }

        // ==================== Level of detail ====================

        /**
         * FIXED groups by exactly the listed dimensions, INCLUDE by the
         * enclosing grouping plus them, EXCLUDE by the enclosing grouping minus
         * them. The subquery is correlated to the enclosing level on every
         * grouping column.
         */
        @Override
        public String visitScopedAggregate(ScopedAggregate aggregate) {
            Scope outer = scopes.peek();
            ImmutableList<String> listed = aggregate.dimensions().collect(FieldRef::normalizedName);

            ImmutableList<String> grouping = switch (aggregate.scope()) {
                case FIXED -> listed;
                case INCLUDE -> outer.grouping().newWithAll(listed).distinct();
                case EXCLUDE -> outer.grouping().reject(aggregate.dimensionNames()::contains);
            };
            if (aggregate.scope() != ScopedAggregate.Scope.FIXED && outer.grouping().isEmpty()) {
                warnings.add(Diagnostic.info(Diagnostic.Kind.SCOPE, aggregate.scope()
                        + " has no surrounding dimensions to adjust; grouping by "
                        + (grouping.isEmpty() ? "nothing" : grouping.makeString(", "))));
            }

            String alias = "lod_" + (++aliasCounter);
            scopes.push(new Scope(alias, grouping));
            String expression;
            try {
                expression = aggregate.expression().accept(this);
            } finally {
                scopes.pop();
            }

            var sb = new StringBuilder("(SELECT ");
            sb.append(expression).append(" FROM ").append(context.sourceTable()).append(" AS ").append(alias);
            if (!grouping.isEmpty()) {
                ImmutableList<String> columns = grouping.collect(FormulaSQLGenerator::columnName);
                sb.append(" WHERE ")
                        .append(columns.collect(c -> alias + "." + c + " = " + outer.qualifier() + "." + c)
                                .makeString(" AND "));
                sb.append(" GROUP BY ").append(columns.collect(c -> alias + "." + c).makeString(", "));
            }
            return sb.append(")").toString();
        }

        // ==================== Table calculations ====================

        @Override
        public String visitWindowCall(WindowCall window) {
            WindowFunctions.Family family = WindowFunctions.familyOf(window.name());
            if (family == null || !registry.isKnown(window.name())) {
                return unsupported(window, "Unknown table calculation " + window.name());
            }

            String argument = window.argument() == null ? null : window.argument().accept(this);
            String orderBy = argument == null ? "" : "ORDER BY " + argument + " " + window.orderMode();

            return switch (family) {
                case RANKING -> window.name() + "() OVER (" + orderBy + ")";
                case RUNNING, WINDOW -> aggregateName(window.name()) + "(" + argument + ") OVER ("
                        + orderBy + frameClause(window.frame()) + ")";
                case OFFSET -> {
                    ImmutableList<FormulaNode> extra = window.extraArgs();
                    String offset = extra.size() > 0 ? extra.get(0).accept(this) : "1";
                    String fallbackValue = extra.size() > 1 ? extra.get(1).accept(this) : dialect().formatNull();
                    yield window.name() + "(" + argument + ", " + offset + ", " + fallbackValue + ") OVER ("
                            + orderBy + ")";
                }
            };
        }

        private String aggregateName(String windowName) {
            return WindowFunctions.aggregateOf(windowName);
        }

        private String frameClause(WindowCall.WindowFrame frame) {
            if (frame == null) {
                return "";
            }
            return " ROWS BETWEEN " + frameBound(frame.startOffset(), true)
                    + " AND " + frameBound(frame.endOffset(), false);
        }

        private String frameBound(Integer offset, boolean start) {
            if (offset == null) {
                return start ? "UNBOUNDED PRECEDING" : "UNBOUNDED FOLLOWING";
            }
            if (offset == 0) {
                return "CURRENT ROW";
            }
            return offset < 0 ? (-(long) offset) + " PRECEDING" : offset + " FOLLOWING";
        }

        // ==================== Degradation ====================

        @Override
        public String visitFallback(Fallback fallback) {
            warnings.add(Diagnostic.warning(Diagnostic.Kind.SYNTAX,
                    "Formula fragment needs manual migration: " + fallback.originalText()));
            return "NULL /* MIGRATION_REQUIRED: " + commentSafe(fallback.originalText()) + " */";
        }

        private String unsupported(FormulaNode node, String reason) {
            warnings.add(Diagnostic.warning(Diagnostic.Kind.SEMANTIC, reason));
            LOGGER.debug("Unsupported construct: {}", reason);
            return "NULL /* unsupported: " + commentSafe(FormulaPrinter.print(node)) + " */";
        }
    }

    /**
     * Keeps arbitrary text from closing the comment it is embedded in, or from
     * opening a nested one where the dialect nests block comments.
     */
    static String commentSafe(String text) {
        return text.replace("*/", "* /").replace("/*", "/ *");
    }
}
