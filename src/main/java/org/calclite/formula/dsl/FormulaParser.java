package org.calclite.formula.dsl;

import org.calclite.formula.dsl.Token.TokenKind;
import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Recursive descent parser for the calculation language.
 *
 * Parses formulas like:
 * IF [Sales] > 1000 THEN 'High' ELSEIF [Sales] > 500 THEN 'Mid' ELSE 'Low' END
 * {FIXED [Region] : SUM([Sales])} / SUM([Sales])
 * RANK(SUM([Profit]), 'desc')
 *
 * Precedence, lowest to highest: OR, AND, equality, relational, additive,
 * multiplicative, unary (-, +, NOT), exponentiation, primary.
 *
 * The parser never throws on bad input. The first unexpected or missing token
 * is recorded as a {@link Diagnostic}, parsing stops, and the smallest
 * construct that cannot be completed becomes a {@link Fallback} carrying its
 * source text from its first token to the end of the formula.
 *
 * Nesting is bounded so that no stage recurses without limit: a formula that
 * nests deeper than {@code maxDepth} levels becomes a single Fallback.
 * ELSEIF chains do not count as nesting, as every stage walks them in a loop.
 */
public final class FormulaParser {

    public static final int DEFAULT_MAX_DEPTH = 256;

    private final String source;
    private final List<Token> tokens;
    private final int maxDepth;
    private int position;
    private int nesting;

    private final MutableList<Diagnostic> diagnostics = Lists.mutable.empty();
    private boolean halted;
    private String failureReason = "";

    public FormulaParser(String source, List<Token> tokens, int maxDepth) {
        this.source = Objects.requireNonNull(source, "Formula cannot be null");
        this.tokens = Objects.requireNonNull(tokens, "Tokens cannot be null");
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenKind.EOF)) {
            throw new IllegalArgumentException("Token stream must end with EOF");
        }
        if (maxDepth < 1) {
            throw new IllegalArgumentException("Maximum depth must be at least 1, got " + maxDepth);
        }
        this.maxDepth = maxDepth;
        this.position = 0;
    }

    public FormulaParser(String source, List<Token> tokens) {
        this(source, tokens, DEFAULT_MAX_DEPTH);
    }

    /**
     * Parses a formula string.
     *
     * @param formula The formula text
     * @return The root node and the diagnostics raised while parsing
     */
    public static ParseResult parse(String formula) {
        return parse(formula, DEFAULT_MAX_DEPTH);
    }

    /**
     * Parses a formula string with a nesting limit.
     *
     * @param formula  The formula text
     * @param maxDepth Deepest nesting accepted before the formula degrades
     */
    public static ParseResult parse(String formula, int maxDepth) {
        return new FormulaParser(formula, FormulaLexer.tokenize(formula), maxDepth).parse();
    }

    /**
     * Parses the whole token stream.
     */
    public ParseResult parse() {
        FormulaNode root;
        if (check(TokenKind.EOF)) {
            fail(Diagnostic.Kind.SYNTAX, "an expression");
            root = new Fallback(source, failureReason);
        } else {
            root = parseExpression();
            if (!halted && !check(TokenKind.EOF)) {
                fail(Diagnostic.Kind.SYNTAX, "end of formula");
                root = new Fallback(source, failureReason);
            } else if (isBlankFallback(root)) {
                root = new Fallback(source, ((Fallback) root).reason());
            }
            if (!(root instanceof Fallback) && nestsDeeperThanLimit(root)) {
                String message = tooDeepMessage();
                diagnostics.add(Diagnostic.error(Diagnostic.Kind.SYNTAX, message, 0));
                root = new Fallback(source, message);
            }
        }
        return new ParseResult(root, diagnostics.toImmutable());
    }

    private FormulaNode parseExpression() {
        return parseOrExpression();
    }

    // ==================== Binary operators ====================

    /**
     * Parses OR expressions: expr OR expr
     */
    private FormulaNode parseOrExpression() {
        int start = peek().position();
        FormulaNode left = parseAndExpression();

        while (check(TokenKind.OR)) {
            advance();
            FormulaNode right = parseAndExpression();
            if (isBlankFallback(right)) {
                return abandon(start);
            }
            left = Logical.or(left, right);
        }

        return left;
    }

    /**
     * Parses AND expressions: expr AND expr
     */
    private FormulaNode parseAndExpression() {
        int start = peek().position();
        FormulaNode left = parseEqualityExpression();

        while (check(TokenKind.AND)) {
            advance();
            FormulaNode right = parseEqualityExpression();
            if (isBlankFallback(right)) {
                return abandon(start);
            }
            left = Logical.and(left, right);
        }

        return left;
    }

    /**
     * Parses equality: [Region] = 'East', [a] != [b], [a] <> [b]
     */
    private FormulaNode parseEqualityExpression() {
        int start = peek().position();
        FormulaNode left = parseRelationalExpression();

        while (check(TokenKind.EQUALS) || check(TokenKind.NOT_EQUALS)) {
            Comparison.Operator op = advance().is(TokenKind.EQUALS)
                    ? Comparison.Operator.EQUALS
                    : Comparison.Operator.NOT_EQUALS;
            FormulaNode right = parseRelationalExpression();
            if (isBlankFallback(right)) {
                return abandon(start);
            }
            left = new Comparison(op, left, right);
        }

        return left;
    }

    /**
     * Parses relational comparisons: [Sales] > 1000
     */
    private FormulaNode parseRelationalExpression() {
        int start = peek().position();
        FormulaNode left = parseAdditiveExpression();

        while (check(TokenKind.LESS_THAN) || check(TokenKind.LESS_THAN_EQ)
                || check(TokenKind.GREATER_THAN) || check(TokenKind.GREATER_THAN_EQ)) {
            Token opToken = advance();
            Comparison.Operator op = switch (opToken.kind()) {
                case LESS_THAN -> Comparison.Operator.LESS_THAN;
                case LESS_THAN_EQ -> Comparison.Operator.LESS_THAN_OR_EQUALS;
                case GREATER_THAN -> Comparison.Operator.GREATER_THAN;
                default -> Comparison.Operator.GREATER_THAN_OR_EQUALS;
            };
            FormulaNode right = parseAdditiveExpression();
            if (isBlankFallback(right)) {
                return abandon(start);
            }
            left = new Comparison(op, left, right);
        }

        return left;
    }

    /**
     * Parses addition and subtraction.
     */
    private FormulaNode parseAdditiveExpression() {
        int start = peek().position();
        FormulaNode left = parseMultiplicativeExpression();

        while (check(TokenKind.PLUS) || check(TokenKind.MINUS)) {
            Arithmetic.Operator op = advance().is(TokenKind.PLUS)
                    ? Arithmetic.Operator.ADD
                    : Arithmetic.Operator.SUBTRACT;
            FormulaNode right = parseMultiplicativeExpression();
            if (isBlankFallback(right)) {
                return abandon(start);
            }
            left = new Arithmetic(op, left, right);
        }

        return left;
    }

    /**
     * Parses multiplication, division and modulo.
     */
    private FormulaNode parseMultiplicativeExpression() {
        int start = peek().position();
        FormulaNode left = parseUnaryExpression();

        while (check(TokenKind.STAR) || check(TokenKind.SLASH) || check(TokenKind.PERCENT)) {
            Arithmetic.Operator op = switch (advance().kind()) {
                case STAR -> Arithmetic.Operator.MULTIPLY;
                case SLASH -> Arithmetic.Operator.DIVIDE;
                default -> Arithmetic.Operator.MODULO;
            };
            FormulaNode right = parseUnaryExpression();
            if (isBlankFallback(right)) {
                return abandon(start);
            }
            left = new Arithmetic(op, left, right);
        }

        return left;
    }

    /**
     * Parses unary minus, unary plus and NOT.
     * A minus directly applied to a number folds into a negative literal;
     * since exponentiation binds tighter, -2^2 is -(2^2).
     */
    private FormulaNode parseUnaryExpression() {
        int start = peek().position();
        if (nesting >= maxDepth) {
            failTooDeep(start);
            return abandon(start);
        }
        nesting++;
        try {
            return parseUnaryOperand(start);
        } finally {
            nesting--;
        }
    }

    private FormulaNode parseUnaryOperand(int start) {
        if (check(TokenKind.MINUS)) {
            advance();
            FormulaNode operand = parseUnaryExpression();
            if (isBlankFallback(operand)) {
                return abandon(start);
            }
            if (operand instanceof Literal literal && literal.dataType() == Literal.DataType.INTEGER) {
                return Literal.integer(-((Long) literal.value()));
            }
            if (operand instanceof Literal literal && literal.dataType() == Literal.DataType.REAL) {
                return Literal.real(-((Double) literal.value()));
            }
            return new Negation(operand);
        }

        if (check(TokenKind.PLUS)) {
            advance();
            FormulaNode operand = parseUnaryExpression();
            return isBlankFallback(operand) ? abandon(start) : operand;
        }

        if (check(TokenKind.NOT)) {
            advance();
            FormulaNode operand = parseUnaryExpression();
            return isBlankFallback(operand) ? abandon(start) : Logical.not(operand);
        }

        return parsePowerExpression();
    }

    /**
     * Parses exponentiation: base ^ exponent (right associative).
     */
    private FormulaNode parsePowerExpression() {
        int start = peek().position();
        FormulaNode base = parsePrimaryExpression();

        if (check(TokenKind.CARET)) {
            advance();
            FormulaNode exponent = parseUnaryExpression();
            if (isBlankFallback(exponent)) {
                return abandon(start);
            }
            return new Arithmetic(Arithmetic.Operator.POWER, base, exponent);
        }

        return base;
    }

    // ==================== Primary expressions ====================

    /**
     * Parses primary expressions: literals, field references, parenthesized
     * expressions, calls, IF, CASE and level of detail braces.
     */
    private FormulaNode parsePrimaryExpression() {
        Token token = peek();

        return switch (token.kind()) {
            case STRING -> {
                advance();
                yield Literal.string(token.text());
            }
            case INTEGER -> {
                advance();
                yield integerLiteral(token.text());
            }
            case REAL -> {
                advance();
                yield Literal.real(Double.parseDouble(token.text()));
            }
            case BOOLEAN -> {
                advance();
                yield Literal.bool("TRUE".equals(token.text()));
            }
            case NULL -> {
                advance();
                yield Literal.NULL;
            }
            case FIELD_REF -> {
                advance();
                yield FieldRef.of(token.text());
            }
            case LPAREN -> parseParenthesized();
            case IDENTIFIER -> parseCall();
            case IF -> parseIf();
            case CASE -> parseCase();
            case LBRACE -> parseLevelOfDetail();
            case PLUS, MINUS, STAR, SLASH, PERCENT, CARET,
                    EQUALS, NOT_EQUALS, LESS_THAN, LESS_THAN_EQ, GREATER_THAN, GREATER_THAN_EQ,
                    THEN, ELSEIF, ELSE, END, WHEN, AND, OR, NOT,
                    FIXED, INCLUDE, EXCLUDE,
                    RPAREN, RBRACE, COMMA, COLON,
                    EOF, UNKNOWN -> {
                fail(Diagnostic.Kind.SYNTAX, "an expression");
                yield new Fallback(source.substring(token.position()), failureReason);
            }
        };
    }

    private static Literal integerLiteral(String text) {
        try {
            return Literal.integer(Long.parseLong(text));
        } catch (NumberFormatException e) {
            // Too large for a long; keep the magnitude as a real
            return Literal.real(Double.parseDouble(text));
        }
    }

    /**
     * Parses ( expr )
     */
    private FormulaNode parseParenthesized() {
        int start = advance().position();
        FormulaNode inner = parseExpression();
        if (halted || expect(TokenKind.RPAREN, "')'") == null) {
            return abandon(start);
        }
        return inner;
    }

    /**
     * Parses NAME(arg, ...) into a FunctionCall, or a WindowCall when NAME is a
     * table calculation. IIF and LOOKUP are lowered here.
     */
    private FormulaNode parseCall() {
        Token nameToken = advance();
        int start = nameToken.position();

        if (expect(TokenKind.LPAREN, "'(' after " + nameToken.text()) == null) {
            return abandon(start);
        }

        MutableList<FormulaNode> arguments = Lists.mutable.empty();
        if (!check(TokenKind.RPAREN)) {
            arguments.add(parseExpression());
            while (!halted && check(TokenKind.COMMA)) {
                advance();
                arguments.add(parseExpression());
            }
        }
        if (halted) {
            return abandon(start);
        }
        Token close = expect(TokenKind.RPAREN, "')' to close " + nameToken.text());
        if (close == null) {
            return abandon(start);
        }

        String name = nameToken.text().toUpperCase(Locale.ROOT);
        String callText = source.substring(start, close.position() + 1);

        if ("IIF".equals(name)) {
            if (arguments.size() != 3) {
                return shapeError(callText, start, "IIF expects 3 arguments, got " + arguments.size());
            }
            return new Conditional(arguments.get(0), arguments.get(1), arguments.get(2));
        }
        if ("LOOKUP".equals(name)) {
            return buildLookup(arguments, callText, start);
        }
        if (WindowFunctions.isWindowFunction(name)) {
            return buildWindowCall(WindowFunctions.canonicalName(name), arguments, callText, start);
        }
        return new FunctionCall(name, arguments.toImmutable());
    }

    /**
     * Parses IF c THEN e (ELSEIF c THEN e)* [ELSE e] END into right-nested
     * Conditionals. A missing ELSE yields NULL.
     */
    private FormulaNode parseIf() {
        int start = advance().position();

        MutableList<FormulaNode> conditions = Lists.mutable.empty();
        MutableList<FormulaNode> branches = Lists.mutable.empty();

        do {
            conditions.add(parseExpression());
            if (halted || expect(TokenKind.THEN, "THEN after IF condition") == null) {
                return abandon(start);
            }
            branches.add(parseExpression());
            if (halted) {
                return abandon(start);
            }
        } while (check(TokenKind.ELSEIF) && advance() != null);

        FormulaNode elseBranch = Literal.NULL;
        if (check(TokenKind.ELSE)) {
            advance();
            elseBranch = parseExpression();
            if (halted) {
                return abandon(start);
            }
        }

        if (expect(TokenKind.END, "ELSE, ELSEIF or END to close IF") == null) {
            return abandon(start);
        }

        FormulaNode result = elseBranch;
        for (int i = conditions.size() - 1; i >= 0; i--) {
            result = new Conditional(conditions.get(i), branches.get(i), result);
        }
        return result;
    }

    /**
     * Parses CASE [subject] WHEN m THEN r ... [ELSE e] END.
     */
    private FormulaNode parseCase() {
        int start = advance().position();

        FormulaNode subject = null;
        if (!check(TokenKind.WHEN)) {
            subject = parseExpression();
            if (halted) {
                return abandon(start);
            }
        }

        MutableList<Case.WhenClause> clauses = Lists.mutable.empty();
        if (!check(TokenKind.WHEN)) {
            expect(TokenKind.WHEN, "WHEN in CASE");
            return abandon(start);
        }
        while (check(TokenKind.WHEN)) {
            advance();
            FormulaNode match = parseExpression();
            if (halted || expect(TokenKind.THEN, "THEN after WHEN") == null) {
                return abandon(start);
            }
            FormulaNode result = parseExpression();
            if (halted) {
                return abandon(start);
            }
            clauses.add(new Case.WhenClause(match, result));
        }

        FormulaNode elseBranch = null;
        if (check(TokenKind.ELSE)) {
            advance();
            elseBranch = parseExpression();
            if (halted) {
                return abandon(start);
            }
        }

        if (expect(TokenKind.END, "WHEN, ELSE or END to close CASE") == null) {
            return abandon(start);
        }
        return new Case(subject, clauses.toImmutable(), elseBranch);
    }

    /**
     * Parses level of detail expressions:
     * {FIXED [Region], [Segment] : SUM([Sales])}
     * {INCLUDE [Customer] : AVG([Profit])}
     * {FIXED : SUM([Sales])} and {SUM([Sales])} aggregate over the whole table.
     */
    private FormulaNode parseLevelOfDetail() {
        int start = advance().position();

        ScopedAggregate.Scope scope;
        switch (peek().kind()) {
            case FIXED -> scope = ScopedAggregate.Scope.FIXED;
            case INCLUDE -> scope = ScopedAggregate.Scope.INCLUDE;
            case EXCLUDE -> scope = ScopedAggregate.Scope.EXCLUDE;
            default -> scope = null;
        }

        if (scope == null) {
            if (check(TokenKind.IDENTIFIER) && !peekNext().is(TokenKind.LPAREN)) {
                fail(Diagnostic.Kind.SCOPE, "FIXED, INCLUDE or EXCLUDE");
                return abandon(start);
            }
            FormulaNode expression = parseExpression();
            if (halted || expect(TokenKind.RBRACE, "'}' to close level of detail expression") == null) {
                return abandon(start);
            }
            return new ScopedAggregate(ScopedAggregate.Scope.FIXED, Lists.immutable.empty(), expression);
        }
        advance();

        Map<String, FieldRef> dimensions = new LinkedHashMap<>();
        if (!check(TokenKind.COLON)) {
            do {
                if (!check(TokenKind.FIELD_REF)) {
                    fail(Diagnostic.Kind.SCOPE, "a dimension field reference");
                    return abandon(start);
                }
                FieldRef dimension = FieldRef.of(advance().text());
                dimensions.putIfAbsent(dimension.normalizedName(), dimension);
            } while (check(TokenKind.COMMA) && advance() != null);
        } else if (scope != ScopedAggregate.Scope.FIXED) {
            fail(Diagnostic.Kind.SCOPE, "at least one dimension after " + scope);
            return abandon(start);
        }

        if (expect(TokenKind.COLON, "':' after level of detail dimensions") == null) {
            return abandon(start);
        }
        FormulaNode expression = parseExpression();
        if (halted || expect(TokenKind.RBRACE, "'}' to close level of detail expression") == null) {
            return abandon(start);
        }
        return new ScopedAggregate(scope, Lists.immutable.withAll(dimensions.values()), expression);
    }

    // ==================== Table calculations ====================

    /**
     * Checks the argument shape of a table calculation and builds the node.
     */
    private FormulaNode buildWindowCall(String name, MutableList<FormulaNode> args, String callText, int start) {
        ImmutableList<FormulaNode> none = Lists.immutable.empty();

        switch (WindowFunctions.familyOf(name)) {
            case RANKING -> {
                if (args.isEmpty() && "ROW_NUMBER".equals(name)) {
                    return new WindowCall(name, null, WindowCall.OrderMode.ASC, null, none);
                }
                if (args.isEmpty() || args.size() > 2) {
                    return shapeError(callText, start, name + " expects 1 or 2 arguments, got " + args.size());
                }
                WindowCall.OrderMode order = WindowCall.OrderMode.ASC;
                if (args.size() == 2) {
                    order = orderMode(args.get(1));
                    if (order == null) {
                        return shapeError(callText, start, name + " direction must be 'asc' or 'desc'");
                    }
                }
                return new WindowCall(name, args.get(0), order, null, none);
            }
            case RUNNING -> {
                if (args.size() != 1) {
                    return shapeError(callText, start, name + " expects 1 argument, got " + args.size());
                }
                return new WindowCall(name, args.get(0), WindowCall.OrderMode.ASC,
                        WindowCall.WindowFrame.UNBOUNDED_TO_CURRENT, none);
            }
            case WINDOW -> {
                if (args.size() != 1 && args.size() != 3) {
                    return shapeError(callText, start, name + " expects 1 or 3 arguments, got " + args.size());
                }
                if (args.size() == 1) {
                    return new WindowCall(name, args.get(0), WindowCall.OrderMode.ASC,
                            WindowCall.WindowFrame.UNBOUNDED_TO_CURRENT, none);
                }
                FrameBound from = frameBound(args.get(1), "FIRST");
                FrameBound to = frameBound(args.get(2), "LAST");
                if (from == null || to == null) {
                    return shapeError(callText, start,
                            name + " frame bounds must be integer offsets, FIRST() or LAST()");
                }
                if (from.offset() != null && to.offset() != null && from.offset() > to.offset()) {
                    return shapeError(callText, start, name + " frame starts after it ends");
                }
                return new WindowCall(name, args.get(0), WindowCall.OrderMode.ASC,
                        new WindowCall.WindowFrame(from.offset(), to.offset()), none);
            }
            case OFFSET -> {
                if (args.isEmpty() || args.size() > 3) {
                    return shapeError(callText, start, name + " expects 1 to 3 arguments, got " + args.size());
                }
                return new WindowCall(name, args.get(0), WindowCall.OrderMode.ASC, null,
                        Lists.immutable.withAll(args.subList(1, args.size())));
            }
            default -> throw new IllegalStateException("Unhandled window family for " + name);
        }
    }

    /**
     * LOOKUP(expr, n) reads n rows away: a negative n looks back (LAG), a
     * positive n looks ahead (LEAD).
     */
    private FormulaNode buildLookup(MutableList<FormulaNode> args, String callText, int start) {
        if (args.size() != 2 || !(args.get(1) instanceof Literal offset)
                || offset.dataType() != Literal.DataType.INTEGER) {
            return shapeError(callText, start, "LOOKUP expects an expression and an integer offset");
        }
        long n = (Long) offset.value();
        String name = n > 0 ? "LEAD" : "LAG";
        return new WindowCall(name, args.get(0), WindowCall.OrderMode.ASC, null,
                Lists.immutable.of(Literal.integer(Math.abs(n))));
    }

    private record FrameBound(Integer offset) {
    }

    /**
     * An integer literal is a row offset; FIRST()/LAST() (whichever is allowed
     * at this end of the frame) is unbounded. Anything else is rejected.
     */
    private static FrameBound frameBound(FormulaNode node, String unboundedName) {
        if (node instanceof Literal literal && literal.dataType() == Literal.DataType.INTEGER) {
            long value = (Long) literal.value();
            if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
                return null;
            }
            return new FrameBound((int) value);
        }
        if (node instanceof FunctionCall call && call.arguments().isEmpty()
                && unboundedName.equals(call.name())) {
            return new FrameBound(null);
        }
        return null;
    }

    private static WindowCall.OrderMode orderMode(FormulaNode node) {
        if (node instanceof Literal literal && literal.dataType() == Literal.DataType.STRING) {
            String direction = ((String) literal.value()).trim().toLowerCase(Locale.ROOT);
            return switch (direction) {
                case "asc", "ascending" -> WindowCall.OrderMode.ASC;
                case "desc", "descending" -> WindowCall.OrderMode.DESC;
                default -> null;
            };
        }
        return null;
    }

    /**
     * A call whose tokens parsed fine but whose arguments do not fit the
     * function. Only the call degrades; parsing continues after it.
     */
    private Fallback shapeError(String callText, int start, String message) {
        diagnostics.add(Diagnostic.error(Diagnostic.Kind.SYNTAX, message, start));
        return new Fallback(callText, message);
    }

    // ==================== Error handling ====================

    /**
     * Records the first failure and stops parsing by jumping to EOF.
     */
    private void fail(Diagnostic.Kind kind, String expected) {
        if (halted) {
            return;
        }
        Token found = peek();
        String message;
        if (found.is(TokenKind.UNKNOWN)) {
            kind = Diagnostic.Kind.LEXICAL;
            message = "Unrecognized character '" + found.text() + "', expected " + expected;
        } else {
            message = "Expected " + expected + " but found " + describe(found);
        }
        diagnostics.add(Diagnostic.error(kind, message, found.position()));
        failureReason = message;
        halted = true;
        position = tokens.size() - 1;
    }

    private void failTooDeep(int at) {
        if (halted) {
            return;
        }
        String message = tooDeepMessage();
        diagnostics.add(Diagnostic.error(Diagnostic.Kind.SYNTAX, message, at));
        failureReason = message;
        halted = true;
        position = tokens.size() - 1;
    }

    private String tooDeepMessage() {
        return "Formula nests deeper than " + maxDepth + " levels";
    }

    /**
     * Degrades the construct starting at {@code start} to a Fallback.
     */
    private Fallback abandon(int start) {
        return new Fallback(source.substring(Math.min(start, source.length())), failureReason);
    }

    private static boolean isBlankFallback(FormulaNode node) {
        return node instanceof Fallback fallback && fallback.originalText().isBlank();
    }

    private static String describe(Token token) {
        return switch (token.kind()) {
            case EOF -> "end of formula";
            case FIELD_REF -> "[" + token.text() + "]";
            default -> "'" + token.text() + "'";
        };
    }

    // ==================== Nesting ====================

    /**
     * Measures the tree with an explicit stack. The else branch of a
     * Conditional that is itself a Conditional stays on the same level.
     */
    private boolean nestsDeeperThanLimit(FormulaNode root) {
        Deque<FormulaNode> nodes = new ArrayDeque<>();
        Deque<Integer> levels = new ArrayDeque<>();
        nodes.push(root);
        levels.push(1);
        while (!nodes.isEmpty()) {
            FormulaNode node = nodes.pop();
            int level = levels.pop();
            if (level > maxDepth) {
                return true;
            }
            for (FormulaNode child : node.accept(CHILDREN)) {
                boolean elseIf = node instanceof Conditional conditional
                        && child == conditional.elseBranch() && child instanceof Conditional;
                nodes.push(child);
                levels.push(elseIf ? level : level + 1);
            }
        }
        return false;
    }

    private static final FormulaNodeVisitor<ImmutableList<FormulaNode>> CHILDREN =
            new FormulaNodeVisitor<>() {
                @Override
                public ImmutableList<FormulaNode> visitLiteral(Literal literal) {
                    return Lists.immutable.empty();
                }

                @Override
                public ImmutableList<FormulaNode> visitFieldRef(FieldRef fieldRef) {
                    return Lists.immutable.empty();
                }

                @Override
                public ImmutableList<FormulaNode> visitArithmetic(Arithmetic arithmetic) {
                    return Lists.immutable.of(arithmetic.left(), arithmetic.right());
                }

                @Override
                public ImmutableList<FormulaNode> visitComparison(Comparison comparison) {
                    return Lists.immutable.of(comparison.left(), comparison.right());
                }

                @Override
                public ImmutableList<FormulaNode> visitLogical(Logical logical) {
                    return logical.right() == null
                            ? Lists.immutable.of(logical.left())
                            : Lists.immutable.of(logical.left(), logical.right());
                }

                @Override
                public ImmutableList<FormulaNode> visitNegation(Negation negation) {
                    return Lists.immutable.of(negation.operand());
                }

                @Override
                public ImmutableList<FormulaNode> visitConditional(Conditional conditional) {
                    return Lists.immutable.of(
                            conditional.condition(), conditional.thenBranch(), conditional.elseBranch());
                }

                @Override
                public ImmutableList<FormulaNode> visitCase(Case caseNode) {
                    MutableList<FormulaNode> children = Lists.mutable.empty();
                    if (caseNode.subject() != null) {
                        children.add(caseNode.subject());
                    }
                    for (Case.WhenClause clause : caseNode.whenClauses()) {
                        children.add(clause.match());
                        children.add(clause.result());
                    }
                    if (caseNode.elseBranch() != null) {
                        children.add(caseNode.elseBranch());
                    }
                    return children.toImmutable();
                }

                @Override
                public ImmutableList<FormulaNode> visitFunctionCall(FunctionCall call) {
                    return call.arguments();
                }

                @Override
                public ImmutableList<FormulaNode> visitScopedAggregate(ScopedAggregate aggregate) {
                    return Lists.immutable.of(aggregate.expression());
                }

                @Override
                public ImmutableList<FormulaNode> visitWindowCall(WindowCall window) {
                    return window.argument() == null
                            ? window.extraArgs()
                            : window.extraArgs().newWith(window.argument());
                }

                @Override
                public ImmutableList<FormulaNode> visitFallback(Fallback fallback) {
                    return Lists.immutable.empty();
                }
            };

    // ==================== Helper Methods ====================

    private Token peek() {
        return tokens.get(position);
    }

    private Token peekNext() {
        return tokens.get(Math.min(position + 1, tokens.size() - 1));
    }

    private boolean check(TokenKind kind) {
        return peek().is(kind);
    }

    private Token advance() {
        Token token = peek();
        if (!token.is(TokenKind.EOF)) {
            position++;
        }
        return token;
    }

    private Token expect(TokenKind kind, String expected) {
        if (check(kind)) {
            return advance();
        }
        fail(Diagnostic.Kind.SYNTAX, expected);
        return null;
    }
}
