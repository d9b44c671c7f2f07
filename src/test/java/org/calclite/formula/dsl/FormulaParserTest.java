package org.calclite.formula.dsl;

import org.eclipse.collections.api.factory.Lists;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser tests - precedence, every construct, and recovery from bad input.
 */
@DisplayName("Formula Parser Tests")
class FormulaParserTest {

    private static FormulaNode parseValid(String formula) {
        ParseResult result = FormulaParser.parse(formula);
        assertTrue(result.diagnostics().isEmpty(), () -> "Unexpected diagnostics: " + result.diagnostics());
        return result.root();
    }

    private static FieldRef field(String name) {
        return FieldRef.of(name);
    }

    private static Literal integer(long value) {
        return Literal.integer(value);
    }

    // ==================== Precedence ====================

    @Nested
    @DisplayName("Operator precedence")
    class Precedence {

        @Test
        @DisplayName("Multiplication binds tighter than addition")
        void testMultiplicationOverAddition() {
            FormulaNode root = parseValid("[a] + [b] * 2");

            assertEquals(new Arithmetic(Arithmetic.Operator.ADD, field("a"),
                    new Arithmetic(Arithmetic.Operator.MULTIPLY, field("b"), integer(2))), root);
        }

        @Test
        @DisplayName("Subtraction is left associative")
        void testLeftAssociative() {
            FormulaNode root = parseValid("10 - 4 - 3");

            assertEquals(new Arithmetic(Arithmetic.Operator.SUBTRACT,
                    new Arithmetic(Arithmetic.Operator.SUBTRACT, integer(10), integer(4)), integer(3)), root);
        }

        @Test
        @DisplayName("-2^2 negates the power, not the base")
        void testUnaryMinusAndPower() {
            FormulaNode root = parseValid("-2^2");

            assertEquals(new Negation(new Arithmetic(Arithmetic.Operator.POWER, integer(2), integer(2))), root);
        }

        @Test
        @DisplayName("Exponentiation is right associative")
        void testPowerRightAssociative() {
            FormulaNode root = parseValid("2 ^ 3 ^ 2");

            assertEquals(new Arithmetic(Arithmetic.Operator.POWER, integer(2),
                    new Arithmetic(Arithmetic.Operator.POWER, integer(3), integer(2))), root);
        }

        @Test
        @DisplayName("A parenthesized negative base stays a negative literal")
        void testParenthesizedNegativeBase() {
            FormulaNode root = parseValid("(-2) ^ 2");

            assertEquals(new Arithmetic(Arithmetic.Operator.POWER, integer(-2), integer(2)), root);
        }

        @Test
        @DisplayName("Minus on a number folds into the literal; on a field it is a negation")
        void testUnaryMinus() {
            assertEquals(integer(-5), parseValid("-5"));
            assertEquals(new Negation(field("x")), parseValid("-[x]"));
            assertEquals(new Arithmetic(Arithmetic.Operator.SUBTRACT, integer(3), Literal.real(-1.5)),
                    parseValid("3 - -1.5"));
            assertEquals(field("x"), parseValid("+[x]"));
        }

        @Test
        @DisplayName("AND binds tighter than OR, NOT tighter than AND")
        void testLogicalPrecedence() {
            assertEquals(Logical.or(field("a"), Logical.and(field("b"), field("c"))),
                    parseValid("[a] OR [b] AND [c]"));
            assertEquals(Logical.and(Logical.not(field("a")), field("b")),
                    parseValid("NOT [a] AND [b]"));
        }

        @Test
        @DisplayName("Comparisons sit between logic and arithmetic")
        void testComparison() {
            FormulaNode root = parseValid("[a] + 1 > [b] * 2 AND [c] <> 'x'");

            assertEquals(Logical.and(
                    new Comparison(Comparison.Operator.GREATER_THAN,
                            new Arithmetic(Arithmetic.Operator.ADD, field("a"), integer(1)),
                            new Arithmetic(Arithmetic.Operator.MULTIPLY, field("b"), integer(2))),
                    new Comparison(Comparison.Operator.NOT_EQUALS, field("c"), Literal.string("x"))), root);
        }

        @Test
        @DisplayName("Modulo is multiplicative")
        void testModulo() {
            assertEquals(new Arithmetic(Arithmetic.Operator.ADD, integer(1),
                    new Arithmetic(Arithmetic.Operator.MODULO, field("a"), integer(3))),
                    parseValid("1 + [a] % 3"));
        }
    }

    // ==================== Conditionals ====================

    @Nested
    @DisplayName("IF and CASE")
    class Conditionals {

        @Test
        @DisplayName("ELSEIF chains nest in the else branch")
        void testElseIfChain() {
            FormulaNode root = parseValid("IF [x] > 10 THEN 'hi' ELSEIF [x] > 5 THEN 'mid' ELSE 'lo' END");

            Conditional outer = assertInstanceOf(Conditional.class, root);
            assertEquals(Literal.string("hi"), outer.thenBranch());
            Conditional inner = assertInstanceOf(Conditional.class, outer.elseBranch());
            assertEquals(new Comparison(Comparison.Operator.GREATER_THAN, field("x"), integer(5)), inner.condition());
            assertEquals(Literal.string("mid"), inner.thenBranch());
            assertEquals(Literal.string("lo"), inner.elseBranch());
        }

        @Test
        @DisplayName("A missing ELSE becomes NULL")
        void testMissingElse() {
            Conditional root = assertInstanceOf(Conditional.class, parseValid("if [a] then 1 end"));

            assertEquals(Literal.NULL, root.elseBranch());
        }

        @Test
        @DisplayName("IIF lowers to a conditional")
        void testIif() {
            assertEquals(new Conditional(field("a"), integer(1), integer(0)), parseValid("IIF([a], 1, 0)"));
        }

        @Test
        @DisplayName("CASE with a subject keeps clauses in source order")
        void testSimpleCase() {
            Case root = assertInstanceOf(Case.class,
                    parseValid("CASE [Region] WHEN 'East' THEN 1 WHEN 'West' THEN 2 ELSE 0 END"));

            assertFalse(root.isSearched());
            assertEquals(field("Region"), root.subject());
            assertEquals(2, root.whenClauses().size());
            assertEquals(Literal.string("East"), root.whenClauses().get(0).match());
            assertEquals(integer(2), root.whenClauses().get(1).result());
            assertEquals(integer(0), root.elseBranch());
        }

        @Test
        @DisplayName("CASE without a subject is searched")
        void testSearchedCase() {
            Case root = assertInstanceOf(Case.class, parseValid("CASE WHEN [x] > 1 THEN 'a' END"));

            assertTrue(root.isSearched());
            assertNull(root.elseBranch());
            assertInstanceOf(Comparison.class, root.whenClauses().get(0).match());
        }

        @Test
        @DisplayName("CASE without WHEN is a syntax error")
        void testCaseWithoutWhen() {
            ParseResult result = FormulaParser.parse("CASE [a] END");

            assertEquals(new Fallback("CASE [a] END", result.diagnostics().get(0).message()), result.root());
            assertEquals(Diagnostic.Kind.SYNTAX, result.diagnostics().get(0).kind());
        }
    }

    // ==================== Level of detail ====================

    @Nested
    @DisplayName("Level of detail expressions")
    class LevelOfDetail {

        @Test
        @DisplayName("FIXED with one dimension")
        void testFixed() {
            FormulaNode root = parseValid("{FIXED [Region] : SUM([Sales])}");

            assertEquals(new ScopedAggregate(ScopedAggregate.Scope.FIXED,
                    Lists.immutable.of(field("Region")),
                    new FunctionCall("SUM", Lists.immutable.of(field("Sales")))), root);
        }

        @Test
        @DisplayName("Duplicate dimensions collapse")
        void testDuplicateDimensions() {
            ScopedAggregate root = assertInstanceOf(ScopedAggregate.class,
                    parseValid("{ INCLUDE [Region], [Segment], [region] : AVG([Profit]) }"));

            assertEquals(ScopedAggregate.Scope.INCLUDE, root.scope());
            assertEquals(Lists.immutable.of("region", "segment"),
                    root.dimensions().collect(FieldRef::normalizedName));
        }

        @Test
        @DisplayName("FIXED without dimensions and the bare brace form are table-scoped")
        void testTableScoped() {
            ScopedAggregate expected = new ScopedAggregate(ScopedAggregate.Scope.FIXED, Lists.immutable.empty(),
                    new FunctionCall("MAX", Lists.immutable.of(field("Order Date"))));

            assertEquals(expected, parseValid("{FIXED : MAX([Order Date])}"));
            assertEquals(expected, parseValid("{MAX([Order Date])}"));
        }

        @Test
        @DisplayName("FIXED nested inside INCLUDE")
        void testNested() {
            ScopedAggregate outer = assertInstanceOf(ScopedAggregate.class,
                    parseValid("{INCLUDE [Customer] : AVG({FIXED [Region] : SUM([Sales])})}"));

            FunctionCall avg = assertInstanceOf(FunctionCall.class, outer.expression());
            ScopedAggregate inner = assertInstanceOf(ScopedAggregate.class, avg.arguments().get(0));
            assertEquals(ScopedAggregate.Scope.FIXED, inner.scope());
            assertEquals(Lists.immutable.of("region"), inner.dimensions().collect(FieldRef::normalizedName));
        }

        @Test
        @DisplayName("LOD inside arithmetic")
        void testInArithmetic() {
            Arithmetic root = assertInstanceOf(Arithmetic.class,
                    parseValid("SUM([Sales]) / {EXCLUDE [Region] : SUM([Sales])}"));

            assertEquals(Arithmetic.Operator.DIVIDE, root.operator());
            assertInstanceOf(ScopedAggregate.class, root.right());
        }

        @Test
        @DisplayName("Unknown scope keyword is a scope error")
        void testUnknownScope() {
            ParseResult result = FormulaParser.parse("{PER [a] : SUM([b])}");

            Fallback fallback = assertInstanceOf(Fallback.class, result.root());
            assertEquals("{PER [a] : SUM([b])}", fallback.originalText());
            assertEquals(Diagnostic.Kind.SCOPE, result.diagnostics().get(0).kind());
        }

        @Test
        @DisplayName("INCLUDE without dimensions is a scope error")
        void testEmptyInclude() {
            ParseResult result = FormulaParser.parse("{INCLUDE : SUM([b])}");

            assertInstanceOf(Fallback.class, result.root());
            assertEquals(Diagnostic.Kind.SCOPE, result.diagnostics().get(0).kind());
        }

        @Test
        @DisplayName("A dimension must be a field reference")
        void testNonFieldDimension() {
            ParseResult result = FormulaParser.parse("{FIXED 'x' : SUM([b])}");

            assertEquals(Diagnostic.Kind.SCOPE, result.diagnostics().get(0).kind());
        }

        @Test
        @DisplayName("Unterminated brace")
        void testUnterminated() {
            ParseResult result = FormulaParser.parse("{FIXED [a] : SUM([b])");

            assertEquals(new Fallback("{FIXED [a] : SUM([b])", result.diagnostics().get(0).message()),
                    result.root());
            assertEquals(Diagnostic.Kind.SYNTAX, result.diagnostics().get(0).kind());
            assertTrue(result.diagnostics().get(0).message().contains("end of formula"));
        }
    }

    // ==================== Table calculations ====================

    @Nested
    @DisplayName("Table calculations")
    class TableCalculations {

        @Test
        @DisplayName("RANK with a direction")
        void testRankDesc() {
            assertEquals(new WindowCall("RANK", field("Sales"), WindowCall.OrderMode.DESC, null,
                    Lists.immutable.empty()), parseValid("RANK([Sales], 'desc')"));
        }

        @Test
        @DisplayName("RANK defaults to ascending; aliases are canonicalized")
        void testRankDefaults() {
            WindowCall rank = assertInstanceOf(WindowCall.class, parseValid("rank([Sales])"));
            assertEquals(WindowCall.OrderMode.ASC, rank.orderMode());

            WindowCall dense = assertInstanceOf(WindowCall.class, parseValid("RANK_DENSE([Sales], 'ASC')"));
            assertEquals("DENSE_RANK", dense.name());

            WindowCall index = assertInstanceOf(WindowCall.class, parseValid("INDEX()"));
            assertEquals("ROW_NUMBER", index.name());
            assertNull(index.argument());
        }

        @Test
        @DisplayName("Running aggregates run from the first row to the current row")
        void testRunning() {
            WindowCall root = assertInstanceOf(WindowCall.class, parseValid("RUNNING_SUM(SUM([Sales]))"));

            assertEquals(WindowCall.WindowFrame.UNBOUNDED_TO_CURRENT, root.frame());
            assertInstanceOf(FunctionCall.class, root.argument());
        }

        @Test
        @DisplayName("WINDOW_ frames take offsets or FIRST()/LAST()")
        void testWindowFrames() {
            WindowCall offsets = assertInstanceOf(WindowCall.class, parseValid("WINDOW_AVG([x], -2, 0)"));
            assertEquals(new WindowCall.WindowFrame(-2, 0), offsets.frame());

            WindowCall whole = assertInstanceOf(WindowCall.class, parseValid("WINDOW_SUM([x], FIRST(), LAST())"));
            assertEquals(new WindowCall.WindowFrame(null, null), whole.frame());

            WindowCall defaulted = assertInstanceOf(WindowCall.class, parseValid("WINDOW_MAX([x])"));
            assertEquals(WindowCall.WindowFrame.UNBOUNDED_TO_CURRENT, defaulted.frame());
        }

        @Test
        @DisplayName("LAG and LEAD keep only the arguments given")
        void testOffsets() {
            WindowCall lag = assertInstanceOf(WindowCall.class, parseValid("LAG([x])"));
            assertTrue(lag.extraArgs().isEmpty());

            WindowCall lead = assertInstanceOf(WindowCall.class, parseValid("LEAD([x], 2, 0)"));
            assertEquals(Lists.immutable.of(integer(2), integer(0)), lead.extraArgs());
        }

        @Test
        @DisplayName("LOOKUP becomes LAG or LEAD by the sign of the offset")
        void testLookup() {
            assertEquals(new WindowCall("LAG", field("x"), WindowCall.OrderMode.ASC, null,
                    Lists.immutable.of(integer(1))), parseValid("LOOKUP([x], -1)"));
            assertEquals(new WindowCall("LEAD", field("x"), WindowCall.OrderMode.ASC, null,
                    Lists.immutable.of(integer(2))), parseValid("LOOKUP([x], 2)"));
        }

        @Test
        @DisplayName("A badly shaped call degrades alone and parsing continues")
        void testShapeError() {
            ParseResult result = FormulaParser.parse("WINDOW_SUM([x], 2, -1) + 1");

            Arithmetic root = assertInstanceOf(Arithmetic.class, result.root());
            Fallback fallback = assertInstanceOf(Fallback.class, root.left());
            assertEquals("WINDOW_SUM([x], 2, -1)", fallback.originalText());
            assertEquals(integer(1), root.right());
            assertEquals(1, result.diagnostics().size());
            assertEquals(Diagnostic.Kind.SYNTAX, result.diagnostics().get(0).kind());
        }

        @Test
        @DisplayName("An unknown rank direction is rejected")
        void testBadDirection() {
            ParseResult result = FormulaParser.parse("RANK([x], 'sideways')");

            assertInstanceOf(Fallback.class, result.root());
            assertTrue(result.hasErrors());
        }
    }

    // ==================== Error recovery ====================

    @Nested
    @DisplayName("Error recovery")
    class ErrorRecovery {

        @Test
        @DisplayName("IF without END degrades to a fallback over the whole IF")
        void testIfWithoutEnd() {
            ParseResult result = FormulaParser.parse("IF [a] THEN 'x'");

            Fallback fallback = assertInstanceOf(Fallback.class, result.root());
            assertEquals("IF [a] THEN 'x'", fallback.originalText());
            assertEquals(1, result.diagnostics().size());
            Diagnostic diagnostic = result.diagnostics().get(0);
            assertEquals(Diagnostic.Severity.ERROR, diagnostic.severity());
            assertEquals(Diagnostic.Kind.SYNTAX, diagnostic.kind());
            assertEquals(15, diagnostic.position());
        }

        @Test
        @DisplayName("Only the smallest broken construct is lost")
        void testSmallestConstruct() {
            ParseResult result = FormulaParser.parse("1 + (2 * 3");

            assertEquals(new Arithmetic(Arithmetic.Operator.ADD, integer(1),
                    new Fallback("(2 * 3", result.diagnostics().get(0).message())), result.root());
        }

        @Test
        @DisplayName("A dangling operator takes its left operand with it")
        void testDanglingOperator() {
            ParseResult result = FormulaParser.parse("[a] +");

            assertEquals("[a] +", assertInstanceOf(Fallback.class, result.root()).originalText());
        }

        @Test
        @DisplayName("Trailing tokens make the whole formula a fallback")
        void testTrailingTokens() {
            ParseResult result = FormulaParser.parse("[a] [b]");

            assertEquals("[a] [b]", assertInstanceOf(Fallback.class, result.root()).originalText());
            assertEquals(4, result.diagnostics().get(0).position());
        }

        @Test
        @DisplayName("An unknown character is reported as lexical")
        void testUnknownCharacter() {
            ParseResult result = FormulaParser.parse("[a] @ 1");

            assertInstanceOf(Fallback.class, result.root());
            assertEquals(Diagnostic.Kind.LEXICAL, result.diagnostics().get(0).kind());
        }

        @Test
        @DisplayName("A keyword where an expression belongs")
        void testUnexpectedKeyword() {
            ParseResult result = FormulaParser.parse("THEN 1");

            assertEquals("THEN 1", assertInstanceOf(Fallback.class, result.root()).originalText());
            assertTrue(result.diagnostics().get(0).message().contains("'THEN'"));
        }

        @Test
        @DisplayName("An unclosed call")
        void testUnclosedCall() {
            ParseResult result = FormulaParser.parse("SUM([a]");

            assertEquals("SUM([a]", assertInstanceOf(Fallback.class, result.root()).originalText());
        }

        @ParameterizedTest
        @ValueSource(strings = { "", "   ", "// only a comment" })
        @DisplayName("Empty formulas are a fallback with a diagnostic")
        void testEmpty(String formula) {
            ParseResult result = FormulaParser.parse(formula);

            assertEquals(formula, assertInstanceOf(Fallback.class, result.root()).originalText());
            assertEquals(1, result.diagnostics().size());
        }

        @ParameterizedTest
        @ValueSource(strings = { ")", "((((", "{", "IF", "CASE WHEN", "[a] + * 2", "SUM(,)", "{FIXED [a] :}",
                "RANK()", "1 2 3", "NOT", "'unterminated", "[unterminated", "IF THEN ELSE END" })
        @DisplayName("Malformed input never throws and always yields a root")
        void testNeverThrows(String formula) {
            ParseResult result = assertDoesNotThrow(() -> FormulaParser.parse(formula));

            assertNotNull(result.root());
            assertTrue(result.hasErrors(), formula);
        }
    }

    // ==================== Nesting limit ====================

    @Nested
    @DisplayName("Nesting limit")
    class NestingLimit {

        @Test
        @DisplayName("Parentheses up to the limit parse")
        void testWithinLimit() {
            ParseResult result = FormulaParser.parse("(([a]))", 3);

            assertFalse(result.hasErrors());
            assertEquals(field("a"), result.root());
        }

        @Test
        @DisplayName("Parentheses past the limit stop the parse")
        void testPastLimit() {
            ParseResult result = FormulaParser.parse("((([a])))", 3);

            assertTrue(result.hasErrors());
            assertEquals("Formula nests deeper than 3 levels", result.diagnostics().get(0).message());
            assertEquals(new Fallback("((([a])))", "Formula nests deeper than 3 levels"), result.root());
        }

        @Test
        @DisplayName("Operator chains count toward the limit")
        void testTallTree() {
            assertFalse(FormulaParser.parse("[a] + [b] + [c]", 3).hasErrors());

            // GIVEN a left-leaning chain four levels tall
            ParseResult result = FormulaParser.parse("[a] + [b] + [c] + [d]", 3);

            // THEN the whole formula is carried instead
            assertEquals(1, result.diagnostics().size());
            assertEquals(Diagnostic.Severity.ERROR, result.diagnostics().get(0).severity());
            assertEquals(0, result.diagnostics().get(0).position());
            assertEquals(new Fallback("[a] + [b] + [c] + [d]", "Formula nests deeper than 3 levels"),
                    result.root());
        }

        @Test
        @DisplayName("ELSEIF branches do not count as nesting")
        void testElseIfChain() {
            ParseResult result = FormulaParser.parse(
                    "IF [a] THEN 1 ELSEIF [b] THEN 2 ELSEIF [c] THEN 3 ELSEIF [d] THEN 4 ELSE 5 END", 2);

            assertFalse(result.hasErrors(), () -> result.diagnostics().toString());
            assertInstanceOf(Conditional.class, result.root());
        }

        @Test
        @DisplayName("The default limit is deep enough for hand-written formulas")
        void testDefaultLimit() {
            String nested = "(".repeat(200) + "[a]" + ")".repeat(200);

            assertEquals(field("a"), parseValid(nested));
        }

        @Test
        @DisplayName("The limit must be positive")
        void testInvalidLimit() {
            assertThrows(IllegalArgumentException.class,
                    () -> new FormulaParser("[a]", FormulaLexer.tokenize("[a]"), 0));
        }
    }
}
