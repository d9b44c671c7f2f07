package org.calclite.engine;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.PropertyDefaults;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.StringLength;
import org.calclite.engine.transpiler.FormulaSQLGenerator;
import org.calclite.formula.dsl.Arithmetic;
import org.calclite.formula.dsl.FieldRef;
import org.calclite.formula.dsl.FormulaNode;
import org.calclite.formula.dsl.FormulaParser;
import org.calclite.formula.dsl.FormulaPrinter;
import org.calclite.formula.dsl.FunctionCall;
import org.calclite.formula.dsl.Literal;
import org.calclite.formula.dsl.ParseResult;
import org.eclipse.collections.api.factory.SortedSets;
import org.eclipse.collections.api.set.sorted.MutableSortedSet;

import java.util.Locale;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Properties that must hold for every formula, not just hand-picked ones.
 */
@PropertyDefaults(tries = 200)
class FormulaPropertiesTest {

    private final FieldCompiler compiler = new FieldCompiler();
    private final FormulaSQLGenerator generator = new FormulaSQLGenerator();

    // ==================== Arbitrary Providers ====================

    @Provide
    Arbitrary<String> fieldNames() {
        return Arbitraries.strings()
                .withCharRange('a', 'z')
                .withCharRange('A', 'Z')
                .withCharRange('0', '9')
                .withChars(' ', '_', '-', '(', ')', '%')
                .ofMinLength(1)
                .ofMaxLength(20);
    }

    @Provide
    Arbitrary<Set<String>> identifiers() {
        return Arbitraries.strings().alpha().ofMinLength(1).ofMaxLength(8).set().ofMinSize(1).ofMaxSize(4);
    }

    @Provide
    Arbitrary<FormulaNode> arithmeticTrees() {
        return tree(3);
    }

    private Arbitrary<FormulaNode> tree(int depth) {
        Arbitrary<FormulaNode> leaf = Arbitraries.oneOf(
                Arbitraries.longs().between(0, 10_000).map(value -> (FormulaNode) Literal.integer(value)),
                Arbitraries.integers().between(0, 100_000).map(cents -> (FormulaNode) Literal.real(cents / 100.0)));
        if (depth == 0) {
            return leaf;
        }
        Arbitrary<FormulaNode> branch = Combinators.combine(
                Arbitraries.of(Arithmetic.Operator.ADD, Arithmetic.Operator.SUBTRACT,
                        Arithmetic.Operator.MULTIPLY, Arithmetic.Operator.DIVIDE),
                tree(depth - 1),
                tree(depth - 1))
                .as((op, left, right) -> (FormulaNode) new Arithmetic(op, left, right));
        return Arbitraries.oneOf(leaf, branch);
    }

    @Provide
    Arbitrary<String> formulaLikeText() {
        return Arbitraries.strings()
                .withChars("[]{}()'\"+-*/^<>=!,:%.\\ \n_")
                .withChars("abcxyzIFTHENELSWCAUMXDRKLOP")
                .withCharRange('0', '9')
                .ofMaxLength(60);
    }

    // ==================== Properties ====================

    @Property
    void fieldReferencesAreLowerCased(@ForAll("fieldNames") String name) {
        ParseResult result = FormulaParser.parse("[" + name + "]");

        FieldRef ref = assertInstanceOf(FieldRef.class, result.root());
        assertEquals(name.toLowerCase(Locale.ROOT), ref.normalizedName());
    }

    @Property
    void printedArithmeticParsesBackUnchanged(@ForAll("arithmeticTrees") FormulaNode tree) {
        ParseResult reparsed = FormulaParser.parse(FormulaPrinter.print(tree));

        assertTrue(reparsed.diagnostics().isEmpty());
        assertEquals(tree, reparsed.root());
    }

    @Property
    void generatedArithmeticReadsAsTheSameTree(@ForAll("arithmeticTrees") FormulaNode tree) {
        // Constant arithmetic SQL is also valid formula text, apart from the NULLIF guards
        String sql = generator.generate(tree).expression();
        ParseResult reparsed = FormulaParser.parse(sql);

        assertTrue(reparsed.diagnostics().isEmpty(), sql);
        assertEquals(tree, withoutZeroGuards(reparsed.root()), sql);
    }

    private static FormulaNode withoutZeroGuards(FormulaNode node) {
        if (node instanceof Arithmetic arithmetic) {
            return new Arithmetic(arithmetic.operator(),
                    withoutZeroGuards(arithmetic.left()), withoutZeroGuards(arithmetic.right()));
        }
        if (node instanceof FunctionCall call && "NULLIF".equals(call.name()) && call.arguments().size() == 2) {
            return withoutZeroGuards(call.arguments().get(0));
        }
        return node;
    }

    @Property
    void dependenciesCoverEveryReferencedField(
            @ForAll("identifiers") Set<String> dimensions,
            @ForAll("identifiers") Set<String> measures) {
        StringBuilder formula = new StringBuilder("{FIXED ");
        formula.append(String.join(", ", dimensions.stream().map(d -> "[" + d + "]").toList()));
        formula.append(" : ");
        formula.append(String.join(" + ", measures.stream().map(m -> "SUM([" + m + "])").toList()));
        formula.append("}");

        CompiledField field = compiler.compile("lod", formula.toString());

        MutableSortedSet<String> expected = SortedSets.mutable.empty();
        dimensions.forEach(d -> expected.add(d.toLowerCase(Locale.ROOT)));
        measures.forEach(m -> expected.add(m.toLowerCase(Locale.ROOT)));
        assertEquals(expected, field.dependencies());
        assertFalse(field.isDegraded(), field.generatedExpression());
    }

    @Property
    void compilationNeverThrows(@ForAll @StringLength(max = 60) String formula) {
        assertCompilesSafely(formula);
    }

    @Property(tries = 500)
    void compilationOfFormulaLikeTextNeverThrows(@ForAll("formulaLikeText") String formula) {
        assertCompilesSafely(formula);
    }

    private void assertCompilesSafely(String formula) {
        CompiledField field = assertDoesNotThrow(() -> compiler.compile("f", formula));

        assertFalse(field.generatedExpression().isBlank());
        assertTrue(field.confidence() >= 0.0 && field.confidence() <= 1.0);
        assertEquals(formula, field.originalFormula());
    }
}
