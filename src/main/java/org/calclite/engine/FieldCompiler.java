package org.calclite.engine;

import org.calclite.engine.transpiler.FormulaSQLGenerator;
import org.calclite.engine.transpiler.FunctionRegistry;
import org.calclite.engine.transpiler.GenerationResult;
import org.calclite.formula.analysis.AnalysisResult;
import org.calclite.formula.analysis.FormulaAnalyzer;
import org.calclite.formula.dsl.Diagnostic;
import org.calclite.formula.dsl.FormulaParser;
import org.calclite.formula.dsl.ParseResult;
import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.parallel.ParallelIterate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point: compiles calculated-field formulas into SQL.
 *
 * Each compilation runs lexer, parser, analyzer and generator over its own
 * data. The only shared state is an immutable snapshot of the function
 * registry and the stages built on it, so a compiler can be used from many
 * threads at once. {@link #replaceRegistry(FunctionRegistry)} swaps the
 * snapshot; compilations already running finish with the old one.
 */
public final class FieldCompiler {

    private static final Logger LOGGER = LoggerFactory.getLogger(FieldCompiler.class);

    private record Pipeline(FunctionRegistry registry, FormulaAnalyzer analyzer, FormulaSQLGenerator generator) {
    }

    private final CompilerConfig config;
    private final AtomicReference<Pipeline> pipeline = new AtomicReference<>();

    public FieldCompiler(CompilerConfig config, FunctionRegistry registry) {
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.pipeline.set(buildPipeline(Objects.requireNonNull(registry, "Function registry cannot be null")));
    }

    public FieldCompiler(CompilerConfig config) {
        this(config, FunctionRegistry.defaults());
    }

    public FieldCompiler() {
        this(CompilerConfig.defaults());
    }

    private Pipeline buildPipeline(FunctionRegistry registry) {
        return new Pipeline(
                registry,
                new FormulaAnalyzer(registry, config.maxSimpleDepth(), config.maxMediumDepth(),
                        config.fallbackPenalty(), config.unknownFunctionPenalty()),
                new FormulaSQLGenerator(registry, config.generationContext()));
    }

    /**
     * Compiles one formula.
     *
     * @param name        The calculated field's name
     * @param formulaText The formula exactly as written
     * @return The compiled field; malformed formulas degrade rather than fail
     * @throws NullPointerException if either argument is null
     */
    public CompiledField compile(String name, String formulaText) {
        Objects.requireNonNull(name, "Field name cannot be null");
        Objects.requireNonNull(formulaText, "Formula text cannot be null");

        Pipeline current = pipeline.get();
        ParseResult parsed = FormulaParser.parse(formulaText, config.maxNestingDepth());
        AnalysisResult analysis = current.analyzer().analyze(parsed.root());
        GenerationResult generated = current.generator().generate(parsed.root());

        MutableList<Diagnostic> diagnostics = Lists.mutable.withAll(parsed.diagnostics());
        diagnostics.addAllIterable(generated.warnings());

        CompiledField field = new CompiledField(
                name,
                formulaText,
                parsed.root(),
                analysis.dependencies(),
                analysis.complexity(),
                analysis.confidence(),
                diagnostics.toImmutable(),
                generated.expression());

        if (field.isDegraded()) {
            LOGGER.warn("Field '{}' compiled with confidence {} and {} diagnostic(s): {}",
                    name, formatConfidence(field.confidence()), diagnostics.size(), diagnostics.get(0));
        } else {
            LOGGER.debug("Field '{}' compiled as {}: {}", name, field.complexity(), field.generatedExpression());
        }
        return field;
    }

    /**
     * Two decimals with a '.' separator whatever the default locale.
     */
    static String formatConfidence(double confidence) {
        return String.format(Locale.ROOT, "%.2f", confidence);
    }

    public CompiledField compile(FormulaSource source) {
        Objects.requireNonNull(source, "Formula source cannot be null");
        return compile(source.fieldName(), source.formulaText());
    }

    /**
     * Compiles a batch in input order.
     */
    public ImmutableList<CompiledField> compileAll(Iterable<FormulaSource> sources) {
        Objects.requireNonNull(sources, "Formula sources cannot be null");
        MutableList<CompiledField> fields = Lists.mutable.empty();
        for (FormulaSource source : sources) {
            fields.add(compile(source));
        }
        LOGGER.debug("Compiled {} field(s)", fields.size());
        return fields.toImmutable();
    }

    /**
     * Compiles a batch on the Eclipse Collections parallel executor. Results keep
     * input order.
     */
    public ImmutableList<CompiledField> compileAllParallel(Iterable<FormulaSource> sources) {
        Objects.requireNonNull(sources, "Formula sources cannot be null");
        return Lists.immutable.withAll(
                ParallelIterate.collect(sources, (FormulaSource source) -> compile(source), false));
    }

    /**
     * Swaps in a new function registry for subsequent compilations.
     */
    public void replaceRegistry(FunctionRegistry registry) {
        Objects.requireNonNull(registry, "Function registry cannot be null");
        Pipeline previous = pipeline.getAndSet(buildPipeline(registry));
        LOGGER.info("Replaced function registry ({} -> {} functions)",
                previous.registry().size(), registry.size());
    }

    public FunctionRegistry registry() {
        return pipeline.get().registry();
    }

    public CompilerConfig config() {
        return config;
    }
}
