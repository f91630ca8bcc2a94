package com.example.tonefst.validation;

import com.example.tonefst.compiler.CompilationDiagnostics;
import com.example.tonefst.compiler.CompilerSettings;
import com.example.tonefst.compiler.RuleCascade;
import com.example.tonefst.fst.Composition;
import com.example.tonefst.fst.Minimization;
import com.example.tonefst.fst.MinimizeConfig;
import com.example.tonefst.fst.ShortestPaths;
import com.example.tonefst.fst.SymbolTable;
import com.example.tonefst.fst.WeightedFst;
import com.example.tonefst.rules.RuleScriptParser;
import com.example.tonefst.rules.Statement;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Applies a compiled relation to test forms. Candidate outputs go to the trace stream, failing
 * cases to the failure log as {@code input -> expected FAILED}.
 */
public final class FormValidator {

    public static final String NORMALIZATION_RESOURCE = "/normalize.rules";

    private final SymbolTable symbols;
    private final CompilerSettings settings;
    private final PrintStream trace;
    private final PrintStream failureLog;
    private WeightedFst normalization;

    public FormValidator(SymbolTable symbols, CompilerSettings settings, PrintStream trace, PrintStream failureLog) {
        this.symbols = Objects.requireNonNull(symbols, "symbols");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.trace = Objects.requireNonNull(trace, "trace");
        this.failureLog = Objects.requireNonNull(failureLog, "failureLog");
    }

    /**
     * Checks that the cheapest output {@code relation} produces for {@code input} (after
     * normalization unless {@code intermediateRepresentation}) is {@code expected}. Both forms are
     * wrapped in boundary markers first.
     */
    public boolean validate(WeightedFst relation, String input, String expected, boolean intermediateRepresentation) {
        String wrappedInput = wrap(input);
        String wrappedExpected = wrap(expected);
        int[] inputLabels;
        int[] expectedLabels;
        try {
            inputLabels = symbols.tokenize(wrappedInput);
            expectedLabels = symbols.tokenize(wrappedExpected);
        } catch (IllegalArgumentException ex) {
            trace.println(input + ": " + ex.getMessage());
            fail(input, expected);
            return false;
        }

        MinimizeConfig config = MinimizeConfig.allowingNondeterminism(settings.delta());
        WeightedFst applied = Composition.sortAndCompose(WeightedFst.linearAcceptor(symbols, inputLabels), relation);
        applied = Minimization.minimize(applied, config);
        traceCandidates(input, applied);

        WeightedFst restricted = intermediateRepresentation ? applied : Composition.sortAndCompose(applied, normalization());
        WeightedFst generated = Composition.sortAndCompose(restricted, WeightedFst.linearAcceptor(symbols, expectedLabels));
        generated = Minimization.minimize(generated, config);

        Optional<ShortestPaths.DecodedPath> best = ShortestPaths.best(generated);
        boolean passed = best.isPresent() && best.get().output().equals(wrappedExpected);
        if (!passed) {
            fail(input, expected);
        }
        return passed;
    }

    public ValidationReport validateAll(WeightedFst relation, List<TestCase> cases, boolean intermediateRepresentation) {
        List<TestCase> failures = new ArrayList<>();
        int passed = 0;
        for (TestCase testCase : cases) {
            if (validate(relation, testCase.form(), testCase.expected(), intermediateRepresentation)) {
                passed++;
            } else {
                failures.add(testCase);
            }
        }
        return new ValidationReport(cases.size(), passed, failures);
    }

    /**
     * Relation that strips every tone annotation from a surface form, compiled from the bundled
     * {@value #NORMALIZATION_RESOURCE} script on first use.
     */
    public WeightedFst normalization() {
        if (normalization == null) {
            List<Statement> script = loadNormalizationScript();
            RuleCascade cascade = new RuleCascade(symbols, settings, new CompilationDiagnostics(trace));
            normalization = cascade.compile(script, RuleCascade.ApplicationMode.EVERYWHERE).fst();
        }
        return normalization;
    }

    private void traceCandidates(String input, WeightedFst applied) {
        Map<String, Double> best = new LinkedHashMap<>();
        for (ShortestPaths.DecodedPath path : ShortestPaths.decode(applied, settings.candidateLimit())) {
            best.merge(path.output(), path.weight(), Math::min);
        }
        List<Map.Entry<String, Double>> ranked = new ArrayList<>(best.entrySet());
        ranked.sort(Map.Entry.comparingByValue(Comparator.naturalOrder()));
        trace.println(input + ":");
        for (Map.Entry<String, Double> candidate : ranked) {
            trace.println(String.format(Locale.ROOT, "  %s\t%.4f", candidate.getKey(), candidate.getValue()));
        }
    }

    private void fail(String input, String expected) {
        failureLog.println(input + " -> " + expected + " FAILED");
    }

    private static String wrap(String form) {
        return SymbolTable.normalize(SymbolTable.BOUNDARY_SYMBOL + form + SymbolTable.BOUNDARY_SYMBOL);
    }

    private static List<Statement> loadNormalizationScript() {
        try (InputStream stream = FormValidator.class.getResourceAsStream(NORMALIZATION_RESOURCE)) {
            if (stream == null) {
                throw new IllegalStateException("Missing resource " + NORMALIZATION_RESOURCE);
            }
            return RuleScriptParser.parse(new String(stream.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read " + NORMALIZATION_RESOURCE, ex);
        }
    }
}
