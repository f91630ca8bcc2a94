package com.example.tonefst.cli;

import com.example.tonefst.compiler.CompilationDiagnostics;
import com.example.tonefst.compiler.CompilerSettings;
import com.example.tonefst.compiler.LinearRuleSetCompiler;
import com.example.tonefst.compiler.RuleCascade;
import com.example.tonefst.compiler.RuleSetUnionBuilder;
import com.example.tonefst.fst.FstException;
import com.example.tonefst.fst.FstSerializer;
import com.example.tonefst.fst.Fsts;
import com.example.tonefst.fst.Minimization;
import com.example.tonefst.fst.MinimizeConfig;
import com.example.tonefst.fst.SymbolTable;
import com.example.tonefst.fst.WeightedFst;
import com.example.tonefst.rules.RuleCompilationException;
import com.example.tonefst.rules.RuleScriptParser;
import com.example.tonefst.rules.Statement;
import com.example.tonefst.validation.FormValidator;
import com.example.tonefst.validation.TestCase;
import com.example.tonefst.validation.TestSetException;
import com.example.tonefst.validation.TestSetReader;
import com.example.tonefst.validation.ValidationReport;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Command line driver: compiles rule files into a relation (or loads a stored one), writes it and
 * checks it against a test set. Cases that fail are listed in {@code log.txt} next to the output.
 */
public final class RuleCompilerApplication {

    static final Path DEFAULT_CHARS = Path.of("chars.txt");
    static final Path DEFAULT_RULES = Path.of("rules", "from_14.txt");
    static final String FAILURE_LOG = "log.txt";
    static final List<TestCase> SAMPLE_TESTS = List.of(
            new TestCase("ni{3>1>4}jo14", "ni3jo14##3>1>4##14>14"));

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILURE = 2;
    static final int EXIT_VALIDATION_FAILED = 3;

    private final PrintStream out;
    private final PrintStream err;

    public RuleCompilerApplication(PrintStream out, PrintStream err) {
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
    }

    public static void main(String[] args) {
        int exitCode = new RuleCompilerApplication(System.out, System.err).run(args);
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    public int run(String[] args) {
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException ex) {
            err.println(ex.getMessage());
            printUsage();
            return EXIT_USAGE;
        }

        try {
            CompilerSettings settings = CompilerSettings.load();
            CompilationDiagnostics diagnostics = new CompilationDiagnostics(err);
            if (options.linearize != null) {
                return linearize(options, settings, diagnostics);
            }

            WeightedFst fst = obtainRelation(options, settings, diagnostics);
            FstSerializer.write(fst, options.output);
            if (options.openFstDirectory != null) {
                FstSerializer.writeText(fst, options.openFstDirectory.resolve("fst_segmentation_notminimized.fst"));
            }
            if (!options.noMinimize) {
                out.println("Minimizing...");
                fst = Minimization.minimize(fst, MinimizeConfig.allowingNondeterminism(settings.delta()));
                FstSerializer.write(fst, options.output);
                if (options.openFstDirectory != null) {
                    FstSerializer.writeText(fst, options.openFstDirectory.resolve("fst_segmentation.fst"));
                }
            }
            out.printf("Relation written to %s (%d states, %d arcs)%n",
                    options.output.toAbsolutePath(), fst.numStates(), fst.numArcs());

            return validate(fst, options, settings);
        } catch (RuleCompilationException | FstException | TestSetException ex) {
            err.println("Compilation failed: " + ex.getMessage());
            return EXIT_FAILURE;
        } catch (IOException | UncheckedIOException ex) {
            err.println("I/O error: " + ex.getMessage());
            return EXIT_FAILURE;
        } catch (IllegalStateException ex) {
            err.println("Configuration error: " + ex.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int linearize(Options options, CompilerSettings settings, CompilationDiagnostics diagnostics)
            throws IOException {
        SymbolTable symbols = SymbolTable.load(options.chars);
        List<Statement> script = RuleScriptParser.parseFile(options.linearize);
        out.println("Linearizing " + options.linearize);
        WeightedFst fst = new LinearRuleSetCompiler(symbols, settings, diagnostics).compileLinear(script);
        FstSerializer.write(fst, options.output);
        if (options.openFstDirectory != null) {
            FstSerializer.writeText(fst, options.openFstDirectory.resolve("linear.fst"));
        }
        out.printf("Linear relation written to %s (%d states, %d arcs)%n",
                options.output.toAbsolutePath(), fst.numStates(), fst.numArcs());
        return EXIT_OK;
    }

    private WeightedFst obtainRelation(Options options, CompilerSettings settings, CompilationDiagnostics diagnostics)
            throws IOException {
        if (options.load != null) {
            out.println("Loading " + options.load);
            return FstSerializer.read(options.load);
        }
        SymbolTable symbols = SymbolTable.load(options.chars);
        if (options.sourceDirectory != null) {
            out.println("Unioning rule files in " + options.sourceDirectory);
            return new RuleSetUnionBuilder(symbols, settings, diagnostics)
                    .compileUnionFromDirectory(options.sourceDirectory);
        }
        RuleCascade cascade = new RuleCascade(symbols, settings, diagnostics);
        WeightedFst result = new WeightedFst(symbols);
        for (Path rules : options.rules()) {
            List<Statement> script = RuleScriptParser.parseFile(rules);
            int index = 0;
            for (Statement statement : script) {
                if (statement instanceof Statement.Rule rule) {
                    out.printf("Rule %d of %s: %s%n", ++index, rules.getFileName(), rule.rule());
                }
            }
            Fsts.union(result, cascade.compile(script, RuleCascade.ApplicationMode.OBLIGATORY).fst());
        }
        return result;
    }

    private int validate(WeightedFst fst, Options options, CompilerSettings settings) throws IOException {
        List<TestCase> tests = options.testSet == null ? SAMPLE_TESTS : TestSetReader.read(options.testSet);
        Path log = options.output.toAbsolutePath().resolveSibling(FAILURE_LOG);
        ValidationReport report;
        try (OutputStream logStream = Files.newOutputStream(log);
             PrintStream failureLog = new PrintStream(logStream, true, StandardCharsets.UTF_8)) {
            FormValidator validator = new FormValidator(fst.symbols(), settings, out, failureLog);
            List<TestCase> failures = new ArrayList<>();
            for (TestCase test : tests) {
                if (validator.validate(fst, test.form(), test.expected(), options.intermediateRepresentation)) {
                    out.println(test.form() + " -> " + test.expected() + " OK");
                } else {
                    out.println(test.form() + " -> " + test.expected() + " FAILED");
                    failures.add(test);
                }
            }
            report = new ValidationReport(tests.size(), tests.size() - failures.size(), failures);
        }
        out.printf("%d of %d test cases passed%n", report.passed(), report.total());
        if (options.report != null) {
            report.write(options.report);
        }
        return report.allPassed() ? EXIT_OK : EXIT_VALIDATION_FAILED;
    }

    private void printUsage() {
        err.println("Usage: RuleCompilerApplication <outpath> [--chars FILE] [--load FILE] [--srcdir DIR]");
        err.println("           [--rules FILE]... [--linearize FILE] [--test CSV] [--ir] [--openfst DIR]");
        err.println("           [--no-min] [--report FILE]");
        err.println("  --chars FILE      symbol inventory, one symbol per line (default chars.txt)");
        err.println("  --load FILE       validate a stored relation instead of compiling one");
        err.println("  --srcdir DIR      union every rule file of DIR, padding files with fewer rules");
        err.println("  --rules FILE      rule file applied as one derivation; repeat to union several");
        err.println("                    (default rules/from_14.txt)");
        err.println("  --linearize FILE  compile FILE with the linear strategy, write it and stop");
        err.println("  --test CSV        test set with form and segmentation columns");
        err.println("  --ir              compare outputs without stripping tone annotations");
        err.println("  --openfst DIR     also write the relation in OpenFST text format");
        err.println("  --no-min          skip the final minimization");
        err.println("  --report FILE     write the validation summary as JSON");
    }

    static final class Options {
        Path output;
        Path chars = DEFAULT_CHARS;
        Path load;
        Path sourceDirectory;
        final List<Path> rules = new ArrayList<>();
        Path linearize;
        Path testSet;
        boolean intermediateRepresentation;
        Path openFstDirectory;
        boolean noMinimize;
        Path report;

        List<Path> rules() {
            return rules.isEmpty() ? List.of(DEFAULT_RULES) : rules;
        }

        static Options parse(String[] args) {
            if (args == null || args.length == 0) {
                throw new IllegalArgumentException("Missing output path.");
            }
            Options options = new Options();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--chars":
                        options.chars = Path.of(value(args, ++i, arg));
                        break;
                    case "--load":
                        options.load = Path.of(value(args, ++i, arg));
                        break;
                    case "--srcdir":
                        options.sourceDirectory = Path.of(value(args, ++i, arg));
                        break;
                    case "--rules":
                        options.rules.add(Path.of(value(args, ++i, arg)));
                        break;
                    case "--linearize":
                        options.linearize = Path.of(value(args, ++i, arg));
                        break;
                    case "--test":
                        options.testSet = Path.of(value(args, ++i, arg));
                        break;
                    case "--openfst":
                        options.openFstDirectory = Path.of(value(args, ++i, arg));
                        break;
                    case "--report":
                        options.report = Path.of(value(args, ++i, arg));
                        break;
                    case "--ir":
                        options.intermediateRepresentation = true;
                        break;
                    case "--no-min":
                        options.noMinimize = true;
                        break;
                    default:
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown option " + arg + ".");
                        }
                        if (options.output != null) {
                            throw new IllegalArgumentException("Unexpected argument " + arg + ".");
                        }
                        options.output = Path.of(arg);
                        break;
                }
            }
            if (options.output == null) {
                throw new IllegalArgumentException("Missing output path.");
            }
            if (options.load != null && options.sourceDirectory != null) {
                throw new IllegalArgumentException("--load and --srcdir cannot be combined.");
            }
            return options;
        }

        private static String value(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Option " + option + " requires a value.");
            }
            return args[index];
        }
    }
}
