package com.example.tonefst.compiler;

import com.example.tonefst.fst.EpsilonRemoval;
import com.example.tonefst.fst.Fsts;
import com.example.tonefst.fst.SymbolTable;
import com.example.tonefst.fst.WeightedFst;
import com.example.tonefst.rules.RuleScriptParser;
import com.example.tonefst.rules.Statement;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Unions whole rule files, each one an alternative derivation. Files with fewer rules are padded
 * with constant-cost fillers so that a derivation costs the same per rule whichever file it comes
 * from.
 */
public final class RuleSetUnionBuilder {

    private final SymbolTable symbols;
    private final CompilerSettings settings;
    private final CompilationDiagnostics diagnostics;

    public RuleSetUnionBuilder(SymbolTable symbols, CompilerSettings settings, CompilationDiagnostics diagnostics) {
        this.symbols = Objects.requireNonNull(symbols, "symbols");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public WeightedFst compileUnion(List<List<Statement>> ruleFiles) {
        RuleCascade cascade = new RuleCascade(symbols, settings, diagnostics);
        WeightedFst accumulator = new WeightedFst(symbols);
        int level = 0;
        for (List<Statement> script : ruleFiles) {
            CompiledRuleSet compiled = cascade.compile(script, RuleCascade.ApplicationMode.OBLIGATORY);
            int rules = compiled.ruleCount();
            WeightedFst alternative = compiled.fst();
            if (rules < level) {
                alternative = alternative.copy();
                pad(alternative, level - rules);
            } else if (rules > level) {
                pad(accumulator, rules - level);
                level = rules;
            }
            Fsts.union(accumulator, alternative);
        }
        return EpsilonRemoval.removeEpsilons(accumulator);
    }

    /**
     * Compiles every regular file of {@code directory}, in file name order.
     */
    public WeightedFst compileUnionFromDirectory(Path directory) throws IOException {
        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
        List<List<Statement>> scripts = new ArrayList<>(files.size());
        for (Path file : files) {
            scripts.add(RuleScriptParser.parseFile(file));
        }
        return compileUnion(scripts);
    }

    private void pad(WeightedFst fst, int fillers) {
        for (int i = 0; i < fillers; i++) {
            Fsts.concat(fst, WeightedFst.filler(symbols, settings.fillerWeight()));
        }
    }
}
