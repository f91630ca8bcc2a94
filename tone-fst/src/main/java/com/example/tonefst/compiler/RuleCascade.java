package com.example.tonefst.compiler;

import com.example.tonefst.fst.Composition;
import com.example.tonefst.fst.Fsts;
import com.example.tonefst.fst.SymbolTable;
import com.example.tonefst.fst.WeightedFst;
import com.example.tonefst.rules.MacroTable;
import com.example.tonefst.rules.Statement;

import java.util.List;
import java.util.Objects;

/**
 * Applies the rules of one script in statement order. The result is the composition of the
 * assembled rules; macro definitions are visible to the rules that follow them.
 */
public final class RuleCascade {

    public enum ApplicationMode {
        /** Every rule must match once; one script describes one derivation. */
        OBLIGATORY,
        /**
         * A rule rewrites in place at any number of non-overlapping positions, each of which may
         * also be left as it is.
         */
        EVERYWHERE
    }

    private final SymbolTable symbols;
    private final CompilerSettings settings;
    private final CompilationDiagnostics diagnostics;

    public RuleCascade(SymbolTable symbols, CompilerSettings settings, CompilationDiagnostics diagnostics) {
        this.symbols = Objects.requireNonNull(symbols, "symbols");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    /**
     * Compiles {@code script}; a script without rules yields the identity over all symbols.
     */
    public CompiledRuleSet compile(List<Statement> script, ApplicationMode mode) {
        MacroTable macros = new MacroTable(settings.macroPolicy());
        RewriteRuleAssembler assembler =
                new RewriteRuleAssembler(new NodeCompiler(symbols, macros, diagnostics), settings.delta());
        WeightedFst result = null;
        int rules = 0;
        for (Statement statement : script) {
            if (statement instanceof Statement.MacroDef definition) {
                MacroDefinitions.define(macros, definition, diagnostics);
            } else if (statement instanceof Statement.Rule rule) {
                WeightedFst compiled;
                if (mode == ApplicationMode.EVERYWHERE) {
                    compiled = assembler.assembleInPlace(rule.rule());
                    Fsts.union(compiled, WeightedFst.sigma(symbols));
                    Fsts.closure(compiled, Fsts.ClosureType.STAR);
                    assembler.optimize(compiled);
                } else {
                    compiled = assembler.assemble(rule.rule(), false);
                }
                rules++;
                if (result == null) {
                    result = compiled;
                } else {
                    result = Composition.sortAndCompose(result, compiled);
                    assembler.optimize(result);
                }
            }
        }
        return new CompiledRuleSet(result == null ? WeightedFst.sigmaStar(symbols) : result, rules);
    }
}
