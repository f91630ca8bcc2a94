package com.example.tonefst.compiler;

import com.example.tonefst.fst.Composition;
import com.example.tonefst.fst.Determinization;
import com.example.tonefst.fst.Fsts;
import com.example.tonefst.fst.Minimization;
import com.example.tonefst.fst.MinimizeConfig;
import com.example.tonefst.fst.SymbolTable;
import com.example.tonefst.fst.WeightedFst;
import com.example.tonefst.rules.MacroTable;
import com.example.tonefst.rules.RegexAst;
import com.example.tonefst.rules.Statement;

import java.util.List;
import java.util.Objects;

/**
 * Folds a whole script into one automaton: the rules become alternatives of a single relation
 * that is then applied after the first segment and after each of the following tone-bearing
 * segments, up to {@link CompilerSettings#tonePositions()} of them.
 *
 * <p>Words with more tone-bearing segments than that are not handled. The rule set is expected to
 * be functional (at most one output per input); that is not checked. Determinization treats each
 * (input, output) label pair as one symbol, so the result is deterministic over label pairs but
 * not necessarily over inputs alone. It describes exactly the same weighted relation.
 */
public final class LinearRuleSetCompiler {

    public static final String SEGMENT_MACRO = "segment";
    public static final String TONE_MACRO = "tone";

    private final SymbolTable symbols;
    private final CompilerSettings settings;
    private final CompilationDiagnostics diagnostics;

    public LinearRuleSetCompiler(SymbolTable symbols, CompilerSettings settings, CompilationDiagnostics diagnostics) {
        this.symbols = Objects.requireNonNull(symbols, "symbols");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public WeightedFst compileLinear(List<Statement> script) {
        MacroTable macros = new MacroTable(settings.macroPolicy());
        NodeCompiler compiler = new NodeCompiler(symbols, macros, diagnostics);
        RewriteRuleAssembler assembler = new RewriteRuleAssembler(compiler, settings.delta());

        WeightedFst base = WeightedFst.sigmaStar(symbols);
        for (Statement statement : script) {
            if (statement instanceof Statement.MacroDef definition) {
                MacroDefinitions.define(macros, definition, diagnostics);
            } else if (statement instanceof Statement.Rule rule) {
                WeightedFst compiled = assembler.assemble(rule.rule(), true);
                assembler.optimize(base);
                Fsts.arcSort(base, Fsts.ArcSortType.INPUT);
                Fsts.union(base, compiled);
            }
        }
        WeightedFst rules = Determinization.determinize(base, settings.delta());

        WeightedFst segmentHead = compiler.compile(
                RegexAst.group(new RegexAst.Boundary(), new RegexAst.Macro(SEGMENT_MACRO)));
        WeightedFst toneSegment = compiler.compile(
                RegexAst.group(new RegexAst.Macro(TONE_MACRO), new RegexAst.Macro(SEGMENT_MACRO)));

        WeightedFst result = WeightedFst.sigmaStar(symbols);
        for (int position = 0; position < settings.tonePositions(); position++) {
            WeightedFst lhs = segmentHead.copy();
            for (int i = 0; i < position; i++) {
                Fsts.concat(lhs, toneSegment);
            }
            Fsts.concat(lhs, rules);
            result = Composition.sortAndCompose(result, lhs);
            assembler.optimize(result);
            result = Minimization.minimize(result, MinimizeConfig.deterministic(settings.delta()));
        }
        return result;
    }
}
