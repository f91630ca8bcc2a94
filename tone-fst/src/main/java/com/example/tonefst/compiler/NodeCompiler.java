package com.example.tonefst.compiler;

import com.example.tonefst.fst.Arc;
import com.example.tonefst.fst.Fsts;
import com.example.tonefst.fst.SymbolTable;
import com.example.tonefst.fst.TropicalWeight;
import com.example.tonefst.fst.WeightedFst;
import com.example.tonefst.rules.MacroTable;
import com.example.tonefst.rules.RegexAst;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Translates one pattern into an automaton fragment. Unknown symbols and undefined macros never
 * abort compilation: they fall back to epsilon (or are skipped inside classes) and are reported
 * through {@link CompilationDiagnostics}.
 */
public final class NodeCompiler {

    private final SymbolTable symbols;
    private final MacroTable macros;
    private final CompilationDiagnostics diagnostics;
    private final Set<String> expanding = new HashSet<>();

    public NodeCompiler(SymbolTable symbols, MacroTable macros, CompilationDiagnostics diagnostics) {
        this.symbols = Objects.requireNonNull(symbols, "symbols");
        this.macros = Objects.requireNonNull(macros, "macros");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public SymbolTable symbols() {
        return symbols;
    }

    public CompilationDiagnostics diagnostics() {
        return diagnostics;
    }

    /**
     * Returns a new automaton for {@code node}, grown from an epsilon seed.
     */
    public WeightedFst compile(RegexAst node) {
        WeightedFst result = WeightedFst.epsilonSeed(symbols);
        Fsts.concat(result, fragment(node));
        return result;
    }

    private WeightedFst fragment(RegexAst node) {
        if (node instanceof RegexAst.Epsilon || node instanceof RegexAst.Comment) {
            return WeightedFst.epsilonSeed(symbols);
        }
        if (node instanceof RegexAst.Char character) {
            return symbolArc(character.symbol());
        }
        if (node instanceof RegexAst.Boundary) {
            int label = symbols.labelOf(SymbolTable.BOUNDARY_SYMBOL).orElse(SymbolTable.DEFAULT_BOUNDARY_LABEL);
            return WeightedFst.singleArc(symbols, label, label, TropicalWeight.ONE);
        }
        if (node instanceof RegexAst.Group group) {
            WeightedFst result = WeightedFst.epsilonSeed(symbols);
            for (RegexAst child : group.nodes()) {
                Fsts.concat(result, compile(child));
            }
            return result;
        }
        if (node instanceof RegexAst.Disjunction disjunction) {
            WeightedFst result = new WeightedFst(symbols);
            for (RegexAst alternative : disjunction.alternatives()) {
                Fsts.union(result, compile(alternative));
            }
            return result;
        }
        if (node instanceof RegexAst.SymbolClass symbolClass) {
            return symbolClass(symbolClass.symbols());
        }
        if (node instanceof RegexAst.SymbolClassComplement complement) {
            return complementClass(complement.symbols());
        }
        if (node instanceof RegexAst.Star star) {
            WeightedFst body = compile(star.node());
            Fsts.closure(body, Fsts.ClosureType.STAR);
            return body;
        }
        if (node instanceof RegexAst.Plus plus) {
            WeightedFst body = compile(plus.node());
            Fsts.closure(body, Fsts.ClosureType.PLUS);
            return body;
        }
        if (node instanceof RegexAst.Option option) {
            WeightedFst body = compile(option.node());
            int superFinal = Fsts.addSuperFinalState(body);
            body.addArc(body.start(), new Arc(SymbolTable.EPSILON_LABEL, SymbolTable.EPSILON_LABEL,
                    TropicalWeight.ONE, superFinal));
            return body;
        }
        if (node instanceof RegexAst.Macro macro) {
            return macro(macro.name());
        }
        throw new IllegalStateException("Unhandled pattern node " + node);
    }

    private WeightedFst symbolArc(String symbol) {
        int label = symbols.labelOf(symbol).orElse(SymbolTable.EPSILON_LABEL);
        if (label == SymbolTable.EPSILON_LABEL && !SymbolTable.EPSILON_SYMBOL.equals(symbol)) {
            diagnostics.warn("Symbol '" + symbol + "' is not in the symbol table, compiled as epsilon");
        }
        return WeightedFst.singleArc(symbols, label, label, TropicalWeight.ONE);
    }

    private WeightedFst symbolClass(Set<String> members) {
        WeightedFst fst = twoStates();
        for (String member : new TreeSet<>(members)) {
            int label = symbols.labelOf(member).orElse(SymbolTable.EPSILON_LABEL);
            if (label == SymbolTable.EPSILON_LABEL) {
                diagnostics.warn("Class member '" + member + "' is not in the symbol table, skipped");
                continue;
            }
            fst.addArc(0, new Arc(label, label, TropicalWeight.ONE, 1));
        }
        return fst;
    }

    /**
     * Enumerates the whole table, so the cost grows with the alphabet.
     */
    private WeightedFst complementClass(Set<String> excluded) {
        Set<String> exclusions = new LinkedHashSet<>(excluded);
        exclusions.add(SymbolTable.BOUNDARY_SYMBOL);
        exclusions.add(SymbolTable.EPSILON_SYMBOL);
        WeightedFst fst = twoStates();
        for (SymbolTable.Entry entry : symbols.entries()) {
            if (entry.label() == SymbolTable.EPSILON_LABEL || exclusions.contains(entry.symbol())) {
                continue;
            }
            fst.addArc(0, new Arc(entry.label(), entry.label(), TropicalWeight.ONE, 1));
        }
        return fst;
    }

    private WeightedFst macro(String name) {
        Optional<RegexAst> definition = macros.lookup(name);
        if (definition.isEmpty()) {
            diagnostics.warn("Macro '" + name + "' is not defined, compiled as epsilon");
            return WeightedFst.epsilonSeed(symbols);
        }
        if (!expanding.add(name)) {
            diagnostics.warn("Macro '" + name + "' refers to itself, compiled as epsilon");
            return WeightedFst.epsilonSeed(symbols);
        }
        try {
            return compile(definition.get());
        } finally {
            expanding.remove(name);
        }
    }

    private WeightedFst twoStates() {
        WeightedFst fst = new WeightedFst(symbols);
        int entry = fst.addState();
        int exit = fst.addState();
        fst.setStart(entry);
        fst.setFinal(exit, TropicalWeight.ONE);
        return fst;
    }
}
