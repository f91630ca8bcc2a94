package com.example.tonefst.fst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Mutable weighted finite-state transducer over the tropical semiring. States are dense integers
 * starting at 0; an automaton without a start state accepts nothing.
 */
public final class WeightedFst {

    public static final int NO_STATE = -1;

    private final SymbolTable symbols;
    private final List<List<Arc>> arcs = new ArrayList<>();
    private final List<Double> finalWeights = new ArrayList<>();
    private int start = NO_STATE;

    public WeightedFst(SymbolTable symbols) {
        this.symbols = Objects.requireNonNull(symbols, "symbols");
    }

    /**
     * Two states joined by one epsilon arc, the second one final. Every compiled fragment is
     * grown from this seed.
     */
    public static WeightedFst epsilonSeed(SymbolTable symbols) {
        return singleArc(symbols, SymbolTable.EPSILON_LABEL, SymbolTable.EPSILON_LABEL, TropicalWeight.ONE);
    }

    public static WeightedFst singleArc(SymbolTable symbols, int ilabel, int olabel, double weight) {
        WeightedFst fst = new WeightedFst(symbols);
        int q0 = fst.addState();
        int q1 = fst.addState();
        fst.setStart(q0);
        fst.setFinal(q1, TropicalWeight.ONE);
        fst.addArc(q0, new Arc(ilabel, olabel, weight, q1));
        return fst;
    }

    /**
     * Epsilon seed whose final state carries {@code finalWeight}; concatenating it adds that cost to
     * every path.
     */
    public static WeightedFst filler(SymbolTable symbols, double finalWeight) {
        WeightedFst fst = epsilonSeed(symbols);
        fst.setFinal(1, finalWeight);
        return fst;
    }

    /**
     * Identity relation over exactly one non-epsilon symbol of the table.
     */
    public static WeightedFst sigma(SymbolTable symbols) {
        WeightedFst fst = new WeightedFst(symbols);
        int q0 = fst.addState();
        int q1 = fst.addState();
        fst.setStart(q0);
        fst.setFinal(q1, TropicalWeight.ONE);
        for (SymbolTable.Entry entry : symbols.entries()) {
            if (entry.label() != SymbolTable.EPSILON_LABEL) {
                fst.addArc(q0, new Arc(entry.label(), entry.label(), TropicalWeight.ONE, q1));
            }
        }
        return fst;
    }

    /**
     * Identity relation over every non-epsilon symbol of the table, any number of times.
     */
    public static WeightedFst sigmaStar(SymbolTable symbols) {
        return weightedSigmaStar(symbols, TropicalWeight.ONE);
    }

    public static WeightedFst weightedSigmaStar(SymbolTable symbols, double weight) {
        WeightedFst fst = new WeightedFst(symbols);
        int q0 = fst.addState();
        fst.setStart(q0);
        fst.setFinal(q0, TropicalWeight.ONE);
        for (SymbolTable.Entry entry : symbols.entries()) {
            if (entry.label() == SymbolTable.EPSILON_LABEL) {
                continue;
            }
            fst.addArc(q0, new Arc(entry.label(), entry.label(), weight, q0));
        }
        return fst;
    }

    public static WeightedFst linearAcceptor(SymbolTable symbols, int[] labels) {
        WeightedFst fst = new WeightedFst(symbols);
        int state = fst.addState();
        fst.setStart(state);
        for (int label : labels) {
            int next = fst.addState();
            fst.addArc(state, new Arc(label, label, TropicalWeight.ONE, next));
            state = next;
        }
        fst.setFinal(state, TropicalWeight.ONE);
        return fst;
    }

    public SymbolTable symbols() {
        return symbols;
    }

    public int addState() {
        arcs.add(new ArrayList<>());
        finalWeights.add(TropicalWeight.ZERO);
        return arcs.size() - 1;
    }

    public int numStates() {
        return arcs.size();
    }

    public int numArcs() {
        int total = 0;
        for (List<Arc> stateArcs : arcs) {
            total += stateArcs.size();
        }
        return total;
    }

    public int start() {
        return start;
    }

    public boolean isEmpty() {
        return start == NO_STATE;
    }

    public void setStart(int state) {
        checkState(state);
        this.start = state;
    }

    public double finalWeight(int state) {
        checkState(state);
        return finalWeights.get(state);
    }

    public boolean isFinal(int state) {
        return !TropicalWeight.isZero(finalWeight(state));
    }

    public void setFinal(int state, double weight) {
        checkState(state);
        finalWeights.set(state, weight);
    }

    public List<Arc> arcs(int state) {
        checkState(state);
        return Collections.unmodifiableList(arcs.get(state));
    }

    public void addArc(int state, Arc arc) {
        checkState(state);
        checkState(arc.nextState());
        arcs.get(state).add(arc);
    }

    public void setArcs(int state, List<Arc> replacement) {
        checkState(state);
        List<Arc> target = arcs.get(state);
        target.clear();
        for (Arc arc : replacement) {
            checkState(arc.nextState());
            target.add(arc);
        }
    }

    /**
     * Drops every state and arc, leaving an automaton that accepts nothing.
     */
    public void clear() {
        arcs.clear();
        finalWeights.clear();
        start = NO_STATE;
    }

    /**
     * Replaces the contents of this automaton with a copy of {@code other}.
     */
    public void assign(WeightedFst other) {
        requireSameSymbols(other);
        clear();
        for (int state = 0; state < other.numStates(); state++) {
            addState();
        }
        for (int state = 0; state < other.numStates(); state++) {
            arcs.get(state).addAll(other.arcs.get(state));
            finalWeights.set(state, other.finalWeights.get(state));
        }
        start = other.start;
    }

    public WeightedFst copy() {
        WeightedFst copy = new WeightedFst(symbols);
        copy.assign(this);
        return copy;
    }

    void requireSameSymbols(WeightedFst other) {
        if (!symbols.equals(other.symbols)) {
            throw new FstException("Automata do not share a symbol table");
        }
    }

    private void checkState(int state) {
        if (state < 0 || state >= arcs.size()) {
            throw new FstException("Unknown state " + state + " (automaton has " + arcs.size() + " states)");
        }
    }

    @Override
    public String toString() {
        return "WeightedFst{states=" + numStates() + ", arcs=" + numArcs() + ", start=" + start + "}";
    }
}
