package com.example.tonefst.fst;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Structural operations on {@link WeightedFst}. Unless stated otherwise, an operation mutates its
 * first argument in place and only reads the second one.
 */
public final class Fsts {

    private static final Comparator<Arc> INPUT_ORDER = Comparator
            .comparingInt(Arc::ilabel)
            .thenComparingInt(Arc::olabel);

    private static final Comparator<Arc> OUTPUT_ORDER = Comparator
            .comparingInt(Arc::olabel)
            .thenComparingInt(Arc::ilabel);

    public enum ClosureType {
        STAR,
        PLUS
    }

    public enum ArcSortType {
        INPUT,
        OUTPUT;

        Comparator<Arc> comparator() {
            return this == INPUT ? INPUT_ORDER : OUTPUT_ORDER;
        }
    }

    private Fsts() {
    }

    /**
     * Appends {@code second} after {@code first}: every final state of {@code first} gets an
     * epsilon arc, weighted with its final weight, to the start of the appended copy.
     */
    public static void concat(WeightedFst first, WeightedFst appended) {
        first.requireSameSymbols(appended);
        WeightedFst second = appended == first ? appended.copy() : appended;
        if (first.isEmpty()) {
            return;
        }
        if (second.isEmpty()) {
            first.clear();
            return;
        }
        List<Integer> finals = finalStates(first);
        int offset = appendStates(first, second);
        for (int state : finals) {
            double weight = first.finalWeight(state);
            first.addArc(state, new Arc(SymbolTable.EPSILON_LABEL, SymbolTable.EPSILON_LABEL,
                    weight, second.start() + offset));
            first.setFinal(state, TropicalWeight.ZERO);
        }
    }

    /**
     * Makes {@code first} accept the union of both relations through a fresh start state with
     * epsilon arcs to both original start states.
     */
    public static void union(WeightedFst first, WeightedFst alternative) {
        first.requireSameSymbols(alternative);
        WeightedFst second = alternative == first ? alternative.copy() : alternative;
        if (second.isEmpty()) {
            return;
        }
        if (first.isEmpty()) {
            first.assign(second);
            return;
        }
        int offset = appendStates(first, second);
        int oldStart = first.start();
        int newStart = first.addState();
        first.addArc(newStart, new Arc(0, 0, TropicalWeight.ONE, oldStart));
        first.addArc(newStart, new Arc(0, 0, TropicalWeight.ONE, second.start() + offset));
        first.setStart(newStart);
    }

    public static void closure(WeightedFst fst, ClosureType type) {
        if (fst.isEmpty()) {
            if (type == ClosureType.STAR) {
                int state = fst.addState();
                fst.setStart(state);
                fst.setFinal(state, TropicalWeight.ONE);
            }
            return;
        }
        int oldStart = fst.start();
        for (int state : finalStates(fst)) {
            fst.addArc(state, new Arc(0, 0, fst.finalWeight(state), oldStart));
        }
        if (type == ClosureType.STAR) {
            int newStart = fst.addState();
            fst.setFinal(newStart, TropicalWeight.ONE);
            fst.addArc(newStart, new Arc(0, 0, TropicalWeight.ONE, oldStart));
            fst.setStart(newStart);
        }
    }

    /**
     * Redirects every final state to one new final state and returns it.
     */
    public static int addSuperFinalState(WeightedFst fst) {
        List<Integer> finals = finalStates(fst);
        int superFinal = fst.addState();
        for (int state : finals) {
            fst.addArc(state, new Arc(0, 0, fst.finalWeight(state), superFinal));
            fst.setFinal(state, TropicalWeight.ZERO);
        }
        fst.setFinal(superFinal, TropicalWeight.ONE);
        return superFinal;
    }

    public static void arcSort(WeightedFst fst, ArcSortType type) {
        for (int state = 0; state < fst.numStates(); state++) {
            List<Arc> sorted = new ArrayList<>(fst.arcs(state));
            sorted.sort(type.comparator());
            fst.setArcs(state, sorted);
        }
    }

    public static boolean isArcSorted(WeightedFst fst, ArcSortType type) {
        Comparator<Arc> comparator = type.comparator();
        for (int state = 0; state < fst.numStates(); state++) {
            List<Arc> stateArcs = fst.arcs(state);
            for (int i = 1; i < stateArcs.size(); i++) {
                if (comparator.compare(stateArcs.get(i - 1), stateArcs.get(i)) > 0) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Replaces every output label with epsilon. Mutates and returns {@code fst}.
     */
    public static WeightedFst outputsToEpsilon(WeightedFst fst) {
        for (int state = 0; state < fst.numStates(); state++) {
            List<Arc> mapped = new ArrayList<>();
            for (Arc arc : fst.arcs(state)) {
                mapped.add(arc.withLabels(arc.ilabel(), SymbolTable.EPSILON_LABEL));
            }
            fst.setArcs(state, mapped);
        }
        return fst;
    }

    /**
     * Replaces every input label with epsilon. Mutates and returns {@code fst}.
     */
    public static WeightedFst inputsToEpsilon(WeightedFst fst) {
        for (int state = 0; state < fst.numStates(); state++) {
            List<Arc> mapped = new ArrayList<>();
            for (Arc arc : fst.arcs(state)) {
                mapped.add(arc.withLabels(SymbolTable.EPSILON_LABEL, arc.olabel()));
            }
            fst.setArcs(state, mapped);
        }
        return fst;
    }

    /**
     * Removes states that are not both reachable from the start and able to reach a final state.
     */
    public static void connect(WeightedFst fst) {
        if (fst.isEmpty()) {
            fst.clear();
            return;
        }
        int n = fst.numStates();
        boolean[] accessible = new boolean[n];
        Deque<Integer> queue = new ArrayDeque<>();
        accessible[fst.start()] = true;
        queue.add(fst.start());
        List<List<Integer>> reverse = new ArrayList<>(n);
        for (int state = 0; state < n; state++) {
            reverse.add(new ArrayList<>());
        }
        for (int state = 0; state < n; state++) {
            for (Arc arc : fst.arcs(state)) {
                reverse.get(arc.nextState()).add(state);
            }
        }
        while (!queue.isEmpty()) {
            int state = queue.poll();
            for (Arc arc : fst.arcs(state)) {
                if (!accessible[arc.nextState()]) {
                    accessible[arc.nextState()] = true;
                    queue.add(arc.nextState());
                }
            }
        }
        boolean[] coaccessible = new boolean[n];
        for (int state = 0; state < n; state++) {
            if (fst.isFinal(state)) {
                coaccessible[state] = true;
                queue.add(state);
            }
        }
        while (!queue.isEmpty()) {
            int state = queue.poll();
            for (int previous : reverse.get(state)) {
                if (!coaccessible[previous]) {
                    coaccessible[previous] = true;
                    queue.add(previous);
                }
            }
        }
        if (!accessible[fst.start()] || !coaccessible[fst.start()]) {
            fst.clear();
            return;
        }
        int[] renumber = new int[n];
        WeightedFst trimmed = new WeightedFst(fst.symbols());
        for (int state = 0; state < n; state++) {
            renumber[state] = accessible[state] && coaccessible[state] ? trimmed.addState() : WeightedFst.NO_STATE;
        }
        for (int state = 0; state < n; state++) {
            if (renumber[state] == WeightedFst.NO_STATE) {
                continue;
            }
            trimmed.setFinal(renumber[state], fst.finalWeight(state));
            for (Arc arc : fst.arcs(state)) {
                int target = renumber[arc.nextState()];
                if (target != WeightedFst.NO_STATE) {
                    trimmed.addArc(renumber[state], arc.withNextState(target));
                }
            }
        }
        trimmed.setStart(renumber[fst.start()]);
        fst.assign(trimmed);
    }

    /**
     * Best-effort simplification: epsilon removal followed by merging of equivalent states. The
     * weighted relation is unchanged; {@code delta} is the tolerance used to compare weights.
     */
    public static void optimize(WeightedFst fst, double delta) {
        WeightedFst withoutEpsilons = EpsilonRemoval.removeEpsilons(fst);
        fst.assign(Minimization.minimize(withoutEpsilons, MinimizeConfig.allowingNondeterminism(delta)));
    }

    static List<Integer> finalStates(WeightedFst fst) {
        List<Integer> finals = new ArrayList<>();
        for (int state = 0; state < fst.numStates(); state++) {
            if (fst.isFinal(state)) {
                finals.add(state);
            }
        }
        return finals;
    }

    private static int appendStates(WeightedFst target, WeightedFst source) {
        int offset = target.numStates();
        for (int state = 0; state < source.numStates(); state++) {
            target.addState();
        }
        for (int state = 0; state < source.numStates(); state++) {
            target.setFinal(state + offset, source.finalWeight(state));
            for (Arc arc : source.arcs(state)) {
                target.addArc(state + offset, arc.withNextState(arc.nextState() + offset));
            }
        }
        return offset;
    }
}
