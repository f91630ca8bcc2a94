package com.example.tonefst.fst;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Weighted subset construction in the tropical semiring. Every (input, output) label pair is
 * treated as one symbol, so the result describes exactly the same weighted relation and has at
 * most one arc per label pair leaving each state.
 *
 * <p>Termination is only guaranteed for automata with the twins property; rule sets in which
 * a cycle can be traversed at different costs may make the construction grow without bound.
 */
public final class Determinization {

    private Determinization() {
    }

    public static WeightedFst determinize(WeightedFst fst, double delta) {
        WeightedFst source = EpsilonRemoval.removeEpsilons(fst);
        WeightedFst result = new WeightedFst(fst.symbols());
        if (source.isEmpty()) {
            return result;
        }

        Map<Subset, Integer> ids = new HashMap<>();
        Deque<Subset> queue = new ArrayDeque<>();
        TreeMap<Integer, Double> initial = new TreeMap<>();
        initial.put(source.start(), TropicalWeight.ONE);
        result.setStart(stateFor(Subset.of(initial), ids, queue, result));

        while (!queue.isEmpty()) {
            Subset subset = queue.poll();
            int state = ids.get(subset);
            double finalWeight = TropicalWeight.ZERO;
            TreeMap<Long, TreeMap<Integer, Double>> transitions = new TreeMap<>();
            for (int i = 0; i < subset.states().size(); i++) {
                int member = subset.states().get(i);
                double residual = subset.residuals().get(i);
                finalWeight = TropicalWeight.plus(finalWeight,
                        TropicalWeight.times(residual, source.finalWeight(member)));
                for (Arc arc : source.arcs(member)) {
                    transitions.computeIfAbsent(pairKey(arc.ilabel(), arc.olabel()), key -> new TreeMap<>())
                            .merge(arc.nextState(), TropicalWeight.times(residual, arc.weight()), TropicalWeight::plus);
                }
            }
            result.setFinal(state, finalWeight);

            for (Map.Entry<Long, TreeMap<Integer, Double>> entry : transitions.entrySet()) {
                double best = TropicalWeight.ZERO;
                for (double weight : entry.getValue().values()) {
                    best = TropicalWeight.plus(best, weight);
                }
                if (TropicalWeight.isZero(best)) {
                    continue;
                }
                TreeMap<Integer, Double> next = new TreeMap<>();
                for (Map.Entry<Integer, Double> target : entry.getValue().entrySet()) {
                    if (TropicalWeight.isZero(target.getValue())) {
                        continue;
                    }
                    next.put(target.getKey(), TropicalWeight.quantize(target.getValue() - best, delta));
                }
                int nextState = stateFor(Subset.of(next), ids, queue, result);
                long key = entry.getKey();
                result.addArc(state, new Arc((int) (key >>> 32), (int) key, best, nextState));
            }
        }
        Fsts.connect(result);
        return result;
    }

    /**
     * Whether no state has an epsilon arc or two arcs carrying the same label pair.
     */
    public static boolean isDeterministic(WeightedFst fst) {
        for (int state = 0; state < fst.numStates(); state++) {
            List<Long> seen = new ArrayList<>();
            for (Arc arc : fst.arcs(state)) {
                if (arc.isEpsilon()) {
                    return false;
                }
                long key = pairKey(arc.ilabel(), arc.olabel());
                if (seen.contains(key)) {
                    return false;
                }
                seen.add(key);
            }
        }
        return true;
    }

    private static long pairKey(int ilabel, int olabel) {
        return ((long) ilabel << 32) | (olabel & 0xffffffffL);
    }

    private static int stateFor(Subset subset, Map<Subset, Integer> ids, Deque<Subset> queue, WeightedFst result) {
        Integer existing = ids.get(subset);
        if (existing != null) {
            return existing;
        }
        int state = result.addState();
        ids.put(subset, state);
        queue.add(subset);
        return state;
    }

    private record Subset(List<Integer> states, List<Double> residuals) {
        static Subset of(TreeMap<Integer, Double> members) {
            return new Subset(List.copyOf(members.keySet()), List.copyOf(members.values()));
        }
    }
}
