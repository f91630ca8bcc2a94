package com.example.tonefst.fst;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Removes arcs that neither consume nor emit a symbol. Each state inherits the non-epsilon arcs
 * and final weights of every state in its epsilon closure, weighted by the cheapest epsilon path.
 */
public final class EpsilonRemoval {

    private EpsilonRemoval() {
    }

    /**
     * Returns a new, connected automaton without {@code 0:0} arcs. The input is not modified.
     */
    public static WeightedFst removeEpsilons(WeightedFst fst) {
        WeightedFst result = new WeightedFst(fst.symbols());
        if (fst.isEmpty()) {
            return result;
        }
        for (int state = 0; state < fst.numStates(); state++) {
            result.addState();
        }
        result.setStart(fst.start());
        for (int state = 0; state < fst.numStates(); state++) {
            Map<Integer, Double> closure = epsilonClosure(fst, state);
            double finalWeight = TropicalWeight.ZERO;
            Map<ArcKey, Double> merged = new LinkedHashMap<>();
            for (Map.Entry<Integer, Double> entry : closure.entrySet()) {
                int reached = entry.getKey();
                double distance = entry.getValue();
                finalWeight = TropicalWeight.plus(finalWeight,
                        TropicalWeight.times(distance, fst.finalWeight(reached)));
                for (Arc arc : fst.arcs(reached)) {
                    if (arc.isEpsilon()) {
                        continue;
                    }
                    ArcKey key = new ArcKey(arc.ilabel(), arc.olabel(), arc.nextState());
                    merged.merge(key, TropicalWeight.times(distance, arc.weight()), TropicalWeight::plus);
                }
            }
            result.setFinal(state, finalWeight);
            for (Map.Entry<ArcKey, Double> entry : merged.entrySet()) {
                ArcKey key = entry.getKey();
                result.addArc(state, new Arc(key.ilabel(), key.olabel(), entry.getValue(), key.nextState()));
            }
        }
        Fsts.connect(result);
        return result;
    }

    private static Map<Integer, Double> epsilonClosure(WeightedFst fst, int source) {
        Map<Integer, Double> distance = new HashMap<>();
        Deque<Integer> queue = new ArrayDeque<>();
        distance.put(source, TropicalWeight.ONE);
        queue.add(source);
        while (!queue.isEmpty()) {
            int state = queue.poll();
            double base = distance.get(state);
            for (Arc arc : fst.arcs(state)) {
                if (!arc.isEpsilon()) {
                    continue;
                }
                double candidate = TropicalWeight.times(base, arc.weight());
                Double known = distance.get(arc.nextState());
                if (known == null || candidate < known) {
                    distance.put(arc.nextState(), candidate);
                    queue.add(arc.nextState());
                }
            }
        }
        return distance;
    }

    private record ArcKey(int ilabel, int olabel, int nextState) {
    }
}
