package com.example.tonefst.fst;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Merges states with identical futures by partition refinement. Two states stay in one block while
 * they have the same final weight and the same set of (input, output, weight, target block)
 * arcs. For a deterministic automaton this yields the minimal automaton for its arc weights; for
 * a nondeterministic one it is the coarsest bisimulation, which still preserves the relation.
 */
public final class Minimization {

    private Minimization() {
    }

    /**
     * Returns a minimized copy of {@code fst}; the input is not modified.
     */
    public static WeightedFst minimize(WeightedFst fst, MinimizeConfig config) {
        WeightedFst source = fst.copy();
        Fsts.connect(source);
        if (!config.allowNondet() && !Determinization.isDeterministic(source)) {
            source = Determinization.determinize(source, config.delta());
        }
        if (source.isEmpty()) {
            return source;
        }

        int n = source.numStates();
        int[] blocks = new int[n];
        Map<Double, Integer> initial = new HashMap<>();
        for (int state = 0; state < n; state++) {
            double finalWeight = TropicalWeight.quantize(source.finalWeight(state), config.delta());
            blocks[state] = initial.computeIfAbsent(finalWeight, key -> initial.size());
        }
        int blockCount = initial.size();

        while (true) {
            Map<Signature, Integer> refined = new HashMap<>();
            int[] next = new int[n];
            for (int state = 0; state < n; state++) {
                Signature signature = signature(source, state, blocks, config.delta());
                next[state] = refined.computeIfAbsent(signature, key -> refined.size());
            }
            blocks = next;
            if (refined.size() == blockCount) {
                break;
            }
            blockCount = refined.size();
        }

        WeightedFst result = new WeightedFst(source.symbols());
        for (int block = 0; block < blockCount; block++) {
            result.addState();
        }
        boolean[] built = new boolean[blockCount];
        for (int state = 0; state < n; state++) {
            int block = blocks[state];
            if (built[block]) {
                continue;
            }
            built[block] = true;
            result.setFinal(block, source.finalWeight(state));
            TreeSet<ArcSignature> emitted = new TreeSet<>();
            for (Arc arc : source.arcs(state)) {
                ArcSignature key = ArcSignature.of(arc, blocks, config.delta());
                if (emitted.add(key)) {
                    result.addArc(block, new Arc(arc.ilabel(), arc.olabel(), arc.weight(), blocks[arc.nextState()]));
                }
            }
        }
        result.setStart(blocks[source.start()]);
        return result;
    }

    private static Signature signature(WeightedFst fst, int state, int[] blocks, double delta) {
        TreeSet<ArcSignature> arcs = new TreeSet<>();
        for (Arc arc : fst.arcs(state)) {
            arcs.add(ArcSignature.of(arc, blocks, delta));
        }
        return new Signature(blocks[state], new ArrayList<>(arcs));
    }

    private record Signature(int block, List<ArcSignature> arcs) {
    }

    private record ArcSignature(int ilabel, int olabel, double weight, int target)
            implements Comparable<ArcSignature> {

        static ArcSignature of(Arc arc, int[] blocks, double delta) {
            return new ArcSignature(arc.ilabel(), arc.olabel(),
                    TropicalWeight.quantize(arc.weight(), delta), blocks[arc.nextState()]);
        }

        @Override
        public int compareTo(ArcSignature other) {
            int result = Integer.compare(ilabel, other.ilabel);
            if (result == 0) {
                result = Integer.compare(olabel, other.olabel);
            }
            if (result == 0) {
                result = Double.compare(weight, other.weight);
            }
            if (result == 0) {
                result = Integer.compare(target, other.target);
            }
            return result;
        }
    }
}
