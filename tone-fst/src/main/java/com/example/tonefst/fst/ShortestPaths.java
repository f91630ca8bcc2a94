package com.example.tonefst.fst;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Enumerates accepting paths in order of increasing weight and decodes their output side.
 *
 * <p>Paths that reach the same state with the same output so far are explored once, which keeps
 * epsilon cycles from looping. Output cycles can still produce unboundedly many paths, so the
 * search stops after {@code limit} results or {@link #MAX_EXPANSIONS} expanded prefixes.
 */
public final class ShortestPaths {

    public static final int MAX_EXPANSIONS = 200_000;

    private ShortestPaths() {
    }

    public record DecodedPath(double weight, String output) {
    }

    public static List<DecodedPath> decode(WeightedFst fst, int limit) {
        List<DecodedPath> results = new ArrayList<>();
        if (fst.isEmpty() || limit <= 0) {
            return results;
        }
        SymbolTable symbols = fst.symbols();
        PriorityQueue<Prefix> queue = new PriorityQueue<>(Comparator
                .comparingDouble(Prefix::weight)
                .thenComparingLong(Prefix::sequence));
        Set<String> expanded = new HashSet<>();
        long sequence = 0;
        queue.add(new Prefix(fst.start(), TropicalWeight.ONE, "", false, sequence++));
        int expansions = 0;

        while (!queue.isEmpty() && results.size() < limit && expansions < MAX_EXPANSIONS) {
            Prefix prefix = queue.poll();
            if (prefix.complete()) {
                results.add(new DecodedPath(prefix.weight(), prefix.output()));
                continue;
            }
            if (!expanded.add(prefix.state() + "\u0000" + prefix.output())) {
                continue;
            }
            expansions++;
            double finalWeight = fst.finalWeight(prefix.state());
            if (!TropicalWeight.isZero(finalWeight)) {
                queue.add(new Prefix(prefix.state(), TropicalWeight.times(prefix.weight(), finalWeight),
                        prefix.output(), true, sequence++));
            }
            for (Arc arc : fst.arcs(prefix.state())) {
                double weight = TropicalWeight.times(prefix.weight(), arc.weight());
                if (TropicalWeight.isZero(weight)) {
                    continue;
                }
                String output = arc.olabel() == SymbolTable.EPSILON_LABEL
                        ? prefix.output()
                        : prefix.output() + symbols.symbolOf(arc.olabel()).orElse("");
                queue.add(new Prefix(arc.nextState(), weight, output, false, sequence++));
            }
        }
        return results;
    }

    public static Optional<DecodedPath> best(WeightedFst fst) {
        List<DecodedPath> paths = decode(fst, 1);
        return paths.isEmpty() ? Optional.empty() : Optional.of(paths.get(0));
    }

    private record Prefix(int state, double weight, String output, boolean complete, long sequence) {
    }
}
