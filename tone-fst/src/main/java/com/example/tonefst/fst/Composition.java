package com.example.tonefst.fst;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted composition of two transducers. The output side of the left operand is matched
 * against the input side of the right operand.
 *
 * <p>Epsilon moves are sequenced: after the right operand has taken an input-epsilon arc on its
 * own, the left operand may not take an output-epsilon arc until both advance together again.
 * Each pair of matching paths is therefore produced exactly once.
 */
public final class Composition {

    private Composition() {
    }

    /**
     * Composes {@code left} with {@code right}. Neither operand is modified.
     *
     * @throws FstException if {@code left} is not arc-sorted by output label, {@code right} is not
     *                      arc-sorted by input label, or the operands use different symbol tables
     */
    public static WeightedFst compose(WeightedFst left, WeightedFst right) {
        left.requireSameSymbols(right);
        if (!Fsts.isArcSorted(left, Fsts.ArcSortType.OUTPUT)) {
            throw new FstException("Left composition operand must be arc-sorted by output label");
        }
        if (!Fsts.isArcSorted(right, Fsts.ArcSortType.INPUT)) {
            throw new FstException("Right composition operand must be arc-sorted by input label");
        }
        WeightedFst result = new WeightedFst(left.symbols());
        if (left.isEmpty() || right.isEmpty()) {
            return result;
        }

        Map<Triple, Integer> ids = new HashMap<>();
        Deque<Triple> queue = new ArrayDeque<>();
        Triple initial = new Triple(left.start(), right.start(), 0);
        result.setStart(stateFor(initial, ids, queue, result));

        while (!queue.isEmpty()) {
            Triple current = queue.poll();
            int source = ids.get(current);
            double leftFinal = left.finalWeight(current.left());
            double rightFinal = right.finalWeight(current.right());
            if (!TropicalWeight.isZero(leftFinal) && !TropicalWeight.isZero(rightFinal)) {
                result.setFinal(source, TropicalWeight.times(leftFinal, rightFinal));
            }

            for (Arc leftArc : left.arcs(current.left())) {
                if (leftArc.olabel() == SymbolTable.EPSILON_LABEL) {
                    if (current.filter() == 0) {
                        int target = stateFor(new Triple(leftArc.nextState(), current.right(), 0), ids, queue, result);
                        result.addArc(source, new Arc(leftArc.ilabel(), SymbolTable.EPSILON_LABEL,
                                leftArc.weight(), target));
                    }
                    continue;
                }
                List<Arc> rightArcs = right.arcs(current.right());
                for (int i = firstWithInput(rightArcs, leftArc.olabel()); i < rightArcs.size(); i++) {
                    Arc rightArc = rightArcs.get(i);
                    if (rightArc.ilabel() != leftArc.olabel()) {
                        break;
                    }
                    int target = stateFor(new Triple(leftArc.nextState(), rightArc.nextState(), 0), ids, queue, result);
                    result.addArc(source, new Arc(leftArc.ilabel(), rightArc.olabel(),
                            TropicalWeight.times(leftArc.weight(), rightArc.weight()), target));
                }
            }

            List<Arc> rightArcs = right.arcs(current.right());
            for (int i = firstWithInput(rightArcs, SymbolTable.EPSILON_LABEL); i < rightArcs.size(); i++) {
                Arc rightArc = rightArcs.get(i);
                if (rightArc.ilabel() != SymbolTable.EPSILON_LABEL) {
                    break;
                }
                int target = stateFor(new Triple(current.left(), rightArc.nextState(), 1), ids, queue, result);
                result.addArc(source, new Arc(SymbolTable.EPSILON_LABEL, rightArc.olabel(),
                        rightArc.weight(), target));
            }
        }
        Fsts.connect(result);
        return result;
    }

    /**
     * Sorts copies of both operands as composition requires and composes them.
     */
    public static WeightedFst sortAndCompose(WeightedFst left, WeightedFst right) {
        WeightedFst sortedLeft = left.copy();
        WeightedFst sortedRight = right.copy();
        Fsts.arcSort(sortedLeft, Fsts.ArcSortType.OUTPUT);
        Fsts.arcSort(sortedRight, Fsts.ArcSortType.INPUT);
        return compose(sortedLeft, sortedRight);
    }

    private static int stateFor(Triple triple, Map<Triple, Integer> ids, Deque<Triple> queue, WeightedFst result) {
        Integer existing = ids.get(triple);
        if (existing != null) {
            return existing;
        }
        int state = result.addState();
        ids.put(triple, state);
        queue.add(triple);
        return state;
    }

    private static int firstWithInput(List<Arc> arcs, int label) {
        int low = 0;
        int high = arcs.size();
        while (low < high) {
            int middle = (low + high) >>> 1;
            if (arcs.get(middle).ilabel() < label) {
                low = middle + 1;
            } else {
                high = middle;
            }
        }
        return low;
    }

    private record Triple(int left, int right, int filter) {
    }
}
