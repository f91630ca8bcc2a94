package com.example.tonefst.fst;

/**
 * Transition of a {@link WeightedFst}: consumes {@code ilabel}, emits {@code olabel} and adds
 * {@code weight} to the path cost. Label 0 is epsilon on either side.
 */
public record Arc(int ilabel, int olabel, double weight, int nextState) {

    public Arc withLabels(int newIlabel, int newOlabel) {
        return new Arc(newIlabel, newOlabel, weight, nextState);
    }

    public Arc withNextState(int state) {
        return new Arc(ilabel, olabel, weight, state);
    }

    public boolean isEpsilon() {
        return ilabel == SymbolTable.EPSILON_LABEL && olabel == SymbolTable.EPSILON_LABEL;
    }
}
