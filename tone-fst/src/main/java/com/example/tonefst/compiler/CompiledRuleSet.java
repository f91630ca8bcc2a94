package com.example.tonefst.compiler;

import com.example.tonefst.fst.WeightedFst;

/**
 * Automaton compiled from one script together with the number of rules it contains.
 */
public record CompiledRuleSet(WeightedFst fst, int ruleCount) {
}
