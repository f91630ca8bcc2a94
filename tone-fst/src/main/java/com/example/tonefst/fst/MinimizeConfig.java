package com.example.tonefst.fst;

/**
 * Options for {@link Minimization#minimize}.
 *
 * @param delta       tolerance used when comparing weights
 * @param allowNondet when {@code false}, a nondeterministic input is determinized before it is
 *                    minimized
 */
public record MinimizeConfig(double delta, boolean allowNondet) {

    public static MinimizeConfig allowingNondeterminism(double delta) {
        return new MinimizeConfig(delta, true);
    }

    public static MinimizeConfig deterministic(double delta) {
        return new MinimizeConfig(delta, false);
    }
}
