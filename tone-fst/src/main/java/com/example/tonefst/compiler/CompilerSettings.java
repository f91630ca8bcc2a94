package com.example.tonefst.compiler;

import com.example.tonefst.rules.MacroRedefinitionPolicy;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Properties;

/**
 * Tunable constants of the compiler. Each value is taken from a system property, then from an
 * environment variable, then from the bundled {@code /tonefst.properties} resource.
 */
public record CompilerSettings(double delta,
                               double fillerWeight,
                               int tonePositions,
                               MacroRedefinitionPolicy macroPolicy,
                               int candidateLimit) {

    public static final String RESOURCE_PATH = "/tonefst.properties";

    public static final String DELTA = "tonefst.delta";
    public static final String FILLER_WEIGHT = "tonefst.filler.weight";
    public static final String TONE_POSITIONS = "tonefst.tone.positions";
    public static final String MACRO_REDEFINITION = "tonefst.macro.redefinition";
    public static final String CANDIDATES = "tonefst.candidates";

    public CompilerSettings {
        if (!(delta > 0)) {
            throw new IllegalArgumentException("delta must be positive: " + delta);
        }
        if (tonePositions < 0) {
            throw new IllegalArgumentException("tonePositions must not be negative: " + tonePositions);
        }
        if (candidateLimit < 1) {
            throw new IllegalArgumentException("candidateLimit must be at least 1: " + candidateLimit);
        }
        if (macroPolicy == null) {
            throw new IllegalArgumentException("macroPolicy must not be null");
        }
    }

    public static CompilerSettings defaults() {
        return new CompilerSettings(1e-7, 10.0, 4, MacroRedefinitionPolicy.IGNORE, 10);
    }

    public static CompilerSettings load() {
        Properties bundled = new Properties();
        try (InputStream stream = CompilerSettings.class.getResourceAsStream(RESOURCE_PATH)) {
            if (stream != null) {
                bundled.load(stream);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read " + RESOURCE_PATH, ex);
        }
        CompilerSettings fallback = defaults();
        try {
            return new CompilerSettings(
                    Double.parseDouble(resolve(DELTA, bundled, Double.toString(fallback.delta()))),
                    Double.parseDouble(resolve(FILLER_WEIGHT, bundled, Double.toString(fallback.fillerWeight()))),
                    Integer.parseInt(resolve(TONE_POSITIONS, bundled, Integer.toString(fallback.tonePositions()))),
                    MacroRedefinitionPolicy.valueOf(resolve(MACRO_REDEFINITION, bundled,
                            fallback.macroPolicy().name()).toUpperCase(Locale.ROOT)),
                    Integer.parseInt(resolve(CANDIDATES, bundled, Integer.toString(fallback.candidateLimit()))));
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException("Invalid compiler setting: " + ex.getMessage(), ex);
        }
    }

    public CompilerSettings withMacroPolicy(MacroRedefinitionPolicy policy) {
        return new CompilerSettings(delta, fillerWeight, tonePositions, policy, candidateLimit);
    }

    public CompilerSettings withTonePositions(int positions) {
        return new CompilerSettings(delta, fillerWeight, positions, macroPolicy, candidateLimit);
    }

    /**
     * {@code tonefst.filler.weight} is read from {@code TONEFST_FILLER_WEIGHT}.
     */
    static String environmentName(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_');
    }

    private static String resolve(String key, Properties bundled, String fallback) {
        String property = System.getProperty(key);
        if (property != null && !property.isBlank()) {
            return property.trim();
        }
        String env = System.getenv(environmentName(key));
        if (env != null && !env.isBlank()) {
            return env.trim();
        }
        String value = bundled.getProperty(key);
        if (value != null && !value.isBlank()) {
            return value.trim();
        }
        return fallback;
    }
}
