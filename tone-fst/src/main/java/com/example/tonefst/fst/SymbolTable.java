package com.example.tonefst.fst;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Immutable bidirectional mapping between symbols and integer labels. Label 0 is always epsilon,
 * the word boundary marker {@code #} is always present. Automata that are combined with each
 * other must refer to equal tables.
 */
public final class SymbolTable {

    public static final int EPSILON_LABEL = 0;
    public static final String EPSILON_SYMBOL = "<eps>";
    public static final String BOUNDARY_SYMBOL = "#";
    /** Label used for the boundary when a table lacks {@link #BOUNDARY_SYMBOL}. */
    public static final int DEFAULT_BOUNDARY_LABEL = 1;

    private final List<String> symbols;
    private final Map<String, Integer> labels;
    private final int longestSymbol;

    private SymbolTable(List<String> symbols) {
        this.symbols = Collections.unmodifiableList(symbols);
        Map<String, Integer> index = new HashMap<>();
        int longest = 0;
        for (int i = 0; i < symbols.size(); i++) {
            index.put(symbols.get(i), i);
            if (i != EPSILON_LABEL) {
                longest = Math.max(longest, symbols.get(i).length());
            }
        }
        this.labels = Collections.unmodifiableMap(index);
        this.longestSymbol = longest;
    }

    /**
     * Builds a table holding epsilon, then {@code symbols} in iteration order (duplicates and blank
     * entries dropped), then the boundary marker if it was not among them.
     */
    public static SymbolTable of(Collection<String> symbols) {
        List<String> ordered = new ArrayList<>();
        ordered.add(EPSILON_SYMBOL);
        for (String symbol : symbols) {
            if (symbol == null || symbol.isEmpty() || ordered.contains(symbol)) {
                continue;
            }
            ordered.add(symbol);
        }
        if (!ordered.contains(BOUNDARY_SYMBOL)) {
            ordered.add(BOUNDARY_SYMBOL);
        }
        return new SymbolTable(ordered);
    }

    /**
     * Reads one symbol per line. Lines are lower-cased and NFD normalized before they are added.
     */
    public static SymbolTable load(Path path) throws IOException {
        String data = Files.readString(path, StandardCharsets.UTF_8).toLowerCase(Locale.ROOT);
        List<String> symbols = new ArrayList<>();
        for (String line : data.split("\\R")) {
            String symbol = normalize(line.strip());
            if (!symbol.isEmpty()) {
                symbols.add(symbol);
            }
        }
        return of(symbols);
    }

    public static String normalize(String text) {
        return Normalizer.normalize(text, Normalizer.Form.NFD);
    }

    public OptionalInt labelOf(String symbol) {
        Integer label = labels.get(symbol);
        return label == null ? OptionalInt.empty() : OptionalInt.of(label);
    }

    public Optional<String> symbolOf(int label) {
        if (label < 0 || label >= symbols.size()) {
            return Optional.empty();
        }
        return Optional.of(symbols.get(label));
    }

    public int boundaryLabel() {
        return labelOf(BOUNDARY_SYMBOL).orElse(DEFAULT_BOUNDARY_LABEL);
    }

    public int size() {
        return symbols.size();
    }

    public List<String> symbols() {
        return symbols;
    }

    public List<Entry> entries() {
        List<Entry> entries = new ArrayList<>(symbols.size());
        for (int i = 0; i < symbols.size(); i++) {
            entries.add(new Entry(i, symbols.get(i)));
        }
        return entries;
    }

    /**
     * Splits {@code text} into labels, always taking the longest symbol that matches at the
     * current position.
     *
     * @throws IllegalArgumentException if some part of the text is not covered by the table
     */
    public int[] tokenize(String text) {
        List<Integer> result = new ArrayList<>();
        int position = 0;
        while (position < text.length()) {
            int matched = -1;
            int matchedLength = 0;
            int maxLength = Math.min(longestSymbol, text.length() - position);
            for (int length = maxLength; length > 0; length--) {
                Integer label = labels.get(text.substring(position, position + length));
                if (label != null && label != EPSILON_LABEL) {
                    matched = label;
                    matchedLength = length;
                    break;
                }
            }
            if (matched < 0) {
                throw new IllegalArgumentException(String.format(Locale.ROOT,
                        "Symbol '%s' at position %d of '%s' is not in the symbol table",
                        text.substring(position, text.offsetByCodePoints(position, 1)), position, text));
            }
            result.add(matched);
            position += matchedLength;
        }
        return result.stream().mapToInt(Integer::intValue).toArray();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SymbolTable)) {
            return false;
        }
        return symbols.equals(((SymbolTable) other).symbols);
    }

    @Override
    public int hashCode() {
        return symbols.hashCode();
    }

    @Override
    public String toString() {
        return "SymbolTable" + symbols;
    }

    public record Entry(int label, String symbol) {
    }
}
