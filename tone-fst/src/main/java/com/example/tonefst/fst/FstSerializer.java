package com.example.tonefst.fst;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Persists automata. The JSON form (symbol table included) can be read back; the text form follows
 * the OpenFST AT&amp;T layout and is meant for inspection with external tools.
 */
public final class FstSerializer {

    private static final Gson GSON = new GsonBuilder().create();

    private FstSerializer() {
    }

    public static JsonObject toJson(WeightedFst fst) {
        JsonObject root = new JsonObject();
        JsonArray symbols = new JsonArray();
        for (String symbol : fst.symbols().symbols()) {
            symbols.add(symbol);
        }
        root.add("symbols", symbols);
        root.addProperty("start", fst.start());
        JsonArray states = new JsonArray();
        for (int state = 0; state < fst.numStates(); state++) {
            JsonObject stateObject = new JsonObject();
            if (fst.isFinal(state)) {
                stateObject.addProperty("final", fst.finalWeight(state));
            }
            JsonArray arcs = new JsonArray();
            for (Arc arc : fst.arcs(state)) {
                JsonArray arcArray = new JsonArray();
                arcArray.add(arc.ilabel());
                arcArray.add(arc.olabel());
                arcArray.add(arc.weight());
                arcArray.add(arc.nextState());
                arcs.add(arcArray);
            }
            stateObject.add("arcs", arcs);
            states.add(stateObject);
        }
        root.add("states", states);
        return root;
    }

    public static WeightedFst fromJson(JsonObject root) {
        try {
            List<String> symbolList = new ArrayList<>();
            for (JsonElement element : member(root, "symbols").getAsJsonArray()) {
                symbolList.add(element.getAsString());
            }
            SymbolTable symbols = SymbolTable.of(symbolList.subList(1, symbolList.size()));
            if (!symbols.symbols().equals(symbolList)) {
                throw new FstException("Serialized symbol table is not in canonical order");
            }
            WeightedFst fst = new WeightedFst(symbols);
            JsonArray states = member(root, "states").getAsJsonArray();
            for (int i = 0; i < states.size(); i++) {
                fst.addState();
            }
            for (int state = 0; state < states.size(); state++) {
                JsonObject stateObject = states.get(state).getAsJsonObject();
                if (stateObject.has("final")) {
                    fst.setFinal(state, stateObject.get("final").getAsDouble());
                }
                for (JsonElement arcElement : member(stateObject, "arcs").getAsJsonArray()) {
                    JsonArray arc = arcElement.getAsJsonArray();
                    fst.addArc(state, new Arc(arc.get(0).getAsInt(), arc.get(1).getAsInt(),
                            arc.get(2).getAsDouble(), arc.get(3).getAsInt()));
                }
            }
            int start = member(root, "start").getAsInt();
            if (start != WeightedFst.NO_STATE) {
                fst.setStart(start);
            }
            return fst;
        } catch (IllegalStateException | UnsupportedOperationException | IndexOutOfBoundsException
                 | NumberFormatException ex) {
            throw new FstException("Malformed automaton JSON", ex);
        }
    }

    public static void write(WeightedFst fst, Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            GSON.toJson(toJson(fst), writer);
        }
    }

    public static WeightedFst read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return fromJson(JsonParser.parseReader(reader).getAsJsonObject());
        } catch (JsonParseException | IllegalStateException ex) {
            throw new FstException("Failed to read automaton from " + path, ex);
        }
    }

    /**
     * Writes arcs as {@code source target input output weight} lines (start state first) followed
     * by {@code state weight} lines for final states.
     */
    public static String toText(WeightedFst fst) {
        StringBuilder builder = new StringBuilder();
        if (fst.isEmpty()) {
            return "";
        }
        SymbolTable symbols = fst.symbols();
        List<Integer> order = new ArrayList<>();
        order.add(fst.start());
        for (int state = 0; state < fst.numStates(); state++) {
            if (state != fst.start()) {
                order.add(state);
            }
        }
        for (int state : order) {
            for (Arc arc : fst.arcs(state)) {
                builder.append(String.format(Locale.ROOT, "%d\t%d\t%s\t%s\t%s%n",
                        state,
                        arc.nextState(),
                        symbols.symbolOf(arc.ilabel()).orElse(Integer.toString(arc.ilabel())),
                        symbols.symbolOf(arc.olabel()).orElse(Integer.toString(arc.olabel())),
                        formatWeight(arc.weight())));
            }
        }
        for (int state : order) {
            if (fst.isFinal(state)) {
                builder.append(String.format(Locale.ROOT, "%d\t%s%n", state, formatWeight(fst.finalWeight(state))));
            }
        }
        return builder.toString();
    }

    public static void writeText(WeightedFst fst, Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Files.writeString(path, toText(fst), StandardCharsets.UTF_8);
    }

    private static JsonElement member(JsonObject object, String name) {
        JsonElement element = object.get(name);
        if (element == null || element.isJsonNull()) {
            throw new FstException("Automaton JSON lacks '" + name + "'");
        }
        return element;
    }

    private static String formatWeight(double weight) {
        if (weight == Math.rint(weight)) {
            return Long.toString((long) weight);
        }
        return Double.toString(weight);
    }
}
