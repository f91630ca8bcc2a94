package com.example.tonefst.fst;

import static com.example.tonefst.fst.FstTestSupport.arc;
import static com.example.tonefst.fst.FstTestSupport.outputs;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FstSerializerTest {

    private final SymbolTable symbols = FstTestSupport.symbols("a", "b");

    private WeightedFst sample() {
        WeightedFst fst = arc(symbols, "a", "b", 1.5);
        Fsts.union(fst, arc(symbols, "b", "", 2.0));
        return fst;
    }

    @Test
    void jsonRoundTripKeepsStructure() {
        WeightedFst fst = sample();

        WeightedFst restored = FstSerializer.fromJson(FstSerializer.toJson(fst));

        assertEquals(fst.symbols(), restored.symbols());
        assertEquals(fst.start(), restored.start());
        assertEquals(fst.numStates(), restored.numStates());
        for (int state = 0; state < fst.numStates(); state++) {
            assertEquals(fst.arcs(state), restored.arcs(state));
            assertEquals(fst.finalWeight(state), restored.finalWeight(state));
        }
    }

    @Test
    void writesAndReadsFiles(@TempDir Path directory) throws Exception {
        Path file = directory.resolve("nested").resolve("relation.json");

        FstSerializer.write(sample(), file);
        WeightedFst restored = FstSerializer.read(file);

        assertTrue(Files.size(file) > 0);
        assertEquals(1.5, outputs(restored, "a").get("b"));
        assertEquals(2.0, outputs(restored, "b").get(""));
    }

    @Test
    void emptyAutomatonSurvivesRoundTrip() {
        WeightedFst restored = FstSerializer.fromJson(FstSerializer.toJson(new WeightedFst(symbols)));

        assertTrue(restored.isEmpty());
        assertEquals("", FstSerializer.toText(restored));
    }

    @Test
    void rejectsMissingMembers() {
        JsonObject json = FstSerializer.toJson(sample());
        json.remove("states");

        FstException ex = assertThrows(FstException.class, () -> FstSerializer.fromJson(json));
        assertTrue(ex.getMessage().contains("states"));
    }

    @Test
    void rejectsReorderedSymbolTable() {
        JsonObject json = JsonParser.parseString(
                "{\"symbols\":[\"<eps>\",\"a\"],\"start\":-1,\"states\":[]}").getAsJsonObject();

        assertThrows(FstException.class, () -> FstSerializer.fromJson(json));
    }

    @Test
    void rejectsNonNumericArcFields() {
        JsonObject json = JsonParser.parseString(
                "{\"symbols\":[\"<eps>\",\"#\"],\"start\":0,\"states\":[{\"arcs\":[[\"x\",1,0.0,0]]}]}")
                .getAsJsonObject();

        FstException ex = assertThrows(FstException.class, () -> FstSerializer.fromJson(json));
        assertEquals("Malformed automaton JSON", ex.getMessage());
    }

    @Test
    void textFormListsStartStateFirst() {
        WeightedFst fst = sample();

        String[] lines = FstSerializer.toText(fst).split("\\R");

        assertTrue(lines[0].startsWith(fst.start() + "\t"));
        assertTrue(FstSerializer.toText(fst).contains("\ta\tb\t1.5"));
        assertTrue(FstSerializer.toText(fst).contains("\tb\t<eps>\t2"));
    }
}
