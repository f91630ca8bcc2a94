package com.example.tonefst.fst;

import static com.example.tonefst.fst.FstTestSupport.arc;
import static com.example.tonefst.fst.FstTestSupport.symbol;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class ShortestPathsTest {

    private final SymbolTable symbols = FstTestSupport.symbols("a", "b", "c");

    @Test
    void returnsPathsInIncreasingWeight() {
        WeightedFst fst = arc(symbols, "a", "c", 3.0);
        Fsts.union(fst, arc(symbols, "a", "a", 1.0));
        Fsts.union(fst, arc(symbols, "a", "b", 2.0));

        List<ShortestPaths.DecodedPath> paths = ShortestPaths.decode(fst, 10);

        assertEquals(List.of(
                new ShortestPaths.DecodedPath(1.0, "a"),
                new ShortestPaths.DecodedPath(2.0, "b"),
                new ShortestPaths.DecodedPath(3.0, "c")), paths);
    }

    @Test
    void stopsAtLimit() {
        WeightedFst fst = symbol(symbols, "a");
        Fsts.closure(fst, Fsts.ClosureType.STAR);

        List<ShortestPaths.DecodedPath> paths = ShortestPaths.decode(fst, 3);

        assertEquals(3, paths.size());
        assertEquals("", paths.get(0).output());
        assertEquals("a", paths.get(1).output());
        assertEquals("aa", paths.get(2).output());
    }

    @Test
    void epsilonCyclesDoNotLoop() {
        WeightedFst fst = WeightedFst.filler(symbols, 1.0);
        Fsts.closure(fst, Fsts.ClosureType.PLUS);

        List<ShortestPaths.DecodedPath> paths = ShortestPaths.decode(fst, 5);

        assertEquals(1, paths.size());
        assertEquals(1.0, paths.get(0).weight());
    }

    @Test
    void bestOfEmptyAutomatonIsAbsent() {
        assertFalse(ShortestPaths.best(new WeightedFst(symbols)).isPresent());
        assertTrue(ShortestPaths.decode(symbol(symbols, "a"), 0).isEmpty());
    }

    @Test
    void bestAddsFinalWeight() {
        WeightedFst fst = arc(symbols, "b", "c", 0.25);
        fst.setFinal(1, 0.5);

        ShortestPaths.DecodedPath best = ShortestPaths.best(fst).orElseThrow();

        assertEquals("c", best.output());
        assertEquals(0.75, best.weight());
    }
}
