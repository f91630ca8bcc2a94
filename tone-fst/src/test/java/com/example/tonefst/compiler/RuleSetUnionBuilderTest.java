package com.example.tonefst.compiler;

import static com.example.tonefst.fst.FstTestSupport.outputs;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.example.tonefst.fst.FstTestSupport;
import com.example.tonefst.fst.SymbolTable;
import com.example.tonefst.fst.WeightedFst;
import com.example.tonefst.rules.RuleScriptParser;
import com.example.tonefst.rules.Statement;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RuleSetUnionBuilderTest {

    private static final String ONE_RULE = "a -> x / _";
    private static final String THREE_RULES = String.join("\n",
            "a -> x / _",
            "x -> y / _",
            "y -> z / _");

    private final SymbolTable symbols = FstTestSupport.symbols("a", "x", "y", "z");
    private final RuleSetUnionBuilder builder =
            new RuleSetUnionBuilder(symbols, CompilerSettings.defaults(), CompilationDiagnostics.silent());

    private static List<Statement> script(String text) {
        return RuleScriptParser.parse(text);
    }

    @Test
    void shorterDerivationIsPaddedWhenItComesFirst() {
        WeightedFst fst = builder.compileUnion(List.of(script(ONE_RULE), script(THREE_RULES)));

        assertEquals(Map.of("ax", 20.0, "axyz", 0.0), outputs(fst, "a"));
    }

    @Test
    void shorterDerivationIsPaddedWhenItComesLast() {
        WeightedFst fst = builder.compileUnion(List.of(script(THREE_RULES), script(ONE_RULE)));

        assertEquals(Map.of("ax", 20.0, "axyz", 0.0), outputs(fst, "a"));
    }

    @Test
    void filesWithEqualRuleCountsAreNotPadded() {
        WeightedFst fst = builder.compileUnion(List.of(script(ONE_RULE), script("a -> y / _")));

        assertEquals(Map.of("ax", 0.0, "ay", 0.0), outputs(fst, "a"));
    }

    @Test
    void compilesEveryFileOfADirectory(@TempDir Path directory) throws Exception {
        Files.writeString(directory.resolve("a_short.rules"), ONE_RULE, StandardCharsets.UTF_8);
        Files.writeString(directory.resolve("b_long.rules"), THREE_RULES, StandardCharsets.UTF_8);
        Files.createDirectory(directory.resolve("ignored"));

        WeightedFst fst = builder.compileUnionFromDirectory(directory);

        assertEquals(Map.of("ax", 20.0, "axyz", 0.0), outputs(fst, "a"));
    }
}
