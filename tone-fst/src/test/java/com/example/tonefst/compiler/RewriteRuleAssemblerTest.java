package com.example.tonefst.compiler;

import static com.example.tonefst.fst.FstTestSupport.outputs;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.tonefst.fst.FstTestSupport;
import com.example.tonefst.fst.SymbolTable;
import com.example.tonefst.fst.WeightedFst;
import com.example.tonefst.rules.MacroTable;
import com.example.tonefst.rules.RegexAst;
import com.example.tonefst.rules.RewriteRule;
import com.example.tonefst.rules.RuleCompilationException;
import com.example.tonefst.rules.RuleScriptParser;
import com.example.tonefst.rules.Statement;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class RewriteRuleAssemblerTest {

    private final SymbolTable symbols = FstTestSupport.symbols("a", "b", "c", "x", "1", "3", "{", "}", ">");
    private final RewriteRuleAssembler assembler = new RewriteRuleAssembler(
            new NodeCompiler(symbols, new MacroTable(), CompilationDiagnostics.silent()), 1e-7);

    private static RewriteRule rule(String line) {
        return ((Statement.Rule) RuleScriptParser.parse(line).get(0)).rule();
    }

    @Test
    void keepsUnderlyingFormAndAppendsTarget() {
        WeightedFst fst = assembler.assemble(rule("a -> x / _"), false);

        assertEquals(Map.of("bacx", 0.0), outputs(fst, "bac"));
        assertTrue(outputs(fst, "bc").isEmpty());
    }

    @Test
    void annotationIsReplacedByItsUnderlyingTone() {
        WeightedFst fst = assembler.assemble(rule("{3>1} -> 0 / _"), false);

        assertEquals(Map.of("a3b", 0.0), outputs(fst, "a{3>1}b"));
    }

    @Test
    void leftAndRightContextsRestrictMatches() {
        WeightedFst fst = assembler.assemble(rule("a -> x / b _ c"), false);

        assertEquals(Map.of("bacx", 0.0), outputs(fst, "bac"));
        assertEquals(Map.of("bacax", 0.0), outputs(fst, "baca"));
        assertTrue(outputs(fst, "bbac").isEmpty());
        assertTrue(outputs(fst, "cab").isEmpty());
        assertTrue(outputs(fst, "ba").isEmpty());
    }

    @Test
    void inPlaceRewriteCoversOnlyTheMatchedSpan() {
        WeightedFst bare = assembler.assembleInPlace(rule("{3>1} -> 0 / _"));
        WeightedFst contextual = assembler.assembleInPlace(rule("a -> x / b _ c"));

        assertEquals(Map.of("3", 0.0), outputs(bare, "{3>1}"));
        assertTrue(outputs(bare, "a{3>1}").isEmpty());
        assertEquals(Map.of("bacx", 0.0), outputs(contextual, "bac"));
        assertTrue(outputs(contextual, "baca").isEmpty());
    }

    @Test
    void droppedLeftContextDoesNotAffectTheLanguage() {
        WeightedFst withB = assembler.assemble(rule("a -> x / b _ c"), true);
        WeightedFst withC = assembler.assemble(rule("a -> x / c _ c"), true);

        for (String input : List.of("ac", "acb", "bac", "ca", "acc")) {
            assertEquals(outputs(withB, input), outputs(withC, input), input);
        }
        assertEquals(Map.of("acbx", 0.0), outputs(withB, "acb"));
        assertTrue(outputs(withB, "bac").isEmpty());
    }

    @Test
    void sourceThatIsNotAGroupIsFatal() {
        RewriteRule malformed = new RewriteRule(RegexAst.epsilon(), new RegexAst.Char("a"),
                RegexAst.epsilon(), RegexAst.epsilon());

        assertThrows(RuleCompilationException.class, () -> assembler.assemble(malformed, false));
    }
}
