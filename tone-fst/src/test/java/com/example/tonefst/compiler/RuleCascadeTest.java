package com.example.tonefst.compiler;

import static com.example.tonefst.fst.FstTestSupport.outputs;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.tonefst.fst.FstTestSupport;
import com.example.tonefst.fst.SymbolTable;
import com.example.tonefst.rules.MacroRedefinitionPolicy;
import com.example.tonefst.rules.RuleCompilationException;
import com.example.tonefst.rules.RuleScriptParser;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.junit.jupiter.api.Test;

class RuleCascadeTest {

    private final SymbolTable symbols = FstTestSupport.symbols("a", "x", "y", "z", "{", "}", ">", "1");
    private final CompilationDiagnostics diagnostics = CompilationDiagnostics.silent();
    private final RuleCascade cascade = new RuleCascade(symbols, CompilerSettings.defaults(), diagnostics);

    @Test
    void obligatoryRulesApplyInOrder() {
        CompiledRuleSet compiled = cascade.compile(RuleScriptParser.parse(String.join("\n",
                "% derivation",
                "a -> x / _",
                "x -> y / _")), RuleCascade.ApplicationMode.OBLIGATORY);

        assertEquals(2, compiled.ruleCount());
        assertEquals(Map.of("axy", 0.0), outputs(compiled.fst(), "a"));
        assertTrue(outputs(compiled.fst(), "z").isEmpty());
    }

    @Test
    void everywhereRulesRewriteEachMatchOrLeaveIt() {
        CompiledRuleSet compiled = cascade.compile(RuleScriptParser.parse("{>1} -> 0 / _"),
                RuleCascade.ApplicationMode.EVERYWHERE);

        assertEquals(1, compiled.ruleCount());
        assertEquals(Map.of("az", 0.0), outputs(compiled.fst(), "az"));
        assertEquals(Map.of("az", 0.0, "a{>1}z", 0.0, "az{>1}", 0.0, "a{>1}z{>1}", 0.0),
                outputs(compiled.fst(), "a{>1}z{>1}"));
    }

    @Test
    void everywhereRulesFeedLaterRules() {
        CompiledRuleSet compiled = cascade.compile(RuleScriptParser.parse(String.join("\n",
                "{1>1} -> 0 / _",
                "{>1} -> 0 / _")), RuleCascade.ApplicationMode.EVERYWHERE);

        assertTrue(outputs(compiled.fst(), "{1>1}a{>1}").containsKey("1a"));
        assertTrue(outputs(compiled.fst(), "{1>1}a{1>1}").containsKey("1a1"));
    }

    @Test
    void scriptWithoutRulesIsIdentity() {
        CompiledRuleSet compiled = cascade.compile(RuleScriptParser.parse("::tone:: = [1]"),
                RuleCascade.ApplicationMode.OBLIGATORY);

        assertEquals(0, compiled.ruleCount());
        assertEquals(Map.of("xyz", 0.0), outputs(compiled.fst(), "xyz"));
    }

    @Test
    void macroRedefinitionIsReported() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        CompilationDiagnostics printed = new CompilationDiagnostics(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        RuleCascade reporting = new RuleCascade(symbols, CompilerSettings.defaults(), printed);

        CompiledRuleSet compiled = reporting.compile(RuleScriptParser.parse(String.join("\n",
                "::m:: = a",
                "::m:: = x",
                "::m:: -> y / _")), RuleCascade.ApplicationMode.OBLIGATORY);

        assertEquals(Map.of("ay", 0.0), outputs(compiled.fst(), "a"));
        assertEquals(1, printed.warnings().size());
        assertTrue(buffer.toString(StandardCharsets.UTF_8).contains("warning: Macro 'm'"));
    }

    @Test
    void rejectPolicyAbortsCompilation() {
        RuleCascade strict = new RuleCascade(symbols,
                CompilerSettings.defaults().withMacroPolicy(MacroRedefinitionPolicy.REJECT), diagnostics);

        assertThrows(RuleCompilationException.class, () -> strict.compile(RuleScriptParser.parse(String.join("\n",
                "::m:: = a",
                "::m:: = x")), RuleCascade.ApplicationMode.OBLIGATORY));
    }
}
