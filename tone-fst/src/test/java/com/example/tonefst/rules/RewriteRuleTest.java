package com.example.tonefst.rules;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;

class RewriteRuleTest {

    private static RewriteRule withSource(RegexAst source) {
        return new RewriteRule(RegexAst.epsilon(), source, RegexAst.epsilon(), RegexAst.epsilon());
    }

    @Test
    void underlyingPartStopsAtArrowAndSkipsAnnotationOpening() {
        RewriteRule rule = withSource(RuleScriptParser.parsePattern("{3>1>4}"));

        assertEquals(List.of(new RegexAst.Char("3")), rule.underlyingSequence());
    }

    @Test
    void sourceWithoutArrowIsEntirelyUnderlying() {
        RewriteRule rule = withSource(RuleScriptParser.parsePattern("ab"));

        assertEquals(List.of(new RegexAst.Char("a"), new RegexAst.Char("b")), rule.underlyingSequence());
    }

    @Test
    void emptyUnderlyingPart() {
        RewriteRule rule = withSource(RuleScriptParser.parsePattern("{>1}"));

        assertEquals(List.of(), rule.underlyingSequence());
    }

    @Test
    void sourceMustBeAGroup() {
        RewriteRule rule = withSource(new RegexAst.Char("a"));

        assertThrows(RuleCompilationException.class, rule::underlyingSequence);
    }
}
