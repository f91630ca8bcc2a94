package com.example.tonefst.rules;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

class RuleScriptParserTest {

    @Test
    void parsesCommentsMacrosAndRules() {
        List<Statement> script = RuleScriptParser.parse(String.join("\n",
                "% tones",
                "",
                "::tone:: = [1234]",
                "{::tone::>::tone::} -> #[^#]+# / _"));

        assertEquals(3, script.size());
        assertInstanceOf(Statement.Comment.class, script.get(0));
        assertEquals(new Statement.MacroDef("tone", new RegexAst.SymbolClass(Set.of("1", "2", "3", "4"))),
                script.get(1));

        RewriteRule rule = ((Statement.Rule) script.get(2)).rule();
        assertEquals(RegexAst.group(
                new RegexAst.Char("{"),
                new RegexAst.Macro("tone"),
                new RegexAst.Char(">"),
                new RegexAst.Macro("tone"),
                new RegexAst.Char("}")), rule.source());
        assertEquals(RegexAst.group(
                new RegexAst.Boundary(),
                new RegexAst.Plus(new RegexAst.SymbolClassComplement(Set.of("#"))),
                new RegexAst.Boundary()), rule.target());
        assertEquals(RegexAst.epsilon(), rule.left());
        assertEquals(RegexAst.epsilon(), rule.right());
    }

    @Test
    void ruleWithoutContextHasEmptyContexts() {
        RewriteRule rule = singleRule("a -> 0");

        assertEquals(RegexAst.group(new RegexAst.Epsilon()), rule.target());
        assertEquals(RegexAst.epsilon(), rule.left());
    }

    @Test
    void parsesContextsAndOperators() {
        RewriteRule rule = singleRule("a? -> b / (c|d)* # _ e+");

        assertEquals(RegexAst.group(new RegexAst.Option(new RegexAst.Char("a"))), rule.source());
        assertEquals(RegexAst.group(
                new RegexAst.Star(new RegexAst.Disjunction(List.of(
                        RegexAst.group(new RegexAst.Char("c")),
                        RegexAst.group(new RegexAst.Char("d"))))),
                new RegexAst.Boundary()), rule.left());
        assertEquals(RegexAst.group(new RegexAst.Plus(new RegexAst.Char("e"))), rule.right());
    }

    @Test
    void escapesAndArrowsInsideClasses() {
        RewriteRule rule = singleRule("\\# [>-] -> \\0\\_ / _");

        assertEquals(RegexAst.group(
                new RegexAst.Char("#"),
                new RegexAst.SymbolClass(Set.of(">", "-"))), rule.source());
        assertEquals(RegexAst.group(new RegexAst.Char("0"), new RegexAst.Char("_")), rule.target());
    }

    @Test
    void combiningMarksStayWithTheirBase() {
        RegexAst pattern = RuleScriptParser.parsePattern("\u00e1b");

        assertEquals(RegexAst.group(new RegexAst.Char("a\u0301"), new RegexAst.Char("b")), pattern);
    }

    @Test
    void groupWithoutAlternativesIsAGroup() {
        assertEquals(RegexAst.group(new RegexAst.Char("a"), new RegexAst.Char("b")),
                RuleScriptParser.parsePattern("(ab)"));
    }

    @Test
    void reportsLineAndColumnOfSyntaxErrors() {
        RuleSyntaxException ex = assertThrows(RuleSyntaxException.class,
                () -> RuleScriptParser.parse("% ok\na -> (b / _"));

        assertEquals(2, ex.line());
        assertEquals(6, ex.column());
        assertTrue(ex.getMessage().contains("line 2"));
    }

    @Test
    void rejectsLinesThatAreNeitherRuleNorMacro() {
        RuleSyntaxException ex = assertThrows(RuleSyntaxException.class, () -> RuleScriptParser.parse("abc"));

        assertEquals(1, ex.line());
    }

    @Test
    void rejectsDanglingOperatorsAndUnclosedClasses() {
        assertThrows(RuleSyntaxException.class, () -> RuleScriptParser.parsePattern("*a"));
        assertThrows(RuleSyntaxException.class, () -> RuleScriptParser.parsePattern("[ab"));
        assertThrows(RuleSyntaxException.class, () -> RuleScriptParser.parsePattern("::tone"));
        assertThrows(RuleSyntaxException.class, () -> RuleScriptParser.parse("-> b"));
    }

    private static RewriteRule singleRule(String line) {
        List<Statement> script = RuleScriptParser.parse(line);
        assertEquals(1, script.size());
        return ((Statement.Rule) script.get(0)).rule();
    }
}
