package com.example.tonefst.rules;

import java.util.List;
import java.util.Set;

/**
 * Pattern over symbols, as produced by {@link RuleScriptParser}. The set of variants is closed;
 * code that interprets patterns handles each of them explicitly.
 */
public sealed interface RegexAst {

    /** Symbol that separates the underlying part of a rule source from its surface part. */
    Char ARROW = new Char(">");

    /** Delimiter opening a tone annotation; never part of the underlying sequence. */
    Char ANNOTATION_OPEN = new Char("{");

    record Epsilon() implements RegexAst {
    }

    record Char(String symbol) implements RegexAst {
    }

    record Boundary() implements RegexAst {
    }

    record Group(List<RegexAst> nodes) implements RegexAst {
        public Group {
            nodes = List.copyOf(nodes);
        }
    }

    record Disjunction(List<RegexAst> alternatives) implements RegexAst {
        public Disjunction {
            alternatives = List.copyOf(alternatives);
        }
    }

    record SymbolClass(Set<String> symbols) implements RegexAst {
        public SymbolClass {
            symbols = Set.copyOf(symbols);
        }
    }

    record SymbolClassComplement(Set<String> symbols) implements RegexAst {
        public SymbolClassComplement {
            symbols = Set.copyOf(symbols);
        }
    }

    record Star(RegexAst node) implements RegexAst {
    }

    record Plus(RegexAst node) implements RegexAst {
    }

    record Option(RegexAst node) implements RegexAst {
    }

    record Macro(String name) implements RegexAst {
    }

    record Comment() implements RegexAst {
    }

    static RegexAst epsilon() {
        return new Epsilon();
    }

    static Group group(RegexAst... nodes) {
        return new Group(List.of(nodes));
    }
}
