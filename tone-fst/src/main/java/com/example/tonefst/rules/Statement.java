package com.example.tonefst.rules;

import java.util.Objects;

/**
 * One line of a rule script.
 */
public sealed interface Statement {

    record Comment() implements Statement {
    }

    record MacroDef(String name, RegexAst definition) implements Statement {
        public MacroDef {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(definition, "definition");
        }
    }

    record Rule(RewriteRule rule) implements Statement {
        public Rule {
            Objects.requireNonNull(rule, "rule");
        }
    }
}
