package com.example.tonefst.rules;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Macro definitions collected while one script is compiled.
 */
public final class MacroTable {

    public enum Outcome {
        DEFINED,
        IGNORED,
        REPLACED
    }

    private final Map<String, RegexAst> definitions = new LinkedHashMap<>();
    private final MacroRedefinitionPolicy policy;

    public MacroTable(MacroRedefinitionPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public MacroTable() {
        this(MacroRedefinitionPolicy.IGNORE);
    }

    /**
     * Adds a definition. A name that is already defined is handled according to the policy; it is
     * never replaced without the outcome saying so.
     *
     * @throws RuleCompilationException on redefinition under {@link MacroRedefinitionPolicy#REJECT}
     */
    public Outcome define(String name, RegexAst definition) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(definition, "definition");
        if (!definitions.containsKey(name)) {
            definitions.put(name, definition);
            return Outcome.DEFINED;
        }
        switch (policy) {
            case REJECT:
                throw new RuleCompilationException("Macro '" + name + "' is already defined");
            case REPLACE:
                definitions.put(name, definition);
                return Outcome.REPLACED;
            default:
                return Outcome.IGNORED;
        }
    }

    public Optional<RegexAst> lookup(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    public boolean contains(String name) {
        return definitions.containsKey(name);
    }

    public Map<String, RegexAst> definitions() {
        return Collections.unmodifiableMap(definitions);
    }

    public MacroRedefinitionPolicy policy() {
        return policy;
    }
}
