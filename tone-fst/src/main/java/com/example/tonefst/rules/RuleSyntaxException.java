package com.example.tonefst.rules;

import java.util.Locale;

/**
 * Exception thrown by {@link RuleScriptParser} for malformed script text.
 */
public class RuleSyntaxException extends RuleCompilationException {

    private final int line;
    private final int column;

    public RuleSyntaxException(String message, int line, int column) {
        super(String.format(Locale.ROOT, "%s (line %d, column %d)", message, line, column));
        this.line = line;
        this.column = column;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}
