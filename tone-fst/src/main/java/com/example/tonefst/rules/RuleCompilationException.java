package com.example.tonefst.rules;

/**
 * Exception thrown when a rule script cannot be compiled, for example because a rule source is
 * not a sequence or a macro is redefined while redefinitions are rejected.
 */
public class RuleCompilationException extends RuntimeException {
    public RuleCompilationException(String message) {
        super(message);
    }

    public RuleCompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
