package com.example.tonefst.rules;

/**
 * What a {@link MacroTable} does when a script defines a macro name a second time.
 */
public enum MacroRedefinitionPolicy {
    /** Keep the first definition and report the attempt. */
    IGNORE,
    /** Fail the compilation. */
    REJECT,
    /** Use the new definition and report the replacement. */
    REPLACE
}
