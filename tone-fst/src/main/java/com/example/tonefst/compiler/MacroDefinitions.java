package com.example.tonefst.compiler;

import com.example.tonefst.rules.MacroTable;
import com.example.tonefst.rules.Statement;

final class MacroDefinitions {

    private MacroDefinitions() {
    }

    /**
     * Enters a definition and reports a redefinition that the table ignored or replaced.
     */
    static void define(MacroTable macros, Statement.MacroDef definition, CompilationDiagnostics diagnostics) {
        MacroTable.Outcome outcome = macros.define(definition.name(), definition.definition());
        if (outcome == MacroTable.Outcome.IGNORED) {
            diagnostics.warn("Macro '" + definition.name() + "' is already defined, the new definition is ignored");
        } else if (outcome == MacroTable.Outcome.REPLACED) {
            diagnostics.warn("Macro '" + definition.name() + "' is redefined, the previous definition is replaced");
        }
    }
}
