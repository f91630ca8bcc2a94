package com.example.tonefst.compiler;

import java.io.OutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Collects recoverable problems found while compiling rules (unknown symbols, undefined or
 * redefined macros). Every warning is kept for the caller and echoed to a console stream.
 */
public final class CompilationDiagnostics {

    private final List<String> warnings = new ArrayList<>();
    private final PrintStream sink;

    public CompilationDiagnostics(PrintStream sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Diagnostics that are only recorded, not printed.
     */
    public static CompilationDiagnostics silent() {
        return new CompilationDiagnostics(new PrintStream(OutputStream.nullOutputStream()));
    }

    public void warn(String message) {
        warnings.add(message);
        sink.println("warning: " + message);
    }

    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
