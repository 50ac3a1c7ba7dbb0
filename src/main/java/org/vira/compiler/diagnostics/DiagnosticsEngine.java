package org.vira.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects diagnostics reported by the front-end phases of a single run.
 * The parser reports one error per failed declaration here and keeps going, so a
 * single run can surface several independent syntax errors.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     * @param message The error message.
     * @param fileName The file the error occurred in.
     * @param line The 1-based line number.
     * @param column The 1-based column number, or 0 if unknown.
     */
    public void reportError(String message, String fileName, int line, int column) {
        diagnostics.add(new Diagnostic(message, fileName, line, column));
    }

    /**
     * Reports a typed compiler failure as an error.
     * @param exception The failure to report.
     */
    public void report(CompilerException exception) {
        reportError(exception.getMessage(), exception.getFileName(), exception.getLine(), exception.getColumn());
    }

    /**
     * @return true if at least one error has been reported.
     */
    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * @return An unmodifiable view of all reported diagnostics in reporting order.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return The number of reported errors.
     */
    public long errorCount() {
        return diagnostics.size();
    }

    /**
     * Builds a one-line-per-diagnostic summary suitable for standard error.
     * @return The formatted diagnostics, separated by newlines.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        for (Diagnostic d : diagnostics) {
            sb.append(d.format()).append(System.lineSeparator());
        }
        return sb.toString();
    }
}
