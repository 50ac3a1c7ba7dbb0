package org.vira.compiler.diagnostics;

/**
 * A single error produced by one of the front-end phases.
 *
 * @param message  The human-readable description.
 * @param fileName The file the message refers to.
 * @param line     The 1-based line number.
 * @param column   The 1-based column number, or 0 if unknown.
 */
public record Diagnostic(String message, String fileName, int line, int column) {

    /**
     * Formats the diagnostic as {@code file:line:column: error: message}. Unknown parts of the
     * location are omitted.
     * @return The formatted diagnostic.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        if (fileName != null) {
            sb.append(fileName);
            if (line > 0) {
                sb.append(':').append(line);
                if (column > 0) {
                    sb.append(':').append(column);
                }
            }
            sb.append(": ");
        }
        sb.append("error: ").append(message);
        return sb.toString();
    }
}
