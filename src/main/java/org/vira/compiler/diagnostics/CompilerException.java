package org.vira.compiler.diagnostics;

/**
 * Base class for the typed failures of the front end. Every failure carries the file
 * and the 1-based line it refers to; the column is 0 where no precise column is known.
 */
public class CompilerException extends RuntimeException {

    private final String fileName;
    private final int line;
    private final int column;

    public CompilerException(String message, String fileName, int line, int column) {
        super(message);
        this.fileName = fileName;
        this.line = line;
        this.column = column;
    }

    public CompilerException(String message, String fileName, int line, int column, Throwable cause) {
        super(message, cause);
        this.fileName = fileName;
        this.line = line;
        this.column = column;
    }

    public String getFileName() {
        return fileName;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
     * @return The failure as a diagnostic line ({@code file:line[:column]: error: message}).
     */
    public String toDiagnosticString() {
        return new Diagnostic(getMessage(), fileName, line, column).format();
    }
}
