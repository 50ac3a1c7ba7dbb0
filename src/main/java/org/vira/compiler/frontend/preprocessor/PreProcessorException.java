package org.vira.compiler.frontend.preprocessor;

import org.vira.compiler.diagnostics.CompilerException;

/**
 * A fatal preprocessing failure. Preprocessing has no recovery: any of these ends the run.
 */
public class PreProcessorException extends CompilerException {

    /**
     * The category of a preprocessing failure.
     */
    public enum Kind {
        /** The macro table is full and a new name was defined. */
        TOO_MANY_DEFINES,
        /** An include would nest deeper than the configured bound. */
        INCLUDE_DEPTH_EXCEEDED,
        /** An included file could not be located. */
        INCLUDE_NOT_FOUND,
        /** A directive is missing a required part, e.g. the closing delimiter of an include path. */
        MALFORMED_DIRECTIVE,
        /** Reading an input or writing the output failed. */
        IO
    }

    private final Kind kind;

    public PreProcessorException(Kind kind, String message, String fileName, int line) {
        super(message, fileName, line, 0);
        this.kind = kind;
    }

    public PreProcessorException(Kind kind, String message, String fileName, int line, Throwable cause) {
        super(message, fileName, line, 0, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
