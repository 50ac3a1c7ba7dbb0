package org.vira.compiler.frontend.semantics;

import org.vira.compiler.diagnostics.CompilerException;
import org.vira.compiler.frontend.lexer.Token;

/**
 * A semantic error. The checker stops at the first one, so a run reports at most one.
 */
public class SemanticException extends CompilerException {

    /**
     * The category of a semantic error.
     */
    public enum Kind {
        /** A name is used before it is declared, or never declared. */
        UNDEFINED_IDENTIFIER,
        /** A node has the wrong number of children for its kind. */
        ARITY,
        /** A node kind the checker has no rule for. */
        UNSUPPORTED_CONSTRUCT
    }

    private final Kind kind;

    public SemanticException(Kind kind, String message, Token location) {
        super(message,
                location != null ? location.fileName() : null,
                location != null ? location.line() : 0,
                location != null ? location.column() : 0);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
