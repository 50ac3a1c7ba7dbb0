package org.vira.compiler.frontend.lexer;

import org.vira.compiler.diagnostics.CompilerException;

/**
 * A lexical error: an unterminated string, an unrecognized character or a number out of range.
 * Lexical errors end the run.
 */
public class LexerException extends CompilerException {

    public LexerException(String message, String fileName, int line, int column) {
        super(message, fileName, line, column);
    }
}
