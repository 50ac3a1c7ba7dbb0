package org.vira.compiler.frontend.parser;

import org.vira.compiler.diagnostics.CompilerException;
import org.vira.compiler.frontend.lexer.Token;

/**
 * A syntax error. The parser catches it at the enclosing declaration, reports it and
 * resynchronizes, so it never escapes {@link Parser#parse()}.
 */
public class ParseException extends CompilerException {

    /**
     * @param message The error message.
     * @param token The token at which the error was detected.
     */
    public ParseException(String message, Token token) {
        super(message, token.fileName(), token.line(), token.column());
    }
}
