package org.vira.compiler.frontend.parser;

import org.vira.compiler.diagnostics.DiagnosticsEngine;
import org.vira.compiler.frontend.lexer.Token;
import org.vira.compiler.frontend.lexer.TokenType;
import org.vira.compiler.frontend.parser.ast.Expression;
import org.vira.compiler.frontend.parser.ast.Statement;

/**
 * Provides statement handlers with access to the token stream.
 * This interface decouples handlers from the concrete {@link Parser} implementation.
 */
public interface ParsingContext {
    /**
     * Checks if the current token matches any of the given types. If so, consumes it.
     * @param types The token types to match.
     * @return true if the current token matches one of the types, false otherwise.
     */
    boolean match(TokenType... types);

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise.
     */
    boolean check(TokenType type);

    /**
     * Consumes the current token and returns it.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     */
    Token peek();

    /**
     * Returns the previously consumed token.
     * @return The previous token.
     */
    Token previous();

    /**
     * Consumes the current token if it is of the expected type.
     * @param type The expected token type.
     * @param errorMessage The error message if the token type does not match.
     * @return The consumed token.
     * @throws ParseException If the current token is of another type.
     */
    Token consume(TokenType type, String errorMessage);

    /**
     * Parses an expression at the current position.
     * @return The expression.
     * @throws ParseException If no valid expression starts here.
     */
    Expression expression();

    /**
     * Parses one declaration with error recovery.
     * @return The statement, or null if it had a syntax error (already reported).
     */
    Statement declaration();

    /**
     * Gets the diagnostics engine for reporting errors.
     * @return The diagnostics engine.
     */
    DiagnosticsEngine getDiagnostics();

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if at the end of the stream, false otherwise.
     */
    boolean isAtEnd();
}
