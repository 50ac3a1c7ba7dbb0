package org.vira.compiler.frontend.parser;

import org.vira.compiler.frontend.parser.ast.Statement;

/**
 * Handler interface for statements introduced by a keyword or marker token.
 * The handler is called with the introducing token still current.
 */
public interface IStatementHandler {

    /**
     * Parses the statement, including its terminating {@code ;}.
     *
     * @param context The parsing context providing access to the token stream.
     * @return The parsed statement.
     * @throws ParseException On a syntax error.
     */
    Statement parse(ParsingContext context);
}
