package org.vira.compiler.frontend.parser.features.write;

import org.vira.compiler.frontend.lexer.Token;
import org.vira.compiler.frontend.lexer.TokenType;
import org.vira.compiler.frontend.parser.IStatementHandler;
import org.vira.compiler.frontend.parser.ParsingContext;
import org.vira.compiler.frontend.parser.ast.Expression;
import org.vira.compiler.frontend.parser.ast.Statement;
import org.vira.compiler.frontend.parser.ast.WriteStatement;

/**
 * Handler for {@code write <expression>;}.
 */
public class WriteStatementHandler implements IStatementHandler {

    @Override
    public Statement parse(ParsingContext context) {
        Token keyword = context.advance();
        Expression expression = context.expression();
        context.consume(TokenType.SEMICOLON, "Expected ';' after write");
        return new WriteStatement(keyword, expression);
    }
}
