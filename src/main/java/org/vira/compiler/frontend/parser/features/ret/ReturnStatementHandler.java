package org.vira.compiler.frontend.parser.features.ret;

import org.vira.compiler.frontend.lexer.Token;
import org.vira.compiler.frontend.lexer.TokenType;
import org.vira.compiler.frontend.parser.IStatementHandler;
import org.vira.compiler.frontend.parser.ParsingContext;
import org.vira.compiler.frontend.parser.ast.Expression;
import org.vira.compiler.frontend.parser.ast.ReturnStatement;
import org.vira.compiler.frontend.parser.ast.Statement;

/**
 * Handler for {@code return <expression>;}.
 */
public class ReturnStatementHandler implements IStatementHandler {

    @Override
    public Statement parse(ParsingContext context) {
        Token keyword = context.advance();
        Expression expression = context.expression();
        context.consume(TokenType.SEMICOLON, "Expected ';' after return value");
        return new ReturnStatement(keyword, expression);
    }
}
