package org.vira.compiler.frontend.parser.features.def;

import org.vira.compiler.frontend.lexer.Token;
import org.vira.compiler.frontend.lexer.TokenType;
import org.vira.compiler.frontend.parser.IStatementHandler;
import org.vira.compiler.frontend.parser.ParsingContext;
import org.vira.compiler.frontend.parser.ast.FunctionDefinition;
import org.vira.compiler.frontend.parser.ast.Statement;

import java.util.ArrayList;
import java.util.List;

/**
 * Handler for function definitions.
 * The syntax is <code>def &lt;name&gt;(&lt;param&gt;, ...) { &lt;declaration&gt;* }</code>.
 * Declarations in the body recover from syntax errors individually, like top-level ones.
 */
public class FunctionDefinitionHandler implements IStatementHandler {

    @Override
    public Statement parse(ParsingContext context) {
        context.advance(); // consume 'def'

        Token name = context.consume(TokenType.IDENTIFIER, "Expected function name");
        context.consume(TokenType.LEFT_PAREN, "Expected '(' after function name");
        List<Token> params = new ArrayList<>();
        if (!context.match(TokenType.RIGHT_PAREN)) {
            do {
                params.add(context.consume(TokenType.IDENTIFIER, "Expected parameter name"));
            } while (context.match(TokenType.COMMA));
            context.consume(TokenType.RIGHT_PAREN, "Expected ')' after parameters");
        }

        context.consume(TokenType.LEFT_BRACE, "Expected '{' before function body");
        List<Statement> body = new ArrayList<>();
        while (!context.check(TokenType.RIGHT_BRACE) && !context.isAtEnd()) {
            Statement statement = context.declaration();
            if (statement != null) {
                body.add(statement);
            }
        }
        context.consume(TokenType.RIGHT_BRACE, "Expected '}' after function body");
        return new FunctionDefinition(name, params, body);
    }
}
