package org.vira.compiler.frontend.parser.features.let;

import org.vira.compiler.frontend.lexer.Token;
import org.vira.compiler.frontend.lexer.TokenType;
import org.vira.compiler.frontend.parser.IStatementHandler;
import org.vira.compiler.frontend.parser.ParsingContext;
import org.vira.compiler.frontend.parser.ast.Expression;
import org.vira.compiler.frontend.parser.ast.Statement;
import org.vira.compiler.frontend.parser.ast.VariableDeclaration;

/**
 * Handler for variable declarations.
 * The syntax is <code>let &lt;name&gt; [= &lt;expression&gt;];</code>.
 */
public class VariableDeclarationHandler implements IStatementHandler {

    @Override
    public Statement parse(ParsingContext context) {
        context.advance(); // consume 'let'

        Token name = context.consume(TokenType.IDENTIFIER, "Expected variable name");
        Expression initializer = null;
        if (context.match(TokenType.ASSIGN)) {
            initializer = context.expression();
        }
        context.consume(TokenType.SEMICOLON, "Expected ';' after variable declaration");
        return new VariableDeclaration(name, initializer);
    }
}
