package org.vira.compiler.frontend.parser.ast;

import org.vira.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * {@code def name(params) { body }}
 *
 * @param name       The function name.
 * @param parameters The parameter names, in order.
 * @param body       The statements of the body.
 */
public record FunctionDefinition(Token name, List<Token> parameters, List<Statement> body) implements Statement {

    public FunctionDefinition {
        parameters = List.copyOf(parameters);
        body = List.copyOf(body);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(body);
    }

    @Override
    public Token location() {
        return name;
    }
}
