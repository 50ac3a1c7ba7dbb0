package org.vira.compiler.frontend.parser.ast;

import org.vira.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * An expression evaluated for its effect, e.g. a call.
 *
 * @param expression The expression.
 */
public record ExpressionStatement(Expression expression) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }

    @Override
    public Token location() {
        return expression.location();
    }
}
