package org.vira.compiler.frontend.parser.ast;

import org.vira.compiler.frontend.lexer.Token;

import java.util.List;
import java.util.Objects;

/**
 * {@code return expression;}
 *
 * @param keyword    The {@code return} token.
 * @param expression The returned value.
 */
public record ReturnStatement(Token keyword, Expression expression) implements Statement {

    public ReturnStatement {
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }

    @Override
    public Token location() {
        return keyword;
    }
}
