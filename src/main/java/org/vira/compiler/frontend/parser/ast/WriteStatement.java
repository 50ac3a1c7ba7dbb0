package org.vira.compiler.frontend.parser.ast;

import org.vira.compiler.frontend.lexer.Token;

import java.util.List;
import java.util.Objects;

/**
 * {@code write expression;}
 *
 * @param keyword    The {@code write} token.
 * @param expression The value written.
 */
public record WriteStatement(Token keyword, Expression expression) implements Statement {

    public WriteStatement {
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
