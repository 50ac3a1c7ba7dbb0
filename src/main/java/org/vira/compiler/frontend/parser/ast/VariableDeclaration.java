package org.vira.compiler.frontend.parser.ast;

import org.vira.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * {@code let name = initializer;}
 *
 * @param name        The variable name.
 * @param initializer The initializer, or null for {@code let name;}.
 */
public record VariableDeclaration(Token name, Expression initializer) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return initializer == null ? List.of() : List.of(initializer);
    }

    @Override
    public Token location() {
        return name;
    }
}
