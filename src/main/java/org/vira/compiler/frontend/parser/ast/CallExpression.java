package org.vira.compiler.frontend.parser.ast;

import org.vira.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A function call {@code name(arg, ...)}.
 *
 * @param callee    The name of the called function.
 * @param arguments The argument expressions, in order.
 */
public record CallExpression(Token callee, List<Expression> arguments) implements Expression {

    public CallExpression {
        arguments = List.copyOf(arguments);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(arguments);
    }

    @Override
    public Token location() {
        return callee;
    }
}
