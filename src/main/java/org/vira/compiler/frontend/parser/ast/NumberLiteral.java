package org.vira.compiler.frontend.parser.ast;

import org.vira.compiler.frontend.lexer.Token;

/**
 * An integer literal.
 *
 * @param token The number token.
 * @param value The literal's value.
 */
public record NumberLiteral(Token token, long value) implements Expression {

    @Override
    public Token location() {
        return token;
    }
}
