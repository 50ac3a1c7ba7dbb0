package org.vira.compiler.frontend.parser.ast;

import org.vira.compiler.frontend.lexer.Token;

/**
 * A string literal.
 *
 * @param token The string token.
 * @param value The contents between the quotes.
 */
public record StringLiteral(Token token, String value) implements Expression {

    @Override
    public Token location() {
        return token;
    }
}
