package org.vira.compiler.frontend.parser.ast;

import org.vira.compiler.frontend.lexer.TokenType;

/**
 * The arithmetic operators of a {@link BinaryOperation}.
 */
public enum BinaryOperator {
    ADD('+'),
    SUBTRACT('-'),
    MULTIPLY('*'),
    DIVIDE('/');

    private final char symbol;

    BinaryOperator(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    /**
     * @param type An operator token type.
     * @return The matching operator.
     * @throws IllegalArgumentException If the token type is not an arithmetic operator.
     */
    public static BinaryOperator fromTokenType(TokenType type) {
        return switch (type) {
            case PLUS -> ADD;
            case MINUS -> SUBTRACT;
            case STAR -> MULTIPLY;
            case SLASH -> DIVIDE;
            default -> throw new IllegalArgumentException("Not a binary operator: " + type);
        };
    }
}
