package org.vira.compiler.frontend.lexer;

/**
 * The kinds of tokens produced by the {@link Lexer}.
 */
public enum TokenType {
    IDENTIFIER,
    KEYWORD,
    NUMBER,
    STRING,

    COLON,
    ASSIGN,
    PLUS,
    MINUS,
    STAR,
    SLASH,
    LEFT_PAREN,
    RIGHT_PAREN,
    LEFT_BRACE,
    RIGHT_BRACE,
    SEMICOLON,
    COMMA,

    /** {@code :name:}, the value is the library name. */
    IMPORT,
    /** {@code < text} up to the end of the line. */
    COMMENT,
    END_OF_FILE,
    UNKNOWN
}
