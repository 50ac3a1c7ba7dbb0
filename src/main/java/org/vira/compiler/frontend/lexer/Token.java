package org.vira.compiler.frontend.lexer;

import java.util.Set;

/**
 * An immutable token.
 *
 * @param type     The token type.
 * @param text     The exact source text of the token, e.g. {@code "a\"b"} including quotes.
 * @param value    The literal value: a {@link Long} for numbers, the string contents for strings,
 *                 the library name for imports, the comment body for comments, otherwise null.
 * @param line     The 1-based line of the first character.
 * @param column   The 1-based column of the first character.
 * @param fileName The file the token was read from.
 */
public record Token(TokenType type, String text, Object value, int line, int column, String fileName) {

    /** Words that are lexed as {@link TokenType#KEYWORD} instead of {@link TokenType#IDENTIFIER}. */
    public static final Set<String> KEYWORDS = Set.of(
            "let", "def", "write", "return", "int", "if", "else", "while", "for");

    /**
     * @param keyword A keyword text.
     * @return true if this is the given keyword.
     */
    public boolean isKeyword(String keyword) {
        return type == TokenType.KEYWORD && text.equals(keyword);
    }
}
