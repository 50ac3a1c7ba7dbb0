package org.vira.compiler.frontend.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts source text into tokens.
 *
 * <p>Tokens are recognized longest-match first: digit runs are numbers, identifier runs are
 * identifiers or keywords, {@code "..."} is a string with backslash pass-through, {@code :name:}
 * is an import marker, {@code <} starts a comment running to the end of the line, and a fixed
 * set of single characters are punctuators. Whitespace is skipped.</p>
 */
public class Lexer {

    private final String source;
    private final String fileName;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    public Lexer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    /**
     * Scans the whole input. Comments are dropped; any unrecognized character is an error.
     * @return The tokens, ending with an {@link TokenType#END_OF_FILE} token.
     * @throws LexerException On the first lexical error.
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            if (token.type() == TokenType.UNKNOWN) {
                throw new LexerException("Unexpected character '" + token.text() + "'",
                        fileName, token.line(), token.column());
            }
            if (token.type() != TokenType.COMMENT) {
                tokens.add(token);
            }
        } while (token.type() != TokenType.END_OF_FILE);
        return tokens;
    }

    /**
     * Returns the next token and advances past it. Once the input is exhausted every call
     * returns an {@link TokenType#END_OF_FILE} token.
     * @return The next token.
     * @throws LexerException If a string is unterminated or a number is out of range.
     */
    public Token nextToken() {
        skipWhitespace();
        if (isAtEnd()) {
            return new Token(TokenType.END_OF_FILE, "", null, line, column, fileName);
        }

        int startLine = line;
        int startColumn = column;
        int start = current;
        char c = peek();

        if (isDigit(c)) {
            return number(start, startLine, startColumn);
        }
        if (isAlpha(c)) {
            return identifier(start, startLine, startColumn);
        }
        switch (c) {
            case '"':
                return string(start, startLine, startColumn);
            case '<':
                return comment(start, startLine, startColumn);
            case ':':
                return colonOrImport(start, startLine, startColumn);
            default:
                break;
        }

        advance();
        TokenType type = switch (c) {
            case '=' -> TokenType.ASSIGN;
            case '+' -> TokenType.PLUS;
            case '-' -> TokenType.MINUS;
            case '*' -> TokenType.STAR;
            case '/' -> TokenType.SLASH;
            case '(' -> TokenType.LEFT_PAREN;
            case ')' -> TokenType.RIGHT_PAREN;
            case '{' -> TokenType.LEFT_BRACE;
            case '}' -> TokenType.RIGHT_BRACE;
            case ';' -> TokenType.SEMICOLON;
            case ',' -> TokenType.COMMA;
            default -> TokenType.UNKNOWN;
        };
        return token(type, start, null, startLine, startColumn);
    }

    private Token number(int start, int startLine, int startColumn) {
        while (!isAtEnd() && isDigit(peek())) advance();
        String digits = source.substring(start, current);
        try {
            return token(TokenType.NUMBER, start, Long.parseLong(digits), startLine, startColumn);
        } catch (NumberFormatException e) {
            throw new LexerException("Number literal out of range: " + digits, fileName, startLine, startColumn);
        }
    }

    private Token identifier(int start, int startLine, int startColumn) {
        while (!isAtEnd() && isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = Token.KEYWORDS.contains(text) ? TokenType.KEYWORD : TokenType.IDENTIFIER;
        return token(type, start, null, startLine, startColumn);
    }

    private Token string(int start, int startLine, int startColumn) {
        advance(); // opening quote
        StringBuilder value = new StringBuilder();
        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\\') {
                advance();
                if (isAtEnd()) break;
            }
            value.append(advance());
        }
        if (isAtEnd()) {
            throw new LexerException("Unterminated string", fileName, startLine, startColumn);
        }
        advance(); // closing quote
        return token(TokenType.STRING, start, value.toString(), startLine, startColumn);
    }

    private Token comment(int start, int startLine, int startColumn) {
        advance(); // <
        while (!isAtEnd() && peek() != '\n') advance();
        return token(TokenType.COMMENT, start, source.substring(start + 1, current), startLine, startColumn);
    }

    private Token colonOrImport(int start, int startLine, int startColumn) {
        advance(); // :
        if (!isAtEnd() && isAlpha(peek())) {
            int nameStart = current;
            int savedColumn = column;
            while (!isAtEnd() && isAlphaNumeric(peek())) advance();
            if (!isAtEnd() && peek() == ':') {
                String library = source.substring(nameStart, current);
                advance();
                return token(TokenType.IMPORT, start, library, startLine, startColumn);
            }
            // no closing colon: only the colon is consumed
            current = nameStart;
            column = savedColumn;
        }
        return token(TokenType.COLON, start, null, startLine, startColumn);
    }

    private Token token(TokenType type, int start, Object value, int startLine, int startColumn) {
        return new Token(type, source.substring(start, current), value, startLine, startColumn, fileName);
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) advance();
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private char peek() {
        return source.charAt(current);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
