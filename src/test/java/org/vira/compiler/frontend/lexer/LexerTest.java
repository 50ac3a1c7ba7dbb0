package org.vira.compiler.frontend.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

@Tag("unit")
class LexerTest {

    private static List<Token> scan(String source) {
        return new Lexer(source, "test.vira").scanTokens();
    }

    @Test
    void scansDeclarationWithPositions() {
        List<Token> tokens = scan("let x = 42;\n  write x;");

        assertThat(tokens)
                .extracting(Token::type, Token::text, Token::line, Token::column)
                .containsExactly(
                        tuple(TokenType.KEYWORD, "let", 1, 1),
                        tuple(TokenType.IDENTIFIER, "x", 1, 5),
                        tuple(TokenType.ASSIGN, "=", 1, 7),
                        tuple(TokenType.NUMBER, "42", 1, 9),
                        tuple(TokenType.SEMICOLON, ";", 1, 11),
                        tuple(TokenType.KEYWORD, "write", 2, 3),
                        tuple(TokenType.IDENTIFIER, "x", 2, 9),
                        tuple(TokenType.SEMICOLON, ";", 2, 10),
                        tuple(TokenType.END_OF_FILE, "", 2, 11));
        assertThat(tokens.get(3).value()).isEqualTo(42L);
        assertThat(tokens).allSatisfy(t -> assertThat(t.fileName()).isEqualTo("test.vira"));
    }

    @Test
    void reservedWordsAreKeywordsButPrefixedNamesAreNot() {
        List<Token> tokens = scan("def return while lettuce _int");

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.KEYWORD, TokenType.KEYWORD, TokenType.KEYWORD,
                TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.END_OF_FILE);
        assertThat(tokens.get(0).isKeyword("def")).isTrue();
        assertThat(tokens.get(3).isKeyword("let")).isFalse();
    }

    @Test
    void punctuators() {
        assertThat(scan("= + - * / ( ) { } ; ,")).extracting(Token::type).containsExactly(
                TokenType.ASSIGN, TokenType.PLUS, TokenType.MINUS, TokenType.STAR, TokenType.SLASH,
                TokenType.LEFT_PAREN, TokenType.RIGHT_PAREN, TokenType.LEFT_BRACE, TokenType.RIGHT_BRACE,
                TokenType.SEMICOLON, TokenType.COMMA, TokenType.END_OF_FILE);
    }

    @Test
    void importMarkerCarriesLibraryName() {
        List<Token> tokens = scan(":math:;");

        assertThat(tokens.get(0).type()).isEqualTo(TokenType.IMPORT);
        assertThat(tokens.get(0).text()).isEqualTo(":math:");
        assertThat(tokens.get(0).value()).isEqualTo("math");
        assertThat(tokens.get(1).type()).isEqualTo(TokenType.SEMICOLON);
    }

    @Test
    void colonWithoutClosingColonRewindsToName() {
        List<Token> tokens = scan(":abc x");

        assertThat(tokens)
                .extracting(Token::type, Token::text, Token::column)
                .containsExactly(
                        tuple(TokenType.COLON, ":", 1),
                        tuple(TokenType.IDENTIFIER, "abc", 2),
                        tuple(TokenType.IDENTIFIER, "x", 6),
                        tuple(TokenType.END_OF_FILE, "", 7));
    }

    @Test
    void commentRunsToEndOfLine() {
        Lexer lexer = new Lexer("x < a note ; +\ny", "test.vira");

        assertThat(lexer.nextToken().type()).isEqualTo(TokenType.IDENTIFIER);
        Token comment = lexer.nextToken();
        assertThat(comment.type()).isEqualTo(TokenType.COMMENT);
        assertThat(comment.value()).isEqualTo(" a note ; +");
        Token y = lexer.nextToken();
        assertThat(y.text()).isEqualTo("y");
        assertThat(y.line()).isEqualTo(2);
    }

    @Test
    void scanTokensDropsComments() {
        assertThat(scan("< header\nwrite 1; < trailing")).extracting(Token::text)
                .containsExactly("write", "1", ";", "");
    }

    @Test
    void stringEscapesCopyTheEscapedCharacter() {
        Token token = scan("\"a\\\"b\\\\c\"").get(0);

        assertThat(token.type()).isEqualTo(TokenType.STRING);
        assertThat(token.text()).isEqualTo("\"a\\\"b\\\\c\"");
        assertThat(token.value()).isEqualTo("a\"b\\c");
    }

    @Test
    void unterminatedStringReportsWhereItStarted() {
        assertThatThrownBy(() -> scan("let s;\n  write \"abc\n;\n"))
                .isInstanceOfSatisfying(LexerException.class, e -> {
                    assertThat(e.getLine()).isEqualTo(2);
                    assertThat(e.getColumn()).isEqualTo(9);
                    assertThat(e.getMessage()).contains("Unterminated string");
                });
    }

    @Test
    void unknownCharacterFailsScan() {
        Lexer lexer = new Lexer("let a = 1 @ 2;", "test.vira");
        for (int i = 0; i < 4; i++) {
            lexer.nextToken();
        }
        assertThat(lexer.nextToken().type()).isEqualTo(TokenType.UNKNOWN);

        assertThatThrownBy(() -> scan("let a = 1 @ 2;"))
                .isInstanceOf(LexerException.class)
                .hasMessage("Unexpected character '@'");
    }

    @Test
    void numberOutOfRangeIsLexicalError() {
        assertThatThrownBy(() -> scan("99999999999999999999"))
                .isInstanceOf(LexerException.class)
                .hasMessageContaining("out of range");
    }

    @Test
    void endOfFileRepeats() {
        Lexer lexer = new Lexer("x", "test.vira");
        lexer.nextToken();

        assertThat(lexer.nextToken().type()).isEqualTo(TokenType.END_OF_FILE);
        assertThat(lexer.nextToken().type()).isEqualTo(TokenType.END_OF_FILE);
    }

    @Test
    void tokenTextsReconstructSourceWithoutWhitespaceAndComments() {
        String source = "def add(a, b) {\n  return a + b;  < sum\n}\nwrite add(1, \"two\");\n:io:;\n";

        String joined = scan(source).stream().map(Token::text).collect(Collectors.joining());

        assertThat(joined).isEqualTo("defadd(a,b){returna+b;}writeadd(1,\"two\");:io:;");
    }
}
