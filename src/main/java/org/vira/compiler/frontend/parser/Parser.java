package org.vira.compiler.frontend.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vira.compiler.diagnostics.DiagnosticsEngine;
import org.vira.compiler.frontend.lexer.Token;
import org.vira.compiler.frontend.lexer.TokenType;
import org.vira.compiler.frontend.parser.ast.BinaryOperation;
import org.vira.compiler.frontend.parser.ast.BinaryOperator;
import org.vira.compiler.frontend.parser.ast.CallExpression;
import org.vira.compiler.frontend.parser.ast.Expression;
import org.vira.compiler.frontend.parser.ast.ExpressionStatement;
import org.vira.compiler.frontend.parser.ast.IdentifierReference;
import org.vira.compiler.frontend.parser.ast.NumberLiteral;
import org.vira.compiler.frontend.parser.ast.Program;
import org.vira.compiler.frontend.parser.ast.Statement;
import org.vira.compiler.frontend.parser.ast.StringLiteral;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A recursive-descent parser that turns a token list into a {@link Program}.
 *
 * <p>Statements introduced by a keyword or an import marker are delegated to the handlers in
 * {@link StatementHandlerRegistry}; everything else is parsed as an expression statement.
 * Expressions follow the usual precedence: {@code * /} bind tighter than {@code + -}, unary
 * minus binds tightest and is lowered to {@code 0 - operand}.</p>
 *
 * <p>A syntax error inside a declaration is reported to the {@link DiagnosticsEngine}, the parser
 * skips ahead to the next {@code ;} or declaration keyword and continues, so one run can
 * report several syntax errors. Failed declarations are left out of the program.</p>
 */
public class Parser implements ParsingContext {

    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final StatementHandlerRegistry handlerRegistry;
    private int current = 0;

    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this(tokens, diagnostics, StatementHandlerRegistry.initialize());
    }

    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics, StatementHandlerRegistry handlerRegistry) {
        this.tokens = new ArrayList<>(tokens);
        this.diagnostics = diagnostics;
        this.handlerRegistry = handlerRegistry;
        if (this.tokens.isEmpty() || this.tokens.get(this.tokens.size() - 1).type() != TokenType.END_OF_FILE) {
            Token last = this.tokens.isEmpty() ? null : this.tokens.get(this.tokens.size() - 1);
            this.tokens.add(new Token(TokenType.END_OF_FILE, "", null,
                    last != null ? last.line() : 1, last != null ? last.column() + last.text().length() : 1,
                    last != null ? last.fileName() : null));
        }
    }

    /**
     * Parses all tokens.
     * @return The program; statements with syntax errors are missing from it.
     */
    public Program parse() {
        List<Statement> statements = new ArrayList<>();
        while (!isAtEnd()) {
            Statement statement = declaration();
            if (statement != null) {
                statements.add(statement);
            }
        }
        return new Program(statements, tokens.get(0).fileName());
    }

    @Override
    public Statement declaration() {
        try {
            Token start = peek();
            Optional<IStatementHandler> handler = handlerRegistry.get(start);
            if (handler.isPresent()) {
                return handler.get().parse(this);
            }
            if (start.type() == TokenType.KEYWORD) {
                throw new ParseException("Unsupported keyword '" + start.text() + "'", start);
            }
            return expressionStatement();
        } catch (ParseException e) {
            diagnostics.report(e);
            log.debug("Syntax error at {}:{}: {}", e.getLine(), e.getColumn(), e.getMessage());
            synchronize();
            return null;
        }
    }

    private Statement expressionStatement() {
        Expression expression = expression();
        consume(TokenType.SEMICOLON, "Expected ';' after expression");
        return new ExpressionStatement(expression);
    }

    /**
     * Discards tokens until just after a {@code ;} or just before {@code let}, {@code def}
     * or {@code write}.
     */
    private void synchronize() {
        while (!isAtEnd()) {
            Token token = peek();
            if (token.type() == TokenType.SEMICOLON) {
                advance();
                return;
            }
            if (token.isKeyword("let") || token.isKeyword("def") || token.isKeyword("write")) {
                return;
            }
            advance();
        }
    }

    // --- Expressions ---

    @Override
    public Expression expression() {
        return equality();
    }

    private Expression equality() {
        // no comparison operators in the language yet
        return additive();
    }

    private Expression additive() {
        Expression expr = multiplicative();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token operator = previous();
            Expression right = multiplicative();
            expr = new BinaryOperation(BinaryOperator.fromTokenType(operator.type()), expr, right, operator);
        }
        return expr;
    }

    private Expression multiplicative() {
        Expression expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH)) {
            Token operator = previous();
            Expression right = unary();
            expr = new BinaryOperation(BinaryOperator.fromTokenType(operator.type()), expr, right, operator);
        }
        return expr;
    }

    private Expression unary() {
        if (match(TokenType.MINUS)) {
            Token minus = previous();
            Expression operand = unary();
            Token zero = new Token(TokenType.NUMBER, "0", 0L, minus.line(), minus.column(), minus.fileName());
            return new BinaryOperation(BinaryOperator.SUBTRACT, new NumberLiteral(zero, 0L), operand, minus);
        }
        return primary();
    }

    private Expression primary() {
        if (match(TokenType.NUMBER)) {
            Token number = previous();
            return new NumberLiteral(number, (Long) number.value());
        }
        if (match(TokenType.STRING)) {
            Token string = previous();
            return new StringLiteral(string, (String) string.value());
        }
        if (match(TokenType.IDENTIFIER)) {
            Token name = previous();
            if (match(TokenType.LEFT_PAREN)) {
                return call(name);
            }
            return new IdentifierReference(name);
        }
        if (match(TokenType.LEFT_PAREN)) {
            Expression expr = expression();
            consume(TokenType.RIGHT_PAREN, "Expected ')' after expression");
            return expr;
        }
        Token unexpected = peek();
        if (unexpected.type() == TokenType.END_OF_FILE) {
            throw new ParseException("Unexpected end of input", unexpected);
        }
        throw new ParseException("Unexpected token '" + unexpected.text() + "'", unexpected);
    }

    private Expression call(Token callee) {
        List<Expression> arguments = new ArrayList<>();
        if (!match(TokenType.RIGHT_PAREN)) {
            do {
                arguments.add(expression());
            } while (match(TokenType.COMMA));
            consume(TokenType.RIGHT_PAREN, "Expected ')' after arguments");
        }
        return new CallExpression(callee, arguments);
    }

    // --- Token stream navigation ---

    @Override
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    @Override
    public Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    @Override
    public Token peek() {
        return tokens.get(current);
    }

    @Override
    public Token previous() {
        if (current == 0) return null;
        return tokens.get(current - 1);
    }

    @Override
    public Token consume(TokenType type, String errorMessage) {
        if (check(type)) return advance();
        throw new ParseException(errorMessage, peek());
    }

    @Override
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    @Override
    public boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }
}
