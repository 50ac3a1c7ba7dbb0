package org.vira.compiler.frontend.parser.ast;

import org.vira.compiler.frontend.lexer.Token;

import java.util.List;
import java.util.Objects;

/**
 * An arithmetic operation with exactly two operands. Unary minus is represented as
 * {@code 0 - operand}.
 *
 * @param operator      The operator.
 * @param left          The left operand.
 * @param right         The right operand.
 * @param operatorToken The operator's token.
 */
public record BinaryOperation(BinaryOperator operator, Expression left, Expression right, Token operatorToken)
        implements Expression {

    public BinaryOperation {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left operand");
        Objects.requireNonNull(right, "right operand");
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }

    @Override
    public Token location() {
        return operatorToken;
    }
}
