package org.vira.compiler.frontend.parser.ast;

/**
 * An expression node.
 */
public sealed interface Expression extends AstNode
        permits NumberLiteral, StringLiteral, IdentifierReference, BinaryOperation, CallExpression {
}
