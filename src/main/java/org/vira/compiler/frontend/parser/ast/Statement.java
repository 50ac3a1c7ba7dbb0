package org.vira.compiler.frontend.parser.ast;

/**
 * A statement node. A {@link Program} is an ordered list of statements.
 */
public sealed interface Statement extends AstNode
        permits VariableDeclaration, FunctionDefinition, ImportStatement, WriteStatement,
                ReturnStatement, ExpressionStatement {
}
