package org.vira.compiler.frontend.parser.ast;

import org.vira.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * The root of the AST: the top-level statements of a source file, in order.
 *
 * @param statements The statements.
 * @param fileName   The source file.
 */
public record Program(List<Statement> statements, String fileName) implements AstNode {

    public Program {
        statements = List.copyOf(statements);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(statements);
    }

    @Override
    public Token location() {
        return statements.isEmpty() ? null : statements.get(0).location();
    }
}
