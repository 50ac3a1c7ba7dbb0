package org.vira.compiler.frontend.semantics.analysis;

import org.vira.compiler.frontend.parser.ast.AstNode;
import org.vira.compiler.frontend.semantics.SymbolTable;

/**
 * Interface for specialized handlers in semantic analysis.
 * Each handler is responsible for checking a specific type of AST node.
 */
public interface IAnalysisHandler {
    /**
     * Checks a single AST node before its children are traversed.
     * @param node The node to check.
     * @param symbolTable The symbol table of the current run.
     * @throws org.vira.compiler.frontend.semantics.SemanticException If the node violates a rule.
     */
    void analyze(AstNode node, SymbolTable symbolTable);

    /**
     * Called after all children of the node have been checked.
     * Override to perform post-traversal actions such as leaving a scope.
     * @param node The node whose children have been checked.
     * @param symbolTable The symbol table of the current run.
     */
    default void afterChildren(AstNode node, SymbolTable symbolTable) {}
}
