package org.vira.compiler.frontend.semantics.analysis;

import org.vira.compiler.frontend.parser.ast.AstNode;
import org.vira.compiler.frontend.semantics.SymbolTable;

/**
 * Accepts a node without checks; its children are still visited.
 * Registered for literals and expression statements.
 */
public class NoOpAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable) {
        // nothing to check
    }
}
