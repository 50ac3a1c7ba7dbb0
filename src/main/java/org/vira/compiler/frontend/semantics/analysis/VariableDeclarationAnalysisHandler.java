package org.vira.compiler.frontend.semantics.analysis;

import org.vira.compiler.frontend.parser.ast.AstNode;
import org.vira.compiler.frontend.parser.ast.VariableDeclaration;
import org.vira.compiler.frontend.semantics.Symbol;
import org.vira.compiler.frontend.semantics.SymbolTable;

/**
 * Defines the variable of a {@code let} once its initializer has been checked,
 * so {@code let x = x;} refers to an outer or earlier {@code x}, never to itself.
 */
public class VariableDeclarationAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable) {
        // defined after the initializer
    }

    @Override
    public void afterChildren(AstNode node, SymbolTable symbolTable) {
        VariableDeclaration decl = (VariableDeclaration) node;
        symbolTable.define(Symbol.of(decl.name(), Symbol.Kind.VARIABLE));
    }
}
