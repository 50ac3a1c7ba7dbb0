package org.vira.compiler.frontend.semantics.analysis;

import org.vira.compiler.frontend.lexer.Token;
import org.vira.compiler.frontend.parser.ast.AstNode;
import org.vira.compiler.frontend.parser.ast.FunctionDefinition;
import org.vira.compiler.frontend.semantics.Symbol;
import org.vira.compiler.frontend.semantics.SymbolTable;

/**
 * Defines the function's name in the enclosing scope before its body is checked, so the
 * body may call the function recursively, then opens a scope holding the parameters.
 * The scope is closed after the body.
 */
public class FunctionDefinitionAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable) {
        FunctionDefinition func = (FunctionDefinition) node;
        symbolTable.define(Symbol.of(func.name(), Symbol.Kind.FUNCTION));
        symbolTable.enterScope();
        for (Token param : func.parameters()) {
            symbolTable.define(Symbol.of(param, Symbol.Kind.PARAMETER));
        }
    }

    @Override
    public void afterChildren(AstNode node, SymbolTable symbolTable) {
        symbolTable.leaveScope();
    }
}
