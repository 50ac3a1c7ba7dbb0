package org.vira.compiler.frontend.semantics.analysis;

import org.vira.compiler.frontend.parser.ast.AstNode;
import org.vira.compiler.frontend.parser.ast.ImportStatement;
import org.vira.compiler.frontend.semantics.Symbol;
import org.vira.compiler.frontend.semantics.SymbolTable;

/**
 * Defines an imported library's name. The library's own contents are not known to the
 * front end; see {@link CallAnalysisHandler} for how calls into it are treated.
 */
public class ImportAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable) {
        ImportStatement imp = (ImportStatement) node;
        symbolTable.define(new Symbol(imp.libraryName(), Symbol.Kind.LIBRARY, imp.marker()));
    }
}
