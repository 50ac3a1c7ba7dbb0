package org.vira.compiler.frontend.semantics.analysis;

import org.vira.compiler.frontend.parser.ast.AstNode;
import org.vira.compiler.frontend.parser.ast.IdentifierReference;
import org.vira.compiler.frontend.semantics.SemanticException;
import org.vira.compiler.frontend.semantics.SymbolTable;

/**
 * Checks that a referenced name has been declared earlier in an enclosing scope.
 */
public class IdentifierAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable) {
        IdentifierReference ref = (IdentifierReference) node;
        String name = ref.name().text();
        if (symbolTable.resolve(name).isEmpty()) {
            throw new SemanticException(SemanticException.Kind.UNDEFINED_IDENTIFIER,
                    "Undefined identifier '" + name + "'", ref.name());
        }
    }
}
