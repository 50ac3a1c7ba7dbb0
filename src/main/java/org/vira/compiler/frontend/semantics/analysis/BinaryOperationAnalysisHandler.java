package org.vira.compiler.frontend.semantics.analysis;

import org.vira.compiler.frontend.parser.ast.AstNode;
import org.vira.compiler.frontend.parser.ast.BinaryOperation;
import org.vira.compiler.frontend.semantics.SemanticException;
import org.vira.compiler.frontend.semantics.SymbolTable;

/**
 * Checks that a binary operation has exactly two operands.
 */
public class BinaryOperationAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable) {
        BinaryOperation binary = (BinaryOperation) node;
        int operands = binary.getChildren().size();
        if (operands != 2) {
            throw new SemanticException(SemanticException.Kind.ARITY,
                    "Binary '" + binary.operator().symbol() + "' must have 2 operands, found " + operands,
                    binary.location());
        }
    }
}
