package org.vira.compiler.frontend.semantics.analysis;

import org.vira.compiler.frontend.parser.ast.AstNode;
import org.vira.compiler.frontend.semantics.SemanticException;
import org.vira.compiler.frontend.semantics.SymbolTable;

/**
 * Checks that a {@code write} or {@code return} statement carries exactly one expression.
 */
public class SingleExpressionAnalysisHandler implements IAnalysisHandler {

    private final String statementName;

    /**
     * @param statementName The keyword used in error messages, e.g. "write".
     */
    public SingleExpressionAnalysisHandler(String statementName) {
        this.statementName = statementName;
    }

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable) {
        int expressions = node.getChildren().size();
        if (expressions != 1) {
            throw new SemanticException(SemanticException.Kind.ARITY,
                    "'" + statementName + "' must have exactly one expression, found " + expressions,
                    node.location());
        }
    }
}
