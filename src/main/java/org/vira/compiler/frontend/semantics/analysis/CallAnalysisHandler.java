package org.vira.compiler.frontend.semantics.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vira.compiler.frontend.parser.ast.AstNode;
import org.vira.compiler.frontend.parser.ast.CallExpression;
import org.vira.compiler.frontend.semantics.SemanticException;
import org.vira.compiler.frontend.semantics.SymbolTable;

/**
 * Checks the target of a call. A callee must be declared, unless a library has been imported:
 * library contents are resolved by later stages, so an unknown callee is then assumed to
 * belong to an imported library.
 */
public class CallAnalysisHandler implements IAnalysisHandler {

    private static final Logger log = LoggerFactory.getLogger(CallAnalysisHandler.class);

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable) {
        CallExpression call = (CallExpression) node;
        String callee = call.callee().text();
        if (symbolTable.resolve(callee).isPresent()) {
            return;
        }
        if (symbolTable.hasImports()) {
            log.debug("{}:{}: '{}' assumed to come from an imported library",
                    call.callee().fileName(), call.callee().line(), callee);
            return;
        }
        throw new SemanticException(SemanticException.Kind.UNDEFINED_IDENTIFIER,
                "Undefined function '" + callee + "'", call.callee());
    }
}
