package org.vira.compiler.frontend.semantics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vira.compiler.frontend.parser.ast.AstNode;
import org.vira.compiler.frontend.parser.ast.Program;
import org.vira.compiler.frontend.semantics.analysis.IAnalysisHandler;

/**
 * Checks a parsed program. It walks the statements in source order, dispatching every node to
 * the handler registered for its class, before and after the node's children.
 *
 * <p>Unlike the parser, the checker does not recover: the first violation ends the check with a
 * {@link SemanticException}, and nothing after it is examined. Names must be declared before
 * they are used.</p>
 */
public class SemanticAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(SemanticAnalyzer.class);

    private final AnalysisHandlerRegistry registry;

    public SemanticAnalyzer() {
        this(AnalysisHandlerRegistry.initializeWithDefaults());
    }

    public SemanticAnalyzer(AnalysisHandlerRegistry registry) {
        this.registry = registry;
    }

    /**
     * Checks the program with a fresh symbol table.
     *
     * @param program The program to check.
     * @throws SemanticException At the first violation.
     */
    public void analyze(Program program) {
        SymbolTable symbolTable = new SymbolTable();
        for (AstNode statement : program.getChildren()) {
            traverse(statement, symbolTable);
        }
        log.debug("Semantic check of {} passed ({} statements)", program.fileName(), program.statements().size());
    }

    private void traverse(AstNode node, SymbolTable symbolTable) {
        IAnalysisHandler handler = registry.resolveHandler(node.getClass())
                .orElseThrow(() -> new SemanticException(SemanticException.Kind.UNSUPPORTED_CONSTRUCT,
                        "Unsupported construct: " + node.getClass().getSimpleName(), node.location()));
        handler.analyze(node, symbolTable);
        for (AstNode child : node.getChildren()) {
            traverse(child, symbolTable);
        }
        handler.afterChildren(node, symbolTable);
    }
}
