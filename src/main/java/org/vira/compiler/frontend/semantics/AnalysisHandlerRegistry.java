package org.vira.compiler.frontend.semantics;

import org.vira.compiler.frontend.parser.ast.AstNode;
import org.vira.compiler.frontend.parser.ast.BinaryOperation;
import org.vira.compiler.frontend.parser.ast.CallExpression;
import org.vira.compiler.frontend.parser.ast.ExpressionStatement;
import org.vira.compiler.frontend.parser.ast.FunctionDefinition;
import org.vira.compiler.frontend.parser.ast.IdentifierReference;
import org.vira.compiler.frontend.parser.ast.ImportStatement;
import org.vira.compiler.frontend.parser.ast.NumberLiteral;
import org.vira.compiler.frontend.parser.ast.ReturnStatement;
import org.vira.compiler.frontend.parser.ast.StringLiteral;
import org.vira.compiler.frontend.parser.ast.VariableDeclaration;
import org.vira.compiler.frontend.parser.ast.WriteStatement;
import org.vira.compiler.frontend.semantics.analysis.BinaryOperationAnalysisHandler;
import org.vira.compiler.frontend.semantics.analysis.CallAnalysisHandler;
import org.vira.compiler.frontend.semantics.analysis.FunctionDefinitionAnalysisHandler;
import org.vira.compiler.frontend.semantics.analysis.IAnalysisHandler;
import org.vira.compiler.frontend.semantics.analysis.IdentifierAnalysisHandler;
import org.vira.compiler.frontend.semantics.analysis.ImportAnalysisHandler;
import org.vira.compiler.frontend.semantics.analysis.NoOpAnalysisHandler;
import org.vira.compiler.frontend.semantics.analysis.SingleExpressionAnalysisHandler;
import org.vira.compiler.frontend.semantics.analysis.VariableDeclarationAnalysisHandler;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping AST node classes to analysis handlers. A node class without a handler
 * is an unsupported construct.
 */
public final class AnalysisHandlerRegistry {

    private final Map<Class<? extends AstNode>, IAnalysisHandler> handlers = new HashMap<>();

    /**
     * Registers an analysis handler for the given AST node class.
     *
     * @param nodeType The concrete AST node class.
     * @param handler  The handler instance.
     * @param <T>      Concrete AST type parameter.
     */
    public <T extends AstNode> void register(Class<T> nodeType, IAnalysisHandler handler) {
        handlers.put(nodeType, handler);
    }

    /**
     * Resolves the handler for the given node class.
     *
     * @param nodeType The AST node class to look up.
     * @return Optional handler if registered.
     */
    public Optional<IAnalysisHandler> resolveHandler(Class<? extends AstNode> nodeType) {
        return Optional.ofNullable(handlers.get(nodeType));
    }

    /**
     * Creates a registry pre-populated with a handler for every statement and expression kind.
     *
     * @return A fully initialized registry.
     */
    public static AnalysisHandlerRegistry initializeWithDefaults() {
        AnalysisHandlerRegistry registry = new AnalysisHandlerRegistry();
        NoOpAnalysisHandler noOp = new NoOpAnalysisHandler();

        registry.register(VariableDeclaration.class, new VariableDeclarationAnalysisHandler());
        registry.register(FunctionDefinition.class, new FunctionDefinitionAnalysisHandler());
        registry.register(ImportStatement.class, new ImportAnalysisHandler());
        registry.register(WriteStatement.class, new SingleExpressionAnalysisHandler("write"));
        registry.register(ReturnStatement.class, new SingleExpressionAnalysisHandler("return"));
        registry.register(ExpressionStatement.class, noOp);

        registry.register(NumberLiteral.class, noOp);
        registry.register(StringLiteral.class, noOp);
        registry.register(IdentifierReference.class, new IdentifierAnalysisHandler());
        registry.register(BinaryOperation.class, new BinaryOperationAnalysisHandler());
        registry.register(CallExpression.class, new CallAnalysisHandler());

        return registry;
    }
}
