package org.vira.compiler.frontend.parser;

import org.vira.compiler.frontend.lexer.Token;
import org.vira.compiler.frontend.lexer.TokenType;
import org.vira.compiler.frontend.parser.features.def.FunctionDefinitionHandler;
import org.vira.compiler.frontend.parser.features.importdir.ImportStatementHandler;
import org.vira.compiler.frontend.parser.features.let.VariableDeclarationHandler;
import org.vira.compiler.frontend.parser.features.ret.ReturnStatementHandler;
import org.vira.compiler.frontend.parser.features.write.WriteStatementHandler;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry for statement handlers.
 * Maps keywords (e.g., "let", "def") and marker token types (e.g., {@link TokenType#IMPORT})
 * to the handler that parses the statement they introduce.
 */
public class StatementHandlerRegistry {

    private final Map<String, IStatementHandler> keywordHandlers = new HashMap<>();
    private final Map<TokenType, IStatementHandler> markerHandlers = new EnumMap<>(TokenType.class);

    /**
     * Registers a handler for a keyword.
     * @param keyword The keyword text.
     * @param handler The handler for statements starting with this keyword.
     */
    public void register(String keyword, IStatementHandler handler) {
        keywordHandlers.put(keyword, handler);
    }

    /**
     * Registers a handler for a marker token type.
     * @param type The token type.
     * @param handler The handler for statements starting with a token of this type.
     */
    public void register(TokenType type, IStatementHandler handler) {
        markerHandlers.put(type, handler);
    }

    /**
     * Looks up the handler for the token that starts a statement.
     * @param token The first token of the statement.
     * @return The handler, or empty if the token does not introduce a registered statement.
     */
    public Optional<IStatementHandler> get(Token token) {
        if (token.type() == TokenType.KEYWORD) {
            return Optional.ofNullable(keywordHandlers.get(token.text()));
        }
        return Optional.ofNullable(markerHandlers.get(token.type()));
    }

    /**
     * Creates a registry with all built-in statement handlers.
     * @return A new registry instance.
     */
    public static StatementHandlerRegistry initialize() {
        StatementHandlerRegistry registry = new StatementHandlerRegistry();
        registry.register("let", new VariableDeclarationHandler());
        registry.register("def", new FunctionDefinitionHandler());
        registry.register("write", new WriteStatementHandler());
        registry.register("return", new ReturnStatementHandler());
        registry.register(TokenType.IMPORT, new ImportStatementHandler());
        return registry;
    }
}
