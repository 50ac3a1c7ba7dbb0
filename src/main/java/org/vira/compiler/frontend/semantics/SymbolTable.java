package org.vira.compiler.frontend.semantics;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A scoped symbol table for one check run. The outermost scope holds top-level declarations;
 * every function body gets its own scope for its parameters and locals.
 */
public class SymbolTable {

    private final Deque<Map<String, Symbol>> scopes = new ArrayDeque<>();
    private int libraryCount = 0;

    public SymbolTable() {
        scopes.push(new HashMap<>());
    }

    /**
     * Defines a symbol in the innermost scope. A later definition of the same name replaces the earlier one.
     * @param symbol The symbol to define.
     */
    public void define(Symbol symbol) {
        scopes.peek().put(symbol.name(), symbol);
        if (symbol.kind() == Symbol.Kind.LIBRARY) {
            libraryCount++;
        }
    }

    /**
     * Resolves a name, searching from the innermost scope outwards.
     * @param name The name.
     * @return The symbol, or empty if the name is not declared in any enclosing scope.
     */
    public Optional<Symbol> resolve(String name) {
        for (Map<String, Symbol> scope : scopes) {
            Symbol symbol = scope.get(name);
            if (symbol != null) {
                return Optional.of(symbol);
            }
        }
        return Optional.empty();
    }

    /**
     * Enters a new innermost scope.
     */
    public void enterScope() {
        scopes.push(new HashMap<>());
    }

    /**
     * Leaves the innermost scope. The outermost scope is never left.
     */
    public void leaveScope() {
        if (scopes.size() > 1) {
            scopes.pop();
        }
    }

    /**
     * @return true if at least one library has been imported so far.
     */
    public boolean hasImports() {
        return libraryCount > 0;
    }
}
