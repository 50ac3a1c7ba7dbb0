package org.vira.compiler.frontend.semantics;

import org.vira.compiler.frontend.lexer.Token;

/**
 * A declared name.
 *
 * @param name        The declared name.
 * @param kind        What the name denotes.
 * @param declaration The token where the name was declared.
 */
public record Symbol(String name, Kind kind, Token declaration) {

    /**
     * What a symbol denotes.
     */
    public enum Kind {
        VARIABLE,
        FUNCTION,
        PARAMETER,
        LIBRARY
    }

    /**
     * Creates a symbol named after its declaring identifier token.
     */
    public static Symbol of(Token identifier, Kind kind) {
        return new Symbol(identifier.text(), kind, identifier);
    }
}
