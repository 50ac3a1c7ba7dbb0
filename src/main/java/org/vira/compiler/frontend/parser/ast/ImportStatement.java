package org.vira.compiler.frontend.parser.ast;

import org.vira.compiler.frontend.lexer.Token;

/**
 * {@code :library:;}
 *
 * @param marker The import marker token.
 */
public record ImportStatement(Token marker) implements Statement {

    /**
     * @return The name between the colons.
     */
    public String libraryName() {
        return (String) marker.value();
    }

    @Override
    public Token location() {
        return marker;
    }
}
