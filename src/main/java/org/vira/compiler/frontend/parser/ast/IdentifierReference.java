package org.vira.compiler.frontend.parser.ast;

import org.vira.compiler.frontend.lexer.Token;

/**
 * A use of a variable, parameter or library name.
 *
 * @param name The identifier token.
 */
public record IdentifierReference(Token name) implements Expression {

    @Override
    public Token location() {
        return name;
    }
}
