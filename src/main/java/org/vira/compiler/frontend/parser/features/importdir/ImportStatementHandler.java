package org.vira.compiler.frontend.parser.features.importdir;

import org.vira.compiler.frontend.lexer.Token;
import org.vira.compiler.frontend.lexer.TokenType;
import org.vira.compiler.frontend.parser.IStatementHandler;
import org.vira.compiler.frontend.parser.ParsingContext;
import org.vira.compiler.frontend.parser.ast.ImportStatement;
import org.vira.compiler.frontend.parser.ast.Statement;

/**
 * Parses an import. The syntax is {@code :library:;}; the lexer has already folded
 * {@code :library:} into a single {@link TokenType#IMPORT} token.
 */
public class ImportStatementHandler implements IStatementHandler {

    @Override
    public Statement parse(ParsingContext context) {
        Token marker = context.advance();
        context.consume(TokenType.SEMICOLON, "Expected ';' after import");
        return new ImportStatement(marker);
    }
}
