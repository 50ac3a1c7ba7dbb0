package org.vira.compiler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vira.compiler.diagnostics.DiagnosticsEngine;
import org.vira.compiler.frontend.lexer.Lexer;
import org.vira.compiler.frontend.lexer.LexerException;
import org.vira.compiler.frontend.lexer.Token;
import org.vira.compiler.frontend.parser.Parser;
import org.vira.compiler.frontend.parser.ast.Program;
import org.vira.compiler.frontend.semantics.SemanticAnalyzer;
import org.vira.compiler.frontend.semantics.SemanticException;

import java.util.List;

/**
 * Runs the lexer, the parser and optionally the semantic checker over already
 * preprocessed source text.
 *
 * <ul>
 *   <li>A lexical error stops the run before parsing; it is the only diagnostic.</li>
 *   <li>Syntax errors are collected, one per failed declaration.</li>
 *   <li>The semantic check runs only on a program without syntax errors and reports at most one error.</li>
 * </ul>
 */
public class FrontEnd {

    private static final Logger log = LoggerFactory.getLogger(FrontEnd.class);

    /**
     * @param source The preprocessed source text.
     * @param fileName The name used in diagnostics.
     * @param semanticCheck Whether to run the semantic checker after parsing.
     * @return The program and the diagnostics of the run.
     */
    public FrontEndResult run(String source, String fileName, boolean semanticCheck) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        List<Token> tokens;
        try {
            tokens = new Lexer(source, fileName).scanTokens();
        } catch (LexerException e) {
            diagnostics.report(e);
            return new FrontEndResult(null, diagnostics);
        }
        log.debug("{}: {} tokens", fileName, tokens.size());

        Program program = new Parser(tokens, diagnostics).parse();
        if (diagnostics.hasErrors()) {
            log.debug("{}: {} syntax errors", fileName, diagnostics.errorCount());
            return new FrontEndResult(program, diagnostics);
        }

        if (semanticCheck) {
            try {
                new SemanticAnalyzer().analyze(program);
            } catch (SemanticException e) {
                diagnostics.report(e);
            }
        }
        return new FrontEndResult(program, diagnostics);
    }
}
