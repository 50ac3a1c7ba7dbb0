package org.vira.compiler;

import org.vira.compiler.diagnostics.DiagnosticsEngine;
import org.vira.compiler.frontend.parser.ast.Program;

/**
 * The outcome of a front-end run.
 *
 * @param program     The parsed program, possibly missing statements with syntax errors;
 *                    null if lexing failed.
 * @param diagnostics Everything reported during the run.
 */
public record FrontEndResult(Program program, DiagnosticsEngine diagnostics) {

    /**
     * @return true if no phase reported an error.
     */
    public boolean isSuccess() {
        return program != null && !diagnostics.hasErrors();
    }
}
