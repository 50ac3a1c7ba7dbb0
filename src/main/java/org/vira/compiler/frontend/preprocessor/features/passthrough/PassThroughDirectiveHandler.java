package org.vira.compiler.frontend.preprocessor.features.passthrough;

import org.vira.compiler.frontend.preprocessor.Directive;
import org.vira.compiler.frontend.preprocessor.IPreProcessorDirectiveHandler;
import org.vira.compiler.frontend.preprocessor.PreProcessor;
import org.vira.compiler.frontend.preprocessor.PreProcessorContext;

/**
 * Copies a directive line to the output unchanged, without macro expansion.
 * Used for {@code #ifdef}, {@code #ifndef} and every directive that has no handler of its own.
 */
public class PassThroughDirectiveHandler implements IPreProcessorDirectiveHandler {

    @Override
    public void process(Directive directive, PreProcessor preProcessor, PreProcessorContext preProcessorContext) {
        preProcessor.emit(directive.text());
    }
}
