package org.vira.compiler.frontend.preprocessor.features.macro;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vira.compiler.frontend.preprocessor.Directive;
import org.vira.compiler.frontend.preprocessor.IPreProcessorDirectiveHandler;
import org.vira.compiler.frontend.preprocessor.PreProcessor;
import org.vira.compiler.frontend.preprocessor.PreProcessorContext;

/**
 * Handles <code>#undef &lt;name&gt;</code>. Undefining an unknown name is not an error.
 */
public class UndefDirectiveHandler implements IPreProcessorDirectiveHandler {

    private static final Logger log = LoggerFactory.getLogger(UndefDirectiveHandler.class);

    @Override
    public void process(Directive directive, PreProcessor preProcessor, PreProcessorContext preProcessorContext) {
        String[] words = directive.arguments().strip().split("\\s+", 2);
        String name = words[0];
        preProcessorContext.undefineMacro(name);
        log.debug("{}:{}: undef {}", directive.fileName(), directive.line(), name);
    }
}
