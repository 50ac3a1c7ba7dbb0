package org.vira.compiler.frontend.preprocessor.features.macro;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vira.compiler.frontend.preprocessor.Directive;
import org.vira.compiler.frontend.preprocessor.IPreProcessorDirectiveHandler;
import org.vira.compiler.frontend.preprocessor.PreProcessor;
import org.vira.compiler.frontend.preprocessor.PreProcessorContext;
import org.vira.compiler.frontend.preprocessor.PreProcessorException;

/**
 * Handles <code>#define &lt;name&gt; &lt;value&gt;</code>.
 * The name is the first whitespace-delimited word; the value is the rest of the line with
 * surrounding whitespace removed and may be empty. An existing definition is overwritten.
 */
public class DefineDirectiveHandler implements IPreProcessorDirectiveHandler {

    private static final Logger log = LoggerFactory.getLogger(DefineDirectiveHandler.class);

    @Override
    public void process(Directive directive, PreProcessor preProcessor, PreProcessorContext preProcessorContext) {
        String args = directive.arguments().strip();
        int end = 0;
        while (end < args.length() && !Character.isWhitespace(args.charAt(end))) end++;
        String name = args.substring(0, end);
        if (name.isEmpty()) {
            throw new PreProcessorException(PreProcessorException.Kind.MALFORMED_DIRECTIVE,
                    "Missing macro name in #define", directive.fileName(), directive.line());
        }
        String value = args.substring(end).strip();

        preProcessorContext.defineMacro(name, value);
        log.debug("{}:{}: define {} = '{}'", directive.fileName(), directive.line(), name, value);
    }
}
