package org.vira.compiler.frontend.preprocessor;

/**
 * Handler interface for preprocessor directives. Handlers act on the run's context
 * (macro table, include stack) and may write lines through the preprocessor.
 */
public interface IPreProcessorDirectiveHandler {

    /**
     * Processes one directive line.
     *
     * @param directive           The parsed directive.
     * @param preProcessor        The preprocessor, for writing output lines.
     * @param preProcessorContext The state of the current run.
     * @throws PreProcessorException If the directive cannot be carried out.
     */
    void process(Directive directive, PreProcessor preProcessor, PreProcessorContext preProcessorContext);
}
