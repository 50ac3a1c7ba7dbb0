package org.vira.compiler.frontend.preprocessor.features.include;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vira.compiler.frontend.io.SourceLoader;
import org.vira.compiler.frontend.preprocessor.Directive;
import org.vira.compiler.frontend.preprocessor.IPreProcessorDirectiveHandler;
import org.vira.compiler.frontend.preprocessor.IncludeFrame;
import org.vira.compiler.frontend.preprocessor.PreProcessor;
import org.vira.compiler.frontend.preprocessor.PreProcessorContext;
import org.vira.compiler.frontend.preprocessor.PreProcessorException;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Handles {@code #include <path>} and {@code #include "path"}.
 * The included file is opened and pushed onto the include stack; the preprocessor then
 * reads from it until its end, after which the including file continues.
 */
public class IncludeDirectiveHandler implements IPreProcessorDirectiveHandler {

    private static final Logger log = LoggerFactory.getLogger(IncludeDirectiveHandler.class);

    @Override
    public void process(Directive directive, PreProcessor preProcessor, PreProcessorContext preProcessorContext) {
        String args = directive.arguments().strip();
        if (args.isEmpty() || (args.charAt(0) != '<' && args.charAt(0) != '"')) {
            throw malformed(directive, "Invalid include: expected <path> or \"path\"");
        }
        boolean system = args.charAt(0) == '<';
        char closing = system ? '>' : '"';
        int end = args.indexOf(closing, 1);
        if (end < 0) {
            throw malformed(directive, "Invalid include: missing closing " + closing);
        }
        String name = args.substring(1, end);
        if (name.isBlank()) {
            throw malformed(directive, "Invalid include: empty path");
        }

        Optional<Path> resolved;
        try {
            IncludeResolver resolver = new IncludeResolver(preProcessorContext.getOptions().includePaths());
            resolved = system
                    ? resolver.resolveSystem(name)
                    : resolver.resolveQuoted(name, preProcessorContext.currentFrame().path());
        } catch (InvalidPathException e) {
            throw malformed(directive, "Invalid include path: " + name);
        }
        if (resolved.isEmpty()) {
            throw new PreProcessorException(PreProcessorException.Kind.INCLUDE_NOT_FOUND,
                    "Cannot open include: " + name, directive.fileName(), directive.line());
        }
        if (!preProcessorContext.canPush()) {
            throw new PreProcessorException(PreProcessorException.Kind.INCLUDE_DEPTH_EXCEEDED,
                    "Include depth exceeded (limit " + preProcessorContext.getOptions().maxIncludeDepth() + ")",
                    directive.fileName(), directive.line());
        }

        Path path = resolved.get();
        BufferedReader reader;
        try {
            reader = SourceLoader.openReader(path);
        } catch (IOException e) {
            throw new PreProcessorException(PreProcessorException.Kind.IO,
                    "Cannot open include: " + name + " (" + e.getMessage() + ")",
                    directive.fileName(), directive.line(), e);
        }
        preProcessorContext.pushFrame(IncludeFrame.included(reader, SourceLoader.logicalName(path), path));
        log.debug("{}:{}: include {} (depth {})", directive.fileName(), directive.line(), path,
                preProcessorContext.depth());
    }

    private static PreProcessorException malformed(Directive directive, String message) {
        return new PreProcessorException(PreProcessorException.Kind.MALFORMED_DIRECTIVE,
                message, directive.fileName(), directive.line());
    }
}
