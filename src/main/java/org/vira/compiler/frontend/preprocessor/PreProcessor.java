package org.vira.compiler.frontend.preprocessor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vira.compiler.frontend.io.SourceLoader;
import org.vira.compiler.frontend.preprocessor.features.macro.MacroExpander;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * The text-level preprocessor. It runs before the lexer and works line by line:
 * directive lines ({@code #include}, {@code #define}, {@code #undef}, ...) are handled
 * by the registered directive handlers, every other line is written out with its
 * macros expanded.
 *
 * <p>Each call to {@code process} uses a fresh {@link PreProcessorContext}, so no macro or
 * include state leaks from one run into the next. Every failure is fatal and surfaces as a
 * {@link PreProcessorException}; output written before the failure is left as it is.</p>
 */
public class PreProcessor {

    private static final Logger log = LoggerFactory.getLogger(PreProcessor.class);

    private final PreProcessorOptions options;
    private final PreProcessorDirectiveRegistry directiveRegistry;
    private Writer output;
    private long linesWritten;

    public PreProcessor(PreProcessorOptions options) {
        this(options, PreProcessorDirectiveRegistry.initialize());
    }

    public PreProcessor(PreProcessorOptions options, PreProcessorDirectiveRegistry directiveRegistry) {
        this.options = options;
        this.directiveRegistry = directiveRegistry;
    }

    /**
     * Preprocesses a file into another file. The output file is created or truncated.
     * @param input The root source file.
     * @param outputFile The file receiving the expanded text.
     * @throws PreProcessorException If the input cannot be read or any directive fails.
     */
    public void process(Path input, Path outputFile) {
        String fileName = SourceLoader.logicalName(input);
        BufferedReader reader;
        try {
            reader = SourceLoader.openReader(input);
        } catch (IOException e) {
            throw new PreProcessorException(PreProcessorException.Kind.IO,
                    "Cannot open input: " + fileName, fileName, 0, e);
        }
        try (reader; Writer writer = Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8)) {
            run(reader, fileName, input, writer);
        } catch (IOException e) {
            throw new PreProcessorException(PreProcessorException.Kind.IO,
                    "Cannot write output: " + outputFile + " (" + e.getMessage() + ")", fileName, 0, e);
        }
    }

    /**
     * Preprocesses a stream. The root reader stays open; streams opened for includes are closed.
     * @param root The root source.
     * @param fileName The name of the root source, used in diagnostics and to resolve quoted includes.
     * @param output The destination of the expanded text.
     * @throws PreProcessorException If reading, writing or any directive fails.
     */
    public void process(Reader root, String fileName, Writer output) {
        BufferedReader reader = root instanceof BufferedReader br ? br : new BufferedReader(root);
        run(reader, fileName, Path.of(fileName), output);
    }

    /**
     * Preprocesses source text held in memory.
     * @param source The source text.
     * @param fileName The name used in diagnostics and to resolve quoted includes.
     * @return The expanded text.
     */
    public String process(String source, String fileName) {
        StringWriter out = new StringWriter();
        process(new StringReader(source), fileName, out);
        return out.toString();
    }

    private void run(BufferedReader root, String fileName, Path rootPath, Writer out) {
        this.output = out;
        this.linesWritten = 0;
        PreProcessorContext context = new PreProcessorContext(options);
        PreProcessorException failure = null;
        try {
            context.pushFrame(IncludeFrame.root(root, fileName, rootPath));
            expand(context);
            out.flush();
        } catch (PreProcessorException e) {
            failure = e;
        } catch (IOException e) {
            IncludeFrame frame = context.currentFrame();
            failure = new PreProcessorException(PreProcessorException.Kind.IO,
                    "I/O error: " + e.getMessage(),
                    frame != null ? frame.fileName() : fileName,
                    frame != null ? frame.lineNumber() : 0, e);
        } finally {
            log.info("Preprocessed {}: {} lines written, {} macros defined, include depth {}",
                    fileName, linesWritten, context.macroCount(), context.maxDepthReached());
            try {
                context.close();
            } catch (IOException e) {
                if (failure != null) {
                    failure.addSuppressed(e);
                } else {
                    failure = new PreProcessorException(PreProcessorException.Kind.IO,
                            "Failed to close include stream: " + e.getMessage(), fileName, 0, e);
                }
            }
            this.output = null;
        }
        if (failure != null) {
            throw failure;
        }
    }

    private void expand(PreProcessorContext context) throws IOException {
        MacroExpander expander = new MacroExpander(context);
        IncludeFrame frame = context.currentFrame();
        while (frame != null) {
            String line = frame.readLine();
            if (line == null) {
                if (context.depth() > 1) {
                    log.debug("End of include {}", frame.fileName());
                    frame = context.popFrame();
                    continue;
                }
                break;
            }
            String trimmed = line.stripLeading();
            if (trimmed.startsWith("#")) {
                processDirective(Directive.parse(trimmed, frame.fileName(), frame.lineNumber()), context);
                frame = context.currentFrame();
            } else {
                emit(expander.expand(line));
            }
        }
    }

    /**
     * Dispatches a directive to its handler.
     * @param directive The parsed directive line.
     * @param context The state of the current run.
     */
    public void processDirective(Directive directive, PreProcessorContext context) {
        directiveRegistry.get(directive.keyword()).process(directive, this, context);
    }

    /**
     * Writes one line of output, terminated by {@code \n}.
     * @param line The line without terminator.
     */
    public void emit(String line) {
        try {
            output.write(line);
            output.write('\n');
            linesWritten++;
        } catch (IOException e) {
            throw new PreProcessorException(PreProcessorException.Kind.IO,
                    "Cannot write output: " + e.getMessage(), null, 0, e);
        }
    }
}
