package org.vira.cli.commands;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.vira.cli.CommandLineInterface;
import org.vira.compiler.frontend.preprocessor.PreProcessor;
import org.vira.compiler.frontend.preprocessor.PreProcessorException;
import org.vira.compiler.frontend.preprocessor.PreProcessorOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that expands {@code #include} and {@code #define} directives of a source file.
 * <p>
 * Exits with 0 on success and 1 with a diagnostic line on standard error on any failure.
 * On failure the output file may be left incomplete.
 */
@Command(
    name = "preprocess",
    mixinStandardHelpOptions = true,
    description = "Expand includes and macros of a Vira source file"
)
public class PreprocessCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PreprocessCommand.class);

    @Parameters(index = "0", paramLabel = "INPUT", description = "Root source file")
    private Path input;

    @Parameters(index = "1", paramLabel = "OUTPUT", description = "File receiving the expanded text")
    private Path output;

    @Option(
        names = {"-I", "--include-path"},
        paramLabel = "DIR",
        description = "Directory searched for #include <...> before the configured ones (repeatable)"
    )
    private List<Path> includePaths = new ArrayList<>();

    @Option(
        names = {"--max-include-depth"},
        description = "Maximum include nesting, the root file included (default: from configuration)"
    )
    private Integer maxIncludeDepth;

    @Option(
        names = {"--max-defines"},
        description = "Maximum number of macros defined at once (default: from configuration)"
    )
    private Integer maxDefines;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var err = spec.commandLine().getErr();

        PreProcessorOptions configured = PreProcessorOptions.fromConfig(parent.getConfig())
                .withLeadingIncludePaths(includePaths);
        PreProcessorOptions options;
        try {
            options = new PreProcessorOptions(
                    maxDefines != null ? maxDefines : configured.maxDefines(),
                    maxIncludeDepth != null ? maxIncludeDepth : configured.maxIncludeDepth(),
                    configured.includePaths());
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        try {
            new PreProcessor(options).process(input, output);
            log.info("Wrote {}", output);
            return 0;
        } catch (PreProcessorException e) {
            log.debug("Preprocessing failed ({})", e.getKind(), e);
            err.println("Error: " + e.toDiagnosticString());
            return 1;
        }
    }
}
