package org.vira.cli.commands;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.vira.cli.CommandLineInterface;
import org.vira.compiler.FrontEnd;
import org.vira.compiler.FrontEndResult;
import org.vira.compiler.frontend.io.SourceLoader;
import org.vira.compiler.frontend.parser.ast.AstPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that lexes and parses a preprocessed source file and optionally runs the
 * semantic checker.
 * <p>
 * Errors are printed to standard error as {@code file:line:column: error: message}.
 */
@Command(
    name = "check",
    mixinStandardHelpOptions = true,
    description = "Lex, parse and optionally check an expanded Vira source file"
)
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    @Parameters(index = "0", paramLabel = "INPUT", description = "Preprocessed source file")
    private Path input;

    @Option(
        names = {"--ast"},
        description = "Print the abstract syntax tree"
    )
    private boolean printAst;

    @Option(
        names = {"--check"},
        description = "Run the semantic checker"
    )
    private boolean semanticCheck;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        // Applies the configured log levels before the front end starts logging.
        parent.getConfig();

        SourceLoader.LoadResult source;
        try {
            source = SourceLoader.loadFile(input);
        } catch (IOException e) {
            err.println("Error: Could not open file: " + input + " (" + e.getMessage() + ")");
            return 1;
        }

        FrontEndResult result = new FrontEnd().run(source.content(), source.logicalName(), semanticCheck);

        if (printAst && result.program() != null) {
            out.print(AstPrinter.print(result.program()));
        }
        if (!result.isSuccess()) {
            err.print(result.diagnostics().summary());
            log.debug("{}: {} errors", source.logicalName(), result.diagnostics().errorCount());
            return 1;
        }

        out.println("Front-end check passed: " + source.logicalName());
        return 0;
    }
}
