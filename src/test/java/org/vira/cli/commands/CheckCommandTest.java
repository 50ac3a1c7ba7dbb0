package org.vira.cli.commands;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.vira.cli.CommandLineInterface;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class CheckCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(String... args) {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        return cmdLine.execute(args);
    }

    private Path source(String text) throws Exception {
        Path file = tempDir.resolve("prog.vira");
        Files.writeString(file, text);
        return file;
    }

    @Test
    void testValidProgramPasses() throws Exception {
        Path file = source("let x = 1;\nwrite x;\n");

        int exitCode = execute("check", file.toString(), "--check");

        assertThat(exitCode)
            .describedAs("stderr: %s", err.toString())
            .isEqualTo(0);
        assertThat(out.toString()).contains("Front-end check passed: ").contains("prog.vira");
    }

    @Test
    void testAstOption() throws Exception {
        Path file = source("let x = 5 + 3 * 2;\n");

        int exitCode = execute("check", file.toString(), "--ast");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains("Program:\n  VarDecl: x\n    Binary: +\n");
    }

    @Test
    void testSyntaxErrorsAreReported() throws Exception {
        Path file = source("let = 1;\nlet y = ;\nlet z = 2;\n");

        int exitCode = execute("check", file.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString())
                .contains("prog.vira:1:5: error: Expected variable name")
                .contains("prog.vira:2:9: error: Unexpected token ';'");
        assertThat(out.toString()).doesNotContain("passed");
    }

    @Test
    void testSemanticErrorOnlyWithCheckOption() throws Exception {
        Path file = source("return undeclared_name;\n");

        assertThat(execute("check", file.toString())).isEqualTo(0);

        int exitCode = execute("check", file.toString(), "--check");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("prog.vira:1:8: error: Undefined identifier 'undeclared_name'");
    }

    @Test
    void testLexicalErrorIsReported() throws Exception {
        Path file = source("write \"unterminated;\n");

        int exitCode = execute("check", file.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("prog.vira:1:7: error: Unterminated string");
    }

    @Test
    void testNonexistentFileReturnsError() {
        int exitCode = execute("check", "/nonexistent/prog.vira");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Could not open file");
    }

    @Test
    void testUndecodableFileReportsCause() throws Exception {
        Path file = tempDir.resolve("latin1.vira");
        Files.write(file, new byte[] {'w', 'r', 'i', 't', 'e', ' ', (byte) 0xE9, ';', '\n'});

        int exitCode = execute("check", file.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Could not open file").contains("Input length");
    }
}
