package org.vira.compiler.frontend.preprocessor;

import org.vira.compiler.frontend.io.SourceLoader;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for macro expansion, include handling and the limits of the preprocessor.
 */
@Tag("unit")
class PreProcessorTest {

    @TempDir
    Path tempDir;

    private static String run(String source) {
        return new PreProcessor(PreProcessorOptions.defaults()).process(source, "main.vira");
    }

    @Test
    void definedMacroIsReplacedAndDirectiveProducesNoOutput() {
        String out = run("#define N 42\nwrite N;\n");

        assertThat(out).isEqualTo("write 42;\n");
    }

    @Test
    void expansionIsSinglePass() {
        String out = run("#define A B\n#define B C\nA;\n");

        assertThat(out).isEqualTo("B;\n");
    }

    @Test
    void onlyWholeIdentifiersAreReplaced() {
        String out = run("#define FOO 7\nFOOBAR FOO 1FOO _FOO\n");

        assertThat(out).isEqualTo("FOOBAR 7 17 _FOO\n");
    }

    @Test
    void macrosAreExpandedInsideStringLiterals() {
        String out = run("#define NAME world\nwrite \"hello NAME\";\n");

        assertThat(out).isEqualTo("write \"hello world\";\n");
    }

    @Test
    void undefRemovesDefinition() {
        String out = run("#define X 1\nX\n#undef X\nX\n");

        assertThat(out).isEqualTo("1\nX\n");
    }

    @Test
    void redefinitionOverwritesValue() {
        String out = run("#define X 1\n#define X 2\nX\n");

        assertThat(out).isEqualTo("2\n");
    }

    @Test
    void defineWithoutValueExpandsToEmptyText() {
        String out = run("#define EMPTY\n[EMPTY]\n");

        assertThat(out).isEqualTo("[]\n");
    }

    @Test
    void conditionalAndUnknownDirectivesArePassedThrough() {
        String out = run("#ifdef DEBUG\nlet x = 1;\n#endif\n  #pragma once\n");

        assertThat(out).isEqualTo("#ifdef DEBUG\nlet x = 1;\n#endif\n#pragma once\n");
    }

    @Test
    void defineWithoutNameIsMalformed() {
        assertThatThrownBy(() -> run("\n#define\n"))
                .isInstanceOfSatisfying(PreProcessorException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(PreProcessorException.Kind.MALFORMED_DIRECTIVE);
                    assertThat(e.getLine()).isEqualTo(2);
                    assertThat(e.getFileName()).isEqualTo("main.vira");
                });
    }

    @Test
    @DisplayName("Redefining an existing name at capacity is allowed, a new name is not")
    void tooManyDefines() {
        PreProcessor pp = new PreProcessor(new PreProcessorOptions(2, 16, List.of()));

        assertThat(pp.process("#define A 1\n#define B 2\n#define A 3\nA B\n", "m.vira")).isEqualTo("3 2\n");
        assertThatThrownBy(() -> pp.process("#define A 1\n#define B 2\n#define C 3\n", "m.vira"))
                .isInstanceOfSatisfying(PreProcessorException.class,
                        e -> assertThat(e.getKind()).isEqualTo(PreProcessorException.Kind.TOO_MANY_DEFINES));
    }

    @Test
    void runsDoNotShareMacros() {
        PreProcessor pp = new PreProcessor(PreProcessorOptions.defaults());

        pp.process("#define X 1\n", "a.vira");

        assertThat(pp.process("X\n", "b.vira")).isEqualTo("X\n");
    }

    @Test
    void quotedIncludeIsResolvedRelativeToIncludingFile() throws Exception {
        Path dir = Files.createDirectories(tempDir.resolve("src"));
        Files.writeString(dir.resolve("defs.vira"), "#define SIZE 8\nlet size = SIZE;\n");
        Path main = dir.resolve("main.vira");
        Files.writeString(main, "#include \"defs.vira\"\nwrite SIZE;\n");
        Path output = tempDir.resolve("out.vira");

        new PreProcessor(PreProcessorOptions.defaults()).process(main, output);

        assertThat(Files.readString(output)).isEqualTo("let size = 8;\nwrite 8;\n");
    }

    @Test
    void includingFileResumesAfterInclude() throws Exception {
        Files.writeString(tempDir.resolve("inner.vira"), "inner;\n");
        Path main = tempDir.resolve("main.vira");
        Files.writeString(main, "before;\n#include \"inner.vira\"\nafter;\n");
        Path output = tempDir.resolve("out.vira");

        new PreProcessor(PreProcessorOptions.defaults()).process(main, output);

        assertThat(Files.readString(output)).isEqualTo("before;\ninner;\nafter;\n");
    }

    @Test
    void systemIncludeUsesFirstMatchingSearchPath() throws Exception {
        Path first = Files.createDirectories(tempDir.resolve("first"));
        Path second = Files.createDirectories(tempDir.resolve("second"));
        Files.writeString(first.resolve("lib.vira"), "first;\n");
        Files.writeString(second.resolve("lib.vira"), "second;\n");
        Files.writeString(second.resolve("only.vira"), "only;\n");
        PreProcessor pp = new PreProcessor(new PreProcessorOptions(16, 16, List.of(first, second)));

        String out = pp.process("#include <lib.vira>\n#include <only.vira>\n", "main.vira");

        assertThat(out).isEqualTo("first;\nonly;\n");
    }

    @Test
    void missingIncludeFails() {
        assertThatThrownBy(() -> run("#include <does/not/exist.vira>\n"))
                .isInstanceOfSatisfying(PreProcessorException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(PreProcessorException.Kind.INCLUDE_NOT_FOUND);
                    assertThat(e.getMessage()).contains("does/not/exist.vira");
                    assertThat(e.getLine()).isEqualTo(1);
                });
    }

    @Test
    void includeWithoutClosingDelimiterIsMalformed() {
        assertThatThrownBy(() -> run("#include <lib.vira\n"))
                .isInstanceOfSatisfying(PreProcessorException.class,
                        e -> assertThat(e.getKind()).isEqualTo(PreProcessorException.Kind.MALFORMED_DIRECTIVE));
        assertThatThrownBy(() -> run("#include lib.vira\n"))
                .isInstanceOfSatisfying(PreProcessorException.class,
                        e -> assertThat(e.getKind()).isEqualTo(PreProcessorException.Kind.MALFORMED_DIRECTIVE));
    }

    @Test
    void selfIncludeStopsAtDepthLimit() throws Exception {
        Path loop = tempDir.resolve("loop.vira");
        Files.writeString(loop, "x;\n#include \"loop.vira\"\n");
        Path output = tempDir.resolve("out.vira");
        PreProcessor pp = new PreProcessor(new PreProcessorOptions(16, 3, List.of()));

        assertThatThrownBy(() -> pp.process(loop, output))
                .isInstanceOfSatisfying(PreProcessorException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(PreProcessorException.Kind.INCLUDE_DEPTH_EXCEEDED);
                    assertThat(e.getFileName()).isEqualTo(SourceLoader.logicalName(loop));
                    assertThat(e.getLine()).isEqualTo(2);
                });
    }

    @Test
    void missingInputFileIsAnIoError() {
        Path output = tempDir.resolve("out.vira");

        assertThatThrownBy(() -> new PreProcessor(PreProcessorOptions.defaults())
                .process(tempDir.resolve("absent.vira"), output))
                .isInstanceOfSatisfying(PreProcessorException.class,
                        e -> assertThat(e.getKind()).isEqualTo(PreProcessorException.Kind.IO));
    }

    @Test
    void diagnosticStringNamesFileAndLine() {
        PreProcessorException e = new PreProcessorException(
                PreProcessorException.Kind.INCLUDE_NOT_FOUND, "Cannot open include: x.vira", "main.vira", 3);

        assertThat(e.toDiagnosticString()).isEqualTo("main.vira:3: error: Cannot open include: x.vira");
    }
}
