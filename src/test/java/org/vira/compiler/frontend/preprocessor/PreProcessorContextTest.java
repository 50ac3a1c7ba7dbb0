package org.vira.compiler.frontend.preprocessor;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.vira.compiler.frontend.preprocessor.features.passthrough.PassThroughDirectiveHandler;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests that include streams are closed exactly once, on a clean end of stream as well as
 * when a run fails, and that the caller's root reader is never closed.
 */
@Tag("unit")
class PreProcessorContextTest {

    private static final class CountingReader extends BufferedReader {
        private int closeCount;

        CountingReader(String text) {
            super(new StringReader(text));
        }

        @Override
        public void close() throws IOException {
            closeCount++;
            super.close();
        }
    }

    private final List<CountingReader> opened = new ArrayList<>();

    /**
     * A registry whose include handler serves in-memory files through counting readers.
     */
    private PreProcessorDirectiveRegistry registryServing(Map<String, String> files) {
        PreProcessorDirectiveRegistry registry = new PreProcessorDirectiveRegistry(new PassThroughDirectiveHandler());
        registry.register("include", (directive, preProcessor, context) -> {
            String name = directive.arguments().strip();
            String text = files.get(name);
            if (text == null) {
                throw new PreProcessorException(PreProcessorException.Kind.INCLUDE_NOT_FOUND,
                        "Cannot open include: " + name, directive.fileName(), directive.line());
            }
            if (!context.canPush()) {
                throw new PreProcessorException(PreProcessorException.Kind.INCLUDE_DEPTH_EXCEEDED,
                        "Include depth exceeded", directive.fileName(), directive.line());
            }
            CountingReader reader = new CountingReader(text);
            opened.add(reader);
            context.pushFrame(IncludeFrame.included(reader, name, null));
        });
        return registry;
    }

    @Test
    void closeReleasesRemainingFramesOnceAndLeavesRootOpen() throws Exception {
        CountingReader root = new CountingReader("");
        CountingReader outer = new CountingReader("");
        CountingReader inner = new CountingReader("");
        PreProcessorContext context = new PreProcessorContext(PreProcessorOptions.defaults());
        context.pushFrame(IncludeFrame.root(root, "main.vira", null));
        context.pushFrame(IncludeFrame.included(outer, "outer.vira", null));
        IncludeFrame innerFrame = IncludeFrame.included(inner, "inner.vira", null);
        context.pushFrame(innerFrame);
        context.defineMacro("X", "1");

        assertThat(context.popFrame().fileName()).isEqualTo("outer.vira");
        context.close();
        context.close();
        innerFrame.close();

        assertThat(inner.closeCount).isEqualTo(1);
        assertThat(outer.closeCount).isEqualTo(1);
        assertThat(root.closeCount).isZero();
        assertThat(context.depth()).isZero();
        assertThat(context.macroCount()).isZero();
    }

    @Test
    void cleanRunClosesEveryIncludeOnce() {
        CountingReader root = new CountingReader("#include a\nmain;\n");
        PreProcessor pp = new PreProcessor(PreProcessorOptions.defaults(), registryServing(Map.of(
                "a", "#include b\na;\n",
                "b", "b;\n")));
        StringWriter out = new StringWriter();

        pp.process(root, "main.vira", out);

        assertThat(out.toString()).isEqualTo("b;\na;\nmain;\n");
        assertThat(opened).hasSize(2).allSatisfy(r -> assertThat(r.closeCount).isEqualTo(1));
        assertThat(root.closeCount).isZero();
    }

    @Test
    void failedRunClosesEveryOpenIncludeOnce() {
        CountingReader root = new CountingReader("#include a\nmain;\n");
        PreProcessor pp = new PreProcessor(PreProcessorOptions.defaults(), registryServing(Map.of(
                "a", "#include b\n",
                "b", "#include c\n",
                "c", "#include missing\n")));

        assertThatThrownBy(() -> pp.process(root, "main.vira", new StringWriter()))
                .isInstanceOfSatisfying(PreProcessorException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(PreProcessorException.Kind.INCLUDE_NOT_FOUND);
                    assertThat(e.getFileName()).isEqualTo("c");
                });
        assertThat(opened).hasSize(3).allSatisfy(r -> assertThat(r.closeCount).isEqualTo(1));
        assertThat(root.closeCount).isZero();
    }

    @Test
    void depthOverflowClosesEveryOpenIncludeOnce() {
        CountingReader root = new CountingReader("#include loop\n");
        PreProcessor pp = new PreProcessor(new PreProcessorOptions(16, 4, List.of()),
                registryServing(Map.of("loop", "#include loop\n")));

        assertThatThrownBy(() -> pp.process(root, "main.vira", new StringWriter()))
                .isInstanceOfSatisfying(PreProcessorException.class,
                        e -> assertThat(e.getKind()).isEqualTo(PreProcessorException.Kind.INCLUDE_DEPTH_EXCEEDED));
        assertThat(opened).hasSize(3).allSatisfy(r -> assertThat(r.closeCount).isEqualTo(1));
        assertThat(root.closeCount).isZero();
    }
}
