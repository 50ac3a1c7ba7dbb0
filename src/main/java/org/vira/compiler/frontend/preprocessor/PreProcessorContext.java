package org.vira.compiler.frontend.preprocessor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The state of one preprocessing run: the macro table and the include stack.
 * A context is created for every run and closed when the run ends, whether it
 * succeeded or not. Closing releases all macros and closes every include stream
 * that is still open.
 */
public class PreProcessorContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PreProcessorContext.class);

    private final PreProcessorOptions options;
    private final Map<String, String> macros = new HashMap<>();
    private final Deque<IncludeFrame> frames = new ArrayDeque<>();
    private int maxDepthReached = 0;

    public PreProcessorContext(PreProcessorOptions options) {
        this.options = options;
    }

    public PreProcessorOptions getOptions() {
        return options;
    }

    // --- Macro table ---

    /**
     * Defines or redefines a macro. Redefining an existing name always succeeds; a new
     * name is rejected once the table holds {@link PreProcessorOptions#maxDefines()} entries.
     * @param name The macro name.
     * @param value The replacement text, possibly empty.
     * @throws PreProcessorException of kind {@code TOO_MANY_DEFINES} if the table is full.
     */
    public void defineMacro(String name, String value) {
        if (!macros.containsKey(name) && macros.size() >= options.maxDefines()) {
            IncludeFrame frame = frames.peek();
            throw new PreProcessorException(PreProcessorException.Kind.TOO_MANY_DEFINES,
                    "Too many defines (limit " + options.maxDefines() + ")",
                    frame != null ? frame.fileName() : null,
                    frame != null ? frame.lineNumber() : 0);
        }
        macros.put(name, value);
    }

    /**
     * Removes a macro. Removing a name that is not defined does nothing.
     * @param name The macro name.
     */
    public void undefineMacro(String name) {
        macros.remove(name);
    }

    /**
     * @param name The macro name.
     * @return The replacement text, or empty if the name is not defined.
     */
    public Optional<String> getMacro(String name) {
        return Optional.ofNullable(macros.get(name));
    }

    public int macroCount() {
        return macros.size();
    }

    // --- Include stack ---

    /**
     * Pushes a frame. The caller must have checked {@link #canPush()} before opening the frame's stream.
     * @param frame The frame to make current.
     */
    public void pushFrame(IncludeFrame frame) {
        if (!canPush()) {
            throw new IllegalStateException("Include stack is full");
        }
        frames.push(frame);
        maxDepthReached = Math.max(maxDepthReached, frames.size());
    }

    /**
     * @return true if another frame fits within the include depth bound.
     */
    public boolean canPush() {
        return frames.size() < options.maxIncludeDepth();
    }

    /**
     * Pops the current frame and closes its stream.
     * @return The frame that is current after the pop, or null if the stack is empty.
     * @throws IOException If closing the stream fails.
     */
    IncludeFrame popFrame() throws IOException {
        IncludeFrame frame = frames.pop();
        frame.close();
        return frames.peek();
    }

    /**
     * @return The frame lines are currently read from, or null if none is open.
     */
    public IncludeFrame currentFrame() {
        return frames.peek();
    }

    public int depth() {
        return frames.size();
    }

    public int maxDepthReached() {
        return maxDepthReached;
    }

    /**
     * Closes all remaining frames, innermost first, and clears the macro table.
     * @throws IOException If closing a stream fails; further failures are added as suppressed.
     */
    @Override
    public void close() throws IOException {
        IOException failure = null;
        while (!frames.isEmpty()) {
            IncludeFrame frame = frames.pop();
            try {
                frame.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        log.debug("Releasing {} macro definitions", macros.size());
        macros.clear();
        if (failure != null) {
            throw failure;
        }
    }
}
