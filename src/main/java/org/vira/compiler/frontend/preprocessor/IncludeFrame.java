package org.vira.compiler.frontend.preprocessor;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;

/**
 * One entry of the include stack: an open line reader, the name of its file and the
 * number of the line last read.
 */
public final class IncludeFrame implements Closeable {

    private final BufferedReader reader;
    private final String fileName;
    private final Path path;
    private final boolean owned;
    private int lineNumber;
    private boolean closed;

    private IncludeFrame(BufferedReader reader, String fileName, Path path, boolean owned) {
        this.reader = reader;
        this.fileName = fileName;
        this.path = path;
        this.owned = owned;
    }

    /**
     * Creates the frame for the root input. The caller keeps ownership of the reader,
     * so closing this frame leaves it open.
     */
    static IncludeFrame root(BufferedReader reader, String fileName, Path path) {
        return new IncludeFrame(reader, fileName, path, false);
    }

    /**
     * Creates a frame for an included file. The frame owns the reader and closes it.
     */
    public static IncludeFrame included(BufferedReader reader, String fileName, Path path) {
        return new IncludeFrame(reader, fileName, path, true);
    }

    /**
     * Reads the next line without its terminator.
     * @return The line, or null at end of stream.
     * @throws IOException If reading fails.
     */
    String readLine() throws IOException {
        String line = reader.readLine();
        if (line != null) {
            lineNumber++;
        }
        return line;
    }

    public String fileName() {
        return fileName;
    }

    /**
     * @return The file's path, or null if the root input did not come from a file.
     */
    public Path path() {
        return path;
    }

    public int lineNumber() {
        return lineNumber;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        if (owned) {
            reader.close();
        }
    }
}
