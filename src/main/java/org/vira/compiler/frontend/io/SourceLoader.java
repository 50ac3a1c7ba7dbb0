package org.vira.compiler.frontend.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Centralizes file access for the front end: whole-file loading for the lexer stage and
 * line-oriented readers for the preprocessor's include frames.
 */
public final class SourceLoader {

    /**
     * Result of loading a source file.
     *
     * @param content     The file content (line endings normalized to {@code \n}).
     * @param logicalName The name used in diagnostics.
     */
    public record LoadResult(String content, String logicalName) {}

    private SourceLoader() {}

    /**
     * Loads content from a local filesystem path.
     *
     * @param path The path of the file.
     * @return The loaded content and the normalized path as logical name.
     * @throws IOException If the file cannot be read.
     */
    public static LoadResult loadFile(Path path) throws IOException {
        String content = Files.readString(path, StandardCharsets.UTF_8);
        return new LoadResult(normalizeLineEndings(content), logicalName(path));
    }

    /**
     * Opens a UTF-8 reader on a local file. The caller owns the returned reader.
     *
     * @param path The path of the file.
     * @return A buffered reader positioned at the start of the file.
     * @throws IOException If the file cannot be opened.
     */
    public static BufferedReader openReader(Path path) throws IOException {
        return Files.newBufferedReader(path, StandardCharsets.UTF_8);
    }

    /**
     * Checks whether a path denotes an existing, readable regular file.
     */
    public static boolean isReadableFile(Path path) {
        return Files.isRegularFile(path) && Files.isReadable(path);
    }

    /**
     * Returns the name used for a path in diagnostics, with forward slashes on every platform.
     */
    public static String logicalName(Path path) {
        return path.normalize().toString().replace('\\', '/');
    }

    private static String normalizeLineEndings(String text) {
        return text.replace("\r\n", "\n").replace("\r", "\n");
    }
}
