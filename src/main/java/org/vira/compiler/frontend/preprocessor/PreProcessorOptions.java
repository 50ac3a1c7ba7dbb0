package org.vira.compiler.frontend.preprocessor;

import com.typesafe.config.Config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Limits and search paths for a preprocessing run.
 *
 * @param maxDefines      Maximum number of distinct macro names defined at the same time.
 * @param maxIncludeDepth Maximum number of open include frames, the root file included.
 * @param includePaths    Directories searched, in order, for {@code #include <...>}.
 */
public record PreProcessorOptions(int maxDefines, int maxIncludeDepth, List<Path> includePaths) {

    public static final int DEFAULT_MAX_DEFINES = 1024;
    public static final int DEFAULT_MAX_INCLUDE_DEPTH = 16;

    public PreProcessorOptions {
        if (maxDefines < 1) {
            throw new IllegalArgumentException("maxDefines must be positive, was " + maxDefines);
        }
        if (maxIncludeDepth < 1) {
            throw new IllegalArgumentException("maxIncludeDepth must be positive, was " + maxIncludeDepth);
        }
        includePaths = List.copyOf(includePaths);
    }

    /**
     * @return The built-in limits with {@code /usr/include} and the working directory as search path.
     */
    public static PreProcessorOptions defaults() {
        return new PreProcessorOptions(DEFAULT_MAX_DEFINES, DEFAULT_MAX_INCLUDE_DEPTH,
                List.of(Path.of("/usr/include"), Path.of(".")));
    }

    /**
     * Reads the options from the {@code vira.preprocessor} section of the application config.
     * @param config The resolved application config.
     * @return The options.
     */
    public static PreProcessorOptions fromConfig(Config config) {
        Config pp = config.getConfig("vira.preprocessor");
        List<Path> paths = new ArrayList<>();
        for (String p : pp.getStringList("include-paths")) {
            paths.add(Path.of(p));
        }
        return new PreProcessorOptions(pp.getInt("max-defines"), pp.getInt("max-include-depth"), paths);
    }

    /**
     * Returns a copy whose search path starts with the given directories, in the given order.
     * @param firstPaths Directories searched before the configured ones.
     * @return The extended options.
     */
    public PreProcessorOptions withLeadingIncludePaths(List<Path> firstPaths) {
        List<Path> paths = new ArrayList<>(firstPaths);
        paths.addAll(includePaths);
        return new PreProcessorOptions(maxDefines, maxIncludeDepth, paths);
    }
}
