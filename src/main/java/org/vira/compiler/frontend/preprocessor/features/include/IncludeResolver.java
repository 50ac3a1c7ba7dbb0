package org.vira.compiler.frontend.preprocessor.features.include;

import org.vira.compiler.frontend.io.SourceLoader;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Locates the file named by an {@code #include} directive.
 *
 * <ul>
 *   <li>{@code <name>}: each search directory is tried in order; the first readable file wins.</li>
 *   <li>{@code "name"}: resolved against the directory of the including file, then as a
 *       literal path relative to the working directory.</li>
 * </ul>
 */
public class IncludeResolver {

    private final List<Path> searchPaths;

    public IncludeResolver(List<Path> searchPaths) {
        this.searchPaths = List.copyOf(searchPaths);
    }

    /**
     * @param name The path between {@code <} and {@code >}.
     * @return The first matching file in the search path, or empty.
     */
    public Optional<Path> resolveSystem(String name) {
        for (Path dir : searchPaths) {
            Path candidate = dir.resolve(name).normalize();
            if (SourceLoader.isReadableFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * @param name The path between the quotes.
     * @param includingFile The file containing the directive, or null if unknown.
     * @return The resolved file, or empty.
     */
    public Optional<Path> resolveQuoted(String name, Path includingFile) {
        Path literal = Path.of(name);
        if (!literal.isAbsolute()) {
            Path parent = includingFile != null ? includingFile.getParent() : null;
            if (parent != null) {
                Path candidate = parent.resolve(name).normalize();
                if (SourceLoader.isReadableFile(candidate)) {
                    return Optional.of(candidate);
                }
            }
        }
        return SourceLoader.isReadableFile(literal) ? Optional.of(literal.normalize()) : Optional.empty();
    }
}
