package org.vira.compiler.frontend.preprocessor.features.macro;

import org.vira.compiler.frontend.preprocessor.PreProcessorContext;

import java.util.Optional;

/**
 * Replaces macro names in a line of text.
 *
 * <p>The line is scanned once from left to right. Every maximal identifier run
 * ({@code [A-Za-z_][A-Za-z0-9_]*}) that names a defined macro is replaced by the macro's
 * value; the inserted value is not scanned again, so expansion is single-pass. All other
 * characters are copied unchanged. The scan does not know about string literals or comments:
 * a macro name inside {@code "..."} is expanded like any other.</p>
 */
public class MacroExpander {

    private final PreProcessorContext context;

    public MacroExpander(PreProcessorContext context) {
        this.context = context;
    }

    /**
     * @param line A line without its terminator.
     * @return The line with macro names replaced.
     */
    public String expand(String line) {
        StringBuilder out = new StringBuilder(line.length());
        int pos = 0;
        while (pos < line.length()) {
            char c = line.charAt(pos);
            if (isIdentifierStart(c)) {
                int start = pos;
                while (pos < line.length() && isIdentifierPart(line.charAt(pos))) pos++;
                String word = line.substring(start, pos);
                Optional<String> value = context.getMacro(word);
                out.append(value.orElse(word));
            } else {
                out.append(c);
                pos++;
            }
        }
        return out.toString();
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }
}
