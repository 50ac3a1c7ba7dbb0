package org.vira.compiler.frontend.preprocessor;

/**
 * A directive line split into its keyword and argument text.
 *
 * @param keyword   The identifier following {@code #}, e.g. {@code include}. Empty for a bare {@code #}.
 * @param arguments Everything after the keyword, untrimmed.
 * @param text      The directive line with leading whitespace removed.
 * @param fileName  The file the line was read from.
 * @param line      The 1-based line number within that file.
 */
public record Directive(String keyword, String arguments, String text, String fileName, int line) {

    /**
     * Splits a line whose first non-whitespace character is {@code #}.
     * @param text The directive line with leading whitespace removed.
     * @param fileName The file the line was read from.
     * @param line The 1-based line number.
     * @return The parsed directive.
     */
    public static Directive parse(String text, String fileName, int line) {
        int pos = 1;
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) pos++;
        int start = pos;
        while (pos < text.length() && isKeywordChar(text.charAt(pos))) pos++;
        return new Directive(text.substring(start, pos), text.substring(pos), text, fileName, line);
    }

    private static boolean isKeywordChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
    }
}
