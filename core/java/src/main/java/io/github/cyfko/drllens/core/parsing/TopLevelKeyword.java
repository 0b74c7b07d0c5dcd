package io.github.cyfko.drllens.core.parsing;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Keywords that start a construct at global scope.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum TopLevelKeyword {
    PACKAGE("package"),
    IMPORT("import"),
    GLOBAL("global"),
    FUNCTION("function"),
    RULE("rule"),
    QUERY("query"),
    DECLARE("declare");

    /**
     * Full header shapes, used to decide that a line inside a construct actually starts the
     * next construct (the current one is missing its {@code end}). Stricter than
     * {@link #match(String)} so that host-language lines such as {@code rule = next;} are not
     * mistaken for headers.
     */
    private static final Pattern HEADER_LINE = Pattern.compile(
            "^(?:(?:rule|query)\\s+(?:\"|[A-Za-z_]\\w*\\s*(?:\\(.*)?$)"
                    + "|function\\s+[A-Za-z_][\\w.<>,\\[\\] ]*\\s+[A-Za-z_]\\w*\\s*\\("
                    + "|declare\\s+(?:(?:trait|enum)\\s+)?[A-Za-z_][\\w.]*(?:\\s+extends\\s+[\\w.]+)?\\s*$"
                    + "|(?:package|import|global)\\s+[A-Za-z_][\\w.]*)");

    private final String keyword;

    TopLevelKeyword(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * Matches the first word of a trimmed line against the keywords. The keyword must be
     * followed by whitespace, a double quote ({@code rule"x"}), or nothing.
     *
     * @param trimmed a trimmed line
     * @return the keyword starting the line, if any
     */
    public static Optional<TopLevelKeyword> match(String trimmed) {
        for (TopLevelKeyword candidate : values()) {
            String word = candidate.keyword;
            if (trimmed.startsWith(word)) {
                if (trimmed.length() == word.length()) {
                    return Optional.of(candidate);
                }
                char next = trimmed.charAt(word.length());
                if (Character.isWhitespace(next) || next == '"') {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Tells whether a trimmed line has the full shape of a construct header.
     */
    public static boolean looksLikeHeader(String trimmed) {
        return HEADER_LINE.matcher(trimmed).find();
    }
}
