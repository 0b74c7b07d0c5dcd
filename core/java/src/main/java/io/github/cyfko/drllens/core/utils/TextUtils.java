package io.github.cyfko.drllens.core.utils;

/**
 * String helpers shared by the parser and the diagnostic passes.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TextUtils {

    private static final int ABBREVIATION_LIMIT = 40;

    private TextUtils() {
    }

    /**
     * Finds the parenthesis closing the one at {@code openIndex}, skipping string and
     * character literals.
     *
     * @param text      text to search
     * @param openIndex index of a {@code '('} in {@code text}
     * @return index of the matching {@code ')'}, or {@code -1} when unbalanced
     */
    public static int findClosingParenthesis(String text, int openIndex) {
        int depth = 0;
        char quote = 0;
        boolean escaped = false;
        for (int i = openIndex; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            switch (c) {
                case '"', '\'' -> quote = c;
                case '(' -> depth++;
                case ')' -> {
                    depth--;
                    if (depth == 0) {
                        return i;
                    }
                }
                default -> { }
            }
        }
        return -1;
    }

    /**
     * Text between the parentheses that follow {@code keyword} at the start of {@code content}.
     * Without such parentheses, or when they are unbalanced, the trimmed text after the keyword
     * is returned; when {@code content} does not start with {@code keyword} it is returned as is.
     */
    public static String constructBody(String keyword, String content) {
        if (keyword == null || !content.startsWith(keyword)) {
            return content;
        }
        String rest = content.substring(keyword.length());
        int open = rest.indexOf('(');
        if (open < 0 || !rest.substring(0, open).isBlank()) {
            return rest.trim();
        }
        int close = findClosingParenthesis(rest, open);
        return close < 0 ? rest.substring(open + 1).trim() : rest.substring(open + 1, close).trim();
    }

    /**
     * Index of the first non-whitespace character of {@code text}, or its length when blank.
     */
    public static int indentOf(String text) {
        int i = 0;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    /**
     * Shortens {@code text} for use inside a message.
     */
    public static String abbreviate(String text) {
        String trimmed = text.strip();
        return trimmed.length() <= ABBREVIATION_LIMIT ? trimmed : trimmed.substring(0, ABBREVIATION_LIMIT - 3) + "...";
    }

    /**
     * Tells whether {@code word} occurs in {@code text} delimited by non-identifier characters.
     */
    public static boolean containsWord(String text, String word) {
        int from = 0;
        while (true) {
            int index = text.indexOf(word, from);
            if (index < 0) {
                return false;
            }
            int after = index + word.length();
            boolean startOk = index == 0 || !Character.isJavaIdentifierPart(text.charAt(index - 1));
            boolean endOk = after == text.length() || !Character.isJavaIdentifierPart(text.charAt(after));
            if (startOk && endOk) {
                return true;
            }
            from = index + 1;
        }
    }
}
