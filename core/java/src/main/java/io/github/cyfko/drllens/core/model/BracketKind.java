package io.github.cyfko.drllens.core.model;

/**
 * The three bracket families tracked independently of each other.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum BracketKind {
    PARENTHESIS('(', ')'),
    BRACE('{', '}'),
    BRACKET('[', ']');

    private final char opening;
    private final char closing;

    BracketKind(char opening, char closing) {
        this.opening = opening;
        this.closing = closing;
    }

    public char opening() {
        return opening;
    }

    public char closing() {
        return closing;
    }

    /**
     * Resolves the bracket family of {@code c}.
     *
     * @param c any character
     * @return the family, or {@code null} when {@code c} is not a bracket
     */
    public static BracketKind of(char c) {
        return switch (c) {
            case '(', ')' -> PARENTHESIS;
            case '{', '}' -> BRACE;
            case '[', ']' -> BRACKET;
            default -> null;
        };
    }

    public static boolean isOpening(char c) {
        return c == '(' || c == '{' || c == '[';
    }
}
