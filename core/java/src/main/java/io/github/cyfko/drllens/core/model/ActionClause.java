package io.github.cyfko.drllens.core.model;

/**
 * The {@code then} part of a rule, kept as opaque host-language text.
 * <p>
 * Line {@code i} of {@link #text()} sits on document line {@code contentStart.line() + i};
 * the first line starts at column {@code contentStart.character()}, the others at column 0.
 * </p>
 *
 * @param text         verbatim action text, leading and trailing blank lines removed
 * @param contentStart position of the first action character, or the end of the {@code then}
 *                     keyword when the clause is empty
 * @param range        from the {@code then} keyword to the end of the last action line
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ActionClause(String text, Position contentStart, Range range) {

    public ActionClause shiftLines(int delta) {
        return delta == 0 ? this : new ActionClause(text, contentStart.shiftLines(delta), range.shiftLines(delta));
    }

    public boolean isEmpty() {
        return text.isBlank();
    }

    /**
     * Maps an index inside {@link #text()} back to a document position.
     *
     * @param offset index into {@code text}
     * @return the document position of that character
     */
    public Position positionOf(int offset) {
        int line = 0;
        int lineStart = 0;
        for (int i = 0; i < offset && i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        int column = offset - lineStart + (line == 0 ? contentStart.character() : 0);
        return new Position(contentStart.line() + line, column);
    }
}
