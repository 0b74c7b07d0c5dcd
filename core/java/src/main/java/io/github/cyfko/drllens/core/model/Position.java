package io.github.cyfko.drllens.core.model;

/**
 * Zero-based location inside a document.
 * <p>
 * {@code line} counts lines separated by {@code '\n'}; {@code character} counts UTF-16
 * code units inside that line, matching {@link String#charAt(int)} indexing.
 * </p>
 *
 * @param line      zero-based line index
 * @param character zero-based column index
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Position(int line, int character) implements Comparable<Position> {

    public Position {
        if (line < 0) {
            throw new IllegalArgumentException("line must not be negative, got: " + line);
        }
        if (character < 0) {
            throw new IllegalArgumentException("character must not be negative, got: " + character);
        }
    }

    public static Position of(int line, int character) {
        return new Position(line, character);
    }

    /**
     * Returns the same column moved by {@code delta} lines.
     *
     * @param delta number of lines to move, may be negative
     * @return the moved position
     */
    public Position shiftLines(int delta) {
        return delta == 0 ? this : new Position(line + delta, character);
    }

    public boolean isBefore(Position other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(Position other) {
        int byLine = Integer.compare(line, other.line);
        return byLine != 0 ? byLine : Integer.compare(character, other.character);
    }
}
