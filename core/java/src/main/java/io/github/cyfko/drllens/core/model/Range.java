package io.github.cyfko.drllens.core.model;

import java.util.Objects;

/**
 * Half-open span {@code [start, end)} between two {@link Position}s.
 *
 * @param start inclusive start
 * @param end   exclusive end, never before {@code start}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Range(Position start, Position end) {

    public Range {
        Objects.requireNonNull(start, "start is required");
        Objects.requireNonNull(end, "end is required");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Range end " + end + " is before start " + start);
        }
    }

    public static Range of(int startLine, int startCharacter, int endLine, int endCharacter) {
        return new Range(new Position(startLine, startCharacter), new Position(endLine, endCharacter));
    }

    /**
     * Empty range located at {@code position}.
     */
    public static Range point(Position position) {
        return new Range(position, position);
    }

    /**
     * Range covering the single character at {@code position}.
     */
    public static Range singleCharacter(Position position) {
        return new Range(position, new Position(position.line(), position.character() + 1));
    }

    public Range shiftLines(int delta) {
        return delta == 0 ? this : new Range(start.shiftLines(delta), end.shiftLines(delta));
    }

    public boolean contains(Position position) {
        return !position.isBefore(start) && position.isBefore(end);
    }

    /**
     * Tells whether any line of this range lies within {@code [firstLine, lastLine]}.
     */
    public boolean overlapsLines(int firstLine, int lastLine) {
        return start.line() <= lastLine && end.line() >= firstLine;
    }

    public boolean isMultiLine() {
        return end.line() > start.line();
    }
}
