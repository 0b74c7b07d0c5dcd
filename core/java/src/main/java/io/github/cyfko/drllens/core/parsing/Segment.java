package io.github.cyfko.drllens.core.parsing;

import io.github.cyfko.drllens.core.model.Position;
import io.github.cyfko.drllens.core.model.Range;

/**
 * A trimmed, comment-free piece of one line inside a rule or query.
 *
 * @param line   line index
 * @param column column of the first character of {@code text}
 * @param text   trimmed text, never blank
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Segment(int line, int column, String text) {

    public Position start() {
        return new Position(line, column);
    }

    public Position end() {
        return new Position(line, column + text.length());
    }

    public Range range() {
        return new Range(start(), end());
    }

    public boolean isKeyword(String keyword) {
        return text.equals(keyword);
    }

    /**
     * {@code when}, {@code then} or {@code end}.
     */
    public boolean isClauseKeyword() {
        return isKeyword("when") || isKeyword("then") || isKeyword("end");
    }
}
