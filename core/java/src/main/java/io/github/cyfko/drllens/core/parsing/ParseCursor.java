package io.github.cyfko.drllens.core.parsing;

import io.github.cyfko.drllens.core.model.Position;
import io.github.cyfko.drllens.core.model.Range;
import io.github.cyfko.drllens.core.utils.TextUtils;

/**
 * Immutable reading position of the parser: a document plus a line index.
 * <p>
 * Sub-parsers receive a cursor and hand back the cursor where the caller should resume,
 * so no parsing state lives in fields shared between calls.
 * </p>
 *
 * @param source the document
 * @param line   current line, {@code source.size()} once exhausted
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ParseCursor(SourceLines source, int line) {

    public static ParseCursor start(SourceLines source) {
        return new ParseCursor(source, 0);
    }

    public boolean atEnd() {
        return line >= source.size();
    }

    public String text() {
        return source.line(line);
    }

    public String trimmed() {
        return text().trim();
    }

    public int indent() {
        return TextUtils.indentOf(text());
    }

    public ParseCursor next() {
        return new ParseCursor(source, line + 1);
    }

    public ParseCursor at(int targetLine) {
        return new ParseCursor(source, targetLine);
    }

    /**
     * Position of the first non-blank character of the current line.
     */
    public Position position() {
        return new Position(line, indent());
    }

    /**
     * Range of the non-blank part of the current line.
     */
    public Range contentRange() {
        String text = text();
        int start = TextUtils.indentOf(text);
        int end = Math.max(start, text.stripTrailing().length());
        return Range.of(line, start, line, end);
    }

    /**
     * Moves past blank lines and {@code //} comment lines. Block comments are expected to be
     * blanked out already (see {@link SourceLines#withoutBlockComments()}), so a line that only
     * held comment text reads as blank while code after a closing {@code *}{@code /} stays put.
     */
    public ParseCursor skipTrivia() {
        int current = line;
        while (current < source.size()) {
            String trimmed = source.line(current).trim();
            if (!trimmed.isEmpty() && !trimmed.startsWith("//")) {
                break;
            }
            current++;
        }
        return current == line ? this : new ParseCursor(source, current);
    }
}
