package io.github.cyfko.drllens.core.model;

import java.util.Objects;

/**
 * A problem met while building the syntax tree.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ParseError(String message, Range range, ParseSeverity severity) {

    public ParseError {
        Objects.requireNonNull(message, "message is required");
        Objects.requireNonNull(range, "range is required");
        Objects.requireNonNull(severity, "severity is required");
    }

    public static ParseError error(String message, Range range) {
        return new ParseError(message, range, ParseSeverity.ERROR);
    }

    public static ParseError warning(String message, Range range) {
        return new ParseError(message, range, ParseSeverity.WARNING);
    }

    public ParseError shiftLines(int delta) {
        return delta == 0 ? this : new ParseError(message, range.shiftLines(delta), severity);
    }

    public boolean isError() {
        return severity == ParseSeverity.ERROR;
    }
}
