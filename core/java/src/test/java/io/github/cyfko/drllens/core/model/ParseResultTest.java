package io.github.cyfko.drllens.core.model;

import io.github.cyfko.drllens.core.exception.DrlSyntaxException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ParseResult}, {@link ActionClause} and {@link ChangedRange}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("ParseResult Tests")
class ParseResultTest {

    @Test
    @DisplayName("Should count only errors when deciding validity")
    void shouldIgnoreWarnings() {
        ParseResult result = new ParseResult(SyntaxTree.empty(),
                List.of(ParseError.warning("Unexpected 'end' outside of a construct", Range.of(0, 0, 0, 3))));

        assertFalse(result.hasErrors());
        assertSame(result.tree(), result.requireValid());
    }

    @Test
    @DisplayName("Should throw for the first error")
    void shouldThrowForFirstError() {
        ParseError first = ParseError.error("first", Range.of(2, 0, 2, 1));
        ParseResult result = new ParseResult(SyntaxTree.empty(),
                List.of(ParseError.warning("ignored", Range.of(0, 0, 0, 1)), first,
                        ParseError.error("second", Range.of(5, 0, 5, 1))));

        DrlSyntaxException e = assertThrows(DrlSyntaxException.class, result::requireValid);

        assertSame(first, e.getError());
    }

    @Test
    @DisplayName("Should copy the error list")
    void shouldCopyErrors() {
        List<ParseError> errors = new ArrayList<>();
        ParseResult result = new ParseResult(SyntaxTree.empty(), errors);

        errors.add(ParseError.error("late", Range.of(0, 0, 0, 1)));

        assertTrue(result.errors().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> result.errors().add(errors.get(0)));
    }

    @Test
    @DisplayName("Should map action offsets back to document positions")
    void shouldMapActionOffsets() {
        ActionClause action = new ActionClause("update($a);\n    retract($b);", Position.of(7, 9), Range.of(6, 4, 8, 16));

        assertEquals(Position.of(7, 16), action.positionOf(7));
        assertEquals(Position.of(8, 12), action.positionOf(24));
        assertEquals(Position.of(7, 9), action.positionOf(0));
    }

    @Test
    @DisplayName("Should reject inverted changed ranges")
    void shouldValidateChangedRange() {
        assertThrows(IllegalArgumentException.class, () -> new ChangedRange(-1, 0));
        assertThrows(IllegalArgumentException.class, () -> new ChangedRange(5, 4));
        assertEquals(3, new ChangedRange(3, 3).startOffset());
    }
}
