package io.github.cyfko.drllens.core.exception;

import io.github.cyfko.drllens.core.model.ParseError;
import io.github.cyfko.drllens.core.model.Position;
import io.github.cyfko.drllens.core.model.Range;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DrlSyntaxException Tests")
class DrlSyntaxExceptionTest {

    @Test
    @DisplayName("Should carry the parse error and a one-based line in its message")
    void shouldCarryParseError() {
        ParseError error = ParseError.error("Expected 'end' to close rule \"R\"", Range.of(4, 6, 4, 6));

        DrlSyntaxException e = new DrlSyntaxException(error);

        assertEquals("Expected 'end' to close rule \"R\" (line 5)", e.getMessage());
        assertSame(error, e.getError());
        assertEquals(Position.of(4, 6), e.getPosition());
    }

    @Test
    @DisplayName("Should have no position when built from a message")
    void shouldHaveNoPositionWithoutError() {
        IllegalStateException cause = new IllegalStateException("io");

        DrlSyntaxException e = new DrlSyntaxException("broken", cause);

        assertNull(e.getError());
        assertNull(e.getPosition());
        assertSame(cause, e.getCause());
    }
}
