package io.github.cyfko.drllens.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link Position} and {@link Range}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("Position and Range Tests")
class RangeTest {

    // ==================== Position ====================

    @Test
    @DisplayName("Should order positions by line then character")
    void shouldOrderPositions() {
        List<Position> positions = new ArrayList<>(List.of(Position.of(2, 0), Position.of(1, 9), Position.of(1, 3)));

        Collections.sort(positions);

        assertEquals(List.of(Position.of(1, 3), Position.of(1, 9), Position.of(2, 0)), positions);
        assertTrue(Position.of(1, 9).isBefore(Position.of(2, 0)));
        assertFalse(Position.of(1, 3).isBefore(Position.of(1, 3)));
    }

    @Test
    @DisplayName("Should reject negative coordinates")
    void shouldRejectNegativeCoordinates() {
        assertThrows(IllegalArgumentException.class, () -> Position.of(-1, 0));
        assertThrows(IllegalArgumentException.class, () -> Position.of(0, -1));
    }

    // ==================== Range ====================

    @Test
    @DisplayName("Should reject an end before the start")
    void shouldRejectInvertedRange() {
        assertThrows(IllegalArgumentException.class, () -> Range.of(3, 0, 2, 5));
    }

    @Test
    @DisplayName("Should treat the end as exclusive")
    void shouldExcludeEnd() {
        Range range = Range.of(1, 4, 3, 2);

        assertTrue(range.contains(Position.of(1, 4)));
        assertTrue(range.contains(Position.of(2, 100)));
        assertFalse(range.contains(Position.of(3, 2)));
        assertFalse(range.contains(Position.of(1, 3)));
        assertTrue(range.isMultiLine());
        assertFalse(Range.singleCharacter(Position.of(0, 7)).isMultiLine());
    }

    @Test
    @DisplayName("Should shift both ends and test line overlap")
    void shouldShiftAndOverlap() {
        Range range = Range.of(4, 2, 6, 1);

        assertEquals(Range.of(7, 2, 9, 1), range.shiftLines(3));
        assertSame(range, range.shiftLines(0));
        assertTrue(range.overlapsLines(6, 10));
        assertFalse(range.overlapsLines(7, 10));
        assertFalse(range.overlapsLines(0, 3));
    }
}
