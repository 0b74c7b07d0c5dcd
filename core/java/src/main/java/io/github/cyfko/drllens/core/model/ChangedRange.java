package io.github.cyfko.drllens.core.model;

/**
 * A region of the new document text touched by an edit, as character offsets
 * ({@code [startOffset, endOffset)}, UTF-16 code units).
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ChangedRange(int startOffset, int endOffset) {

    public ChangedRange {
        if (startOffset < 0) {
            throw new IllegalArgumentException("startOffset must not be negative, got: " + startOffset);
        }
        if (endOffset < startOffset) {
            throw new IllegalArgumentException("endOffset " + endOffset + " is before startOffset " + startOffset);
        }
    }
}
