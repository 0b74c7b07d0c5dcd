package io.github.cyfko.drllens.core.outline;

import java.util.Objects;

/**
 * A foldable line span. Both lines are zero-based and inclusive.
 *
 * @param startLine     first line, kept visible when folded
 * @param endLine       last line, strictly after {@code startLine}
 * @param kind          what is folded
 * @param collapsedText text shown in place of the folded lines
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FoldingRange(int startLine, int endLine, FoldingRangeKind kind, String collapsedText) {

    public FoldingRange {
        Objects.requireNonNull(kind, "kind is required");
        if (startLine < 0 || endLine <= startLine) {
            throw new IllegalArgumentException("Invalid folding span: " + startLine + ".." + endLine);
        }
    }
}
