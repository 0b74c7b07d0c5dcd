package io.github.cyfko.drllens.core.model;

/**
 * A parenthesised construct region ({@code exists(...)}, {@code not(...)}, ...) inside a condition.
 * <p>
 * Regions of one condition live in a flat list; {@code parentIndex} points at the enclosing
 * region in that list, or is {@code -1} for an outermost region.
 * </p>
 *
 * @param keyword     construct keyword that opened the region
 * @param parentIndex index of the enclosing region, {@code -1} when none
 * @param depth       zero-based nesting depth
 * @param range       from the keyword to just after the closing parenthesis
 * @param complete    {@code false} when no closing parenthesis was found
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record PatternRegion(String keyword, int parentIndex, int depth, Range range, boolean complete) {

    public PatternRegion shiftLines(int delta) {
        return delta == 0 ? this : new PatternRegion(keyword, parentIndex, depth, range.shiftLines(delta), complete);
    }

    public boolean isRoot() {
        return parentIndex < 0;
    }
}
