package io.github.cyfko.drllens.core.model;

/**
 * A {@code name : Type} field of a {@code declare} block.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FieldNode(String name, String type, Range range) {

    public FieldNode shiftLines(int delta) {
        return delta == 0 ? this : new FieldNode(name, type, range.shiftLines(delta));
    }
}
