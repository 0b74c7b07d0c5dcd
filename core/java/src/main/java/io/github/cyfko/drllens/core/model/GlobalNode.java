package io.github.cyfko.drllens.core.model;

/**
 * A {@code global Type name} declaration.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record GlobalNode(String type, String name, Range range) {

    public GlobalNode shiftLines(int delta) {
        return delta == 0 ? this : new GlobalNode(type, name, range.shiftLines(delta));
    }
}
