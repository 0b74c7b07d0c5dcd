package io.github.cyfko.drllens.core.model;

/**
 * A typed parameter of a function or query.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ParameterNode(String type, String name, Range range) {

    public ParameterNode shiftLines(int delta) {
        return delta == 0 ? this : new ParameterNode(type, name, range.shiftLines(delta));
    }
}
