package io.github.cyfko.drllens.core.model;

import java.util.List;

/**
 * A {@code declare ... end} type declaration.
 *
 * @param name      declared type name
 * @param superType type named after {@code extends}, or {@code null}
 * @param fields    fields in declaration order
 * @param range     from {@code declare} to {@code end}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record DeclareNode(String name, String superType, List<FieldNode> fields, Range range) {

    public DeclareNode {
        fields = List.copyOf(fields);
    }

    public DeclareNode shiftLines(int delta) {
        return delta == 0 ? this : new DeclareNode(name, superType,
                fields.stream().map(f -> f.shiftLines(delta)).toList(), range.shiftLines(delta));
    }
}
