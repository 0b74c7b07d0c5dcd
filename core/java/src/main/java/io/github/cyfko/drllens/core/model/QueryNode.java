package io.github.cyfko.drllens.core.model;

import java.util.List;

/**
 * A {@code query ... end} block.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record QueryNode(String name, List<ParameterNode> parameters, List<ConditionNode> conditions, Range range) {

    public QueryNode {
        parameters = List.copyOf(parameters);
        conditions = List.copyOf(conditions);
    }

    public QueryNode shiftLines(int delta) {
        return delta == 0 ? this : new QueryNode(name,
                parameters.stream().map(p -> p.shiftLines(delta)).toList(),
                conditions.stream().map(c -> c.shiftLines(delta)).toList(),
                range.shiftLines(delta));
    }
}
