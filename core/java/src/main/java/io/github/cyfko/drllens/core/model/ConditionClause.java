package io.github.cyfko.drllens.core.model;

import java.util.List;

/**
 * The {@code when} part of a rule.
 *
 * @param conditions conditions in source order
 * @param range      from the {@code when} keyword to the end of the last condition
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ConditionClause(List<ConditionNode> conditions, Range range) {

    public ConditionClause {
        conditions = List.copyOf(conditions);
    }

    public ConditionClause shiftLines(int delta) {
        return delta == 0 ? this
                : new ConditionClause(conditions.stream().map(c -> c.shiftLines(delta)).toList(), range.shiftLines(delta));
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }
}
