package io.github.cyfko.drllens.core.model;

import java.util.List;
import java.util.Optional;

/**
 * A {@code rule ... end} block.
 *
 * @param name       rule name, empty when the header could not be read
 * @param attributes attributes in source order
 * @param when       the condition clause, or {@code null} when absent
 * @param then       the action clause, or {@code null} when absent
 * @param range      from the {@code rule} keyword to the end of {@code end} (or the last consumed line)
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record RuleNode(String name, List<RuleAttribute> attributes, ConditionClause when, ActionClause then, Range range) {

    public RuleNode {
        attributes = List.copyOf(attributes);
    }

    public RuleNode shiftLines(int delta) {
        if (delta == 0) {
            return this;
        }
        return new RuleNode(name,
                attributes.stream().map(a -> a.shiftLines(delta)).toList(),
                when == null ? null : when.shiftLines(delta),
                then == null ? null : then.shiftLines(delta),
                range.shiftLines(delta));
    }

    public Optional<RuleAttribute> attribute(String attributeName) {
        return attributes.stream().filter(a -> a.name().equals(attributeName)).findFirst();
    }

    public boolean hasAttribute(String attributeName) {
        return attribute(attributeName).isPresent();
    }

    public List<ConditionNode> conditions() {
        return when == null ? List.of() : when.conditions();
    }
}
