package io.github.cyfko.drllens.core.model;

import io.github.cyfko.drllens.core.utils.TextUtils;

import java.util.List;

/**
 * One condition of a {@code when} clause or query body.
 * <p>
 * {@code content} is the raw text of the condition, lines joined with {@code '\n'} when the
 * condition spans several lines. Multi-line conditions also carry their matched parenthesis
 * pairs, the construct regions found inside them and the deepest region nesting.
 * </p>
 * <p>
 * The {@code field operator value} constraints of the condition's fact pattern are listed in
 * {@code constraints}. Constructs and connectives ({@code exists( A() and B() )},
 * {@code A() or B()}) list their operands in {@code innerConditions}, each parsed the same way.
 * </p>
 *
 * @param kind         condition shape
 * @param variable     bound variable ({@code $p} in {@code $p : Person()}), or {@code null}
 * @param factType     pattern fact type, or {@code null}
 * @param content      raw condition text
 * @param range        full span of the condition
 * @param brackets     matched parenthesis pairs, sorted by opening position
 * @param regions      flat construct region list, parents before children
 * @param nestingDepth number of nested construct levels, {@code 0} for a plain pattern
 * @param constraints  constraints of the fact pattern, in source order
 * @param innerConditions operands of a construct or connective, in source order
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ConditionNode(
        ConditionKind kind,
        String variable,
        String factType,
        String content,
        Range range,
        List<BracketPair> brackets,
        List<PatternRegion> regions,
        int nestingDepth,
        List<ConstraintNode> constraints,
        List<ConditionNode> innerConditions
) {

    public ConditionNode {
        brackets = List.copyOf(brackets);
        regions = List.copyOf(regions);
        constraints = List.copyOf(constraints);
        innerConditions = List.copyOf(innerConditions);
    }

    public ConditionNode shiftLines(int delta) {
        if (delta == 0) {
            return this;
        }
        return new ConditionNode(kind, variable, factType, content, range.shiftLines(delta),
                brackets.stream().map(b -> b.shiftLines(delta)).toList(),
                regions.stream().map(r -> r.shiftLines(delta)).toList(),
                nestingDepth,
                constraints.stream().map(c -> c.shiftLines(delta)).toList(),
                innerConditions.stream().map(c -> c.shiftLines(delta)).toList());
    }

    public boolean isMultiLine() {
        return range.isMultiLine();
    }

    /**
     * Text between the parentheses that follow the construct keyword, e.g. {@code Person()} for
     * {@code exists( Person() )}. For other kinds, or when the parentheses are missing or
     * unbalanced, the trimmed content after the keyword is returned.
     */
    public String body() {
        return TextUtils.constructBody(kind.keyword(), content);
    }
}
