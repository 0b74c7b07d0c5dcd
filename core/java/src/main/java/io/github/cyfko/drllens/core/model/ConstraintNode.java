package io.github.cyfko.drllens.core.model;

/**
 * A {@code field operator value} constraint inside a fact pattern, e.g. {@code age > 18} in
 * {@code Person( age > 18 )}.
 *
 * @param field    constrained field, binding prefix removed ({@code age} for {@code $a : age > 18})
 * @param operator comparison operator as written ({@code ==}, {@code matches}, {@code not memberOf}, ...)
 * @param value    right-hand side, trimmed
 * @param range    span of the whole constraint
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ConstraintNode(String field, String operator, String value, Range range) {

    public ConstraintNode shiftLines(int delta) {
        return delta == 0 ? this : new ConstraintNode(field, operator, value, range.shiftLines(delta));
    }
}
