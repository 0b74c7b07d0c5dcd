package io.github.cyfko.drllens.core.model;

/**
 * A rule attribute such as {@code salience 10} or {@code no-loop}.
 *
 * @param name  attribute name as written
 * @param value raw value text without trailing semicolon, or {@code null} when absent
 * @param range span of the attribute line
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record RuleAttribute(String name, String value, Range range) {

    public RuleAttribute shiftLines(int delta) {
        return delta == 0 ? this : new RuleAttribute(name, value, range.shiftLines(delta));
    }

    /**
     * Value with one pair of surrounding double or single quotes removed.
     */
    public String unquotedValue() {
        if (value == null || value.length() < 2) {
            return value;
        }
        char first = value.charAt(0);
        char last = value.charAt(value.length() - 1);
        if ((first == '"' || first == '\'') && first == last) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
