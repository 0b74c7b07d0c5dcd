package io.github.cyfko.drllens.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Shape of a single condition line of a {@code when} clause or a query body.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ConditionKind {
    PATTERN,
    EXISTS,
    NOT,
    EVAL,
    FORALL,
    COLLECT,
    ACCUMULATE,
    AND,
    OR;

    /**
     * Keyword introducing this kind of condition, or {@code null} for
     * {@link #PATTERN}, {@link #AND} and {@link #OR}.
     */
    public String keyword() {
        return switch (this) {
            case PATTERN, AND, OR -> null;
            default -> name().toLowerCase(Locale.ROOT);
        };
    }

    /**
     * Resolves the construct keyword ({@code exists}, {@code not}, {@code eval},
     * {@code forall}, {@code collect}, {@code accumulate}).
     */
    public static Optional<ConditionKind> fromKeyword(String word) {
        if (word == null) {
            return Optional.empty();
        }
        for (ConditionKind kind : values()) {
            if (word.equals(kind.keyword())) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
