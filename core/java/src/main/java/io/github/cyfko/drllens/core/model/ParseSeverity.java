package io.github.cyfko.drllens.core.model;

/**
 * Severity of a {@link ParseError}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ParseSeverity {
    ERROR,
    WARNING
}
