package io.github.cyfko.drllens.core.model;

/**
 * Severity of a {@link Diagnostic}, from most to least important.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum DiagnosticSeverity {
    ERROR,
    WARNING,
    INFORMATION,
    HINT;

    public static DiagnosticSeverity from(ParseSeverity severity) {
        return severity == ParseSeverity.ERROR ? ERROR : WARNING;
    }
}
