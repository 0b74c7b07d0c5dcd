package io.github.cyfko.drllens.core.model;

import java.util.Objects;

/**
 * A problem reported to the user by the diagnostic engine.
 *
 * @param severity how serious the problem is
 * @param range    where it is
 * @param message  human readable description
 * @param source   tag of the pass that produced it, e.g. {@code drools-semantic}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Diagnostic(DiagnosticSeverity severity, Range range, String message, String source) {

    public Diagnostic {
        Objects.requireNonNull(severity, "severity is required");
        Objects.requireNonNull(range, "range is required");
        Objects.requireNonNull(message, "message is required");
        Objects.requireNonNull(source, "source is required");
    }

    public static Diagnostic error(Range range, String message, String source) {
        return new Diagnostic(DiagnosticSeverity.ERROR, range, message, source);
    }

    public static Diagnostic warning(Range range, String message, String source) {
        return new Diagnostic(DiagnosticSeverity.WARNING, range, message, source);
    }

    public static Diagnostic information(Range range, String message, String source) {
        return new Diagnostic(DiagnosticSeverity.INFORMATION, range, message, source);
    }
}
