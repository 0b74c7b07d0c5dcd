package io.github.cyfko.drllens.core.config;

/**
 * Switches and limits of the diagnostic engine.
 * <p>
 * Each flag enables one category of passes. Parse errors are always reported; the
 * {@code maxProblems} cap keeps the diagnostics that come first in pass order.
 * </p>
 *
 * @param maxProblems          maximum number of diagnostics returned
 * @param enableSyntaxChecks   bracket balance and multi-line pattern checks
 * @param enableSemanticChecks duplicates, structure, attributes and variable references
 * @param enableStyleWarnings  best-practice and performance suggestions
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record DiagnosticSettings(
        int maxProblems,
        boolean enableSyntaxChecks,
        boolean enableSemanticChecks,
        boolean enableStyleWarnings
) {

    public static final int DEFAULT_MAX_PROBLEMS = 100;

    public DiagnosticSettings {
        if (maxProblems < 0) {
            throw new IllegalArgumentException("maxProblems must not be negative, got: " + maxProblems);
        }
    }

    /**
     * Every category enabled, at most {@value #DEFAULT_MAX_PROBLEMS} problems.
     */
    public static DiagnosticSettings defaults() {
        return new DiagnosticSettings(DEFAULT_MAX_PROBLEMS, true, true, true);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int _maxProblems = DEFAULT_MAX_PROBLEMS;
        private boolean _enableSyntaxChecks = true;
        private boolean _enableSemanticChecks = true;
        private boolean _enableStyleWarnings = true;

        private Builder() {
        }

        public DiagnosticSettings build() {
            return new DiagnosticSettings(_maxProblems, _enableSyntaxChecks, _enableSemanticChecks, _enableStyleWarnings);
        }

        public Builder maxProblems(int maxProblems) { this._maxProblems = maxProblems; return this; }
        public Builder enableSyntaxChecks(boolean enabled) { this._enableSyntaxChecks = enabled; return this; }
        public Builder enableSemanticChecks(boolean enabled) { this._enableSemanticChecks = enabled; return this; }
        public Builder enableStyleWarnings(boolean enabled) { this._enableStyleWarnings = enabled; return this; }
    }
}
