package io.github.cyfko.drllens.core.model;

import java.util.List;

/**
 * Parse result plus the diagnostics computed from it.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record AnalysisResult(ParseResult parseResult, List<Diagnostic> diagnostics) {

    public AnalysisResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public SyntaxTree tree() {
        return parseResult.tree();
    }

    public long count(DiagnosticSeverity severity) {
        return diagnostics.stream().filter(d -> d.severity() == severity).count();
    }
}
