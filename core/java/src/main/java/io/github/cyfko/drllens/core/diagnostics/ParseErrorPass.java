package io.github.cyfko.drllens.core.diagnostics;

import io.github.cyfko.drllens.core.model.Diagnostic;
import io.github.cyfko.drllens.core.model.DiagnosticSeverity;
import io.github.cyfko.drllens.core.spi.DiagnosticContext;
import io.github.cyfko.drllens.core.spi.DiagnosticPass;
import io.github.cyfko.drllens.core.spi.PassCategory;

import java.util.List;

/**
 * Reports every parse error as a diagnostic with the same range and message.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ParseErrorPass implements DiagnosticPass {

    @Override
    public String name() {
        return "parse-errors";
    }

    @Override
    public PassCategory category() {
        return PassCategory.PARSE;
    }

    @Override
    public List<Diagnostic> run(DiagnosticContext context) {
        return context.parseErrors().stream()
                .map(error -> new Diagnostic(DiagnosticSeverity.from(error.severity()), error.range(),
                        error.message(), DiagnosticSources.PARSER))
                .toList();
    }
}
