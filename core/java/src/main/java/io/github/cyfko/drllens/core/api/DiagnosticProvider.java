package io.github.cyfko.drllens.core.api;

import io.github.cyfko.drllens.core.model.Diagnostic;
import io.github.cyfko.drllens.core.model.ParseError;
import io.github.cyfko.drllens.core.model.ParseResult;
import io.github.cyfko.drllens.core.model.SyntaxTree;

import java.util.List;

/**
 * Computes user-facing diagnostics from a document and its syntax tree.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface DiagnosticProvider {

    /**
     * @param text        raw document text
     * @param tree        syntax tree of {@code text}
     * @param parseErrors errors recorded while parsing {@code text}
     * @return diagnostics in pass order, capped by the provider settings; never {@code null}
     */
    List<Diagnostic> diagnose(String text, SyntaxTree tree, List<ParseError> parseErrors);

    default List<Diagnostic> diagnose(String text, ParseResult parseResult) {
        return diagnose(text, parseResult.tree(), parseResult.errors());
    }
}
