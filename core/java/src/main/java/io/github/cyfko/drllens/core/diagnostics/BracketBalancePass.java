package io.github.cyfko.drllens.core.diagnostics;

import io.github.cyfko.drllens.core.model.Diagnostic;
import io.github.cyfko.drllens.core.model.Range;
import io.github.cyfko.drllens.core.parsing.BracketTracker;
import io.github.cyfko.drllens.core.spi.DiagnosticContext;
import io.github.cyfko.drllens.core.spi.DiagnosticPass;
import io.github.cyfko.drllens.core.spi.PassCategory;

import java.util.List;

/**
 * Rescans the raw text for unbalanced brackets, independently of the syntax tree.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BracketBalancePass implements DiagnosticPass {

    @Override
    public String name() {
        return "bracket-balance";
    }

    @Override
    public PassCategory category() {
        return PassCategory.SYNTAX;
    }

    @Override
    public List<Diagnostic> run(DiagnosticContext context) {
        return BracketTracker.scan(context.lines()).unmatched().stream()
                .map(bracket -> Diagnostic.error(Range.singleCharacter(bracket.position()),
                        (bracket.opening() ? "Unmatched opening " : "Unmatched closing ") + bracket.character(),
                        DiagnosticSources.SYNTAX))
                .toList();
    }
}
