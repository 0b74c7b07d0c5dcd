package io.github.cyfko.drllens.core.model;

import io.github.cyfko.drllens.core.exception.DrlSyntaxException;

import java.util.List;
import java.util.Objects;

/**
 * Output of a parse: the tree plus the errors recorded while building it.
 * <p>
 * Parsing never throws; problems are reported here. Callers that prefer fail-fast
 * behaviour can use {@link #requireValid()}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ParseResult(SyntaxTree tree, List<ParseError> errors) {

    public ParseResult {
        Objects.requireNonNull(tree, "tree is required");
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return errors.stream().anyMatch(ParseError::isError);
    }

    /**
     * Returns the tree when no {@link ParseSeverity#ERROR} was recorded.
     *
     * @return the syntax tree
     * @throws DrlSyntaxException describing the first error otherwise
     */
    public SyntaxTree requireValid() {
        for (ParseError error : errors) {
            if (error.isError()) {
                throw new DrlSyntaxException(error);
            }
        }
        return tree;
    }
}
