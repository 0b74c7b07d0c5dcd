package io.github.cyfko.drllens.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Everything the incremental path needs besides the new text.
 *
 * @param previousTree   tree of the text before the edit; never modified
 * @param previousErrors errors of the previous parse, kept when outside the reparsed span
 * @param changedRanges  edited regions, as offsets into the new text
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record IncrementalParseRequest(SyntaxTree previousTree, List<ParseError> previousErrors, List<ChangedRange> changedRanges) {

    public IncrementalParseRequest {
        Objects.requireNonNull(previousTree, "previousTree is required");
        previousErrors = previousErrors == null ? List.of() : List.copyOf(previousErrors);
        changedRanges = changedRanges == null ? List.of() : List.copyOf(changedRanges);
    }

    public static IncrementalParseRequest of(ParseResult previous, ChangedRange... changedRanges) {
        return new IncrementalParseRequest(previous.tree(), previous.errors(), List.of(changedRanges));
    }
}
