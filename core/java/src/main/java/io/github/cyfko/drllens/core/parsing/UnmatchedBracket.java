package io.github.cyfko.drllens.core.parsing;

import io.github.cyfko.drllens.core.model.BracketKind;
import io.github.cyfko.drllens.core.model.Position;

/**
 * A bracket without a partner.
 *
 * @param kind     bracket family
 * @param position location of the bracket character
 * @param opening  {@code true} for an opening bracket never closed, {@code false} for a
 *                 closing bracket with nothing to close
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record UnmatchedBracket(BracketKind kind, Position position, boolean opening) {

    public char character() {
        return opening ? kind.opening() : kind.closing();
    }
}
