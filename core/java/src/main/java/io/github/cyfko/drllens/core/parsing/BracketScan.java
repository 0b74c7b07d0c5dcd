package io.github.cyfko.drllens.core.parsing;

import io.github.cyfko.drllens.core.model.BracketPair;
import io.github.cyfko.drllens.core.model.Position;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a {@link BracketTracker} run.
 *
 * @param pairs     matched pairs, sorted by opening position
 * @param unmatched unmatched brackets, sorted by position
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record BracketScan(List<BracketPair> pairs, List<UnmatchedBracket> unmatched) {

    public BracketScan {
        pairs = List.copyOf(pairs);
        unmatched = List.copyOf(unmatched);
    }

    public boolean isBalanced() {
        return unmatched.isEmpty();
    }

    /**
     * Finds the pair whose opening or closing bracket sits at {@code position}.
     */
    public Optional<BracketPair> pairAt(Position position) {
        return pairs.stream()
                .filter(pair -> pair.open().equals(position) || pair.close().equals(position))
                .findFirst();
    }
}
