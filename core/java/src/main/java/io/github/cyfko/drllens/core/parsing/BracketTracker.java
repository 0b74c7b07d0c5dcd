package io.github.cyfko.drllens.core.parsing;

import io.github.cyfko.drllens.core.model.BracketKind;
import io.github.cyfko.drllens.core.model.BracketPair;
import io.github.cyfko.drllens.core.model.Position;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Matches {@code ()}, {@code {}} and {@code []} over a document fed line by line.
 * <p>
 * Each bracket family has its own stack, so {@code ( ]} reports two unmatched brackets
 * instead of a crossed pair. A closing bracket met with an empty stack is recorded at once;
 * brackets still open when {@link #finish()} is called are reported as unmatched openings.
 * Brackets inside string literals and comments are ignored (see {@link CodeScanner}).
 * </p>
 *
 * <pre>{@code
 * BracketScan scan = BracketTracker.scan(SourceLines.of(text));
 * scan.unmatched().forEach(b -> System.out.println("Unmatched " + b.character() + " at " + b.position()));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class BracketTracker {

    private final Map<BracketKind, Deque<Position>> openStacks = new EnumMap<>(BracketKind.class);
    private final List<BracketPair> pairs = new ArrayList<>();
    private final List<UnmatchedBracket> unmatchedClosings = new ArrayList<>();
    private final CodeScanner scanner = new CodeScanner();

    public BracketTracker() {
        for (BracketKind kind : BracketKind.values()) {
            openStacks.put(kind, new ArrayDeque<>());
        }
    }

    /**
     * Scans a whole document.
     */
    public static BracketScan scan(SourceLines source) {
        BracketTracker tracker = new BracketTracker();
        for (int line = 0; line < source.size(); line++) {
            tracker.feed(source.line(line), line);
        }
        return tracker.finish();
    }

    /**
     * Receives every bracket as it is matched.
     */
    @FunctionalInterface
    public interface BracketListener {

        /**
         * @param c       the bracket character
         * @param column  index of {@code c} in the fed text
         * @param partner for a closing bracket, where its opening bracket sits; {@code null} for
         *                an opening bracket or a closing one with nothing to close
         */
        void bracket(char c, int column, Position position, Position partner);
    }

    public void feed(String text, int line) {
        feed(text, line, 0, null);
    }

    /**
     * Feeds a piece of a line whose first character sits at {@code columnOffset}.
     */
    public void feed(String text, int line, int columnOffset, BracketListener listener) {
        scanner.scan(text, (c, column) -> {
            Position position = new Position(line, columnOffset + column);
            Position partner = accept(c, position);
            if (listener != null && BracketKind.of(c) != null) {
                listener.bracket(c, column, position, partner);
            }
        });
    }

    private Position accept(char c, Position position) {
        BracketKind kind = BracketKind.of(c);
        if (kind == null) {
            return null;
        }
        Deque<Position> stack = openStacks.get(kind);
        if (BracketKind.isOpening(c)) {
            stack.push(position);
            return null;
        }
        if (stack.isEmpty()) {
            unmatchedClosings.add(new UnmatchedBracket(kind, position, false));
            return null;
        }
        Position open = stack.pop();
        pairs.add(new BracketPair(kind, open, position));
        return open;
    }

    public int depth(BracketKind kind) {
        return openStacks.get(kind).size();
    }

    /**
     * Produces the scan result. The tracker can keep being fed afterwards.
     */
    public BracketScan finish() {
        List<UnmatchedBracket> unmatched = new ArrayList<>(unmatchedClosings);
        openStacks.forEach((kind, stack) -> stack.forEach(position -> unmatched.add(new UnmatchedBracket(kind, position, true))));
        unmatched.sort(Comparator.comparing(UnmatchedBracket::position).thenComparing(UnmatchedBracket::kind));
        List<BracketPair> sortedPairs = new ArrayList<>(pairs);
        sortedPairs.sort(Comparator.comparing(BracketPair::open));
        return new BracketScan(sortedPairs, unmatched);
    }
}
