package io.github.cyfko.drllens.core.parsing;

import io.github.cyfko.drllens.core.model.Range;

/**
 * Result of a construct sub-parser: either the parsed node with the cursor to resume from,
 * or a failure message with the offending range.
 * <p>
 * Recoverable failures travel as values so that the recovery controller decides what to do
 * with them; nothing is thrown for a malformed document.
 * </p>
 *
 * <pre>{@code
 * ParseOutcome<GlobalNode> outcome = declarations.parseGlobal(cursor);
 * if (!outcome.isSuccess()) {
 *     session.error(outcome.failureMessage(), outcome.failureRange());
 * }
 * }</pre>
 *
 * @param <T> parsed node type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ParseOutcome<T> {

    private final T node;
    private final ParseCursor next;
    private final String failureMessage;
    private final Range failureRange;

    private ParseOutcome(T node, ParseCursor next, String failureMessage, Range failureRange) {
        this.node = node;
        this.next = next;
        this.failureMessage = failureMessage;
        this.failureRange = failureRange;
    }

    /**
     * @param node the parsed node
     * @param next cursor positioned on the first line after the construct
     */
    public static <T> ParseOutcome<T> success(T node, ParseCursor next) {
        return new ParseOutcome<>(node, next, null, null);
    }

    /**
     * @param message explanation of the failure
     * @param range   offending range
     */
    public static <T> ParseOutcome<T> failure(String message, Range range) {
        return new ParseOutcome<>(null, null, message, range);
    }

    public boolean isSuccess() {
        return failureMessage == null;
    }

    public T node() {
        return node;
    }

    public ParseCursor next() {
        return next;
    }

    public String failureMessage() {
        return failureMessage;
    }

    public Range failureRange() {
        return failureRange;
    }

    @Override
    public String toString() {
        return isSuccess() ? "ParseOutcome[success=" + node + "]"
                : "ParseOutcome[failure=" + failureMessage + " at " + failureRange + "]";
    }
}
