package io.github.cyfko.drllens.core.parsing;

import io.github.cyfko.drllens.core.config.ParserPolicy;
import io.github.cyfko.drllens.core.model.ParseError;
import io.github.cyfko.drllens.core.model.Position;
import io.github.cyfko.drllens.core.model.Range;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Per-call parsing state: the policy, the bounded error list and a few flags.
 * <p>
 * A session belongs to exactly one parse call and is never shared.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ParseSession {

    private static final Logger log = Logger.getLogger(ParseSession.class.getName());

    private final ParserPolicy policy;
    private final List<ParseError> errors = new ArrayList<>();
    private int dropped;
    private boolean unterminatedConstruct;
    private Position lastPosition = new Position(0, 0);

    public ParseSession(ParserPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy is required");
    }

    public ParserPolicy policy() {
        return policy;
    }

    public void error(String message, Range range) {
        record(ParseError.error(message, range));
    }

    public void warning(String message, Range range) {
        record(ParseError.warning(message, range));
    }

    /**
     * Keeps {@code error} unless {@link ParserPolicy#maxErrors()} is reached.
     */
    public void record(ParseError error) {
        if (errors.size() < policy.maxErrors()) {
            errors.add(error);
            return;
        }
        if (dropped++ == 0) {
            log.fine(() -> String.format("Parse error limit of %d reached, further errors are dropped", policy.maxErrors()));
        }
    }

    public List<ParseError> errors() {
        return List.copyOf(errors);
    }

    public int droppedErrors() {
        return dropped;
    }

    /**
     * Flags that a construct ran to the end of the input without being closed.
     */
    public void markUnterminated() {
        unterminatedConstruct = true;
    }

    public boolean hasUnterminatedConstruct() {
        return unterminatedConstruct;
    }

    public void track(ParseCursor cursor) {
        if (!cursor.atEnd()) {
            lastPosition = cursor.position();
        }
    }

    public Position lastPosition() {
        return lastPosition;
    }
}
