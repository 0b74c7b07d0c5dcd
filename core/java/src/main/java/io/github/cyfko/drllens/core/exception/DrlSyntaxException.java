package io.github.cyfko.drllens.core.exception;

import io.github.cyfko.drllens.core.model.ParseError;
import io.github.cyfko.drllens.core.model.ParseResult;
import io.github.cyfko.drllens.core.model.Position;

/**
 * Exception raised when a caller explicitly asks for a document without syntax errors.
 * <p>
 * The parser itself never throws: it reports problems as {@link ParseError} values. This
 * exception exists for fail-fast consumers such as build tools, through
 * {@link ParseResult#requireValid()}.
 * </p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * try {
 *     SyntaxTree tree = parser.parse(source).requireValid();
 *     deploy(tree);
 * } catch (DrlSyntaxException e) {
 *     System.err.println("rules.drl:" + (e.getPosition().line() + 1) + ": " + e.getMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see ParseResult#requireValid()
 */
public class DrlSyntaxException extends RuntimeException {

    private final transient ParseError error;

    /**
     * Constructor with an explanatory error message.
     *
     * @param message the message describing the syntax error
     */
    public DrlSyntaxException(String message) {
        super(message);
        this.error = null;
    }

    /**
     * Constructor with an explanatory message and an underlying cause.
     *
     * @param message the message describing the syntax error
     * @param cause   the original cause of this exception
     */
    public DrlSyntaxException(String message, Throwable cause) {
        super(message, cause);
        this.error = null;
    }

    /**
     * Wraps the first blocking {@link ParseError} of a parse.
     *
     * @param error the parse error, its message becomes this exception's message
     */
    public DrlSyntaxException(ParseError error) {
        super(error.message() + " (line " + (error.range().start().line() + 1) + ")");
        this.error = error;
    }

    /**
     * @return the wrapped parse error, or {@code null} when built from a plain message
     */
    public ParseError getError() {
        return error;
    }

    /**
     * @return start of the offending range, or {@code null} when unknown
     */
    public Position getPosition() {
        return error == null ? null : error.range().start();
    }
}
