package io.github.cyfko.drllens.core.api;

import io.github.cyfko.drllens.core.model.IncrementalParseRequest;
import io.github.cyfko.drllens.core.model.ParseError;
import io.github.cyfko.drllens.core.model.ParseResult;

/**
 * Error-tolerant parser for Drools Rule Language documents.
 * <p>
 * Implementations never throw for document content: malformed constructs are reported as
 * {@link ParseError}s next to a tree holding everything that could be read. A parse failure
 * that cannot be contained yields an empty tree and a single error.
 * </p>
 *
 * <h2>Full parse</h2>
 * <pre>{@code
 * DrlParser parser = new BasicDrlParser();
 * ParseResult result = parser.parse(Files.readString(path));
 * result.errors().forEach(e -> System.out.println(e.message()));
 * }</pre>
 *
 * <h2>Incremental parse</h2>
 * <p>After an edit, pass the previous result and the edited offsets of the new text. Only
 * the constructs touched by the edit are reparsed; the result equals a full parse whenever the
 * edit does not cross construct boundaries.</p>
 * <pre>{@code
 * ParseResult next = parser.parse(newText,
 *     IncrementalParseRequest.of(previous, new ChangedRange(120, 135)));
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations are stateless between calls and may be shared across threads.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface DrlParser {

    /**
     * Parses a whole document.
     *
     * @param text document text; {@code null} is treated as empty
     * @return the tree and the errors met
     */
    ParseResult parse(String text);

    /**
     * Parses a document, reusing the previous tree where the edit allows it.
     *
     * @param text    new document text; {@code null} is treated as empty
     * @param request previous tree and errors plus the edited ranges, or {@code null} for a full parse
     * @return the tree and the errors met
     */
    ParseResult parse(String text, IncrementalParseRequest request);
}
