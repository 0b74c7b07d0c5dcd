package io.github.cyfko.drllens.core.impl;

import io.github.cyfko.drllens.core.api.DrlParser;
import io.github.cyfko.drllens.core.config.ParserPolicy;
import io.github.cyfko.drllens.core.model.IncrementalParseRequest;
import io.github.cyfko.drllens.core.model.ParseError;
import io.github.cyfko.drllens.core.model.ParseResult;
import io.github.cyfko.drllens.core.model.Position;
import io.github.cyfko.drllens.core.model.Range;
import io.github.cyfko.drllens.core.model.SyntaxTree;
import io.github.cyfko.drllens.core.parsing.DocumentParser;
import io.github.cyfko.drllens.core.parsing.ParseSession;
import io.github.cyfko.drllens.core.parsing.SourceLines;

import java.util.List;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link DrlParser}.
 * <p>
 * Parsing is line oriented and runs in a single pass over the document:
 * </p>
 * <ol>
 *   <li><b>Size guard</b>: documents longer than {@link ParserPolicy#maxDocumentLength()} get an
 *       empty tree and one error</li>
 *   <li><b>Dispatch</b>: each construct is read by its sub-parser; failures are recorded and
 *       skipped</li>
 *   <li><b>Containment</b>: an unexpected runtime failure is logged and turned into an empty
 *       tree with a single {@code Critical parsing error}</li>
 * </ol>
 * <p>With an {@link IncrementalParseRequest}, parsing goes through {@link IncrementalMerger}
 * and only the constructs touched by the edit are read again.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicDrlParser implements DrlParser {

    private static final Logger log = Logger.getLogger(BasicDrlParser.class.getName());

    private final ParserPolicy policy;
    private final Function<ParseSession, DocumentParser> documentParsers;

    /**
     * Creates a parser with {@link ParserPolicy#defaults()}.
     */
    public BasicDrlParser() {
        this(ParserPolicy.defaults());
    }

    /**
     * @param policy limits applied to every parse
     * @throws IllegalArgumentException if {@code policy} is null
     */
    public BasicDrlParser(ParserPolicy policy) {
        this(policy, DocumentParser::new);
    }

    BasicDrlParser(ParserPolicy policy, Function<ParseSession, DocumentParser> documentParsers) {
        if (policy == null) {
            throw new IllegalArgumentException("Parser policy is required");
        }
        this.policy = policy;
        this.documentParsers = documentParsers;
    }

    public ParserPolicy policy() {
        return policy;
    }

    @Override
    public ParseResult parse(String text) {
        return parse(text, null);
    }

    @Override
    public ParseResult parse(String text, IncrementalParseRequest request) {
        String source = text == null ? "" : text;
        if (source.length() > policy.maxDocumentLength()) {
            log.fine(() -> String.format("Rejected document of %d characters (max: %d)", source.length(), policy.maxDocumentLength()));
            ParseError error = ParseError.error(String.format("Document too large: %d characters (max: %d)",
                    source.length(), policy.maxDocumentLength()), Range.point(new Position(0, 0)));
            return new ParseResult(SyntaxTree.empty(), List.of(error));
        }

        long start = System.nanoTime();
        ParseResult result = request == null ? parseLines(SourceLines.of(source)).result() : reparse(source, request);
        log.fine(() -> String.format("Parsed %d lines (%s) into %d rules with %d errors in %d us",
                result.tree().lineCount(), request == null ? "full" : "incremental",
                result.tree().rules().size(), result.errors().size(), (System.nanoTime() - start) / 1000));
        return result;
    }

    private ParseResult reparse(String text, IncrementalParseRequest request) {
        try {
            return new IncrementalMerger(this).merge(text, request);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Incremental reparse failed, falling back to a full parse", e);
            return parseLines(SourceLines.of(text)).result();
        }
    }

    /**
     * Parses {@code lines} as a standalone document.
     */
    SpanParse parseLines(SourceLines lines) {
        ParseSession session = new ParseSession(policy);
        try {
            SyntaxTree tree = documentParsers.apply(session).parse(lines);
            if (session.droppedErrors() > 0) {
                log.fine(() -> String.format("Dropped %d parse errors over the limit of %d",
                        session.droppedErrors(), policy.maxErrors()));
            }
            return new SpanParse(new ParseResult(tree, session.errors()), session.hasUnterminatedConstruct(), false);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Critical parsing error, returning an empty tree", e);
            ParseError fatal = ParseError.error("Critical parsing error: " + e.getMessage(), Range.point(session.lastPosition()));
            return new SpanParse(new ParseResult(SyntaxTree.empty(), List.of(fatal)), false, true);
        }
    }
}
