package io.github.cyfko.drllens.core.parsing;

import io.github.cyfko.drllens.core.model.SyntaxTree;
import io.github.cyfko.drllens.core.utils.TextUtils;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Top-level dispatch loop: reads a document construct by construct.
 * <p>
 * Each significant line is routed on its first word to the matching sub-parser. A failed
 * construct is reported and skipped with {@link ErrorRecovery}; any other line at global
 * scope becomes a warning. Every iteration moves at least one line forward, so the loop
 * ends on any input.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class DocumentParser {

    private final ParseSession session;
    private final DeclarationParser declarations = new DeclarationParser();
    private final FunctionParser functions;
    private final RuleParser rules;
    private final QueryParser queries;
    private final DeclareParser declares;

    public DocumentParser(ParseSession session) {
        this.session = Objects.requireNonNull(session, "session is required");
        this.functions = new FunctionParser(session);
        this.rules = new RuleParser(session);
        this.queries = new QueryParser(session);
        this.declares = new DeclareParser(session);
    }

    /**
     * Parses {@code text} with its block comments blanked out; verbatim parts of a construct
     * (action text, function bodies) are still read from the original lines.
     */
    public SyntaxTree parse(SourceLines text) {
        SourceLines source = text.withoutBlockComments();
        SyntaxTree.Builder tree = SyntaxTree.builder();
        ParseCursor cursor = ParseCursor.start(source).skipTrivia();
        while (!cursor.atEnd()) {
            session.track(cursor);
            ParseCursor next = dispatch(cursor, tree);
            cursor = (next.line() > cursor.line() ? next : cursor.next()).skipTrivia();
        }
        return tree.build(source.fullRange(), source.size());
    }

    private ParseCursor dispatch(ParseCursor cursor, SyntaxTree.Builder tree) {
        String trimmed = cursor.trimmed();
        Optional<TopLevelKeyword> keyword = TopLevelKeyword.match(trimmed);
        if (keyword.isEmpty()) {
            if (trimmed.equals("end")) {
                session.warning("Unexpected 'end' outside of a construct", cursor.contentRange());
            } else {
                session.warning("Unexpected content outside of a construct: '" + TextUtils.abbreviate(trimmed) + "'",
                        cursor.contentRange());
            }
            return cursor.next();
        }
        return switch (keyword.get()) {
            case PACKAGE -> accept(cursor, declarations.parsePackage(cursor), node -> {
                if (tree.hasPackage()) {
                    session.warning("Duplicate package declaration, the first one is kept", node.range());
                } else {
                    tree.packageNode(node);
                }
            });
            case IMPORT -> accept(cursor, declarations.parseImport(cursor), tree::addImport);
            case GLOBAL -> accept(cursor, declarations.parseGlobal(cursor), tree::addGlobal);
            case FUNCTION -> accept(cursor, functions.parse(cursor), tree::addFunction);
            case RULE -> accept(cursor, rules.parse(cursor), tree::addRule);
            case QUERY -> accept(cursor, queries.parse(cursor), tree::addQuery);
            case DECLARE -> accept(cursor, declares.parse(cursor), tree::addDeclare);
        };
    }

    private <T> ParseCursor accept(ParseCursor cursor, ParseOutcome<T> outcome, Consumer<T> sink) {
        if (outcome.isSuccess()) {
            sink.accept(outcome.node());
            return outcome.next();
        }
        session.error(outcome.failureMessage(), outcome.failureRange());
        return ErrorRecovery.resynchronize(cursor);
    }
}
