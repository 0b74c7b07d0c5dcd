package io.github.cyfko.drllens.core.spi;

import io.github.cyfko.drllens.core.model.ConditionNode;
import io.github.cyfko.drllens.core.model.ParseError;
import io.github.cyfko.drllens.core.model.Position;
import io.github.cyfko.drllens.core.model.Range;
import io.github.cyfko.drllens.core.model.SyntaxTree;
import io.github.cyfko.drllens.core.parsing.SourceLines;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Read-only input shared by all diagnostic passes of one run.
 *
 * @param text        raw document text
 * @param lines       line view of {@code text}
 * @param tree        syntax tree of {@code text}
 * @param parseErrors errors recorded while parsing
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record DiagnosticContext(String text, SourceLines lines, SyntaxTree tree, List<ParseError> parseErrors) {

    public DiagnosticContext {
        Objects.requireNonNull(text, "text is required");
        Objects.requireNonNull(lines, "lines is required");
        Objects.requireNonNull(tree, "tree is required");
        parseErrors = List.copyOf(parseErrors);
    }

    public static DiagnosticContext of(String text, SyntaxTree tree, List<ParseError> parseErrors) {
        String source = text == null ? "" : text;
        return new DiagnosticContext(source, SourceLines.of(source),
                tree == null ? SyntaxTree.empty() : tree,
                parseErrors == null ? List.of() : parseErrors);
    }

    /**
     * Range from {@code start} to the end of the non-blank text of its line; used to point at
     * a construct header.
     */
    public Range headerRange(Position start) {
        int end = lines.line(start.line()).stripTrailing().length();
        return new Range(start, new Position(start.line(), Math.max(start.character(), end)));
    }

    /**
     * Document text covered by {@code range}, lines joined with {@code '\n'}.
     */
    public String textOf(Range range) {
        Position start = range.start();
        Position end = range.end();
        StringBuilder out = new StringBuilder();
        for (int line = start.line(); line <= end.line(); line++) {
            String text = lines.line(line);
            int from = line == start.line() ? Math.min(start.character(), text.length()) : 0;
            int to = line == end.line() ? Math.min(end.character(), text.length()) : text.length();
            if (line > start.line()) {
                out.append('\n');
            }
            if (to > from) {
                out.append(text, from, to);
            }
        }
        return out.toString();
    }

    /**
     * Conditions of every rule and query.
     */
    public Stream<ConditionNode> allConditions() {
        return Stream.concat(
                tree.rules().stream().flatMap(rule -> rule.conditions().stream()),
                tree.queries().stream().flatMap(query -> query.conditions().stream()));
    }
}
