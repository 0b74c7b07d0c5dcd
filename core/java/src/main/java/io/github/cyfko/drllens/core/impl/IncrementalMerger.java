package io.github.cyfko.drllens.core.impl;

import io.github.cyfko.drllens.core.model.ChangedRange;
import io.github.cyfko.drllens.core.model.DeclareNode;
import io.github.cyfko.drllens.core.model.FunctionNode;
import io.github.cyfko.drllens.core.model.GlobalNode;
import io.github.cyfko.drllens.core.model.ImportNode;
import io.github.cyfko.drllens.core.model.IncrementalParseRequest;
import io.github.cyfko.drllens.core.model.PackageNode;
import io.github.cyfko.drllens.core.model.ParseError;
import io.github.cyfko.drllens.core.model.ParseResult;
import io.github.cyfko.drllens.core.model.QueryNode;
import io.github.cyfko.drllens.core.model.Range;
import io.github.cyfko.drllens.core.model.RuleNode;
import io.github.cyfko.drllens.core.model.SyntaxTree;
import io.github.cyfko.drllens.core.parsing.CodeScanner;
import io.github.cyfko.drllens.core.parsing.SourceLines;
import io.github.cyfko.drllens.core.parsing.TopLevelKeyword;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Reparses only the constructs touched by an edit and splices them into the previous tree.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>The line delta is the new line count minus the previous one.</li>
 *   <li>Each changed range maps to new lines {@code [s, e]} and previous lines {@code [s, e - delta]}.</li>
 *   <li>Every previous node overlapping that span is dropped and the span grows to cover it
 *       entirely, until no node is partially covered.</li>
 *   <li>A failed construct before the span, whose recovery may reach into it, pulls the span
 *       start back to its header.</li>
 *   <li>The span is parsed as a document of its own; its nodes and errors are moved down to
 *       the span start.</li>
 *   <li>Nodes after the span move by the line delta; all lists are sorted again.</li>
 * </ol>
 * <p>
 * A full parse is used instead when the edit cannot be localised: several ranges with a line
 * count change, a span starting inside or leaving open a block comment, a construct running
 * off the end of the span, or a failed span parse. The previous tree is never modified.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
final class IncrementalMerger {

    private static final Logger log = Logger.getLogger(IncrementalMerger.class.getName());

    private final BasicDrlParser parser;

    IncrementalMerger(BasicDrlParser parser) {
        this.parser = parser;
    }

    ParseResult merge(String text, IncrementalParseRequest request) {
        SourceLines lines = SourceLines.of(text);
        List<ChangedRange> ranges = request.changedRanges();
        if (ranges.isEmpty()) {
            return fullParse(lines, "no changed range");
        }
        int delta = lines.size() - request.previousTree().lineCount();
        if (ranges.size() > 1 && delta != 0) {
            return fullParse(lines, "several changed ranges with a line count change");
        }

        ParseResult current = new ParseResult(request.previousTree(), request.previousErrors());
        for (ChangedRange range : ranges) {
            Optional<ParseResult> merged = mergeRange(lines, current, range, delta);
            if (merged.isEmpty()) {
                return fullParse(lines, "edit at offsets " + range.startOffset() + ".." + range.endOffset() + " is not local");
            }
            current = merged.get();
        }
        return current;
    }

    private Optional<ParseResult> mergeRange(SourceLines lines, ParseResult previous, ChangedRange range, int delta) {
        SyntaxTree tree = previous.tree();
        int oldFirst = lines.lineOfOffset(range.startOffset());
        int newLastEdited = lines.lineOfOffset(range.endOffset());
        int oldLast = Math.min(newLastEdited - delta, tree.lineCount() - 1);
        if (oldLast < oldFirst) {
            return Optional.empty();
        }

        List<Range> nodeRanges = nodeRanges(tree);
        boolean widened = true;
        while (widened) {
            widened = false;
            for (Range node : nodeRanges) {
                if (node.overlapsLines(oldFirst, oldLast)
                        && (node.start().line() < oldFirst || node.end().line() > oldLast)) {
                    oldFirst = Math.min(oldFirst, node.start().line());
                    oldLast = Math.max(oldLast, node.end().line());
                    widened = true;
                }
            }
        }
        oldFirst = failedConstructStart(lines, nodeRanges, previous.errors(), oldFirst);
        int newFirst = oldFirst;
        int newLast = Math.min(oldLast + delta, lines.size() - 1);

        if (startsInsideBlockComment(lines, newFirst)) {
            return Optional.empty();
        }
        SyntaxTree fresh;
        List<ParseError> freshErrors;
        if (newLast < newFirst) {
            fresh = SyntaxTree.empty();
            freshErrors = List.of();
        } else {
            SourceLines span = lines.slice(newFirst, newLast);
            if (leavesBlockCommentOpen(span)) {
                return Optional.empty();
            }
            SpanParse parse = parser.parseLines(span);
            if (parse.fatal() || parse.unterminated()) {
                return Optional.empty();
            }
            fresh = parse.result().tree();
            freshErrors = parse.result().errors();
        }

        Splice splice = new Splice(oldFirst, oldLast, delta, newFirst);
        SyntaxTree merged = new SyntaxTree(
                splice.packageNode(tree.packageNode(), fresh.packageNode()),
                splice.nodes(tree.imports(), fresh.imports(), ImportNode::range, ImportNode::shiftLines),
                splice.nodes(tree.globals(), fresh.globals(), GlobalNode::range, GlobalNode::shiftLines),
                splice.nodes(tree.functions(), fresh.functions(), FunctionNode::range, FunctionNode::shiftLines),
                splice.nodes(tree.rules(), fresh.rules(), RuleNode::range, RuleNode::shiftLines),
                splice.nodes(tree.queries(), fresh.queries(), QueryNode::range, QueryNode::shiftLines),
                splice.nodes(tree.declares(), fresh.declares(), DeclareNode::range, DeclareNode::shiftLines),
                lines.fullRange(),
                lines.size());

        List<ParseError> errors = splice.nodes(previous.errors(), freshErrors, ParseError::range, ParseError::shiftLines);
        int maxErrors = parser.policy().maxErrors();
        List<ParseError> capped = errors.size() > maxErrors ? errors.subList(0, maxErrors) : errors;
        int reparsed = newLast - newFirst + 1;
        log.fine(() -> String.format("Reparsed lines %d..%d (%d lines) of %d", newFirst, newLast, reparsed, lines.size()));
        return Optional.of(new ParseResult(merged, capped));
    }

    private ParseResult fullParse(SourceLines lines, String reason) {
        log.fine(() -> "Falling back to a full parse: " + reason);
        return parser.parseLines(lines).result();
    }

    /**
     * A construct that failed to parse leaves no node, only an error, and its recovery may have
     * swallowed lines up to the span. When such an error precedes the span with no node in
     * between, the span moves back to the header of that construct.
     */
    private static int failedConstructStart(SourceLines lines, List<Range> nodeRanges, List<ParseError> errors, int first) {
        int failedLine = -1;
        for (ParseError error : errors) {
            int line = error.range().start().line();
            if (line < first && line > failedLine && nodeRanges.stream().noneMatch(node -> node.overlapsLines(line, line))) {
                failedLine = line;
            }
        }
        int floor = failedLine;
        if (floor < 0 || nodeRanges.stream().anyMatch(node -> node.overlapsLines(floor, first - 1))) {
            return first;
        }
        int previousNodeEnd = nodeRanges.stream()
                .mapToInt(node -> node.end().line())
                .filter(line -> line < floor)
                .max()
                .orElse(-1);
        for (int line = failedLine; line > previousNodeEnd; line--) {
            if (TopLevelKeyword.match(lines.line(line).trim()).isPresent()) {
                return line;
            }
        }
        return failedLine;
    }

    private static List<Range> nodeRanges(SyntaxTree tree) {
        return Stream.of(
                        Stream.ofNullable(tree.packageNode()).map(PackageNode::range),
                        tree.imports().stream().map(ImportNode::range),
                        tree.globals().stream().map(GlobalNode::range),
                        tree.functions().stream().map(FunctionNode::range),
                        tree.rules().stream().map(RuleNode::range),
                        tree.queries().stream().map(QueryNode::range),
                        tree.declares().stream().map(DeclareNode::range))
                .flatMap(Function.identity())
                .toList();
    }

    private static boolean startsInsideBlockComment(SourceLines lines, int line) {
        CodeScanner scanner = new CodeScanner();
        for (int i = 0; i < line; i++) {
            scanner.scan(lines.line(i), (c, column) -> { });
        }
        return scanner.inBlockComment();
    }

    private static boolean leavesBlockCommentOpen(SourceLines span) {
        CodeScanner scanner = new CodeScanner();
        for (String line : span.asList()) {
            scanner.scan(line, (c, column) -> { });
        }
        return scanner.inBlockComment();
    }

    /**
     * Line bookkeeping of one splice: previous span {@code [oldFirst, oldLast]}, line delta and
     * the new line where the reparsed span starts.
     */
    private record Splice(int oldFirst, int oldLast, int delta, int newFirst) {

        <T> List<T> nodes(List<T> previous, List<T> fresh, Function<T, Range> range, BiFunction<T, Integer, T> shift) {
            List<T> result = new ArrayList<>(previous.size() + fresh.size());
            for (T node : previous) {
                Range r = range.apply(node);
                if (r.end().line() < oldFirst) {
                    result.add(node);
                } else if (r.start().line() > oldLast) {
                    result.add(shift.apply(node, delta));
                }
            }
            for (T node : fresh) {
                result.add(shift.apply(node, newFirst));
            }
            result.sort(Comparator.comparing(node -> range.apply(node).start()));
            return result;
        }

        PackageNode packageNode(PackageNode previous, PackageNode fresh) {
            List<PackageNode> candidates = nodes(
                    previous == null ? List.of() : List.of(previous),
                    fresh == null ? List.of() : List.of(fresh),
                    PackageNode::range, PackageNode::shiftLines);
            return candidates.isEmpty() ? null : candidates.get(0);
        }
    }
}
