package io.github.cyfko.drllens.core.outline;

import io.github.cyfko.drllens.core.model.ConditionNode;
import io.github.cyfko.drllens.core.model.DeclareNode;
import io.github.cyfko.drllens.core.model.FunctionNode;
import io.github.cyfko.drllens.core.model.ImportNode;
import io.github.cyfko.drllens.core.model.QueryNode;
import io.github.cyfko.drllens.core.model.Range;
import io.github.cyfko.drllens.core.model.RuleNode;
import io.github.cyfko.drllens.core.model.SyntaxTree;
import io.github.cyfko.drllens.core.parsing.CodeScanner;
import io.github.cyfko.drllens.core.parsing.SourceLines;
import io.github.cyfko.drllens.core.utils.TextUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Computes foldable regions of a parsed document.
 * <p>
 * Multi-line constructs fold as {@link FoldingRangeKind#REGION}: rules and their
 * {@code when}/{@code then} clauses, functions, queries, declarations and multi-line
 * conditions. Block comments and runs of at least {@value #MIN_LINE_COMMENT_RUN} line comments
 * fold as {@link FoldingRangeKind#COMMENT}; groups of consecutive imports as
 * {@link FoldingRangeKind#IMPORTS}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FoldingRangeProvider {

    public static final int MIN_LINE_COMMENT_RUN = 3;

    /**
     * @return folding ranges sorted by start line, outer ranges first
     */
    public List<FoldingRange> foldingRanges(String text, SyntaxTree tree) {
        SourceLines lines = SourceLines.of(text == null ? "" : text);
        List<FoldingRange> out = new ArrayList<>();
        for (RuleNode rule : tree.rules()) {
            add(out, rule.range(), "rule \"" + rule.name() + "\"");
            if (rule.when() != null) {
                add(out, rule.when().range(), "when...");
            }
            if (rule.then() != null) {
                add(out, rule.then().range(), "then...");
            }
            rule.conditions().forEach(condition -> addCondition(out, condition));
        }
        for (FunctionNode function : tree.functions()) {
            add(out, function.range(), "function " + function.name() + "(...)");
        }
        for (QueryNode query : tree.queries()) {
            add(out, query.range(), "query \"" + query.name() + "\"");
            query.conditions().forEach(condition -> addCondition(out, condition));
        }
        for (DeclareNode declare : tree.declares()) {
            add(out, declare.range(), "declare " + declare.name());
        }
        addImportGroups(out, tree.imports());
        addComments(out, lines);
        out.sort(Comparator.comparingInt(FoldingRange::startLine)
                .thenComparing(Comparator.comparingInt(FoldingRange::endLine).reversed()));
        return List.copyOf(out);
    }

    private static void add(List<FoldingRange> out, Range range, String collapsedText) {
        if (range.isMultiLine()) {
            out.add(new FoldingRange(range.start().line(), range.end().line(), FoldingRangeKind.REGION, collapsedText));
        }
    }

    private static void addCondition(List<FoldingRange> out, ConditionNode condition) {
        add(out, condition.range(), TextUtils.abbreviate(condition.content().lines().findFirst().orElse("")));
    }

    private static void addImportGroups(List<FoldingRange> out, List<ImportNode> imports) {
        int groupStart = -1;
        int last = -1;
        for (ImportNode node : imports) {
            int line = node.range().start().line();
            if (groupStart >= 0 && line > last + 1) {
                addImportGroup(out, groupStart, last);
                groupStart = -1;
            }
            if (groupStart < 0) {
                groupStart = line;
            }
            last = line;
        }
        if (groupStart >= 0) {
            addImportGroup(out, groupStart, last);
        }
    }

    private static void addImportGroup(List<FoldingRange> out, int start, int end) {
        if (end > start) {
            out.add(new FoldingRange(start, end, FoldingRangeKind.IMPORTS, "imports..."));
        }
    }

    private static void addComments(List<FoldingRange> out, SourceLines lines) {
        CodeScanner scanner = new CodeScanner();
        int blockStart = -1;
        int runStart = -1;
        int runLength = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.line(i);
            boolean wasInBlock = scanner.inBlockComment();
            scanner.scan(line, (c, column) -> { });
            if (!wasInBlock && scanner.inBlockComment()) {
                blockStart = i;
            } else if (wasInBlock && !scanner.inBlockComment() && blockStart >= 0) {
                if (i > blockStart) {
                    out.add(new FoldingRange(blockStart, i, FoldingRangeKind.COMMENT, "/* ... */"));
                }
                blockStart = -1;
            }

            if (!wasInBlock && line.strip().startsWith("//")) {
                if (runLength == 0) {
                    runStart = i;
                }
                runLength++;
            } else {
                addCommentRun(out, runStart, runLength);
                runLength = 0;
            }
        }
        addCommentRun(out, runStart, runLength);
        if (blockStart >= 0 && lines.size() - 1 > blockStart) {
            out.add(new FoldingRange(blockStart, lines.size() - 1, FoldingRangeKind.COMMENT, "/* ... */"));
        }
    }

    private static void addCommentRun(List<FoldingRange> out, int start, int length) {
        if (length >= MIN_LINE_COMMENT_RUN) {
            out.add(new FoldingRange(start, start + length - 1, FoldingRangeKind.COMMENT, "// ..."));
        }
    }
}
