package io.github.cyfko.drllens.core.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Root of a parsed DRL document.
 * <p>
 * A tree is immutable: every list is an unmodifiable copy sorted by ascending start line, so two
 * trees built from the same text are {@link #equals(Object) equal}. Incremental reparsing
 * produces a new tree and leaves the previous one untouched.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ParseResult result = new BasicDrlParser().parse(text);
 * for (RuleNode rule : result.tree().rules()) {
 *     System.out.println(rule.name() + " @ line " + (rule.range().start().line() + 1));
 * }
 * }</pre>
 *
 * @param packageNode package declaration, or {@code null}
 * @param imports     import declarations
 * @param globals     global declarations
 * @param functions   function declarations
 * @param rules       rules
 * @param queries     queries
 * @param declares    type declarations
 * @param range       span of the whole document
 * @param lineCount   number of lines of the parsed text
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record SyntaxTree(
        PackageNode packageNode,
        List<ImportNode> imports,
        List<GlobalNode> globals,
        List<FunctionNode> functions,
        List<RuleNode> rules,
        List<QueryNode> queries,
        List<DeclareNode> declares,
        Range range,
        int lineCount
) {

    public SyntaxTree {
        imports = sortedCopy(imports, ImportNode::range);
        globals = sortedCopy(globals, GlobalNode::range);
        functions = sortedCopy(functions, FunctionNode::range);
        rules = sortedCopy(rules, RuleNode::range);
        queries = sortedCopy(queries, QueryNode::range);
        declares = sortedCopy(declares, DeclareNode::range);
        if (range == null) {
            throw new IllegalArgumentException("Tree range is required");
        }
        if (lineCount < 0) {
            throw new IllegalArgumentException("lineCount must not be negative, got: " + lineCount);
        }
    }

    /**
     * Minimal tree returned when a document cannot be parsed at all.
     */
    public static SyntaxTree empty() {
        return new SyntaxTree(null, List.of(), List.of(), List.of(), List.of(), List.of(), List.of(),
                Range.point(new Position(0, 0)), 0);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return packageNode == null && imports.isEmpty() && globals.isEmpty() && functions.isEmpty()
                && rules.isEmpty() && queries.isEmpty() && declares.isEmpty();
    }

    private static <T> List<T> sortedCopy(List<T> nodes, Function<T, Range> range) {
        List<T> copy = new ArrayList<>(nodes);
        // List.sort is stable: nodes starting on the same line keep their source order
        copy.sort(Comparator.comparing(node -> range.apply(node).start()));
        return List.copyOf(copy);
    }

    /**
     * Mutable accumulator used while parsing.
     */
    public static final class Builder {
        private PackageNode packageNode;
        private final List<ImportNode> imports = new ArrayList<>();
        private final List<GlobalNode> globals = new ArrayList<>();
        private final List<FunctionNode> functions = new ArrayList<>();
        private final List<RuleNode> rules = new ArrayList<>();
        private final List<QueryNode> queries = new ArrayList<>();
        private final List<DeclareNode> declares = new ArrayList<>();

        private Builder() {
        }

        public Builder packageNode(PackageNode node) { this.packageNode = node; return this; }
        public Builder addImport(ImportNode node) { imports.add(node); return this; }
        public Builder addGlobal(GlobalNode node) { globals.add(node); return this; }
        public Builder addFunction(FunctionNode node) { functions.add(node); return this; }
        public Builder addRule(RuleNode node) { rules.add(node); return this; }
        public Builder addQuery(QueryNode node) { queries.add(node); return this; }
        public Builder addDeclare(DeclareNode node) { declares.add(node); return this; }

        public boolean hasPackage() {
            return packageNode != null;
        }

        public SyntaxTree build(Range range, int lineCount) {
            return new SyntaxTree(packageNode, imports, globals, functions, rules, queries, declares, range, lineCount);
        }
    }
}
