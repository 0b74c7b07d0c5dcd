package io.github.cyfko.drllens.core.outline;

import io.github.cyfko.drllens.core.model.ActionClause;
import io.github.cyfko.drllens.core.model.ConditionClause;
import io.github.cyfko.drllens.core.model.ConditionNode;
import io.github.cyfko.drllens.core.model.DeclareNode;
import io.github.cyfko.drllens.core.model.FunctionNode;
import io.github.cyfko.drllens.core.model.ImportNode;
import io.github.cyfko.drllens.core.model.ParameterNode;
import io.github.cyfko.drllens.core.model.QueryNode;
import io.github.cyfko.drllens.core.model.Range;
import io.github.cyfko.drllens.core.model.RuleAttribute;
import io.github.cyfko.drllens.core.model.RuleNode;
import io.github.cyfko.drllens.core.model.SyntaxTree;
import io.github.cyfko.drllens.core.utils.TextUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the hierarchical symbol outline of a syntax tree.
 *
 * <h2>Shape</h2>
 * <pre>
 * package            PACKAGE
 * Imports (n)        NAMESPACE  > one MODULE per import
 * type name          VARIABLE   (globals)
 * name(params)       METHOD     > one PROPERTY per parameter
 * rule name          FUNCTION   > attributes (PROPERTY), when (OBJECT) > conditions, then (OBJECT)
 * name(params)       INTERFACE  > conditions (queries)
 * name               CLASS      > fields (declarations)
 * </pre>
 * Top-level symbols are sorted by position.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class DocumentOutline {

    public List<DocumentSymbol> symbols(SyntaxTree tree) {
        List<DocumentSymbol> out = new ArrayList<>();
        if (tree.packageNode() != null) {
            out.add(DocumentSymbol.leaf(tree.packageNode().name(), SymbolKind.PACKAGE, tree.packageNode().range()));
        }
        if (!tree.imports().isEmpty()) {
            List<ImportNode> imports = tree.imports();
            List<DocumentSymbol> children = imports.stream()
                    .map(node -> DocumentSymbol.leaf(node.path(), SymbolKind.MODULE, node.range()))
                    .toList();
            Range span = new Range(imports.get(0).range().start(), imports.get(imports.size() - 1).range().end());
            out.add(new DocumentSymbol("Imports (" + imports.size() + ")", SymbolKind.NAMESPACE, span, children));
        }
        tree.globals().forEach(global -> out.add(DocumentSymbol.leaf(
                global.name() + ": " + global.type(), SymbolKind.VARIABLE, global.range())));
        tree.functions().forEach(function -> out.add(functionSymbol(function)));
        tree.rules().forEach(rule -> out.add(ruleSymbol(rule)));
        tree.queries().forEach(query -> out.add(querySymbol(query)));
        tree.declares().forEach(declare -> out.add(declareSymbol(declare)));
        out.sort(Comparator.comparing(symbol -> symbol.range().start()));
        return List.copyOf(out);
    }

    private DocumentSymbol functionSymbol(FunctionNode function) {
        List<DocumentSymbol> parameters = function.parameters().stream()
                .map(p -> DocumentSymbol.leaf(p.name() + ": " + p.type(), SymbolKind.PROPERTY, p.range()))
                .toList();
        String signature = function.returnType() + " " + function.name() + "(" + signature(function.parameters()) + ")";
        return new DocumentSymbol(signature, SymbolKind.METHOD, function.range(), parameters);
    }

    private DocumentSymbol ruleSymbol(RuleNode rule) {
        List<DocumentSymbol> children = new ArrayList<>();
        for (RuleAttribute attribute : rule.attributes()) {
            String name = attribute.value() == null ? attribute.name() : attribute.name() + ": " + attribute.value();
            children.add(DocumentSymbol.leaf(name, SymbolKind.PROPERTY, attribute.range()));
        }
        if (rule.when() != null) {
            children.add(whenSymbol(rule.when()));
        }
        if (rule.then() != null) {
            ActionClause then = rule.then();
            String preview = then.isEmpty() ? "then" : "then: " + TextUtils.abbreviate(then.text().lines().findFirst().orElse(""));
            children.add(DocumentSymbol.leaf(preview, SymbolKind.OBJECT, then.range()));
        }
        return new DocumentSymbol(rule.name(), SymbolKind.FUNCTION, rule.range(), children);
    }

    private DocumentSymbol whenSymbol(ConditionClause when) {
        List<DocumentSymbol> conditions = when.conditions().stream().map(this::conditionSymbol).toList();
        long multiLine = when.conditions().stream().filter(ConditionNode::isMultiLine).count();
        String name = multiLine == 0
                ? "when (" + conditions.size() + " conditions)"
                : "when (" + multiLine + " multi-line, " + (conditions.size() - multiLine) + " regular)";
        return new DocumentSymbol(name, SymbolKind.OBJECT, when.range(), conditions);
    }

    private DocumentSymbol conditionSymbol(ConditionNode condition) {
        String preview = TextUtils.abbreviate(condition.content().replaceAll("\\s+", " "));
        SymbolKind kind = condition.kind().keyword() != null ? SymbolKind.CONSTRUCTOR : SymbolKind.FIELD;
        return DocumentSymbol.leaf(preview, kind, condition.range());
    }

    private DocumentSymbol querySymbol(QueryNode query) {
        List<DocumentSymbol> conditions = query.conditions().stream().map(this::conditionSymbol).toList();
        return new DocumentSymbol(query.name() + "(" + signature(query.parameters()) + ")",
                SymbolKind.INTERFACE, query.range(), conditions);
    }

    private DocumentSymbol declareSymbol(DeclareNode declare) {
        List<DocumentSymbol> fields = declare.fields().stream()
                .map(f -> DocumentSymbol.leaf(f.name() + ": " + f.type(), SymbolKind.PROPERTY, f.range()))
                .toList();
        return new DocumentSymbol(declare.name(), SymbolKind.CLASS, declare.range(), fields);
    }

    private static String signature(List<ParameterNode> parameters) {
        return parameters.stream().map(p -> p.type() + " " + p.name()).collect(Collectors.joining(", "));
    }
}
