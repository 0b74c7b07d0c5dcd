package io.github.cyfko.drllens.core.diagnostics;

import io.github.cyfko.drllens.core.config.DrlKeywords;
import io.github.cyfko.drllens.core.model.ConditionKind;
import io.github.cyfko.drllens.core.model.ConditionNode;
import io.github.cyfko.drllens.core.model.Diagnostic;
import io.github.cyfko.drllens.core.model.GlobalNode;
import io.github.cyfko.drllens.core.model.ImportNode;
import io.github.cyfko.drllens.core.model.Range;
import io.github.cyfko.drllens.core.model.RuleNode;
import io.github.cyfko.drllens.core.model.SyntaxTree;
import io.github.cyfko.drllens.core.spi.DiagnosticContext;
import io.github.cyfko.drllens.core.spi.DiagnosticPass;
import io.github.cyfko.drllens.core.spi.PassCategory;
import io.github.cyfko.drllens.core.utils.TextUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Best-practice and performance suggestions. Everything reported here has
 * {@link io.github.cyfko.drllens.core.model.DiagnosticSeverity#INFORMATION} severity.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class StylePass implements DiagnosticPass {

    public static final int MAX_CONDITIONS = 10;
    public static final int MAX_RULE_NAME_LENGTH = 100;

    private static final Pattern SIDE_EFFECT = Pattern.compile(
            "\\b(?:" + String.join("|", DrlKeywords.SIDE_EFFECT_CALLS) + ")\\s*\\(");

    @Override
    public String name() {
        return "style";
    }

    @Override
    public PassCategory category() {
        return PassCategory.STYLE;
    }

    @Override
    public List<Diagnostic> run(DiagnosticContext context) {
        SyntaxTree tree = context.tree();
        List<Diagnostic> out = new ArrayList<>();

        List<RuleNode> rules = tree.rules();
        if (rules.size() > 1 && rules.stream().noneMatch(rule -> rule.hasAttribute("salience"))) {
            out.add(info(context.headerRange(rules.get(0).range().start()),
                    "Multiple rules defined but none specify salience; firing order is not guaranteed",
                    DiagnosticSources.BEST_PRACTICE));
        }
        for (RuleNode rule : rules) {
            checkRule(context, rule, out);
        }
        checkUnusedGlobals(tree, out);
        checkSemicolons(context, out);
        return out;
    }

    private void checkRule(DiagnosticContext context, RuleNode rule, List<Diagnostic> out) {
        Range header = context.headerRange(rule.range().start());
        if (rule.then() != null && SIDE_EFFECT.matcher(rule.then().text()).find()
                && !rule.hasAttribute("no-loop") && !rule.hasAttribute("lock-on-active")) {
            out.add(info(header, "Consider adding no-loop attribute to prevent infinite rule execution",
                    DiagnosticSources.BEST_PRACTICE));
        }
        if (rule.name().length() > MAX_RULE_NAME_LENGTH) {
            out.add(info(header, String.format("Rule name is very long (%d characters)", rule.name().length()),
                    DiagnosticSources.BEST_PRACTICE));
        }
        List<ConditionNode> conditions = rule.conditions();
        if (conditions.size() > MAX_CONDITIONS) {
            out.add(info(rule.when().range(),
                    String.format("Rule has %d conditions; consider splitting it into smaller rules", conditions.size()),
                    DiagnosticSources.PERFORMANCE));
        }
        for (ConditionNode condition : conditions) {
            if (condition.kind() == ConditionKind.EVAL) {
                out.add(info(condition.range(), "eval() prevents indexing; prefer constraints on fact patterns",
                        DiagnosticSources.PERFORMANCE));
            }
        }
    }

    private void checkUnusedGlobals(SyntaxTree tree, List<Diagnostic> out) {
        if (tree.globals().isEmpty()) {
            return;
        }
        String usages = Stream.of(
                        tree.rules().stream().flatMap(rule -> Stream.concat(
                                rule.conditions().stream().map(ConditionNode::content),
                                rule.then() == null ? Stream.<String>empty() : Stream.of(rule.then().text()))),
                        tree.queries().stream().flatMap(query -> query.conditions().stream().map(ConditionNode::content)),
                        tree.functions().stream().map(function -> function.body()))
                .flatMap(s -> s)
                .collect(Collectors.joining("\n"));
        for (GlobalNode global : tree.globals()) {
            if (!global.name().isBlank() && !TextUtils.containsWord(usages, global.name())) {
                out.add(info(global.range(), "Global variable \"" + global.name() + "\" is declared but never used",
                        DiagnosticSources.BEST_PRACTICE));
            }
        }
    }

    private void checkSemicolons(DiagnosticContext context, List<Diagnostic> out) {
        SyntaxTree tree = context.tree();
        if (tree.packageNode() != null) {
            checkSemicolon(context, tree.packageNode().range(), "Package declaration", out);
        }
        for (ImportNode node : tree.imports()) {
            checkSemicolon(context, node.range(), "Import statement", out);
        }
        for (GlobalNode node : tree.globals()) {
            checkSemicolon(context, node.range(), "Global declaration", out);
        }
    }

    private void checkSemicolon(DiagnosticContext context, Range range, String what, List<Diagnostic> out) {
        if (!context.textOf(range).stripTrailing().endsWith(";")) {
            out.add(info(range, what + " should end with a semicolon", DiagnosticSources.BEST_PRACTICE));
        }
    }

    private static Diagnostic info(Range range, String message, String source) {
        return Diagnostic.information(range, message, source);
    }
}
