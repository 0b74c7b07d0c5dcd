package io.github.cyfko.drllens.core.diagnostics;

import io.github.cyfko.drllens.core.config.DrlKeywords;
import io.github.cyfko.drllens.core.model.ConditionKind;
import io.github.cyfko.drllens.core.model.ConditionNode;
import io.github.cyfko.drllens.core.model.DeclareNode;
import io.github.cyfko.drllens.core.model.Diagnostic;
import io.github.cyfko.drllens.core.model.FieldNode;
import io.github.cyfko.drllens.core.model.FunctionNode;
import io.github.cyfko.drllens.core.model.ParameterNode;
import io.github.cyfko.drllens.core.model.QueryNode;
import io.github.cyfko.drllens.core.model.Range;
import io.github.cyfko.drllens.core.model.RuleNode;
import io.github.cyfko.drllens.core.parsing.CodeScanner;
import io.github.cyfko.drllens.core.spi.DiagnosticContext;
import io.github.cyfko.drllens.core.spi.DiagnosticPass;
import io.github.cyfko.drllens.core.spi.PassCategory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks that rules, functions, queries and declarations carry the parts they need to be useful:
 * names, return and parameter types, clause contents and field types. Also suggests quoting a
 * bare rule name that runs into other words or punctuation.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class StructuralCompletenessPass implements DiagnosticPass {

    private static final Pattern BARE_RULE_NAME = Pattern.compile("^\\s*rule\\s+([^\\s\"]\\S*)(?:\\s+(\\S+))?");
    private static final Set<String> HEADER_FOLLOWERS = Set.of("when", "then", "end", "extends");

    @Override
    public String name() {
        return "structure";
    }

    @Override
    public PassCategory category() {
        return PassCategory.SEMANTIC;
    }

    @Override
    public List<Diagnostic> run(DiagnosticContext context) {
        List<Diagnostic> out = new ArrayList<>();
        for (RuleNode rule : context.tree().rules()) {
            checkRule(context, rule, out);
        }
        for (FunctionNode function : context.tree().functions()) {
            checkFunction(context, function, out);
        }
        for (QueryNode query : context.tree().queries()) {
            if (query.name().isBlank()) {
                out.add(error(context.headerRange(query.range().start()), "Query must have a name"));
            }
            if (query.conditions().isEmpty()) {
                out.add(warning(context.headerRange(query.range().start()), "Query has no conditions"));
            }
            checkConditions(query.conditions(), out);
        }
        for (DeclareNode declare : context.tree().declares()) {
            if (declare.name().isBlank()) {
                out.add(error(context.headerRange(declare.range().start()), "Declaration must have a name"));
            }
            for (FieldNode field : declare.fields()) {
                if (field.name().isBlank()) {
                    out.add(Diagnostic.error(field.range(), "Field must have a name", DiagnosticSources.SYNTAX));
                }
                if (field.type().isBlank()) {
                    out.add(Diagnostic.error(field.range(), "Field must have a type", DiagnosticSources.SYNTAX));
                }
            }
        }
        return out;
    }

    private void checkRule(DiagnosticContext context, RuleNode rule, List<Diagnostic> out) {
        var header = context.headerRange(rule.range().start());
        if (rule.name().isBlank()) {
            out.add(error(header, "Rule must have a name"));
        } else if (needsQuotes(context.lines().line(rule.range().start().line()))) {
            out.add(warning(header, "Rule names with spaces or special characters should be quoted"));
        }
        if (rule.when() == null && rule.then() == null) {
            out.add(error(header, "Rule must have at least a when or then clause"));
            return;
        }
        if (rule.when() != null && rule.when().isEmpty()) {
            out.add(warning(rule.when().range(), "When clause is empty"));
        }
        if (rule.then() == null) {
            out.add(warning(header, "Rule has no then clause"));
        } else if (rule.then().isEmpty()) {
            out.add(warning(rule.then().range(), "Then clause is empty"));
        }
        checkConditions(rule.conditions(), out);
    }

    private void checkConditions(List<ConditionNode> conditions, List<Diagnostic> out) {
        for (ConditionNode condition : conditions) {
            if (condition.kind() == ConditionKind.EVAL && condition.body().isBlank()) {
                out.add(error(condition.range(), "Eval condition cannot be empty"));
            }
        }
    }

    private void checkFunction(DiagnosticContext context, FunctionNode function, List<Diagnostic> out) {
        var header = context.headerRange(function.range().start());
        if (function.name().isBlank()) {
            out.add(error(header, "Function must have a name"));
        }
        if (function.returnType().isBlank()) {
            out.add(error(header, "Function must specify a return type"));
        }
        for (ParameterNode parameter : function.parameters()) {
            if (parameter.name().isBlank()) {
                out.add(error(parameter.range(), "Function parameter must have a name"));
            }
            if (parameter.type().isBlank()) {
                out.add(error(parameter.range(), "Function parameter must have a type"));
            }
        }
        if (function.body().isBlank()) {
            out.add(warning(function.range(), "Function has empty body"));
        }
    }

    /**
     * A bare name holding punctuation ({@code rule my-rule}), or followed by a word that is
     * neither a clause keyword nor an attribute ({@code rule My Rule}).
     */
    private static boolean needsQuotes(String headerLine) {
        Matcher matcher = BARE_RULE_NAME.matcher(headerLine.substring(0, CodeScanner.codeEnd(headerLine)));
        if (!matcher.find()) {
            return false;
        }
        String name = matcher.group(1);
        for (int i = 0; i < name.length(); i++) {
            if (!Character.isJavaIdentifierPart(name.charAt(i))) {
                return true;
            }
        }
        String next = matcher.group(2);
        return next != null && !next.startsWith("@") && !HEADER_FOLLOWERS.contains(next)
                && !DrlKeywords.RULE_ATTRIBUTES.contains(next);
    }

    private static Diagnostic error(Range range, String message) {
        return Diagnostic.error(range, message, DiagnosticSources.SEMANTIC);
    }

    private static Diagnostic warning(Range range, String message) {
        return Diagnostic.warning(range, message, DiagnosticSources.SEMANTIC);
    }
}
