package io.github.cyfko.drllens.core.diagnostics;

import io.github.cyfko.drllens.core.model.ActionClause;
import io.github.cyfko.drllens.core.model.ConditionNode;
import io.github.cyfko.drllens.core.model.Diagnostic;
import io.github.cyfko.drllens.core.model.GlobalNode;
import io.github.cyfko.drllens.core.model.Position;
import io.github.cyfko.drllens.core.model.Range;
import io.github.cyfko.drllens.core.model.RuleNode;
import io.github.cyfko.drllens.core.parsing.CodeScanner;
import io.github.cyfko.drllens.core.spi.DiagnosticContext;
import io.github.cyfko.drllens.core.spi.DiagnosticPass;
import io.github.cyfko.drllens.core.spi.PassCategory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks that every {@code $variable} used in a rule's action code is bound by its conditions.
 * <p>
 * Bindings are the pattern variables ({@code $p : Person()}) and field bindings
 * ({@code Person( $age : age )}) found anywhere in the {@code when} clause, plus globals whose
 * name starts with {@code $}. String literals and comments of the action code are ignored.
 * Each undefined occurrence is reported at its own position.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class VariableCrossReferencePass implements DiagnosticPass {

    private static final Pattern BINDING = Pattern.compile("(\\$[A-Za-z_]\\w*)\\s*:(?!:)");

    @Override
    public String name() {
        return "variable-references";
    }

    @Override
    public PassCategory category() {
        return PassCategory.SEMANTIC;
    }

    @Override
    public List<Diagnostic> run(DiagnosticContext context) {
        Set<String> globals = new HashSet<>();
        for (GlobalNode global : context.tree().globals()) {
            globals.add(global.name());
        }
        List<Diagnostic> out = new ArrayList<>();
        for (RuleNode rule : context.tree().rules()) {
            if (rule.then() == null || rule.then().isEmpty()) {
                continue;
            }
            Set<String> declared = new HashSet<>(globals);
            for (ConditionNode condition : rule.conditions()) {
                if (condition.variable() != null) {
                    declared.add(condition.variable());
                }
                Matcher matcher = BINDING.matcher(condition.content());
                while (matcher.find()) {
                    declared.add(matcher.group(1));
                }
            }
            checkAction(rule.then(), declared, out);
        }
        return out;
    }

    private void checkAction(ActionClause action, Set<String> declared, List<Diagnostic> out) {
        String[] lines = action.text().split("\n", -1);
        CodeScanner scanner = new CodeScanner();
        int lineOffset = 0;
        for (String line : lines) {
            int base = lineOffset;
            List<int[]> references = new ArrayList<>();
            scanner.scan(line, (c, column) -> {
                if (c == '$' && (column == 0 || !Character.isJavaIdentifierPart(line.charAt(column - 1)))
                        && column + 1 < line.length() && Character.isJavaIdentifierStart(line.charAt(column + 1))
                        && line.charAt(column + 1) != '$') {
                    int end = column + 1;
                    while (end < line.length() && Character.isJavaIdentifierPart(line.charAt(end)) && line.charAt(end) != '$') {
                        end++;
                    }
                    references.add(new int[]{column, end});
                }
            });
            for (int[] reference : references) {
                String variable = line.substring(reference[0], reference[1]);
                if (!declared.contains(variable)) {
                    Position start = action.positionOf(base + reference[0]);
                    Range range = new Range(start, new Position(start.line(), start.character() + variable.length()));
                    out.add(Diagnostic.error(range, "Undefined variable: " + variable, DiagnosticSources.SEMANTIC));
                }
            }
            lineOffset += line.length() + 1;
        }
    }
}
