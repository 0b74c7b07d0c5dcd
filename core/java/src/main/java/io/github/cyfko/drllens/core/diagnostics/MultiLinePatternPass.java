package io.github.cyfko.drllens.core.diagnostics;

import io.github.cyfko.drllens.core.model.ConditionKind;
import io.github.cyfko.drllens.core.model.ConditionNode;
import io.github.cyfko.drllens.core.model.Diagnostic;
import io.github.cyfko.drllens.core.model.PatternRegion;
import io.github.cyfko.drllens.core.parsing.CodeScanner;
import io.github.cyfko.drllens.core.spi.DiagnosticContext;
import io.github.cyfko.drllens.core.spi.DiagnosticPass;
import io.github.cyfko.drllens.core.spi.PassCategory;
import io.github.cyfko.drllens.core.utils.TextUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Checks the construct regions of conditions: empty {@code exists( )}-style bodies, malformed
 * {@code accumulate} bodies and deeply nested constructs.
 * <p>
 * An {@code accumulate} body either uses the {@code init}/{@code action}/{@code result} form
 * ({@code init( ... )} or {@code init: ...}), with all three clauses, or separates its source
 * pattern from the accumulate function with a top-level {@code ,} or {@code ;}.
 * </p>
 * <p>
 * Empty {@code eval( )} is left to {@link StructuralCompletenessPass}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class MultiLinePatternPass implements DiagnosticPass {

    /** Nesting deeper than this gets a readability hint. */
    public static final int NESTING_HINT_THRESHOLD = 3;

    private static final Pattern INIT_CLAUSE = Pattern.compile("\\binit\\s*[:(]");
    private static final Pattern ACTION_CLAUSE = Pattern.compile("\\baction\\s*[:(]");
    private static final Pattern RESULT_CLAUSE = Pattern.compile("\\bresult\\s*[:(]");

    @Override
    public String name() {
        return "multiline-patterns";
    }

    @Override
    public PassCategory category() {
        return PassCategory.SYNTAX;
    }

    @Override
    public List<Diagnostic> run(DiagnosticContext context) {
        List<Diagnostic> out = new ArrayList<>();
        context.allConditions().forEach(condition -> check(context, condition, out));
        return out;
    }

    private void check(DiagnosticContext context, ConditionNode condition, List<Diagnostic> out) {
        for (PatternRegion region : condition.regions()) {
            if (!region.complete() || region.keyword().equals(ConditionKind.EVAL.keyword())) {
                continue;
            }
            String body = TextUtils.constructBody(region.keyword(), context.textOf(region.range()));
            if (body.isBlank()) {
                out.add(Diagnostic.warning(region.range(), "Empty " + region.keyword() + " pattern", DiagnosticSources.MULTILINE));
            } else if (region.keyword().equals(ConditionKind.ACCUMULATE.keyword()) && !isWellFormedAccumulate(body)) {
                out.add(Diagnostic.error(region.range(), "accumulate pattern must contain init:, action:, and result: clauses",
                        DiagnosticSources.MULTILINE));
            }
        }
        if (condition.nestingDepth() > NESTING_HINT_THRESHOLD) {
            out.add(Diagnostic.information(condition.range(),
                    String.format("Pattern nesting depth of %d; consider splitting the condition", condition.nestingDepth()),
                    DiagnosticSources.MULTILINE));
        }
    }

    private static boolean isWellFormedAccumulate(String body) {
        boolean init = INIT_CLAUSE.matcher(body).find();
        boolean action = ACTION_CLAUSE.matcher(body).find();
        boolean result = RESULT_CLAUSE.matcher(body).find();
        if (init || action || result) {
            return init && action && result;
        }
        CodeScanner scanner = new CodeScanner();
        int[] depth = {0};
        boolean[] separated = {false};
        for (String line : body.split("\n", -1)) {
            scanner.scan(line, (c, column) -> {
                switch (c) {
                    case '(', '[', '{' -> depth[0]++;
                    case ')', ']', '}' -> depth[0]--;
                    case ',', ';' -> separated[0] |= depth[0] == 0;
                    default -> { }
                }
            });
        }
        return separated[0];
    }
}
