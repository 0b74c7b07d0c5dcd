package io.github.cyfko.drllens.core.diagnostics;

import io.github.cyfko.drllens.core.config.DrlKeywords;
import io.github.cyfko.drllens.core.model.Diagnostic;
import io.github.cyfko.drllens.core.model.RuleAttribute;
import io.github.cyfko.drllens.core.model.RuleNode;
import io.github.cyfko.drllens.core.spi.DiagnosticContext;
import io.github.cyfko.drllens.core.spi.DiagnosticPass;
import io.github.cyfko.drllens.core.spi.PassCategory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validates rule attribute names and values.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class RuleAttributePass implements DiagnosticPass {

    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
    private static final String VALID_ATTRIBUTES = String.join(", ", DrlKeywords.RULE_ATTRIBUTES);

    @Override
    public String name() {
        return "rule-attributes";
    }

    @Override
    public PassCategory category() {
        return PassCategory.SEMANTIC;
    }

    @Override
    public List<Diagnostic> run(DiagnosticContext context) {
        List<Diagnostic> out = new ArrayList<>();
        for (RuleNode rule : context.tree().rules()) {
            Set<String> seen = new HashSet<>();
            for (RuleAttribute attribute : rule.attributes()) {
                if (!seen.add(attribute.name())) {
                    out.add(Diagnostic.warning(attribute.range(),
                            "Duplicate attribute \"" + attribute.name() + "\"", DiagnosticSources.SEMANTIC));
                }
                check(attribute, out);
            }
        }
        return out;
    }

    private void check(RuleAttribute attribute, List<Diagnostic> out) {
        String name = attribute.name();
        String value = attribute.unquotedValue();
        if (!DrlKeywords.RULE_ATTRIBUTES.contains(name)) {
            out.add(Diagnostic.warning(attribute.range(),
                    "Unknown rule attribute: \"" + name + "\". Valid attributes are: " + VALID_ATTRIBUTES,
                    DiagnosticSources.SEMANTIC));
            return;
        }
        if (name.equals("salience")) {
            // Dynamic salience is written as a parenthesised expression
            if (value == null || !(INTEGER.matcher(value).matches() || value.startsWith("("))) {
                out.add(Diagnostic.error(attribute.range(), "Salience value must be a number", DiagnosticSources.SEMANTIC));
            }
        } else if (DrlKeywords.BOOLEAN_ATTRIBUTES.contains(name)) {
            if (value != null && !value.equals("true") && !value.equals("false")) {
                out.add(Diagnostic.error(attribute.range(), name + " value must be true or false", DiagnosticSources.SEMANTIC));
            }
        } else if (name.equals("dialect")) {
            if (value == null || !DrlKeywords.DIALECTS.contains(value.toLowerCase(Locale.ROOT))) {
                out.add(Diagnostic.warning(attribute.range(), "Dialect should be \"java\" or \"mvel\"", DiagnosticSources.SEMANTIC));
            }
        }
    }
}
