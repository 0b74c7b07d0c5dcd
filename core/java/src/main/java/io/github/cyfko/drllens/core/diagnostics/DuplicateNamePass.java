package io.github.cyfko.drllens.core.diagnostics;

import io.github.cyfko.drllens.core.model.Diagnostic;
import io.github.cyfko.drllens.core.model.ImportNode;
import io.github.cyfko.drllens.core.model.Position;
import io.github.cyfko.drllens.core.spi.DiagnosticContext;
import io.github.cyfko.drllens.core.spi.DiagnosticPass;
import io.github.cyfko.drllens.core.spi.PassCategory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Flags rules, functions, queries and globals declared more than once, and repeated imports.
 * <p>
 * Only the second and later declarations are reported; the message points back at the first one
 * with a 1-based line number.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class DuplicateNamePass implements DiagnosticPass {

    @Override
    public String name() {
        return "duplicate-names";
    }

    @Override
    public PassCategory category() {
        return PassCategory.SEMANTIC;
    }

    @Override
    public List<Diagnostic> run(DiagnosticContext context) {
        List<Diagnostic> out = new ArrayList<>();
        var tree = context.tree();
        checkNames(context, tree.rules(), r -> r.name(), r -> r.range().start(), "Duplicate rule name", out);
        checkNames(context, tree.functions(), f -> f.name(), f -> f.range().start(), "Duplicate function name", out);
        checkNames(context, tree.queries(), q -> q.name(), q -> q.range().start(), "Duplicate query name", out);
        checkNames(context, tree.globals(), g -> g.name(), g -> g.range().start(), "Duplicate global variable", out);

        Set<String> seenImports = new HashSet<>();
        for (ImportNode node : tree.imports()) {
            String key = (node.staticImport() ? "static " : "") + (node.functionImport() ? "function " : "") + node.path();
            if (!seenImports.add(key)) {
                out.add(Diagnostic.warning(node.range(), "Duplicate import: \"" + node.path() + "\"", DiagnosticSources.SEMANTIC));
            }
        }
        return out;
    }

    private static <T> void checkNames(DiagnosticContext context, List<T> nodes, Function<T, String> nameOf,
                                       Function<T, Position> startOf, String label, List<Diagnostic> out) {
        Map<String, Position> firstSeen = new HashMap<>();
        for (T node : nodes) {
            String name = nameOf.apply(node);
            if (name == null || name.isBlank()) {
                continue;
            }
            Position start = startOf.apply(node);
            Position first = firstSeen.putIfAbsent(name, start);
            if (first != null) {
                out.add(Diagnostic.error(context.headerRange(start),
                        String.format("%s: \"%s\". First defined at line %d", label, name, first.line() + 1),
                        DiagnosticSources.SEMANTIC));
            }
        }
    }
}
