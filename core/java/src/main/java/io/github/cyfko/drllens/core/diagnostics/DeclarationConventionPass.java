package io.github.cyfko.drllens.core.diagnostics;

import io.github.cyfko.drllens.core.model.Diagnostic;
import io.github.cyfko.drllens.core.model.GlobalNode;
import io.github.cyfko.drllens.core.model.ImportNode;
import io.github.cyfko.drllens.core.model.PackageNode;
import io.github.cyfko.drllens.core.spi.DiagnosticContext;
import io.github.cyfko.drllens.core.spi.DiagnosticPass;
import io.github.cyfko.drllens.core.spi.PassCategory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Checks the header declarations of a document against Java naming rules:
 * <ul>
 *   <li>package names are lowercase and dot-separated (warning);</li>
 *   <li>import paths are dotted identifiers, optionally ending with {@code .*} (error);</li>
 *   <li>globals have a type and a name (error), and the name is a Java identifier (warning).</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class DeclarationConventionPass implements DiagnosticPass {

    private static final Pattern PACKAGE_NAME = Pattern.compile("^[a-z][a-z0-9_]*(\\.[a-z][a-z0-9_]*)*$");
    private static final Pattern IMPORT_PATH = Pattern.compile("^[A-Za-z_]\\w*(\\.[A-Za-z_]\\w*)*(\\.\\*)?$");
    private static final Pattern VARIABLE_NAME = Pattern.compile("^[A-Za-z_$][\\w$]*$");

    @Override
    public String name() {
        return "declarations";
    }

    @Override
    public PassCategory category() {
        return PassCategory.SEMANTIC;
    }

    @Override
    public List<Diagnostic> run(DiagnosticContext context) {
        List<Diagnostic> out = new ArrayList<>();
        PackageNode packageNode = context.tree().packageNode();
        if (packageNode != null && !PACKAGE_NAME.matcher(packageNode.name()).matches()) {
            out.add(Diagnostic.warning(packageNode.range(),
                    "Package name should follow Java naming conventions (lowercase, dot-separated)", DiagnosticSources.SEMANTIC));
        }
        for (ImportNode node : context.tree().imports()) {
            if (!IMPORT_PATH.matcher(node.path()).matches()) {
                out.add(Diagnostic.error(node.range(), "Invalid import path: \"" + node.path() + "\"", DiagnosticSources.SEMANTIC));
            }
        }
        for (GlobalNode global : context.tree().globals()) {
            checkGlobal(global, out);
        }
        return out;
    }

    private void checkGlobal(GlobalNode global, List<Diagnostic> out) {
        if (global.type().isBlank()) {
            out.add(Diagnostic.error(global.range(), "Global variable must have a type", DiagnosticSources.SEMANTIC));
        }
        if (global.name().isBlank()) {
            out.add(Diagnostic.error(global.range(), "Global variable must have a name", DiagnosticSources.SEMANTIC));
        } else if (!VARIABLE_NAME.matcher(global.name()).matches()) {
            out.add(Diagnostic.warning(global.range(), "Global variable name should follow Java naming conventions",
                    DiagnosticSources.SEMANTIC));
        }
    }
}
