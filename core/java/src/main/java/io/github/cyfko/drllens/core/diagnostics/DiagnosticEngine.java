package io.github.cyfko.drllens.core.diagnostics;

import io.github.cyfko.drllens.core.api.DiagnosticProvider;
import io.github.cyfko.drllens.core.config.DiagnosticSettings;
import io.github.cyfko.drllens.core.model.Diagnostic;
import io.github.cyfko.drllens.core.model.ParseError;
import io.github.cyfko.drllens.core.model.Range;
import io.github.cyfko.drllens.core.model.SyntaxTree;
import io.github.cyfko.drllens.core.spi.DiagnosticContext;
import io.github.cyfko.drllens.core.spi.DiagnosticPass;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the diagnostic passes over a parsed document.
 *
 * <h2>Pass order</h2>
 * <ol>
 *   <li>{@link ParseErrorPass} (always enabled)</li>
 *   <li>{@link DuplicateNamePass}</li>
 *   <li>{@link DeclarationConventionPass}</li>
 *   <li>{@link StructuralCompletenessPass}</li>
 *   <li>{@link RuleAttributePass}</li>
 *   <li>{@link VariableCrossReferencePass}</li>
 *   <li>{@link BracketBalancePass}</li>
 *   <li>{@link MultiLinePatternPass}</li>
 *   <li>{@link StylePass}</li>
 *   <li>additional passes, in registration order</li>
 * </ol>
 * <p>
 * Passes whose category is switched off by the {@link DiagnosticSettings} are skipped. The
 * output is capped at {@code maxProblems}, keeping diagnostics in pass order. A pass that throws
 * is reported as one warning and the remaining passes still run.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * DrlParser parser = new BasicDrlParser();
 * DiagnosticProvider engine = new DiagnosticEngine(DiagnosticSettings.defaults());
 *
 * ParseResult parsed = parser.parse(text);
 * List<Diagnostic> problems = engine.diagnose(text, parsed);
 * }</pre>
 *
 * <p>Instances are immutable and can be shared between threads.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class DiagnosticEngine implements DiagnosticProvider {

    private static final Logger log = Logger.getLogger(DiagnosticEngine.class.getName());

    private final DiagnosticSettings settings;
    private final List<DiagnosticPass> passes;

    public DiagnosticEngine() {
        this(DiagnosticSettings.defaults());
    }

    public DiagnosticEngine(DiagnosticSettings settings) {
        this(settings, List.of());
    }

    /**
     * @param settings         category switches and output cap
     * @param additionalPasses passes run after the built-in ones
     */
    public DiagnosticEngine(DiagnosticSettings settings, List<DiagnosticPass> additionalPasses) {
        if (settings == null) {
            throw new IllegalArgumentException("Diagnostic settings are required");
        }
        Objects.requireNonNull(additionalPasses, "additionalPasses is required");
        this.settings = settings;
        List<DiagnosticPass> all = new ArrayList<>(builtInPasses());
        all.addAll(additionalPasses);
        this.passes = List.copyOf(all);
    }

    /**
     * The built-in passes in execution order.
     */
    public static List<DiagnosticPass> builtInPasses() {
        return List.of(
                new ParseErrorPass(),
                new DuplicateNamePass(),
                new DeclarationConventionPass(),
                new StructuralCompletenessPass(),
                new RuleAttributePass(),
                new VariableCrossReferencePass(),
                new BracketBalancePass(),
                new MultiLinePatternPass(),
                new StylePass());
    }

    public DiagnosticSettings settings() {
        return settings;
    }

    public List<DiagnosticPass> passes() {
        return passes;
    }

    @Override
    public List<Diagnostic> diagnose(String text, SyntaxTree tree, List<ParseError> parseErrors) {
        int max = settings.maxProblems();
        if (max == 0) {
            return List.of();
        }
        DiagnosticContext context = DiagnosticContext.of(text, tree, parseErrors);
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (DiagnosticPass pass : passes) {
            if (diagnostics.size() >= max) {
                break;
            }
            if (!pass.category().isEnabled(settings)) {
                continue;
            }
            diagnostics.addAll(runPass(pass, context));
        }
        int produced = diagnostics.size();
        List<Diagnostic> result = produced > max ? List.copyOf(diagnostics.subList(0, max)) : List.copyOf(diagnostics);
        log.fine(() -> String.format("Computed %d diagnostics (%d before cap) over %d lines",
                result.size(), produced, context.lines().size()));
        return result;
    }

    private List<Diagnostic> runPass(DiagnosticPass pass, DiagnosticContext context) {
        try {
            List<Diagnostic> found = pass.run(context);
            return found == null ? List.of() : found;
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Diagnostic pass '" + pass.name() + "' failed", e);
            return List.of(Diagnostic.warning(Range.of(0, 0, 0, 0),
                    "Internal error in " + pass.name() + ": " + e.getMessage(), DiagnosticSources.ENGINE));
        }
    }
}
