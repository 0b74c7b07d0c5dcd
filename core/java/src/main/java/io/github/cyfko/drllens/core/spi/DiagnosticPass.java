package io.github.cyfko.drllens.core.spi;

import io.github.cyfko.drllens.core.model.Diagnostic;

import java.util.List;

/**
 * One independent check of the diagnostic engine.
 * <p>
 * A pass reads the {@link DiagnosticContext} and returns its own findings; it never sees the
 * output of other passes. Passes run in registration order, which is also the order kept when
 * the engine truncates its output.
 * </p>
 *
 * <h3>Example Implementation:</h3>
 * <pre>{@code
 * public class NoTodoInActionsPass implements DiagnosticPass {
 *     public String name() { return "no-todo"; }
 *     public PassCategory category() { return PassCategory.STYLE; }
 *     public List<Diagnostic> run(DiagnosticContext context) {
 *         return context.tree().rules().stream()
 *             .filter(rule -> rule.then() != null && rule.then().text().contains("TODO"))
 *             .map(rule -> Diagnostic.information(rule.then().range(), "Unfinished action", "team-rules"))
 *             .toList();
 *     }
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface DiagnosticPass {

    /**
     * Short identifier used in logs and internal error reports.
     */
    String name();

    PassCategory category();

    /**
     * Runs the check.
     *
     * @param context the document under analysis
     * @return the findings in document order, never {@code null}
     */
    List<Diagnostic> run(DiagnosticContext context);
}
