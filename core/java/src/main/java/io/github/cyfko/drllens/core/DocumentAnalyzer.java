package io.github.cyfko.drllens.core;

import io.github.cyfko.drllens.core.api.DiagnosticProvider;
import io.github.cyfko.drllens.core.api.DrlParser;
import io.github.cyfko.drllens.core.config.LensConfiguration;
import io.github.cyfko.drllens.core.diagnostics.DiagnosticEngine;
import io.github.cyfko.drllens.core.impl.BasicDrlParser;
import io.github.cyfko.drllens.core.model.AnalysisResult;
import io.github.cyfko.drllens.core.model.ChangedRange;
import io.github.cyfko.drllens.core.model.Diagnostic;
import io.github.cyfko.drllens.core.model.IncrementalParseRequest;
import io.github.cyfko.drllens.core.model.ParseResult;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Entry point combining parsing and diagnostics.
 * <p>
 * Each call parses the text (fully or incrementally), runs the diagnostic passes over the
 * resulting tree and returns both. Nothing is cached between calls: the caller keeps the previous
 * {@link AnalysisResult} and hands it back to {@link #reanalyze}.
 * </p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * DocumentAnalyzer analyzer = DocumentAnalyzer.of(LensConfiguration.fromClasspath("drl-lens.properties"));
 *
 * AnalysisResult first = analyzer.analyze(text);
 * first.diagnostics().forEach(d -> System.out.println(d.range().start() + " " + d.message()));
 *
 * // after the user typed "x" at offset 120
 * AnalysisResult next = analyzer.reanalyze(editedText, first, new ChangedRange(120, 121));
 * }</pre>
 *
 * <p><strong>Error Handling:</strong> malformed documents never throw; problems are reported as
 * {@link Diagnostic}s. Only invalid configuration raises {@link IllegalArgumentException}.</p>
 *
 * <p>Instances are immutable and thread-safe; calls for the same document must be serialized by
 * the caller.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class DocumentAnalyzer {

    private static final Logger log = Logger.getLogger(DocumentAnalyzer.class.getName());

    private final DrlParser parser;
    private final DiagnosticProvider diagnosticProvider;

    public DocumentAnalyzer(DrlParser parser, DiagnosticProvider diagnosticProvider) {
        this.parser = Objects.requireNonNull(parser, "parser is required");
        this.diagnosticProvider = Objects.requireNonNull(diagnosticProvider, "diagnosticProvider is required");
    }

    /**
     * Analyzer with default policy and settings.
     */
    public static DocumentAnalyzer create() {
        return of(LensConfiguration.defaults());
    }

    public static DocumentAnalyzer of(LensConfiguration configuration) {
        Objects.requireNonNull(configuration, "configuration is required");
        return new DocumentAnalyzer(new BasicDrlParser(configuration.parserPolicy()),
                new DiagnosticEngine(configuration.diagnosticSettings()));
    }

    public AnalysisResult analyze(String text) {
        long start = System.nanoTime();
        ParseResult parsed = parser.parse(text);
        return finish(text, parsed, start, "full");
    }

    /**
     * Analyzes {@code text} reusing the tree of {@code previous} outside the changed ranges.
     *
     * @param text          the edited document
     * @param previous      result for the text before the edit
     * @param changedRanges edited regions, as offsets into {@code text}
     */
    public AnalysisResult reanalyze(String text, AnalysisResult previous, ChangedRange... changedRanges) {
        if (previous == null) {
            return analyze(text);
        }
        long start = System.nanoTime();
        ParseResult parsed = parser.parse(text, IncrementalParseRequest.of(previous.parseResult(), changedRanges));
        return finish(text, parsed, start, "incremental");
    }

    private AnalysisResult finish(String text, ParseResult parsed, long start, String mode) {
        List<Diagnostic> diagnostics = diagnosticProvider.diagnose(text, parsed);
        AnalysisResult result = new AnalysisResult(parsed, diagnostics);
        log.fine(() -> String.format("Analyzed document (%s): %d rules, %d parse errors, %d diagnostics in %d us",
                mode, parsed.tree().rules().size(), parsed.errors().size(), diagnostics.size(),
                (System.nanoTime() - start) / 1000));
        return result;
    }
}
