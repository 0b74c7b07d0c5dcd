package io.github.cyfko.drllens.core.diagnostics;

/**
 * Source tags attached to diagnostics, one per family of checks.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class DiagnosticSources {

    private DiagnosticSources() {
    }

    public static final String PARSER = "drools-parser";
    public static final String SEMANTIC = "drools-semantic";
    public static final String SYNTAX = "drools-syntax";
    public static final String MULTILINE = "drools-multiline";
    public static final String BEST_PRACTICE = "drools-best-practice";
    public static final String PERFORMANCE = "drools-performance";

    /** Reports a pass that failed internally. */
    public static final String ENGINE = "drools-engine";
}
