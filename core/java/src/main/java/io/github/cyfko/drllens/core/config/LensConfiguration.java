package io.github.cyfko.drllens.core.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Parser policy and diagnostic settings read from {@code java.util.Properties}.
 * <p>
 * Missing keys keep their default value; malformed values are rejected with an
 * {@link IllegalArgumentException} naming the key.
 * </p>
 *
 * <h2>Keys</h2>
 * <pre>
 * drl-lens.parser.max-errors=100
 * drl-lens.parser.max-nesting-depth=50
 * drl-lens.parser.max-document-length=5000000
 * drl-lens.diagnostics.max-problems=100
 * drl-lens.diagnostics.enable-syntax-checks=true
 * drl-lens.diagnostics.enable-semantic-checks=true
 * drl-lens.diagnostics.enable-style-warnings=true
 * </pre>
 *
 * @param parserPolicy       limits for the parser
 * @param diagnosticSettings switches for the diagnostic engine
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record LensConfiguration(ParserPolicy parserPolicy, DiagnosticSettings diagnosticSettings) {

    public static final String PREFIX = "drl-lens.";
    public static final String MAX_ERRORS = PREFIX + "parser.max-errors";
    public static final String MAX_NESTING_DEPTH = PREFIX + "parser.max-nesting-depth";
    public static final String MAX_DOCUMENT_LENGTH = PREFIX + "parser.max-document-length";
    public static final String MAX_PROBLEMS = PREFIX + "diagnostics.max-problems";
    public static final String ENABLE_SYNTAX_CHECKS = PREFIX + "diagnostics.enable-syntax-checks";
    public static final String ENABLE_SEMANTIC_CHECKS = PREFIX + "diagnostics.enable-semantic-checks";
    public static final String ENABLE_STYLE_WARNINGS = PREFIX + "diagnostics.enable-style-warnings";

    public LensConfiguration {
        Objects.requireNonNull(parserPolicy, "parserPolicy is required");
        Objects.requireNonNull(diagnosticSettings, "diagnosticSettings is required");
    }

    public static LensConfiguration defaults() {
        return new LensConfiguration(ParserPolicy.defaults(), DiagnosticSettings.defaults());
    }

    /**
     * Builds a configuration from {@code properties}.
     */
    public static LensConfiguration from(Properties properties) {
        Objects.requireNonNull(properties, "properties is required");
        ParserPolicy defaults = ParserPolicy.defaults();
        ParserPolicy policy = ParserPolicy.builder()
                .policyName(ParserPolicy.PolicyName.CUSTOM_POLICY.name())
                .maxErrors(intValue(properties, MAX_ERRORS, defaults.maxErrors()))
                .maxNestingDepth(intValue(properties, MAX_NESTING_DEPTH, defaults.maxNestingDepth()))
                .maxDocumentLength(intValue(properties, MAX_DOCUMENT_LENGTH, defaults.maxDocumentLength()))
                .build();
        DiagnosticSettings settings = DiagnosticSettings.builder()
                .maxProblems(intValue(properties, MAX_PROBLEMS, DiagnosticSettings.DEFAULT_MAX_PROBLEMS))
                .enableSyntaxChecks(booleanValue(properties, ENABLE_SYNTAX_CHECKS))
                .enableSemanticChecks(booleanValue(properties, ENABLE_SEMANTIC_CHECKS))
                .enableStyleWarnings(booleanValue(properties, ENABLE_STYLE_WARNINGS))
                .build();
        return new LensConfiguration(policy, settings);
    }

    /**
     * Loads a properties file from the class path of this library.
     *
     * @param resource absolute resource name, e.g. {@code /drl-lens.properties}
     * @return the configuration, or {@link #defaults()} when the resource does not exist
     * @throws UncheckedIOException when the resource exists but cannot be read
     */
    public static LensConfiguration fromClasspath(String resource) {
        try (InputStream in = LensConfiguration.class.getResourceAsStream(resource)) {
            if (in == null) {
                return defaults();
            }
            Properties properties = new Properties();
            properties.load(in);
            return from(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read configuration resource " + resource, e);
        }
    }

    private static int intValue(Properties properties, String key, int fallback) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " must be an integer, got: " + raw, e);
        }
    }

    private static boolean booleanValue(Properties properties, String key) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return true;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "true" -> true;
            case "false" -> false;
            default -> throw new IllegalArgumentException("Property " + key + " must be true or false, got: " + raw);
        };
    }
}
