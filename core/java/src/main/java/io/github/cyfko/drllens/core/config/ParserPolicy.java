package io.github.cyfko.drllens.core.config;

/**
 * Resource limits applied by the DRL parser.
 * <p>
 * The parser is meant to run on every keystroke of an editor, so each limit bounds the work
 * or memory spent on a hostile or broken document instead of failing the parse.
 * </p>
 *
 * <h2>Limits</h2>
 * <ul>
 *   <li><b>maxErrors</b>: parse errors kept per parse; later ones are silently dropped</li>
 *   <li><b>maxNestingDepth</b>: nested {@code exists/not/eval/forall/collect/accumulate} regions
 *       tracked inside one condition</li>
 *   <li><b>maxDocumentLength</b>: characters accepted; longer documents get an empty tree and
 *       a single error</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ParserPolicy policy = ParserPolicy.builder()
 *     .maxErrors(20)
 *     .maxNestingDepth(10)
 *     .build();
 * DrlParser parser = new BasicDrlParser(policy);
 * }</pre>
 *
 * @param policyName        name of the preset this policy comes from
 * @param maxErrors         maximum number of parse errors kept
 * @param maxNestingDepth   maximum construct nesting depth
 * @param maxDocumentLength maximum document length in characters
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ParserPolicy(
        String policyName,
        int maxErrors,
        int maxNestingDepth,
        int maxDocumentLength
) {

    public ParserPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxErrors <= 0) {
            throw new IllegalArgumentException("maxErrors must be positive, got: " + maxErrors);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
        if (maxDocumentLength <= 0) {
            throw new IllegalArgumentException("maxDocumentLength must be positive, got: " + maxDocumentLength);
        }
    }

    /**
     * Editor-friendly defaults: 100 errors, depth 50, 5 000 000 characters.
     */
    public static ParserPolicy defaults() {
        return new ParserPolicy(PolicyName.DEFAULT_POLICY.name(), 100, 50, 5_000_000);
    }

    /**
     * Tight limits for untrusted input: 50 errors, depth 20, 1 000 000 characters.
     */
    public static ParserPolicy strict() {
        return new ParserPolicy(PolicyName.STRICT_POLICY.name(), 50, 20, 1_000_000);
    }

    /**
     * Generous limits for batch tooling: 1 000 errors, depth 100, 50 000 000 characters.
     */
    public static ParserPolicy relaxed() {
        return new ParserPolicy(PolicyName.RELAXED_POLICY.name(), 1000, 100, 50_000_000);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxErrors = 100;
        private int _maxNestingDepth = 50;
        private int _maxDocumentLength = 5_000_000;

        private Builder() {
        }

        public ParserPolicy build() {
            return new ParserPolicy(_policyName, _maxErrors, _maxNestingDepth, _maxDocumentLength);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxErrors(int maxErrors) { this._maxErrors = maxErrors; return this; }
        public Builder maxNestingDepth(int maxNestingDepth) { this._maxNestingDepth = maxNestingDepth; return this; }
        public Builder maxDocumentLength(int maxDocumentLength) { this._maxDocumentLength = maxDocumentLength; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
