package io.github.cyfko.drllens.core.spi;

import io.github.cyfko.drllens.core.config.DiagnosticSettings;

/**
 * Category of a {@link DiagnosticPass}, switched on and off by {@link DiagnosticSettings}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum PassCategory {
    /** Translation of parse errors; always enabled. */
    PARSE,
    SYNTAX,
    SEMANTIC,
    STYLE;

    public boolean isEnabled(DiagnosticSettings settings) {
        return switch (this) {
            case PARSE -> true;
            case SYNTAX -> settings.enableSyntaxChecks();
            case SEMANTIC -> settings.enableSemanticChecks();
            case STYLE -> settings.enableStyleWarnings();
        };
    }
}
