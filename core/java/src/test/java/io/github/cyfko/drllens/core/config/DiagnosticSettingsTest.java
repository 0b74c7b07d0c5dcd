package io.github.cyfko.drllens.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DiagnosticSettings}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("DiagnosticSettings Tests")
class DiagnosticSettingsTest {

    @Test
    @DisplayName("Should enable every category by default")
    void shouldEnableEverythingByDefault() {
        DiagnosticSettings settings = DiagnosticSettings.defaults();

        assertEquals(DiagnosticSettings.DEFAULT_MAX_PROBLEMS, settings.maxProblems());
        assertTrue(settings.enableSyntaxChecks());
        assertTrue(settings.enableSemanticChecks());
        assertTrue(settings.enableStyleWarnings());
        assertEquals(settings, DiagnosticSettings.builder().build());
    }

    @Test
    @DisplayName("Should accept zero problems and reject a negative cap")
    void shouldValidateCap() {
        assertEquals(0, DiagnosticSettings.builder().maxProblems(0).build().maxProblems());
        assertThrows(IllegalArgumentException.class, () -> DiagnosticSettings.builder().maxProblems(-1).build());
    }
}
