package io.github.cyfko.drllens.core.diagnostics;

import io.github.cyfko.drllens.core.model.Diagnostic;
import io.github.cyfko.drllens.core.model.DiagnosticSeverity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static io.github.cyfko.drllens.core.diagnostics.PassFixture.messages;
import static io.github.cyfko.drllens.core.diagnostics.PassFixture.run;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link StylePass}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("StylePass Tests")
class StylePassTest {

    private StylePass pass;

    @BeforeEach
    void setUp() {
        pass = new StylePass();
    }

    @Test
    @DisplayName("Should suggest salience when several rules have none")
    void shouldSuggestSalience() {
        // Given
        String text = "rule \"A\" when then end\nrule \"B\" when then end";

        // When
        List<Diagnostic> diagnostics = run(pass, text);

        // Then
        assertEquals(List.of("Multiple rules defined but none specify salience; firing order is not guaranteed"),
                messages(diagnostics));
        assertEquals(0, diagnostics.get(0).range().start().line());
        assertEquals(DiagnosticSources.BEST_PRACTICE, diagnostics.get(0).source());
    }

    @Test
    @DisplayName("Should suggest no-loop for rules modifying working memory")
    void shouldSuggestNoLoop() {
        String modifying = "rule \"M\"\nwhen\n    $p : Person()\nthen\n    update($p);\nend";
        String guarded = "rule \"M\"\nlock-on-active\nwhen\n    $p : Person()\nthen\n    update($p);\nend";

        assertEquals(List.of("Consider adding no-loop attribute to prevent infinite rule execution"),
                messages(run(pass, modifying)));
        assertTrue(run(pass, guarded).isEmpty());
    }

    @Test
    @DisplayName("Should flag very long rule names")
    void shouldFlagLongNames() {
        String name = "x".repeat(StylePass.MAX_RULE_NAME_LENGTH + 1);

        List<String> found = messages(run(pass, "rule \"" + name + "\" when then end"));

        assertEquals(List.of("Rule name is very long (101 characters)"), found);
    }

    @Test
    @DisplayName("Should report performance concerns")
    void shouldReportPerformanceConcerns() {
        // Given
        String conditions = IntStream.rangeClosed(1, 11)
                .mapToObj(i -> "    Fact" + i + "()")
                .collect(Collectors.joining("\n"));
        String text = "rule \"Big\"\nwhen\n" + conditions + "\n    eval( true )\nthen\nend";

        // When
        List<Diagnostic> diagnostics = run(pass, text);

        // Then
        assertEquals(List.of("Rule has 12 conditions; consider splitting it into smaller rules",
                "eval() prevents indexing; prefer constraints on fact patterns"), messages(diagnostics));
        assertTrue(diagnostics.stream().allMatch(d -> d.source().equals(DiagnosticSources.PERFORMANCE)));
        assertEquals(13, diagnostics.get(1).range().start().line());
    }

    @Test
    @DisplayName("Should report unused globals and missing semicolons")
    void shouldReportDeclarationHygiene() {
        // Given
        String text = String.join("\n",
                "package com.example",
                "import java.util.List",
                "global java.util.List audit;",
                "global java.util.List results",
                "rule \"R\"",
                "when",
                "    Person()",
                "then",
                "    results.add(1);",
                "end");

        // When
        List<Diagnostic> diagnostics = run(pass, text);

        // Then
        assertEquals(List.of(
                "Global variable \"audit\" is declared but never used",
                "Package declaration should end with a semicolon",
                "Import statement should end with a semicolon",
                "Global declaration should end with a semicolon"), messages(diagnostics));
        assertTrue(diagnostics.stream().allMatch(d -> d.severity() == DiagnosticSeverity.INFORMATION));
    }

    @Test
    @DisplayName("Should count a global referenced only from a function as used")
    void shouldSeeUsagesInFunctions() {
        String text = "global java.util.List audit;\nfunction void log(String m) {\n    audit.add(m);\n}";

        assertTrue(run(pass, text).isEmpty());
    }
}
