package io.github.cyfko.drllens.core.diagnostics;

import io.github.cyfko.drllens.core.model.Diagnostic;
import io.github.cyfko.drllens.core.model.DiagnosticSeverity;
import io.github.cyfko.drllens.core.model.GlobalNode;
import io.github.cyfko.drllens.core.model.Range;
import io.github.cyfko.drllens.core.model.SyntaxTree;
import io.github.cyfko.drllens.core.spi.DiagnosticContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.cyfko.drllens.core.diagnostics.PassFixture.messages;
import static io.github.cyfko.drllens.core.diagnostics.PassFixture.run;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the semantic passes: duplicate names, declaration conventions, structural
 * completeness, rule attributes and variable cross references.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("Semantic Passes Tests")
class SemanticPassesTest {

    // ==================== DuplicateNamePass ====================

    @Nested
    @DisplayName("DuplicateNamePass")
    class DuplicateNames {

        private final DuplicateNamePass pass = new DuplicateNamePass();

        @Test
        @DisplayName("Should flag every repeat after the first definition")
        void shouldFlagRepeats() {
            // Given
            String text = String.join("\n",
                    "rule \"A\" when then end",
                    "rule \"A\" when then end",
                    "rule \"A\" when then end");

            // When
            List<Diagnostic> diagnostics = run(pass, text);

            // Then
            assertEquals(2, diagnostics.size());
            assertEquals(1, diagnostics.get(0).range().start().line());
            assertEquals(2, diagnostics.get(1).range().start().line());
            assertTrue(diagnostics.stream().allMatch(d -> d.message().endsWith("First defined at line 1")));
        }

        @Test
        @DisplayName("Should check globals, functions and imports")
        void shouldCheckOtherConstructs() {
            // Given
            String text = String.join("\n",
                    "import java.util.List;",
                    "import java.util.List;",
                    "global java.util.List results;",
                    "global java.util.Set results;",
                    "function void log(String m) {",
                    "    System.out.println(m);",
                    "}",
                    "function void log(String m) {",
                    "    System.err.println(m);",
                    "}");

            // When
            List<String> found = messages(run(pass, text));

            // Then
            assertTrue(found.contains("Duplicate import: \"java.util.List\""));
            assertTrue(found.contains("Duplicate global variable: \"results\". First defined at line 3"));
            assertTrue(found.contains("Duplicate function name: \"log\". First defined at line 5"));
            assertEquals(3, found.size());
        }

        @Test
        @DisplayName("Should treat a static import as distinct from a plain one")
        void shouldDistinguishStaticImports() {
            String text = "import com.example.Util;\nimport static com.example.Util;";

            assertTrue(run(pass, text).isEmpty());
        }

        @Test
        @DisplayName("Should report nothing for distinct names")
        void shouldAcceptDistinctNames() {
            assertTrue(run(pass, "rule \"A\" when then end\nrule \"B\" when then end").isEmpty());
        }
    }

    // ==================== StructuralCompletenessPass ====================

    @Nested
    @DisplayName("StructuralCompletenessPass")
    class Structure {

        private final StructuralCompletenessPass pass = new StructuralCompletenessPass();

        @Test
        @DisplayName("Should require a when or then clause")
        void shouldRequireAClause() {
            List<Diagnostic> diagnostics = run(pass, "rule \"Bare\"\nend");

            assertEquals(List.of("Rule must have at least a when or then clause"), messages(diagnostics));
            assertEquals(DiagnosticSeverity.ERROR, diagnostics.get(0).severity());
            assertEquals(Range.of(0, 0, 0, 11), diagnostics.get(0).range());
        }

        @Test
        @DisplayName("Should warn about empty clauses")
        void shouldWarnAboutEmptyClauses() {
            List<Diagnostic> diagnostics = run(pass, "rule \"Hollow\"\nwhen\nthen\nend");

            assertEquals(List.of("When clause is empty", "Then clause is empty"), messages(diagnostics));
            assertTrue(diagnostics.stream().allMatch(d -> d.severity() == DiagnosticSeverity.WARNING));
        }

        @Test
        @DisplayName("Should warn about a missing then clause but accept a missing when clause")
        void shouldTreatMissingClausesDifferently() {
            assertEquals(List.of("Rule has no then clause"),
                    messages(run(pass, "rule \"NoThen\"\nwhen\n    Person()\nend")));
            assertTrue(run(pass, "rule \"NoWhen\"\nthen\n    System.out.println(1);\nend").isEmpty());
        }

        @Test
        @DisplayName("Should reject an empty eval")
        void shouldRejectEmptyEval() {
            String text = "rule \"E\"\nwhen\n    eval( )\nthen\n    System.out.println(1);\nend";

            List<Diagnostic> diagnostics = run(pass, text);

            assertEquals(List.of("Eval condition cannot be empty"), messages(diagnostics));
            assertEquals(2, diagnostics.get(0).range().start().line());
        }

        @Test
        @DisplayName("Should check functions and queries")
        void shouldCheckFunctionsAndQueries() {
            String text = "function void noop() {\n}\nquery \"nothing\"\nend";

            assertEquals(List.of("Function has empty body", "Query has no conditions"), messages(run(pass, text)));
        }

        @Test
        @DisplayName("Should report a function without a return type or a name")
        void shouldReportIncompleteFunctionHeaders() {
            assertEquals(List.of("Function must specify a return type"),
                    messages(run(pass, "function greet(String n) {\n    return;\n}")));
            assertEquals(List.of("Function must have a name"),
                    messages(run(pass, "function void (String n) {\n    return;\n}")));
        }

        @Test
        @DisplayName("Should report function parameters missing a name or a type")
        void shouldReportIncompleteParameters() {
            // Given
            String text = "function void f(String, , int b) {\n    return;\n}";

            // When
            List<Diagnostic> diagnostics = run(pass, text);

            // Then
            assertEquals(List.of("Function parameter must have a name", "Function parameter must have a name",
                    "Function parameter must have a type"), messages(diagnostics));
            assertEquals(Range.of(0, 16, 0, 22), diagnostics.get(0).range());
        }

        @Test
        @DisplayName("Should report a query and a declaration without a name")
        void shouldReportNamelessQueryAndDeclare() {
            assertEquals(List.of("Query must have a name"), messages(run(pass, "query\n    Person()\nend")));
            assertEquals(List.of("Declaration must have a name"), messages(run(pass, "declare\n    id : String\nend")));
        }

        @Test
        @DisplayName("Should report declared fields missing a name or a type")
        void shouldReportIncompleteFields() {
            List<Diagnostic> diagnostics = run(pass, "declare Item\n    : String\n    label :\nend");

            assertEquals(List.of("Field must have a name", "Field must have a type"), messages(diagnostics));
            assertEquals(Range.of(1, 4, 1, 12), diagnostics.get(0).range());
            assertTrue(diagnostics.stream().allMatch(d -> d.source().equals(DiagnosticSources.SYNTAX)));
        }

        @Test
        @DisplayName("Should suggest quoting a bare rule name with spaces or punctuation")
        void shouldSuggestQuotingRuleNames() {
            String advice = "Rule names with spaces or special characters should be quoted";

            assertTrue(messages(run(pass, "rule my-rule\nwhen\n    Person()\nthen\n    x();\nend")).contains(advice));
            assertTrue(messages(run(pass, "rule My Rule\nwhen\n    Person()\nthen\n    x();\nend")).contains(advice));
            assertTrue(run(pass, "rule Simple\nwhen\n    Person()\nthen\n    x();\nend").isEmpty());
            assertTrue(run(pass, "rule Simple salience 10\nwhen\n    Person()\nthen\n    x();\nend").isEmpty());
            assertTrue(run(pass, "rule Simple when Person() then x(); end").isEmpty());
        }
    }

    // ==================== DeclarationConventionPass ====================

    @Nested
    @DisplayName("DeclarationConventionPass")
    class DeclarationConventions {

        private final DeclarationConventionPass pass = new DeclarationConventionPass();

        @Test
        @DisplayName("Should warn about a package name that is not lowercase")
        void shouldCheckPackageName() {
            List<Diagnostic> diagnostics = run(pass, "package com.Example.Rules;");

            assertEquals(List.of("Package name should follow Java naming conventions (lowercase, dot-separated)"),
                    messages(diagnostics));
            assertEquals(DiagnosticSeverity.WARNING, diagnostics.get(0).severity());
            assertTrue(run(pass, "package com.example.rules_v2;").isEmpty());
        }

        @Test
        @DisplayName("Should reject malformed import paths")
        void shouldCheckImportPaths() {
            // Given
            String text = String.join("\n",
                    "import com..model.Person;",
                    "import com.example.*;",
                    "import static com.example.Util.format;",
                    "import com.example-model.Item;");

            // When
            List<Diagnostic> diagnostics = run(pass, text);

            // Then
            assertEquals(List.of("Invalid import path: \"com..model.Person\"", "Invalid import path: \"com.example-model.Item\""),
                    messages(diagnostics));
            assertTrue(diagnostics.stream().allMatch(d -> d.severity() == DiagnosticSeverity.ERROR));
            assertEquals(3, diagnostics.get(1).range().start().line());
        }

        @Test
        @DisplayName("Should check global names")
        void shouldCheckGlobals() {
            String text = "global java.util.List\nglobal java.util.List my-list;\nglobal java.util.List results;";

            assertEquals(List.of("Global variable must have a name", "Global variable name should follow Java naming conventions"),
                    messages(run(pass, text)));
        }

        @Test
        @DisplayName("Should require a global type")
        void shouldRequireGlobalType() {
            // Given
            Range range = Range.of(0, 0, 0, 14);
            SyntaxTree tree = SyntaxTree.builder().addGlobal(new GlobalNode("", "results", range)).build(range, 1);

            // When
            List<Diagnostic> diagnostics = pass.run(DiagnosticContext.of("global results", tree, List.of()));

            // Then
            assertEquals(List.of("Global variable must have a type"), messages(diagnostics));
        }
    }

    // ==================== RuleAttributePass ====================

    @Nested
    @DisplayName("RuleAttributePass")
    class Attributes {

        private final RuleAttributePass pass = new RuleAttributePass();

        private List<Diagnostic> withAttributes(String... attributes) {
            return run(pass, "rule \"R\"\n" + String.join("\n", attributes) + "\nwhen\nthen\nend");
        }

        @Test
        @DisplayName("Should accept well-formed attributes")
        void shouldAcceptValidAttributes() {
            assertTrue(withAttributes("salience -5", "no-loop", "lock-on-active false", "dialect \"mvel\"",
                    "agenda-group \"g\"").isEmpty());
        }

        @Test
        @DisplayName("Should accept a dynamic salience expression")
        void shouldAcceptDynamicSalience() {
            assertTrue(withAttributes("salience ($priority * 2)").isEmpty());
        }

        @Test
        @DisplayName("Should reject a non-numeric salience")
        void shouldRejectTextualSalience() {
            List<Diagnostic> diagnostics = withAttributes("salience high");

            assertEquals(List.of("Salience value must be a number"), messages(diagnostics));
            assertEquals(1, diagnostics.get(0).range().start().line());
        }

        @Test
        @DisplayName("Should reject a non-boolean value for a boolean attribute")
        void shouldRejectNonBoolean() {
            assertEquals(List.of("no-loop value must be true or false"), messages(withAttributes("no-loop yes")));
        }

        @Test
        @DisplayName("Should warn about unknown dialects, unknown attributes and repeats")
        void shouldWarnAboutQuestionableAttributes() {
            List<Diagnostic> diagnostics = withAttributes("dialect \"groovy\"", "priority 3", "enabled true", "enabled true");

            List<String> found = messages(diagnostics);
            assertEquals(3, found.size());
            assertEquals("Dialect should be \"java\" or \"mvel\"", found.get(0));
            assertTrue(found.get(1).startsWith("Unknown rule attribute: \"priority\". Valid attributes are: salience, no-loop"));
            assertEquals("Duplicate attribute \"enabled\"", found.get(2));
            assertTrue(diagnostics.stream().allMatch(d -> d.severity() == DiagnosticSeverity.WARNING));
        }
    }

    // ==================== VariableCrossReferencePass ====================

    @Nested
    @DisplayName("VariableCrossReferencePass")
    class VariableReferences {

        private final VariableCrossReferencePass pass = new VariableCrossReferencePass();

        @Test
        @DisplayName("Should accept variables bound by patterns and nested bindings")
        void shouldAcceptDeclaredVariables() {
            String text = String.join("\n",
                    "rule \"R\"",
                    "when",
                    "    $p : Person( $age : age > 18 )",
                    "then",
                    "    audit.add($p.getName() + $age);",
                    "end");

            assertTrue(run(pass, text).isEmpty());
        }

        @Test
        @DisplayName("Should ignore variables inside strings and comments")
        void shouldIgnoreStringsAndComments() {
            String text = String.join("\n",
                    "rule \"R\"",
                    "when",
                    "    Person()",
                    "then",
                    "    System.out.println(\"costs $5 or $ghost\"); // $other",
                    "    /* $hidden */",
                    "end");

            assertTrue(run(pass, text).isEmpty());
        }

        @Test
        @DisplayName("Should report each undefined occurrence at its position")
        void shouldReportEachOccurrence() {
            String text = String.join("\n",
                    "rule \"R\"",
                    "when",
                    "    $p : Person()",
                    "then",
                    "    $q.run();",
                    "    $p.use($q);",
                    "end");

            List<Diagnostic> diagnostics = run(pass, text);

            assertEquals(2, diagnostics.size());
            assertEquals(Range.of(4, 4, 4, 6), diagnostics.get(0).range());
            assertEquals(Range.of(5, 11, 5, 13), diagnostics.get(1).range());
            assertEquals("Undefined variable: $q", diagnostics.get(1).message());
        }

        @Test
        @DisplayName("Should not carry bindings from one rule to another")
        void shouldScopeBindingsPerRule() {
            String text = String.join("\n",
                    "rule \"A\" when $p : Person() then use($p); end",
                    "rule \"B\" when Person() then use($p); end");

            List<Diagnostic> diagnostics = run(pass, text);

            assertEquals(1, diagnostics.size());
            assertEquals(1, diagnostics.get(0).range().start().line());
        }
    }
}
