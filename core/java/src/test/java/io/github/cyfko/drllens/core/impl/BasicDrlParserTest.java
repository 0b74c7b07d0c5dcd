package io.github.cyfko.drllens.core.impl;

import io.github.cyfko.drllens.core.DrlFixtures;
import io.github.cyfko.drllens.core.config.ParserPolicy;
import io.github.cyfko.drllens.core.exception.DrlSyntaxException;
import io.github.cyfko.drllens.core.model.ConditionKind;
import io.github.cyfko.drllens.core.model.ConditionNode;
import io.github.cyfko.drllens.core.model.ConstraintNode;
import io.github.cyfko.drllens.core.model.DeclareNode;
import io.github.cyfko.drllens.core.model.FunctionNode;
import io.github.cyfko.drllens.core.model.ParseError;
import io.github.cyfko.drllens.core.model.ParseResult;
import io.github.cyfko.drllens.core.model.ParseSeverity;
import io.github.cyfko.drllens.core.model.Position;
import io.github.cyfko.drllens.core.model.QueryNode;
import io.github.cyfko.drllens.core.model.Range;
import io.github.cyfko.drllens.core.model.RuleNode;
import io.github.cyfko.drllens.core.model.SyntaxTree;
import io.github.cyfko.drllens.core.parsing.DocumentParser;
import io.github.cyfko.drllens.core.parsing.ParseCursor;
import io.github.cyfko.drllens.core.parsing.ParseSession;
import io.github.cyfko.drllens.core.parsing.SourceLines;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link BasicDrlParser}: construct recognition, recovery from malformed input and
 * policy limits.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("BasicDrlParser Tests")
class BasicDrlParserTest {

    private BasicDrlParser parser;

    @BeforeEach
    void setUp() {
        parser = new BasicDrlParser();
    }

    private static List<String> messages(ParseResult result) {
        return result.errors().stream().map(ParseError::message).toList();
    }

    @Nested
    @DisplayName("Complete documents")
    class CompleteDocuments {

        private SyntaxTree tree;

        @BeforeEach
        void parseFixture() {
            ParseResult result = parser.parse(DrlFixtures.load("complete.drl"));
            assertTrue(result.errors().isEmpty(), () -> "Unexpected errors: " + result.errors());
            tree = result.tree();
        }

        @Test
        @DisplayName("Should read package, imports and globals")
        void shouldReadDeclarations() {
            assertEquals("com.example.rules", tree.packageNode().name());
            assertEquals(3, tree.imports().size());
            assertEquals("com.example.model.Person", tree.imports().get(0).path());
            assertTrue(tree.imports().get(2).staticImport());
            assertEquals("results", tree.globals().get(0).name());
            assertEquals("java.util.List", tree.globals().get(0).type());
        }

        @Test
        @DisplayName("Should read a function with its parameters and body")
        void shouldReadFunction() {
            FunctionNode function = tree.functions().get(0);

            assertEquals("greet", function.name());
            assertEquals("String", function.returnType());
            assertEquals(List.of("name", "times"), function.parameters().stream().map(p -> p.name()).toList());
            assertEquals("int", function.parameters().get(1).type());
            assertEquals("return \"Hello \" + name;", function.body());
            assertEquals(Range.of(8, 0, 10, 1), function.range());
        }

        @Test
        @DisplayName("Should read a declaration with its fields")
        void shouldReadDeclare() {
            DeclareNode declare = tree.declares().get(0);

            assertEquals("Customer", declare.name());
            assertEquals("Person", declare.superType());
            assertEquals(2, declare.fields().size());
            assertEquals("id", declare.fields().get(0).name());
            assertEquals("String", declare.fields().get(0).type());
            assertEquals("int", declare.fields().get(1).type());
        }

        @Test
        @DisplayName("Should read a query with parameters and conditions")
        void shouldReadQuery() {
            QueryNode query = tree.queries().get(0);

            assertEquals("adults", query.name());
            assertEquals("minAge", query.parameters().get(0).name());
            assertEquals(1, query.conditions().size());
            assertEquals("$p", query.conditions().get(0).variable());
            assertEquals(20, query.range().end().line());
        }

        @Test
        @DisplayName("Should read rule attributes and clauses")
        void shouldReadRule() {
            RuleNode rule = tree.rules().get(0);

            assertEquals("Adult discount", rule.name());
            assertEquals("10", rule.attribute("salience").orElseThrow().value());
            assertEquals("true", rule.attribute("no-loop").orElseThrow().value());
            assertEquals(2, rule.conditions().size());
            assertEquals("$a", rule.conditions().get(1).variable());
            assertEquals("Account", rule.conditions().get(1).factType());
            assertTrue(rule.then().text().contains("update($a);"));
            assertEquals(Range.of(22, 0, 32, 3), rule.range());
        }

        @Test
        @DisplayName("Should capture a multi-line exists construct as one condition")
        void shouldCaptureMultiLineConstruct() {
            RuleNode rule = tree.rules().get(1);
            ConditionNode exists = rule.conditions().get(0);

            assertEquals(1, rule.conditions().size());
            assertEquals(ConditionKind.EXISTS, exists.kind());
            assertEquals(Range.of(36, 8, 40, 9), exists.range());
            assertTrue(exists.isMultiLine());
            assertEquals(1, exists.nestingDepth());
            assertEquals(2, exists.brackets().size());
            assertEquals(1, exists.regions().size());
            assertTrue(exists.regions().get(0).complete());
            assertEquals("Account", exists.factType());
        }

        @Test
        @DisplayName("Should produce the same tree for CRLF line endings")
        void shouldIgnoreCarriageReturns() {
            String crlf = DrlFixtures.load("complete.drl").replace("\n", "\r\n");

            assertEquals(tree, parser.parse(crlf).tree());
        }
    }

    @Nested
    @DisplayName("Rule shapes")
    class RuleShapes {

        @Test
        @DisplayName("Should parse a rule written on one line")
        void shouldParseOneLineRule() {
            ParseResult result = parser.parse("rule \"Dup\" when Person() then end");

            assertTrue(result.errors().isEmpty());
            RuleNode rule = result.tree().rules().get(0);
            assertEquals("Dup", rule.name());
            assertEquals("Person", rule.conditions().get(0).factType());
            assertTrue(rule.then().isEmpty());
            assertEquals(Range.of(0, 0, 0, 33), rule.range());
        }

        @Test
        @DisplayName("Should accept an unquoted rule name")
        void shouldAcceptUnquotedName() {
            ParseResult result = parser.parse("rule Simple\nwhen\n  Person()\nthen\n  x();\nend");

            assertEquals("Simple", result.tree().rules().get(0).name());
            assertEquals("x();", result.tree().rules().get(0).then().text().strip());
        }

        @Test
        @DisplayName("Should recognise top-level connectives")
        void shouldRecogniseConnectives() {
            ParseResult result = parser.parse("rule \"C\"\nwhen\n  Person() or Account()\nthen\nend");

            assertEquals(ConditionKind.OR, result.tree().rules().get(0).conditions().get(0).kind());
        }

        @Test
        @DisplayName("Should find N conditions for N multi-line constructs")
        void shouldCountMultiLineConstructs() {
            ParseResult result = parser.parse(DrlFixtures.load("multiline.drl"));

            assertTrue(result.errors().isEmpty(), () -> result.errors().toString());
            List<ConditionNode> conditions = result.tree().rules().get(0).conditions();
            assertEquals(4, conditions.size());
            assertEquals(List.of(ConditionKind.PATTERN, ConditionKind.EXISTS, ConditionKind.NOT, ConditionKind.EVAL),
                    conditions.stream().map(ConditionNode::kind).toList());
            assertEquals(Range.of(8, 4, 12, 5), conditions.get(2).range());
            assertTrue(conditions.stream().skip(1).allMatch(ConditionNode::isMultiLine));
        }

        @Test
        @DisplayName("Should read a function whose brace opens on the next line")
        void shouldReadBraceOnNextLine() {
            ParseResult result = parser.parse("function void log(String m)\n{\n  System.out.println(m);\n}");

            assertTrue(result.errors().isEmpty());
            assertEquals("System.out.println(m);", result.tree().functions().get(0).body());
        }
    }

    @Nested
    @DisplayName("Condition details")
    class ConditionDetails {

        @Test
        @DisplayName("Should split pattern constraints into field, operator and value")
        void shouldReadConstraints() {
            ParseResult result = parser.parse(
                    "rule \"K\"\nwhen\n    $p : Person( age >= 18, name matches \"A, B\", $c : city != null, total(x, y) )\nthen\nend");

            List<ConstraintNode> constraints = result.tree().rules().get(0).conditions().get(0).constraints();

            assertEquals(3, constraints.size());
            assertEquals(new ConstraintNode("age", ">=", "18", Range.of(2, 17, 2, 26)), constraints.get(0));
            assertEquals(List.of("name", "matches", "\"A, B\""),
                    List.of(constraints.get(1).field(), constraints.get(1).operator(), constraints.get(1).value()));
            assertEquals(List.of("city", "!=", "null"),
                    List.of(constraints.get(2).field(), constraints.get(2).operator(), constraints.get(2).value()));
        }

        @Test
        @DisplayName("Should list the operands of a construct as inner conditions")
        void shouldReadInnerConditions() {
            ParseResult result = parser.parse(
                    "rule \"I\"\nwhen\n    exists( Person( age > 18 ) and Account( balance < 0 ) )\nthen\nend");

            ConditionNode exists = result.tree().rules().get(0).conditions().get(0);

            assertEquals(ConditionKind.EXISTS, exists.kind());
            assertEquals(List.of("Person", "Account"), exists.innerConditions().stream().map(ConditionNode::factType).toList());
            assertEquals(Range.of(2, 12, 2, 30), exists.innerConditions().get(0).range());
            assertEquals("balance", exists.innerConditions().get(1).constraints().get(0).field());
        }

        @Test
        @DisplayName("Should list the operands of a top-level connective")
        void shouldReadConnectiveOperands() {
            ParseResult result = parser.parse("rule \"C\"\nwhen\n  Person() or not( Account() )\nthen\nend");

            ConditionNode or = result.tree().rules().get(0).conditions().get(0);

            assertEquals(ConditionKind.OR, or.kind());
            assertEquals(List.of(ConditionKind.PATTERN, ConditionKind.NOT),
                    or.innerConditions().stream().map(ConditionNode::kind).toList());
            assertEquals("Account", or.innerConditions().get(1).innerConditions().get(0).factType());
        }

        @Test
        @DisplayName("Should map inner conditions of a multi-line construct to their lines")
        void shouldMapMultiLineInnerConditions() {
            ParseResult result = parser.parse(DrlFixtures.load("multiline.drl"));

            ConditionNode exists = result.tree().rules().get(0).conditions().get(1);

            assertEquals(1, exists.innerConditions().size());
            ConditionNode order = exists.innerConditions().get(0);
            assertEquals("Order", order.factType());
            assertEquals(Range.of(6, 8, 6, 31), order.range());
            assertEquals(new ConstraintNode("customer", "==", "$c", Range.of(6, 15, 6, 29)), order.constraints().get(0));
        }

        @Test
        @DisplayName("Should move constraints with their condition when lines shift")
        void shouldShiftConstraints() {
            ConditionNode condition = parser.parse("rule \"S\"\nwhen\n  Person( age > 1 )\nthen\nend")
                    .tree().rules().get(0).conditions().get(0);

            ConditionNode shifted = condition.shiftLines(3);

            assertEquals(5, shifted.constraints().get(0).range().start().line());
            assertEquals(condition.constraints().get(0).field(), shifted.constraints().get(0).field());
        }
    }

    @Nested
    @DisplayName("Block comments")
    class BlockComments {

        @Test
        @DisplayName("Should parse a rule that follows a comment on the same line")
        void shouldParseRuleAfterInlineComment() {
            ParseResult result = parser.parse("/* header */ rule \"A\" when Person() then end");

            assertTrue(result.errors().isEmpty(), () -> result.errors().toString());
            assertEquals(1, result.tree().rules().size());
            RuleNode rule = result.tree().rules().get(0);
            assertEquals("A", rule.name());
            assertEquals("Person", rule.conditions().get(0).factType());
            assertEquals(Position.of(0, 13), rule.range().start());
        }

        @Test
        @DisplayName("Should parse a rule that starts on the line closing a comment")
        void shouldParseRuleAfterClosingComment() {
            ParseResult result = parser.parse("/*\n * doc */ rule \"B\"\nwhen\n    Person()\nthen\n    x();\nend");

            assertTrue(result.errors().isEmpty(), () -> result.errors().toString());
            assertEquals(List.of("B"), result.tree().rules().stream().map(RuleNode::name).toList());
            assertEquals(1, result.tree().rules().get(0).range().start().line());
        }

        @Test
        @DisplayName("Should ignore commented-out conditions and keep comments in the action text")
        void shouldIgnoreCommentedConditions() {
            ParseResult result = parser.parse("rule \"C\"\nwhen\n  /* Account() */\n  Person()\nthen\n  /* keep */ x();\nend");

            assertTrue(result.errors().isEmpty(), () -> result.errors().toString());
            RuleNode rule = result.tree().rules().get(0);
            assertEquals(List.of("Person"), rule.conditions().stream().map(ConditionNode::factType).toList());
            assertEquals("/* keep */ x();", rule.then().text().strip());
        }

        @Test
        @DisplayName("Should not count braces inside a comment of a function body")
        void shouldIgnoreBracesInComments() {
            ParseResult result = parser.parse("function void f() {\n  /* } */\n  return;\n}");

            assertTrue(result.errors().isEmpty(), () -> result.errors().toString());
            assertEquals("/* } */\n  return;", result.tree().functions().get(0).body());
        }
    }

    @Nested
    @DisplayName("Error recovery")
    class ErrorRecoveryBehaviour {

        @Test
        @DisplayName("Should keep every rule of a partially broken document")
        void shouldKeepRulesAroundErrors() {
            ParseResult result = parser.parse(DrlFixtures.load("broken.drl"));

            assertEquals(List.of("First", "Second", "Third"),
                    result.tree().rules().stream().map(RuleNode::name).toList());
            assertEquals(List.of(
                    "Incomplete condition: 1 unclosed parenthesis",
                    "Invalid global declaration: expected 'global <Type> <name>'",
                    "Unexpected content outside of a construct: 'this line is garbage'"), messages(result));
            assertEquals(ParseSeverity.WARNING, result.errors().get(2).severity());
            assertEquals(Range.singleCharacter(Position.of(4, 10)), result.errors().get(0).range());
        }

        @Test
        @DisplayName("Should close a rule without end at the next rule header")
        void shouldCloseRuleAtNextHeader() {
            ParseResult result = parser.parse("rule \"A\"\nwhen\n  Person()\nthen\n  x();\nrule \"B\"\nwhen\nthen\nend");

            assertEquals(2, result.tree().rules().size());
            assertEquals(List.of("Expected 'end' to close rule \"A\""), messages(result));
            assertEquals(Range.point(Position.of(4, 6)), result.errors().get(0).range());
            assertEquals(Position.of(4, 6), result.tree().rules().get(0).range().end());
        }

        @Test
        @DisplayName("Should keep a rule whose construct is still open at end of input")
        void shouldKeepUnterminatedRule() {
            ParseResult result = parser.parse("rule \"A\"\nwhen\n  exists( Person(");

            assertEquals(1, result.tree().rules().size());
            assertEquals(List.of(
                    "Incomplete exists pattern: missing closing parenthesis",
                    "Expected 'end' to close rule \"A\""), messages(result));
        }

        @Test
        @DisplayName("Should report an unterminated function body and keep the function")
        void shouldReportUnterminatedFunction() {
            ParseResult result = parser.parse("function int f() {\n  return 1;\nrule \"R\" when then end");

            assertEquals(1, result.tree().functions().size());
            assertEquals(1, result.tree().rules().size());
            assertEquals(List.of("Unterminated body of function 'f': missing '}'"), messages(result));
        }

        @Test
        @DisplayName("Should keep a function whose header lacks a return type")
        void shouldKeepFunctionWithoutReturnType() {
            ParseResult result = parser.parse("function greet(String n) {\n    return;\n}");

            FunctionNode function = result.tree().functions().get(0);
            assertEquals("greet", function.name());
            assertEquals("", function.returnType());
            assertEquals("return;", function.body());
            assertEquals(List.of("Invalid function declaration: missing return type of function 'greet'"), messages(result));
        }

        @Test
        @DisplayName("Should keep queries and declarations whose header lacks a name")
        void shouldKeepNamelessConstructs() {
            ParseResult result = parser.parse("query\n    Person()\nend\ndeclare\n    id : String\nend");

            QueryNode query = result.tree().queries().get(0);
            DeclareNode declare = result.tree().declares().get(0);
            assertEquals("", query.name());
            assertEquals("Person", query.conditions().get(0).factType());
            assertEquals("", declare.name());
            assertEquals("id", declare.fields().get(0).name());
            assertEquals(List.of(
                    "Invalid query declaration: expected query \"<name>\"",
                    "Invalid declare statement: expected 'declare <TypeName>'"), messages(result));
        }

        @Test
        @DisplayName("Should keep a global declared with its type only")
        void shouldKeepGlobalWithoutName() {
            ParseResult result = parser.parse("global java.util.List");

            assertTrue(result.errors().isEmpty());
            assertEquals("java.util.List", result.tree().globals().get(0).type());
            assertEquals("", result.tree().globals().get(0).name());
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "", "}}}}", "rule", "rule \"", "function", "when then end", "declare\nend\nend",
                "query q(\n", "\"unterminated", "rule \"x\" when exists( not( eval( ( ( then end",
                "/* never closed\nrule \"x\"", "import", "package", "end\nend", "rule \"a\"\n\tsalience\n"
        })
        @DisplayName("Should never throw on malformed input")
        void shouldNeverThrow(String text) {
            ParseResult result = assertDoesNotThrow(() -> parser.parse(text));
            assertNotNull(result.tree());
        }

        @Test
        @DisplayName("Should treat null text as an empty document")
        void shouldAcceptNull() {
            ParseResult result = parser.parse(null);

            assertTrue(result.tree().isEmpty());
            assertTrue(result.errors().isEmpty());
        }

        @Test
        @DisplayName("Should throw from requireValid only when an error exists")
        void shouldFailFastOnRequest() {
            DrlSyntaxException exception = assertThrows(DrlSyntaxException.class,
                    () -> parser.parse(DrlFixtures.load("broken.drl")).requireValid());
            assertEquals(Position.of(4, 10), exception.getPosition());

            assertNotNull(parser.parse("rule \"ok\" when then end").requireValid());
        }
    }

    @Nested
    @DisplayName("Policy limits")
    class PolicyLimits {

        @Test
        @DisplayName("Should cap the number of recorded errors")
        void shouldCapErrors() {
            BasicDrlParser limited = new BasicDrlParser(ParserPolicy.builder().maxErrors(2).build());

            ParseResult result = limited.parse("junk 1\njunk 2\njunk 3\njunk 4\njunk 5");

            assertEquals(2, result.errors().size());
        }

        @Test
        @DisplayName("Should reject documents above the size limit")
        void shouldRejectLargeDocuments() {
            BasicDrlParser limited = new BasicDrlParser(ParserPolicy.builder().maxDocumentLength(10).build());

            ParseResult result = limited.parse("rule \"too long\" when then end");

            assertTrue(result.tree().isEmpty());
            assertEquals(1, result.errors().size());
            assertTrue(result.errors().get(0).message().startsWith("Document too large"));
        }

        @Test
        @DisplayName("Should stop opening regions past the nesting limit")
        void shouldCapNesting() {
            BasicDrlParser limited = new BasicDrlParser(ParserPolicy.builder().maxNestingDepth(2).build());

            ParseResult result = limited.parse("rule \"D\"\nwhen\n  not( exists( not( Person() ) ) )\nthen\nend");

            assertEquals(List.of("Maximum pattern nesting depth of 2 exceeded"), messages(result));
            ConditionNode condition = result.tree().rules().get(0).conditions().get(0);
            assertEquals(2, condition.regions().size());
            assertEquals(2, condition.nestingDepth());
            assertEquals(0, condition.regions().get(1).parentIndex());
        }

        @Test
        @DisplayName("Should require a policy")
        void shouldRequirePolicy() {
            assertThrows(IllegalArgumentException.class, () -> new BasicDrlParser(null));
        }
    }

    @Nested
    @DisplayName("Failure containment")
    class FailureContainment {

        @Mock
        private DocumentParser documentParser;

        @BeforeEach
        void setUpMocks() {
            MockitoAnnotations.openMocks(this);
        }

        @Test
        @DisplayName("Should turn a runtime failure into an empty tree with one error")
        void shouldContainRuntimeFailure() {
            // Given: a document parser that fails after reaching line 1
            when(documentParser.parse(any())).thenThrow(new IllegalStateException("boom"));
            BasicDrlParser failing = new BasicDrlParser(ParserPolicy.defaults(), session -> {
                session.track(ParseCursor.start(SourceLines.of("a\n  b")).next());
                return documentParser;
            });

            // When
            ParseResult result = failing.parse("rule \"R\"\nwhen\nthen\nend");

            // Then
            assertEquals(SyntaxTree.empty(), result.tree());
            assertEquals(1, result.errors().size());
            ParseError error = result.errors().get(0);
            assertEquals("Critical parsing error: boom", error.message());
            assertEquals(ParseSeverity.ERROR, error.severity());
            assertEquals(Range.point(Position.of(1, 2)), error.range());
        }

        @Test
        @DisplayName("Should hand each parse a fresh session")
        void shouldUseFreshSessionPerParse() {
            // Given
            List<ParseSession> sessions = new ArrayList<>();
            BasicDrlParser recording = new BasicDrlParser(ParserPolicy.defaults(), session -> {
                sessions.add(session);
                return new DocumentParser(session);
            });

            // When
            recording.parse("package a.b");
            recording.parse("package c.d");

            // Then
            assertEquals(2, sessions.size());
            assertNotSame(sessions.get(0), sessions.get(1));
        }
    }
}
