package io.suitegraph.parser;

import static org.junit.jupiter.api.Assertions.*;

import io.suitegraph.CyclingMode;
import io.suitegraph.ErrorKind;
import io.suitegraph.GraphLine;
import io.suitegraph.GraphParseException;
import io.suitegraph.ast.AndNode;
import io.suitegraph.ast.ExprNode;
import io.suitegraph.ast.Leaf;
import io.suitegraph.ast.OrNode;
import io.suitegraph.ast.TaskRef;
import io.suitegraph.display.Display;
import io.suitegraph.graph.GraphFragment;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/** Unit tests for the recursive descent graph parser. */
public class ParserTest {

  private static Leaf leaf(String name) {
    return Leaf.of(TaskRef.of(name));
  }

  private static GraphParseException parseError(String input) {
    return assertThrows(GraphParseException.class, () -> Parser.parse(GraphLine.of(input)));
  }

  @Test
  void testBareName() throws GraphParseException {
    assertEquals(List.of(leaf("foo")), Parser.parseChain("foo"));
  }

  @Test
  void testAndBindsTighterThanOr() throws GraphParseException {
    List<ExprNode> stages = Parser.parseChain("a | b & c");
    assertEquals(1, stages.size());
    assertEquals(
        new OrNode(List.of(leaf("a"), new AndNode(List.of(leaf("b"), leaf("c"))))),
        stages.get(0));
  }

  @Test
  void testParenthesesOverridePrecedence() throws GraphParseException {
    ExprNode expr = Parser.parseChain("(a | b) & c").get(0);
    assertEquals(
        new AndNode(List.of(new OrNode(List.of(leaf("a"), leaf("b"))), leaf("c"))), expr);
  }

  @Test
  void testOperandsAreFlatWithinOneOperator() throws GraphParseException {
    ExprNode expr = Parser.parseChain("a & b & c").get(0);
    assertEquals(new AndNode(List.of(leaf("a"), leaf("b"), leaf("c"))), expr);
  }

  @Test
  void testRedundantParentheses() throws GraphParseException {
    assertEquals(List.of(leaf("a"), leaf("b")), Parser.parseChain("((a)) => (b)"));
  }

  @Test
  void testChain() throws GraphParseException {
    List<ExprNode> stages = Parser.parseChain("a => b & c => d");
    assertEquals(3, stages.size());
    assertEquals("b & c", Display.render(stages.get(1)));
  }

  @Test
  void testSuicideOnRight() throws GraphParseException {
    List<ExprNode> stages = Parser.parseChain("foo:fail => !bar");
    assertEquals(new Leaf(TaskRef.of("bar"), true), stages.get(1));
  }

  @Test
  void testLineWithoutArrowDeclaresTasks() throws GraphParseException {
    GraphFragment fragment = Parser.parse(GraphLine.of("foo & bar"));
    assertTrue(fragment.edges().isEmpty());
    assertEquals(List.of("foo", "bar"), List.copyOf(fragment.tasks()));
  }

  @Test
  void testDefaultRecurrenceInNonCyclingSuite() throws GraphParseException {
    GraphFragment fragment = Parser.parse(GraphLine.of("foo => bar"));
    assertEquals(GraphLine.RUN_ONCE, fragment.recurrence());
    assertEquals("R1", fragment.edges().iterator().next().recurrence());
  }

  @Test
  void testExplicitRecurrenceInNonCyclingSuite() throws GraphParseException {
    GraphFragment fragment =
        Parser.parse(new GraphLine("foo => bar", "R1", CyclingMode.NON_CYCLING));
    assertEquals("R1", fragment.recurrence());
  }

  @Test
  void testRecurrenceAttachedVerbatim() throws GraphParseException {
    GraphFragment fragment =
        Parser.parse(new GraphLine("foo[-P1D] => foo", "T00, T12", CyclingMode.CYCLING));
    assertEquals("T00, T12", fragment.edges().iterator().next().recurrence());
  }

  @Test
  void testMissingRecurrenceInCyclingSuite() {
    GraphParseException e =
        assertThrows(
            GraphParseException.class,
            () -> Parser.parse(new GraphLine("foo => bar", null, CyclingMode.CYCLING)));
    assertEquals(ErrorKind.MISSING_RECURRENCE, e.kind());
    assertTrue(e.recurrence().isEmpty());
  }

  @Test
  void testBlankRecurrenceInCyclingSuite() {
    GraphParseException e =
        assertThrows(
            GraphParseException.class,
            () -> Parser.parse(new GraphLine("foo => bar", "  ", CyclingMode.CYCLING)));
    assertEquals(ErrorKind.MISSING_RECURRENCE, e.kind());
  }

  @Test
  void testLexErrorsReportedBeforeMissingRecurrence() {
    GraphParseException e =
        assertThrows(
            GraphParseException.class,
            () -> Parser.parse(new GraphLine("foo && bar => baz", null, CyclingMode.CYCLING)));
    assertEquals(ErrorKind.DOUBLED_AND, e.kind());
  }

  @ParameterizedTest
  @CsvSource(
      delimiter = ';',
      value = {
        "(a & b => c; UNBALANCED_GROUPING",
        "a & b) => c; UNBALANCED_GROUPING",
        "a => b); UNBALANCED_GROUPING",
        ") a; UNBALANCED_GROUPING",
        "((a) => b; UNBALANCED_GROUPING",
        "=> a; MALFORMED_ARROW",
        "a =>; MALFORMED_ARROW",
        "a => => b; MALFORMED_ARROW",
        "(a => b); MALFORMED_ARROW",
        "a & => b; MISSING_TASK",
        "a | => b; MISSING_TASK",
        "& a => b; MISSING_TASK",
        "a => b &; MISSING_TASK",
        "a & | b => c; MISSING_TASK",
        "() => a; MISSING_TASK",
        "(a & ) => b; MISSING_TASK",
        "a b => c; UNEXPECTED_TOKEN",
        "a => (b) c; UNEXPECTED_TOKEN",
        "(a b) => c; UNEXPECTED_TOKEN",
        "!a => b; MISPLACED_SUICIDE",
        "!a; MISPLACED_SUICIDE",
        "a => !b => c; MISPLACED_SUICIDE",
        "a & !b => c; MISPLACED_SUICIDE"
      })
  void testStructuralErrors(String input, ErrorKind expected) {
    GraphParseException e = parseError(input);
    assertEquals(expected, e.kind(), input);
    assertEquals(ErrorKind.Category.STRUCTURAL, e.kind().category());
    assertTrue(e.getMessage().endsWith(": " + input), e.getMessage());
  }

  @Test
  void testEmptyLine() {
    assertEquals(ErrorKind.MISSING_TASK, parseError("").kind());
  }

  @Test
  void testErrorSpanPointsAtOffendingToken() {
    GraphParseException e = parseError("a & b) => c");
    assertEquals(")", e.offending());
    e = parseError("a => => b");
    assertEquals("=>", e.offending());
    assertEquals(5, e.span().start());
  }

  @Test
  void testUnclosedParenthesisSpan() {
    GraphParseException e = parseError("x => (a & b");
    assertEquals(ErrorKind.UNBALANCED_GROUPING, e.kind());
    assertEquals("(", e.offending());
    assertEquals(5, e.span().start());
  }

  @Test
  void testEachLineParsedIndependently() throws GraphParseException {
    assertThrows(GraphParseException.class, () -> Parser.parse(GraphLine.of("a && b")));
    GraphFragment fragment = Parser.parse(GraphLine.of("a & b => c"));
    assertEquals(2, fragment.edges().size());
  }
}
