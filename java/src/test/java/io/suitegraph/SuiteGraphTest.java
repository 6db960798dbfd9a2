package io.suitegraph;

import static org.junit.jupiter.api.Assertions.*;

import io.suitegraph.ast.TaskRef;
import io.suitegraph.config.GraphEntry;
import io.suitegraph.config.SchedulingConfig;
import io.suitegraph.display.Display;
import io.suitegraph.graph.Edge;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** End-to-end tests for building and validating suite graphs. */
public class SuiteGraphTest {
  private static final String AND_ERROR = "GraphParseError: the graph AND operator is '&': ";
  private static final String OR_ERROR = "GraphParseError: the graph OR operator is '|': ";

  // A blank initial cycle point means a non-cycling suite, whose line has no recurrence.
  private static SchedulingConfig suite(String initialCyclePoint, String graph) {
    if (initialCyclePoint == null || initialCyclePoint.isEmpty()) {
      return SchedulingConfig.of(GraphEntry.of(graph));
    }
    return new SchedulingConfig(initialCyclePoint, List.of(new GraphEntry("R1", graph)));
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "2015"})
  void testDoubledAndRejected(String initialCyclePoint) {
    SchedulingConfig config = suite(initialCyclePoint, "foo && bar => baz");
    GraphParseException e =
        assertThrows(GraphParseException.class, () -> SuiteGraph.parse(config));
    assertTrue(e.render().startsWith(AND_ERROR), e.render());
    assertEquals(ErrorKind.DOUBLED_AND, e.kind());
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "2015"})
  void testDoubledOrRejected(String initialCyclePoint) {
    SchedulingConfig config = suite(initialCyclePoint, "foo || bar => baz");
    GraphParseException e =
        assertThrows(GraphParseException.class, () -> SuiteGraph.parse(config));
    assertTrue(e.render().startsWith(OR_ERROR), e.render());
    assertEquals(ErrorKind.DOUBLED_OR, e.kind());
  }

  @Test
  void testDiagnosticIdenticalInBothModes() {
    GraphParseException async =
        assertThrows(
            GraphParseException.class,
            () -> SuiteGraph.parse(suite(null, "foo && bar => baz")));
    GraphParseException cycling =
        assertThrows(
            GraphParseException.class,
            () -> SuiteGraph.parse(suite("2015", "foo && bar => baz")));
    assertEquals(async.render(), cycling.render());
    assertEquals(async.span(), cycling.span());
  }

  @Test
  void testSingleAndTrigger() throws GraphParseException {
    SuiteGraph graph = SuiteGraph.parse(suite(null, "foo & bar => baz"));
    TaskRef foo = new TaskRef("foo", null, "succeeded");
    TaskRef bar = new TaskRef("bar", null, "succeeded");
    TaskRef baz = TaskRef.of("baz");
    assertEquals(
        Set.of(
            new Edge(foo, baz, "R1", Set.of(bar), false),
            new Edge(bar, baz, "R1", Set.of(foo), false)),
        graph.edges());
    assertEquals(CyclingMode.NON_CYCLING, graph.mode());
    assertEquals(Set.of("foo", "bar", "baz"), graph.tasks());
  }

  @Test
  void testSingleAndTriggerInCyclingSuite() throws GraphParseException {
    SuiteGraph graph = SuiteGraph.parse(suite("2015", "foo & bar => baz"));
    assertEquals(CyclingMode.CYCLING, graph.mode());
    assertEquals(2, graph.edges("R1").size());
  }

  @Test
  void testMissingRecurrenceInCyclingSuite() {
    SchedulingConfig config =
        SchedulingConfig.of(GraphEntry.of("foo => bar")).withInitialCyclePoint("2015");
    GraphParseException e =
        assertThrows(GraphParseException.class, () -> SuiteGraph.parse(config));
    assertEquals(ErrorKind.MISSING_RECURRENCE, e.kind());
  }

  @Test
  void testMultipleRecurrences() throws GraphParseException {
    SchedulingConfig config =
        new SchedulingConfig(
            "2015",
            List.of(
                new GraphEntry("R1", "prep => foo"),
                new GraphEntry("P1Y", "foo[-P1Y] => foo => bar\nbar => baz")));
    SuiteGraph graph = SuiteGraph.parse(config);

    assertEquals(Set.of("P1Y", "R1"), graph.recurrences());
    assertEquals(1, graph.edges("R1").size());
    assertEquals(3, graph.edges("P1Y").size());
    assertEquals(
        Set.of(new TaskRef("foo", "-P1Y", "succeeded")), graph.predecessors("P1Y", "foo"));
    assertEquals(
        "P1Y: bar:succeeded => baz\n"
            + "P1Y: foo:succeeded => bar\n"
            + "P1Y: foo[-P1Y]:succeeded => foo\n"
            + "R1: prep:succeeded => foo",
        graph.toString());
  }

  @Test
  void testTriggersCombinedAcrossLines() throws GraphParseException {
    SuiteGraph graph = SuiteGraph.parse(suite(null, "a => c\nb => c"));
    String rendered = Display.render(graph.trigger("R1", TaskRef.of("c")).orElseThrow());
    assertEquals("a:succeeded & b:succeeded => c", rendered);
  }

  @Test
  void testDuplicateLinesAreNotErrors() throws GraphParseException {
    SuiteGraph graph = SuiteGraph.parse(suite(null, "a => b\na => b"));
    assertEquals(1, graph.edges().size());
  }

  @Test
  void testStandaloneTask() throws GraphParseException {
    SuiteGraph graph = SuiteGraph.parse(suite(null, "lonely\na => b"));
    assertTrue(graph.tasks().contains("lonely"));
    assertEquals(1, graph.edges().size());
  }

  @Test
  void testParseStopsAtFirstBadLine() {
    SchedulingConfig config = suite(null, "a => b\nc || d => e\nf && g => h");
    GraphParseException e =
        assertThrows(GraphParseException.class, () -> SuiteGraph.parse(config));
    assertEquals(ErrorKind.DOUBLED_OR, e.kind());
  }

  @Test
  void testValidateCollectsEveryBadLine() {
    SchedulingConfig config = suite("2015", "a => b\nc || d => e\nf && g => h\n(x => y");
    List<GraphParseException> errors = SuiteGraph.validate(config);
    assertEquals(3, errors.size());
    assertEquals(ErrorKind.DOUBLED_OR, errors.get(0).kind());
    assertEquals(ErrorKind.DOUBLED_AND, errors.get(1).kind());
    assertEquals(ErrorKind.UNBALANCED_GROUPING, errors.get(2).kind());
    assertEquals("R1", errors.get(1).recurrence().orElseThrow());
  }

  @Test
  void testValidateValidGraph() {
    assertTrue(SuiteGraph.validate(suite(null, "a & b => c\nc | d => e")).isEmpty());
  }

  @Test
  void testParseLine() throws GraphParseException {
    assertEquals(2, SuiteGraph.parseLine(GraphLine.of("a | b => c")).edges().size());
  }
}
