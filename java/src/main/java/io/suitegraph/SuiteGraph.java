package io.suitegraph;

import io.suitegraph.ast.TaskRef;
import io.suitegraph.config.SchedulingConfig;
import io.suitegraph.display.Display;
import io.suitegraph.graph.Edge;
import io.suitegraph.graph.EdgeAccumulator;
import io.suitegraph.graph.EdgeAccumulator.TriggerKey;
import io.suitegraph.graph.GraphFragment;
import io.suitegraph.graph.Trigger;
import io.suitegraph.parser.Parser;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The main entry point for building and validating a suite's dependency graph.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * SchedulingConfig config =
 *     SchedulingConfig.of(new GraphEntry("R1", "foo & bar => baz")).withInitialCyclePoint("2015");
 * SuiteGraph graph = SuiteGraph.parse(config);
 * for (Edge edge : graph.edges()) {
 *     System.out.println(edge);
 * }
 * }</pre>
 */
public final class SuiteGraph {
  private static final Logger log = LoggerFactory.getLogger(SuiteGraph.class);

  private final CyclingMode mode;
  private final Set<String> tasks;
  private final Set<Edge> edges;
  private final Map<TriggerKey, Trigger> triggers;

  private SuiteGraph(
      CyclingMode mode, Set<String> tasks, Set<Edge> edges, Map<TriggerKey, Trigger> triggers) {
    this.mode = mode;
    this.tasks = tasks;
    this.edges = edges;
    this.triggers = triggers;
  }

  /**
   * Parses every graph line of a scheduling section, stopping at the first invalid line.
   *
   * @param config the scheduling section
   * @return the assembled graph
   * @throws GraphParseException for the first line that fails to parse
   */
  public static SuiteGraph parse(SchedulingConfig config) throws GraphParseException {
    CyclingMode mode = config.mode();
    List<GraphLine> lines = config.lines();
    log.debug("Parsing {} graph line(s) in {} mode", lines.size(), mode);

    EdgeAccumulator accumulator = new EdgeAccumulator();
    for (GraphLine line : lines) {
      accumulator.add(parseLine(line));
    }
    return new SuiteGraph(mode, accumulator.tasks(), accumulator.edges(), accumulator.triggers());
  }

  /**
   * Parses a single graph line.
   *
   * @param line the line and its recurrence context
   * @return the tasks, edges and triggers declared by the line
   * @throws GraphParseException if the line is invalid
   */
  public static GraphFragment parseLine(GraphLine line) throws GraphParseException {
    GraphFragment fragment = Parser.parse(line);
    log.debug(
        "[{}] {} -> {} edge(s)", fragment.recurrence(), line.text(), fragment.edges().size());
    return fragment;
  }

  /**
   * Parses every graph line and collects one error per failing line.
   *
   * @param config the scheduling section
   * @return the errors, empty if the graph is valid
   */
  public static List<GraphParseException> validate(SchedulingConfig config) {
    List<GraphParseException> errors = new ArrayList<>();
    for (GraphLine line : config.lines()) {
      try {
        Parser.parse(line);
      } catch (GraphParseException e) {
        log.warn("{}", e.render());
        errors.add(e);
      }
    }
    return errors;
  }

  /**
   * Returns the suite's cycling mode.
   *
   * @return the mode
   */
  public CyclingMode mode() {
    return mode;
  }

  /**
   * Returns the names of all tasks in the graph.
   *
   * @return the task names
   */
  public Set<String> tasks() {
    return tasks;
  }

  /**
   * Returns every edge in the graph.
   *
   * @return the deduplicated edges
   */
  public Set<Edge> edges() {
    return edges;
  }

  /**
   * Returns the edges of one recurrence.
   *
   * @param recurrence the recurrence label
   * @return the edges declared under that recurrence
   */
  public Set<Edge> edges(String recurrence) {
    return edges.stream()
        .filter(edge -> edge.recurrence().equals(recurrence))
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }

  /**
   * Returns the recurrence labels that have at least one edge, sorted.
   *
   * @return the recurrence labels
   */
  public Set<String> recurrences() {
    return edges.stream().map(Edge::recurrence).collect(Collectors.toCollection(TreeSet::new));
  }

  /**
   * Returns the combined trigger of every successor.
   *
   * @return the triggers
   */
  public Collection<Trigger> triggers() {
    return triggers.values();
  }

  /**
   * Returns the trigger of a successor under a recurrence, if it has one.
   *
   * @param recurrence the recurrence label
   * @param successor the triggered task occurrence
   * @return the combined (non-suicide) trigger, or empty
   */
  public Optional<Trigger> trigger(String recurrence, TaskRef successor) {
    return Optional.ofNullable(triggers.get(new TriggerKey(recurrence, successor, false)));
  }

  /**
   * Returns the direct predecessors of a task under a recurrence.
   *
   * @param recurrence the recurrence label
   * @param successor the task name
   * @return the predecessor task outputs
   */
  public Set<TaskRef> predecessors(String recurrence, String successor) {
    return edges(recurrence).stream()
        .filter(edge -> edge.successor().name().equals(successor))
        .map(Edge::predecessor)
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }

  /**
   * Returns the graph as sorted edge lines.
   *
   * @return the canonical form
   */
  @Override
  public String toString() {
    return Display.render(this);
  }
}
