package io.suitegraph.config;

import io.suitegraph.CyclingMode;
import io.suitegraph.GraphLine;
import io.suitegraph.parser.GraphText;
import java.util.ArrayList;
import java.util.List;

/**
 * The parts of a suite's {@code [scheduling]} section that shape its graph.
 *
 * @param initialCyclePoint the initial cycle point (may be null)
 * @param graph the graph entries, in declaration order
 */
public record SchedulingConfig(String initialCyclePoint, List<GraphEntry> graph) {
  /** Creates a new SchedulingConfig with a defensive copy of the entries. */
  public SchedulingConfig {
    graph = graph == null ? List.of() : List.copyOf(graph);
  }

  /**
   * Creates a non-cycling configuration.
   *
   * @param graph the graph entries
   * @return a new SchedulingConfig with no initial cycle point
   */
  public static SchedulingConfig of(GraphEntry... graph) {
    return new SchedulingConfig(null, List.of(graph));
  }

  /**
   * Returns a copy with the specified initial cycle point.
   *
   * @param initialCyclePoint the initial cycle point
   * @return a new SchedulingConfig with the updated initial cycle point
   */
  public SchedulingConfig withInitialCyclePoint(String initialCyclePoint) {
    return new SchedulingConfig(initialCyclePoint, graph);
  }

  /**
   * Returns the suite's cycling mode.
   *
   * @return {@link CyclingMode#CYCLING} if an initial cycle point is set
   */
  public CyclingMode mode() {
    return CyclingMode.fromInitialCyclePoint(initialCyclePoint);
  }

  /**
   * Splits every entry into logical lines, each carrying its recurrence and the suite's mode.
   *
   * @return the graph lines in declaration order
   */
  public List<GraphLine> lines() {
    CyclingMode mode = mode();
    List<GraphLine> lines = new ArrayList<>();
    for (GraphEntry entry : graph) {
      for (String text : GraphText.logicalLines(entry.graph())) {
        lines.add(new GraphLine(text, entry.recurrence(), mode));
      }
    }
    return lines;
  }
}
