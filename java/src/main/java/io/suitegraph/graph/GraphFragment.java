package io.suitegraph.graph;

import io.suitegraph.GraphLine;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The result of parsing one graph line.
 *
 * @param line the parsed line
 * @param recurrence the recurrence attached to every edge, after defaulting
 * @param tasks the names of all tasks the line mentions, in order of appearance
 * @param edges the dependency edges, empty for a line without an arrow
 * @param triggers the trigger condition of every successor in the line
 */
public record GraphFragment(
    GraphLine line,
    String recurrence,
    Set<String> tasks,
    Set<Edge> edges,
    List<Trigger> triggers) {
  /** Creates a new GraphFragment with defensive, order-preserving copies. */
  public GraphFragment {
    tasks = Collections.unmodifiableSet(new LinkedHashSet<>(tasks));
    edges = Collections.unmodifiableSet(new LinkedHashSet<>(edges));
    triggers = List.copyOf(triggers);
  }
}
