package io.suitegraph.graph;

import io.suitegraph.ast.TaskRef;
import java.util.Set;

/**
 * A dependency of one task occurrence on another.
 *
 * <p>Predecessors joined by {@code &} produce one edge each, and each edge lists the others in
 * {@code coRequired}: the successor waits for all of them together. Predecessors joined by
 * {@code |} produce independent edges with no co-required predecessors.
 *
 * @param predecessor the task output that triggers the successor
 * @param successor the triggered task occurrence, without an output
 * @param recurrence the recurrence the dependency applies to
 * @param coRequired the other predecessors that must be satisfied together with this one
 * @param suicide true if satisfying the condition removes the successor instead of running it
 */
public record Edge(
    TaskRef predecessor,
    TaskRef successor,
    String recurrence,
    Set<TaskRef> coRequired,
    boolean suicide) {
  /** Creates a new Edge with a defensive copy of the co-required set. */
  public Edge {
    coRequired = coRequired == null ? Set.of() : Set.copyOf(coRequired);
  }

  /**
   * Creates an edge whose predecessor alone satisfies the dependency.
   *
   * @param predecessor the triggering task output
   * @param successor the triggered task
   * @param recurrence the recurrence label
   * @return a new Edge
   */
  public static Edge of(TaskRef predecessor, TaskRef successor, String recurrence) {
    return new Edge(predecessor, successor, recurrence, Set.of(), false);
  }

  /**
   * Returns true if other predecessors must be satisfied together with this one.
   *
   * @return whether the co-required set is non-empty
   */
  public boolean isJoint() {
    return !coRequired.isEmpty();
  }
}
