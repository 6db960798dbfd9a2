package io.suitegraph.graph;

import io.suitegraph.ast.AndNode;
import io.suitegraph.ast.ExprNode;
import io.suitegraph.ast.TaskRef;
import io.suitegraph.display.Display;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Unions the fragments of many graph lines into one graph.
 *
 * <p>Safe for concurrent use: lines may be parsed on separate threads and added here as they
 * finish. Duplicate edges are merged. Conditions declared for the same successor on different
 * lines must all hold, so they are joined with AND. A joined condition lists its distinct operands
 * sorted by their rendering, so it does not depend on the order lines arrive in.
 */
public final class EdgeAccumulator {
  private final Set<String> tasks = ConcurrentHashMap.newKeySet();
  private final Set<Edge> edges = ConcurrentHashMap.newKeySet();
  private final Map<TriggerKey, ExprNode> triggers = new ConcurrentHashMap<>();

  /**
   * Adds the tasks, edges and triggers of a parsed line.
   *
   * @param fragment the parsed line
   */
  public void add(GraphFragment fragment) {
    tasks.addAll(fragment.tasks());
    edges.addAll(fragment.edges());
    for (Trigger trigger : fragment.triggers()) {
      TriggerKey key =
          new TriggerKey(trigger.recurrence(), trigger.successor(), trigger.suicide());
      triggers.merge(key, trigger.condition(), EdgeAccumulator::combine);
    }
  }

  /**
   * Returns a snapshot of the task names seen so far.
   *
   * @return the task names
   */
  public Set<String> tasks() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(tasks));
  }

  /**
   * Returns a snapshot of the deduplicated edges seen so far.
   *
   * @return the edges
   */
  public Set<Edge> edges() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(edges));
  }

  /**
   * Returns a snapshot of the combined trigger of every successor.
   *
   * @return the triggers, keyed by recurrence, successor and suicide flag
   */
  public Map<TriggerKey, Trigger> triggers() {
    Map<TriggerKey, Trigger> out = new LinkedHashMap<>();
    triggers.forEach(
        (key, condition) ->
            out.put(key, new Trigger(key.recurrence(), key.successor(), condition, key.suicide())));
    return Collections.unmodifiableMap(out);
  }

  private static ExprNode combine(ExprNode existing, ExprNode added) {
    Set<ExprNode> operands = new LinkedHashSet<>();
    addOperands(existing, operands);
    addOperands(added, operands);
    if (operands.size() == 1) {
      return operands.iterator().next();
    }
    List<ExprNode> sorted = new ArrayList<>(operands);
    sorted.sort(Comparator.comparing((ExprNode node) -> Display.render(node)));
    return new AndNode(sorted);
  }

  private static void addOperands(ExprNode node, Set<ExprNode> out) {
    if (node instanceof AndNode and) {
      out.addAll(and.children());
    } else {
      out.add(node);
    }
  }

  /**
   * Identifies one successor's trigger.
   *
   * @param recurrence the recurrence label
   * @param successor the triggered task occurrence
   * @param suicide whether this is the suicide trigger
   */
  public record TriggerKey(String recurrence, TaskRef successor, boolean suicide) {}
}
