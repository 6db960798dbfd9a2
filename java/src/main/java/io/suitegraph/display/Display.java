package io.suitegraph.display;

import io.suitegraph.SuiteGraph;
import io.suitegraph.ast.AndNode;
import io.suitegraph.ast.ExprNode;
import io.suitegraph.ast.Leaf;
import io.suitegraph.ast.OrNode;
import io.suitegraph.ast.TaskRef;
import io.suitegraph.graph.Edge;
import io.suitegraph.graph.Trigger;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** Renders graph expressions and edges in canonical graph syntax. */
public final class Display {
  private Display() {}

  /**
   * Renders an expression, adding parentheses only where OR sits inside AND.
   *
   * @param node the expression
   * @return the canonical form, e.g. {@code (a | b) & c:failed}
   */
  public static String render(ExprNode node) {
    if (node instanceof Leaf leaf) {
      return (leaf.suicide() ? "!" : "") + leaf.task();
    }
    if (node instanceof AndNode and) {
      return and.children().stream()
          .map(child -> child instanceof OrNode ? "(" + render(child) + ")" : render(child))
          .collect(Collectors.joining(" & "));
    }
    if (node instanceof OrNode or) {
      return or.children().stream().map(Display::render).collect(Collectors.joining(" | "));
    }
    throw new IllegalStateException("unknown expression node: " + node);
  }

  /**
   * Renders an edge, listing co-required predecessors in sorted order.
   *
   * @param edge the edge
   * @return e.g. {@code foo:succeeded => baz (with bar:succeeded)}
   */
  public static String render(Edge edge) {
    StringBuilder sb = new StringBuilder();
    sb.append(edge.predecessor()).append(" => ");
    if (edge.suicide()) {
      sb.append('!');
    }
    sb.append(edge.successor());
    if (edge.isJoint()) {
      sb.append(" (with ").append(sorted(edge.coRequired())).append(')');
    }
    return sb.toString();
  }

  /**
   * Renders a trigger as a single graph line.
   *
   * @param trigger the trigger
   * @return e.g. {@code a:succeeded & b:succeeded => c}
   */
  public static String render(Trigger trigger) {
    return render(trigger.condition())
        + " => "
        + (trigger.suicide() ? "!" : "")
        + trigger.successor();
  }

  /**
   * Renders a whole graph, one edge per line, grouped by recurrence.
   *
   * @param graph the graph
   * @return the rendered edges, sorted
   */
  public static String render(SuiteGraph graph) {
    List<String> lines = new ArrayList<>();
    for (String recurrence : graph.recurrences()) {
      graph.edges(recurrence).stream()
          .map(edge -> recurrence + ": " + render(edge))
          .sorted()
          .forEach(lines::add);
    }
    return String.join("\n", lines);
  }

  private static String sorted(Iterable<TaskRef> tasks) {
    List<String> names = new ArrayList<>();
    tasks.forEach(task -> names.add(task.toString()));
    names.sort(null);
    return String.join(", ", names);
  }
}
