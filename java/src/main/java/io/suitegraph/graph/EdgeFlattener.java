package io.suitegraph.graph;

import io.suitegraph.ErrorKind;
import io.suitegraph.GraphLine;
import io.suitegraph.GraphParseException;
import io.suitegraph.Span;
import io.suitegraph.ast.AndNode;
import io.suitegraph.ast.ExprNode;
import io.suitegraph.ast.Leaf;
import io.suitegraph.ast.OrNode;
import io.suitegraph.ast.Outputs;
import io.suitegraph.ast.TaskRef;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Turns the expressions between a line's arrows into dependency edges. */
public final class EdgeFlattener {
  /**
   * The most conjunctions a left-hand expression may expand to. Each OR group joined by AND
   * multiplies the count, so {@code (a|b) & (c|d) & ...} doubles it per group.
   */
  public static final int MAX_ALTERNATIVES = 1024;

  private EdgeFlattener() {}

  /**
   * Flattens a parsed line.
   *
   * <p>For every arrow {@code L => R}, each leaf of {@code R} becomes a successor. {@code L} is
   * rewritten into disjunctive normal form; every task in a conjunction becomes a predecessor edge
   * that lists the rest of the conjunction as co-required.
   *
   * @param line the line the stages came from
   * @param recurrence the recurrence to attach to every edge
   * @param stages the expressions between arrows, left to right
   * @return the tasks, edges and triggers of the line
   * @throws GraphParseException if a left-hand expression expands past {@link #MAX_ALTERNATIVES}
   */
  public static GraphFragment flatten(GraphLine line, String recurrence, List<ExprNode> stages)
      throws GraphParseException {
    Set<String> tasks = new LinkedHashSet<>();
    for (ExprNode stage : stages) {
      for (Leaf leaf : stage.leaves()) {
        tasks.add(leaf.task().name());
      }
    }

    Set<Edge> edges = new LinkedHashSet<>();
    List<Trigger> triggers = new ArrayList<>();
    for (int i = 0; i + 1 < stages.size(); i++) {
      ExprNode condition = resolveOutputs(stages.get(i));
      long count = countAlternatives(condition);
      if (count > MAX_ALTERNATIVES) {
        throw GraphParseException.structural(
            ErrorKind.TOO_MANY_ALTERNATIVES,
            "(" + count + " > " + MAX_ALTERNATIVES + ")",
            new Span(0, line.text().length()),
            line.text(),
            recurrence);
      }
      List<Set<TaskRef>> terms = disjunctiveNormalForm(condition);

      for (Leaf target : stages.get(i + 1).leaves()) {
        TaskRef successor = target.task().withoutOutput();
        triggers.add(new Trigger(recurrence, successor, condition, target.suicide()));

        for (Set<TaskRef> term : terms) {
          for (TaskRef predecessor : term) {
            Set<TaskRef> others = new LinkedHashSet<>(term);
            others.remove(predecessor);
            edges.add(new Edge(predecessor, successor, recurrence, others, target.suicide()));
          }
        }
      }
    }

    return new GraphFragment(line, recurrence, tasks, edges, triggers);
  }

  /**
   * Gives every predecessor leaf an explicit output: bare names mean {@code succeeded}, and
   * {@code finished} means {@code succeeded | failed}.
   *
   * @param node a left-hand expression
   * @return the expression with outputs resolved
   */
  public static ExprNode resolveOutputs(ExprNode node) {
    if (node instanceof Leaf leaf) {
      TaskRef task = leaf.task();
      if (task.output() == null) {
        return new Leaf(task.withOutput(Outputs.SUCCEEDED), false);
      }
      if (task.output().equals(Outputs.FINISHED)) {
        return new OrNode(
            List.of(
                new Leaf(task.withOutput(Outputs.SUCCEEDED), false),
                new Leaf(task.withOutput(Outputs.FAILED), false)));
      }
      return new Leaf(task, false);
    }
    if (node instanceof AndNode and) {
      return new AndNode(resolveAll(and.children()));
    }
    if (node instanceof OrNode or) {
      return new OrNode(resolveAll(or.children()));
    }
    throw new IllegalStateException("unknown expression node: " + node);
  }

  /**
   * Rewrites an expression as a list of alternative conjunctions of task outputs.
   *
   * @param node the expression
   * @return the conjunctions, any one of which satisfies the expression
   * @throws IllegalArgumentException if the expression expands past {@link #MAX_ALTERNATIVES}
   */
  public static List<Set<TaskRef>> disjunctiveNormalForm(ExprNode node) {
    if (countAlternatives(node) > MAX_ALTERNATIVES) {
      throw new IllegalArgumentException("too many alternatives: " + node);
    }
    return expand(node);
  }

  /**
   * Counts the conjunctions an expression expands to before duplicates are removed. Saturates at
   * {@code Long.MAX_VALUE}.
   *
   * @param node the expression
   * @return an upper bound on the size of its disjunctive normal form
   */
  public static long countAlternatives(ExprNode node) {
    if (node instanceof Leaf) {
      return 1;
    }
    if (node instanceof OrNode or) {
      long sum = 0;
      for (ExprNode child : or.children()) {
        long n = countAlternatives(child);
        sum = sum > Long.MAX_VALUE - n ? Long.MAX_VALUE : sum + n;
      }
      return sum;
    }
    if (node instanceof AndNode and) {
      long product = 1;
      for (ExprNode child : and.children()) {
        long n = countAlternatives(child);
        product = product > Long.MAX_VALUE / n ? Long.MAX_VALUE : product * n;
      }
      return product;
    }
    throw new IllegalStateException("unknown expression node: " + node);
  }

  private static List<Set<TaskRef>> expand(ExprNode node) {
    if (node instanceof Leaf leaf) {
      Set<TaskRef> term = new LinkedHashSet<>();
      term.add(leaf.task());
      return List.of(term);
    }
    if (node instanceof OrNode or) {
      Set<Set<TaskRef>> terms = new LinkedHashSet<>();
      for (ExprNode child : or.children()) {
        terms.addAll(expand(child));
      }
      return new ArrayList<>(terms);
    }
    if (node instanceof AndNode and) {
      List<Set<TaskRef>> terms = new ArrayList<>();
      terms.add(new LinkedHashSet<>());
      for (ExprNode child : and.children()) {
        List<Set<TaskRef>> right = expand(child);
        Set<Set<TaskRef>> product = new LinkedHashSet<>();
        for (Set<TaskRef> left : terms) {
          for (Set<TaskRef> term : right) {
            Set<TaskRef> merged = new LinkedHashSet<>(left);
            merged.addAll(term);
            product.add(merged);
          }
        }
        terms = new ArrayList<>(product);
      }
      return terms;
    }
    throw new IllegalStateException("unknown expression node: " + node);
  }

  private static List<ExprNode> resolveAll(List<ExprNode> children) {
    List<ExprNode> resolved = new ArrayList<>();
    for (ExprNode child : children) {
      resolved.add(resolveOutputs(child));
    }
    return resolved;
  }
}
