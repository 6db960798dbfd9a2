package io.suitegraph.ast;

/**
 * A single task reference in an expression.
 *
 * @param task the referenced task occurrence
 * @param suicide true if written with a leading {@code !}
 */
public record Leaf(TaskRef task, boolean suicide) implements ExprNode {
  /**
   * Creates a plain leaf.
   *
   * @param task the referenced task occurrence
   * @return a new Leaf
   */
  public static Leaf of(TaskRef task) {
    return new Leaf(task, false);
  }
}
