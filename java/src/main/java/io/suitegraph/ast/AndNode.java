package io.suitegraph.ast;

import java.util.List;

/**
 * Conditions that must all hold.
 *
 * @param children the operands, at least two
 */
public record AndNode(List<ExprNode> children) implements ExprNode {
  /** Creates a new AndNode with a defensive copy of the operands. */
  public AndNode {
    children = List.copyOf(children);
    if (children.size() < 2) {
      throw new IllegalArgumentException("AND needs at least two operands");
    }
  }
}
