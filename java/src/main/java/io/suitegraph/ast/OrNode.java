package io.suitegraph.ast;

import java.util.List;

/**
 * Conditions of which any one suffices.
 *
 * @param children the operands, at least two
 */
public record OrNode(List<ExprNode> children) implements ExprNode {
  /** Creates a new OrNode with a defensive copy of the operands. */
  public OrNode {
    children = List.copyOf(children);
    if (children.size() < 2) {
      throw new IllegalArgumentException("OR needs at least two operands");
    }
  }
}
