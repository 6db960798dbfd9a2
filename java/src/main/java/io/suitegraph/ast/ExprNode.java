package io.suitegraph.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Sealed interface for the boolean expression on either side of a graph arrow.
 *
 * <ul>
 *   <li>{@link Leaf} - "foo", "foo:fail", "!foo"
 *   <li>{@link AndNode} - "foo &amp; bar"
 *   <li>{@link OrNode} - "foo | bar"
 * </ul>
 */
public sealed interface ExprNode permits Leaf, AndNode, OrNode {

  /**
   * Returns every leaf of this expression, left to right.
   *
   * @return the leaves
   */
  default List<Leaf> leaves() {
    List<Leaf> out = new ArrayList<>();
    collectLeaves(this, out);
    return out;
  }

  private static void collectLeaves(ExprNode node, List<Leaf> out) {
    if (node instanceof Leaf leaf) {
      out.add(leaf);
    } else if (node instanceof AndNode and) {
      and.children().forEach(child -> collectLeaves(child, out));
    } else if (node instanceof OrNode or) {
      or.children().forEach(child -> collectLeaves(child, out));
    }
  }
}
