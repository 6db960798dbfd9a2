package io.suitegraph;

/**
 * One logical line of a suite's graph, with the recurrence it was declared under.
 *
 * @param text the graph expression, e.g. {@code foo & bar => baz}
 * @param recurrence the recurrence label, e.g. {@code R1} or {@code P1D}; null if omitted
 * @param mode the cycling mode of the enclosing suite
 */
public record GraphLine(String text, String recurrence, CyclingMode mode) {
  /** The implicit run-once recurrence of non-cycling suites. */
  public static final String RUN_ONCE = "R1";

  /** Validates the required components. */
  public GraphLine {
    if (text == null) {
      throw new IllegalArgumentException("graph line text must not be null");
    }
    if (mode == null) {
      throw new IllegalArgumentException("cycling mode must not be null");
    }
  }

  /**
   * Creates a line for a non-cycling suite with no explicit recurrence.
   *
   * @param text the graph expression
   * @return a new GraphLine
   */
  public static GraphLine of(String text) {
    return new GraphLine(text, null, CyclingMode.NON_CYCLING);
  }

  /**
   * Returns true if the line names a recurrence.
   *
   * @return whether a non-blank recurrence label is present
   */
  public boolean hasRecurrence() {
    return recurrence != null && !recurrence.isBlank();
  }
}
