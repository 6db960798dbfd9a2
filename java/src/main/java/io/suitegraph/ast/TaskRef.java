package io.suitegraph.ast;

/**
 * A reference to a task occurrence in a graph expression.
 *
 * @param name the task name
 * @param offset the inter-cycle offset written in brackets, e.g. {@code -P1D}; null if absent
 * @param output the normalised output qualifier, e.g. {@code failed}; null if absent
 */
public record TaskRef(String name, String offset, String output) {
  /** Validates the name. */
  public TaskRef {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("task name must not be empty");
    }
  }

  /**
   * Creates a reference to a task in the current cycle with no output qualifier.
   *
   * @param name the task name
   * @return a new TaskRef
   */
  public static TaskRef of(String name) {
    return new TaskRef(name, null, null);
  }

  /**
   * Returns a copy with the specified output.
   *
   * @param output the output label
   * @return a new TaskRef with the updated output
   */
  public TaskRef withOutput(String output) {
    return new TaskRef(name, offset, output);
  }

  /**
   * Returns a copy without an output, used for the successor side of a trigger.
   *
   * @return a new TaskRef with no output
   */
  public TaskRef withoutOutput() {
    return output == null ? this : new TaskRef(name, offset, null);
  }

  /** Renders the reference as written in a graph, e.g. {@code foo[-P1D]:failed}. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(name);
    if (offset != null) {
      sb.append('[').append(offset).append(']');
    }
    if (output != null) {
      sb.append(':').append(output);
    }
    return sb.toString();
  }
}
