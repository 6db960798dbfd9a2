package io.suitegraph.config;

/**
 * One {@code <recurrence> = <graph>} entry of the {@code [[graph]]} section.
 *
 * @param recurrence the recurrence label; null when the graph was given without one
 * @param graph the graph string, possibly spanning several lines
 */
public record GraphEntry(String recurrence, String graph) {
  /**
   * Creates an entry with no recurrence label.
   *
   * @param graph the graph string
   * @return a new GraphEntry
   */
  public static GraphEntry of(String graph) {
    return new GraphEntry(null, graph);
  }
}
