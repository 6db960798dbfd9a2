package io.suitegraph;

/**
 * Represents a range of character positions in a graph line.
 *
 * @param start the start position (inclusive)
 * @param end the end position (exclusive)
 */
public record Span(int start, int end) {
  /**
   * Returns the length of this span.
   *
   * @return the number of characters covered by this span, at least one
   */
  public int length() {
    return Math.max(1, end - start);
  }

  /**
   * Returns the characters of {@code input} covered by this span, clamped to the input bounds.
   *
   * @param input the line this span points into
   * @return the covered substring, possibly empty
   */
  public String text(String input) {
    if (input == null) {
      return "";
    }
    int from = Math.min(Math.max(0, start), input.length());
    int to = Math.min(Math.max(from, end), input.length());
    return input.substring(from, to);
  }
}
