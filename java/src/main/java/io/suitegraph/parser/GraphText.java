package io.suitegraph.parser;

import java.util.ArrayList;
import java.util.List;

/** Splits a multi-line graph string into logical graph lines. */
public final class GraphText {
  private static final String[] CONTINUATIONS = {"=>", "&", "|"};

  private GraphText() {}

  /**
   * Returns the logical lines of a graph string.
   *
   * <p>Comments starting with {@code #} run to the end of the line and are removed. Blank lines
   * are skipped. A line that ends with {@code =>}, {@code &} or {@code |} continues onto the next
   * line, and a line that starts with one of them continues the previous line.
   *
   * @param graph the graph string, possibly spanning several lines
   * @return the logical lines, trimmed
   */
  public static List<String> logicalLines(String graph) {
    List<String> lines = new ArrayList<>();
    if (graph == null) {
      return lines;
    }

    StringBuilder current = null;
    for (String raw : graph.split("\r?\n", -1)) {
      String line = stripComment(raw).trim();
      if (line.isEmpty()) {
        continue;
      }

      if (current != null && (endsWithOperator(current) || startsWithOperator(line))) {
        current.append(' ').append(line);
        continue;
      }

      if (current != null) {
        lines.add(current.toString());
      }
      current = new StringBuilder(line);
    }

    if (current != null) {
      lines.add(current.toString());
    }
    return lines;
  }

  private static String stripComment(String line) {
    int hash = line.indexOf('#');
    return hash < 0 ? line : line.substring(0, hash);
  }

  private static boolean endsWithOperator(CharSequence line) {
    String text = line.toString();
    for (String op : CONTINUATIONS) {
      if (text.endsWith(op)) {
        return true;
      }
    }
    return false;
  }

  private static boolean startsWithOperator(String line) {
    for (String op : CONTINUATIONS) {
      if (line.startsWith(op)) {
        return true;
      }
    }
    return false;
  }
}
