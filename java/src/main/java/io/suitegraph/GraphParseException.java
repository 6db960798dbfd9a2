package io.suitegraph;

import java.util.Optional;

/**
 * Exception thrown when a graph line cannot be tokenized or parsed.
 *
 * <p>The message is the kind's fixed template followed by the offending line, for example
 * {@code the graph AND operator is '&': foo && bar => baz}. {@link #render()} adds the {@code
 * GraphParseError: } prefix users see in diagnostics.
 */
public final class GraphParseException extends Exception {
  /** Prefix of every rendered diagnostic. */
  public static final String PREFIX = "GraphParseError: ";

  /** The error kind. */
  private final ErrorKind kind;

  /** The location of the error in the line. */
  private final Span span;

  /** The graph line being parsed. */
  private final String input;

  /** The recurrence label the line was declared under, if known. */
  private final String recurrence;

  private GraphParseException(
      ErrorKind kind, String detail, Span span, String input, String recurrence) {
    super(message(kind, detail, input));
    this.kind = kind;
    this.span = span;
    this.input = input;
    this.recurrence = recurrence;
  }

  /**
   * Creates a new lexer error.
   *
   * @param kind the error kind, which must be in the {@code LEX} category
   * @param detail extra text placed between the template and the line, may be null
   * @param span the location of the error in the input
   * @param input the graph line
   * @param recurrence the recurrence label, may be null
   * @return a new GraphParseException for a lexer error
   */
  public static GraphParseException lex(
      ErrorKind kind, String detail, Span span, String input, String recurrence) {
    requireCategory(kind, ErrorKind.Category.LEX);
    return new GraphParseException(kind, detail, span, input, recurrence);
  }

  /**
   * Creates a new structural error.
   *
   * @param kind the error kind, which must be in the {@code STRUCTURAL} category
   * @param detail extra text placed between the template and the line, may be null
   * @param span the location of the error in the input
   * @param input the graph line
   * @param recurrence the recurrence label, may be null
   * @return a new GraphParseException for a structural error
   */
  public static GraphParseException structural(
      ErrorKind kind, String detail, Span span, String input, String recurrence) {
    requireCategory(kind, ErrorKind.Category.STRUCTURAL);
    return new GraphParseException(kind, detail, span, input, recurrence);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the span where the error occurred.
   *
   * @return the span
   */
  public Span span() {
    return span;
  }

  /**
   * Returns the graph line that failed.
   *
   * @return the line
   */
  public String input() {
    return input;
  }

  /**
   * Returns the characters the span points at, e.g. {@code &&} for a doubled AND.
   *
   * @return the offending substring
   */
  public String offending() {
    return span.text(input);
  }

  /**
   * Returns the recurrence label of the failing line, if known.
   *
   * @return the recurrence, or empty
   */
  public Optional<String> recurrence() {
    return Optional.ofNullable(recurrence);
  }

  /**
   * Returns the token that should have been written, if the kind implies one.
   *
   * @return the expected token, or empty
   */
  public Optional<String> expected() {
    return Optional.ofNullable(kind.expected());
  }

  /**
   * Renders the diagnostic as written to the error stream.
   *
   * @return {@code GraphParseError: } followed by the message
   */
  public String render() {
    return PREFIX + getMessage();
  }

  /**
   * Formats a rich error message with an underline and the expected token.
   *
   * <pre>
   * GraphParseError: the graph AND operator is '&amp;': foo &amp;&amp; bar =&gt; baz
   *   [R1] foo &amp;&amp; bar =&gt; baz
   *            ^^ expected: '&amp;'
   * </pre>
   *
   * @return a formatted error message
   */
  public String displayRich() {
    StringBuilder sb = new StringBuilder();
    sb.append(render()).append("\n");

    String label = recurrence == null ? "" : "[" + recurrence + "] ";
    sb.append("  ").append(label).append(input).append("\n");

    sb.append(" ".repeat(span.start() + 2 + label.length()));
    sb.append("^".repeat(span.length()));

    if (kind.expected() != null) {
      sb.append(" expected: '").append(kind.expected()).append("'");
    }

    return sb.toString();
  }

  private static String message(ErrorKind kind, String detail, String input) {
    StringBuilder sb = new StringBuilder(kind.template());
    if (detail != null && !detail.isEmpty()) {
      sb.append(" ").append(detail);
    }
    sb.append(": ").append(input == null ? "" : input);
    return sb.toString();
  }

  private static void requireCategory(ErrorKind kind, ErrorKind.Category category) {
    if (kind.category() != category) {
      throw new IllegalArgumentException(kind + " is not a " + category + " error");
    }
  }
}
