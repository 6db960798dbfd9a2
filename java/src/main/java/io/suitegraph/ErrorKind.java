package io.suitegraph;

/** The type of error raised while tokenizing or parsing a graph line. */
public enum ErrorKind {
  /** A doubled {@code &&} where the single-character AND operator was meant. */
  DOUBLED_AND(Category.LEX, "the graph AND operator is '&'", "&"),
  /** A doubled {@code ||} where the single-character OR operator was meant. */
  DOUBLED_OR(Category.LEX, "the graph OR operator is '|'", "|"),
  /** A character that cannot start any token. */
  UNEXPECTED_CHARACTER(Category.LEX, "unexpected character", null),
  /** An unmatched parenthesis or offset bracket. */
  UNBALANCED_GROUPING(Category.STRUCTURAL, "unbalanced grouping", null),
  /** A broken arrow, or an arrow missing one of its sides. */
  MALFORMED_ARROW(Category.STRUCTURAL, "the graph arrow operator is '=>'", "=>"),
  /** A line without a recurrence in a cycling suite. */
  MISSING_RECURRENCE(
      Category.STRUCTURAL, "a recurrence is required when an initial cycle point is set", null),
  /** An operator or group with no task to apply to. */
  MISSING_TASK(Category.STRUCTURAL, "null task name in graph", null),
  /** Two operands with no operator between them. */
  UNEXPECTED_TOKEN(Category.STRUCTURAL, "expected an operator between tasks", null),
  /** A suicide marker anywhere other than the right of a trigger. */
  MISPLACED_SUICIDE(Category.STRUCTURAL, "suicide markers must be on the right of a trigger", null),
  /** A left-hand expression whose AND of OR groups expands past the alternative limit. */
  TOO_MANY_ALTERNATIVES(
      Category.STRUCTURAL, "the trigger expression expands to too many alternatives", null);

  /** Whether an error is detected while scanning characters or while parsing tokens. */
  public enum Category {
    /** Detected by the lexer. */
    LEX,
    /** Detected by the parser or the recurrence check. */
    STRUCTURAL
  }

  private final Category category;
  private final String template;
  private final String expected;

  ErrorKind(Category category, String template, String expected) {
    this.category = category;
    this.template = template;
    this.expected = expected;
  }

  /**
   * Returns the stage that detects this kind of error.
   *
   * @return the error category
   */
  public Category category() {
    return category;
  }

  /**
   * Returns the fixed message text for this kind, before line context is appended.
   *
   * @return the message template
   */
  public String template() {
    return template;
  }

  /**
   * Returns the token that should have been written, if this kind implies one.
   *
   * @return the expected token, or null
   */
  public String expected() {
    return expected;
  }
}
