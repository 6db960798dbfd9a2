package io.suitegraph.lexer;

import io.suitegraph.Span;
import io.suitegraph.ast.TaskRef;

/**
 * Represents a lexed token.
 *
 * @param kind the type of token
 * @param span the location in the input
 * @param text the exact source characters of the token
 * @param task the task reference (for NAME tokens)
 * @param suicide whether the name carried a leading "!" (for NAME tokens)
 */
public record Token(TokenKind kind, Span span, String text, TaskRef task, boolean suicide) {
  /** Creates an operator or grouping token. */
  public static Token symbol(TokenKind kind, Span span, String text) {
    return new Token(kind, span, text, null, false);
  }

  /** Creates a task name token. */
  public static Token name(TaskRef task, boolean suicide, Span span, String text) {
    return new Token(TokenKind.NAME, span, text, task, suicide);
  }
}
