package io.suitegraph.lexer;

/** The type of token. */
public enum TokenKind {
  /** A task reference, e.g. "foo", "!foo", "foo[-P1D]:fail". */
  NAME,
  /** The "=>" sequencing operator. */
  ARROW,
  /** The "&amp;" operator. */
  AND,
  /** The "|" operator. */
  OR,
  /** An opening parenthesis. */
  LPAREN,
  /** A closing parenthesis. */
  RPAREN
}
