package io.suitegraph.lexer;

import io.suitegraph.ErrorKind;
import io.suitegraph.GraphParseException;
import io.suitegraph.Span;
import io.suitegraph.ast.Outputs;
import io.suitegraph.ast.TaskRef;
import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizes a graph line into a list of tokens.
 *
 * <p>The AND and OR operators are single characters. Their doubled forms {@code &&} and {@code
 * ||} are rejected here, before any structural parsing, so the diagnostic names the operator
 * instead of reporting a generic syntax error. The whole line is checked for doubled operators
 * before the token scan, so an earlier bad character never hides one. The rules do not depend on
 * the suite's cycling mode.
 */
public final class Lexer {
  private final String input;
  private final String recurrence;
  private int pos;

  private Lexer(String input, String recurrence) {
    this.input = input;
    this.recurrence = recurrence;
    this.pos = 0;
  }

  /**
   * Tokenizes a graph line.
   *
   * @param input the graph line to tokenize
   * @return a list of tokens
   * @throws GraphParseException if the line contains invalid tokens
   */
  public static List<Token> tokenize(String input) throws GraphParseException {
    return tokenize(input, null);
  }

  /**
   * Tokenizes a graph line, tagging any error with the line's recurrence label.
   *
   * @param input the graph line to tokenize
   * @param recurrence the recurrence label reported in errors, may be null
   * @return a list of tokens
   * @throws GraphParseException if the line contains invalid tokens
   */
  public static List<Token> tokenize(String input, String recurrence)
      throws GraphParseException {
    return new Lexer(input, recurrence).doTokenize();
  }

  private List<Token> doTokenize() throws GraphParseException {
    checkDoubledOperators();

    List<Token> tokens = new ArrayList<>();
    while (true) {
      skipWhitespace();
      if (pos >= input.length()) {
        break;
      }

      int start = pos;
      char ch = input.charAt(pos);

      switch (ch) {
        case '&' -> tokens.add(symbol(TokenKind.AND, 1));
        case '|' -> tokens.add(symbol(TokenKind.OR, 1));
        case '=' -> {
          if (!peekIs(start + 1, '>')) {
            throw error(ErrorKind.MALFORMED_ARROW, null, new Span(start, start + 2));
          }
          tokens.add(symbol(TokenKind.ARROW, 2));
        }
        case '(' -> tokens.add(symbol(TokenKind.LPAREN, 1));
        case ')' -> tokens.add(symbol(TokenKind.RPAREN, 1));
        default -> {
          if (ch == '!' || isNameStart(ch)) {
            tokens.add(lexName());
          } else {
            throw unexpected(start);
          }
        }
      }
    }

    return tokens;
  }

  // Bracketed offsets are skipped; an unterminated '[' runs to the end of the line.
  private void checkDoubledOperators() throws GraphParseException {
    int i = 0;
    while (i < input.length()) {
      char ch = input.charAt(i);
      if (ch == '[') {
        int close = input.indexOf(']', i + 1);
        if (close < 0) {
          return;
        }
        i = close + 1;
        continue;
      }
      if (ch == '&' && peekIs(i + 1, '&')) {
        throw error(ErrorKind.DOUBLED_AND, null, new Span(i, i + 2));
      }
      if (ch == '|' && peekIs(i + 1, '|')) {
        throw error(ErrorKind.DOUBLED_OR, null, new Span(i, i + 2));
      }
      i++;
    }
  }

  private Token symbol(TokenKind kind, int width) {
    int start = pos;
    pos += width;
    return Token.symbol(kind, new Span(start, pos), input.substring(start, pos));
  }

  private Token lexName() throws GraphParseException {
    int start = pos;

    boolean suicide = false;
    if (input.charAt(pos) == '!') {
      suicide = true;
      pos++;
      if (pos >= input.length() || !isNameStart(input.charAt(pos))) {
        throw error(
            ErrorKind.UNEXPECTED_CHARACTER,
            "'!' (expected a task name after it)",
            new Span(start, start + 1));
      }
    }

    int nameStart = pos;
    while (pos < input.length() && isNameChar(input.charAt(pos))) {
      pos++;
    }
    String name = input.substring(nameStart, pos);

    String offset = null;
    if (peekIs(pos, '[')) {
      offset = lexOffset();
    }

    String output = null;
    if (peekIs(pos, ':')) {
      output = lexOutput();
    }

    TaskRef task = new TaskRef(name, offset, output);
    return Token.name(task, suicide, new Span(start, pos), input.substring(start, pos));
  }

  // Offset contents are never operators, so "&", "|" and "=" in brackets are just bad characters.
  private String lexOffset() throws GraphParseException {
    int open = pos;
    int close = input.indexOf(']', open + 1);
    if (close < 0) {
      throw error(ErrorKind.UNBALANCED_GROUPING, "(unmatched '[')", new Span(open, open + 1));
    }
    if (close == open + 1) {
      throw error(
          ErrorKind.UNEXPECTED_CHARACTER,
          "']' (empty cycle point offset)",
          new Span(close, close + 1));
    }
    for (int i = open + 1; i < close; i++) {
      if (!isOffsetChar(input.charAt(i))) {
        throw unexpected(i);
      }
    }
    pos = close + 1;
    return input.substring(open + 1, close);
  }

  private String lexOutput() throws GraphParseException {
    int colon = pos;
    pos++;
    int labelStart = pos;
    while (pos < input.length() && isOutputChar(input.charAt(pos))) {
      pos++;
    }
    if (pos == labelStart) {
      throw error(
          ErrorKind.UNEXPECTED_CHARACTER,
          "':' (expected an output label after it)",
          new Span(colon, colon + 1));
    }
    return Outputs.normalize(input.substring(labelStart, pos));
  }

  private void skipWhitespace() {
    while (pos < input.length() && isWhitespace(input.charAt(pos))) {
      pos++;
    }
  }

  private boolean peekIs(int at, char expected) {
    return at < input.length() && input.charAt(at) == expected;
  }

  private GraphParseException unexpected(int at) {
    return error(
        ErrorKind.UNEXPECTED_CHARACTER, "'" + input.charAt(at) + "'", new Span(at, at + 1));
  }

  private GraphParseException error(ErrorKind kind, String detail, Span span) {
    return kind.category() == ErrorKind.Category.LEX
        ? GraphParseException.lex(kind, detail, span, input, recurrence)
        : GraphParseException.structural(kind, detail, span, input, recurrence);
  }

  private static boolean isNameStart(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }

  private static boolean isNameChar(char c) {
    return isNameStart(c) || c == '-' || c == '+' || c == '%' || c == '@';
  }

  private static boolean isOffsetChar(char c) {
    return Character.isLetterOrDigit(c) || c == '^' || c == '+' || c == '-' || c == ':' || c == '.';
  }

  private static boolean isOutputChar(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '-';
  }

  private static boolean isWhitespace(char c) {
    return c == ' ' || c == '\t' || c == '\n' || c == '\r';
  }
}
