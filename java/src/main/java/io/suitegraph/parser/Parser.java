package io.suitegraph.parser;

import io.suitegraph.CyclingMode;
import io.suitegraph.ErrorKind;
import io.suitegraph.GraphLine;
import io.suitegraph.GraphParseException;
import io.suitegraph.Span;
import io.suitegraph.ast.AndNode;
import io.suitegraph.ast.ExprNode;
import io.suitegraph.ast.Leaf;
import io.suitegraph.ast.OrNode;
import io.suitegraph.graph.EdgeFlattener;
import io.suitegraph.graph.GraphFragment;
import io.suitegraph.lexer.Lexer;
import io.suitegraph.lexer.Token;
import io.suitegraph.lexer.TokenKind;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser for graph lines.
 *
 * <pre>
 * line    := chain EOF
 * chain   := orExpr ( "=&gt;" orExpr )*
 * orExpr  := andExpr ( "|" andExpr )*
 * andExpr := primary ( "&amp;" primary )*
 * primary := NAME | "(" orExpr ")"
 * </pre>
 */
public final class Parser {
  private final String input;
  private final String recurrence;
  private final List<Token> tokens;
  private int pos;
  private int depth;
  private Token stageSuicide;

  private Parser(String input, String recurrence, List<Token> tokens) {
    this.input = input;
    this.recurrence = recurrence;
    this.tokens = tokens;
    this.pos = 0;
    this.depth = 0;
  }

  /**
   * Parses a graph line into its edges.
   *
   * <p>The line is tokenized before its recurrence is checked, so lexical errors are reported the
   * same way in cycling and non-cycling suites.
   *
   * @param line the graph line and its recurrence context
   * @return the tasks, edges and trigger conditions declared by the line
   * @throws GraphParseException if the line is invalid
   */
  public static GraphFragment parse(GraphLine line) throws GraphParseException {
    String recurrence = line.hasRecurrence() ? line.recurrence() : null;
    List<Token> tokens = Lexer.tokenize(line.text(), recurrence);

    if (recurrence == null) {
      if (line.mode() == CyclingMode.CYCLING) {
        throw GraphParseException.structural(
            ErrorKind.MISSING_RECURRENCE,
            null,
            new Span(0, line.text().length()),
            line.text(),
            null);
      }
      recurrence = GraphLine.RUN_ONCE;
    }

    List<ExprNode> stages = new Parser(line.text(), recurrence, tokens).parseLine();
    return EdgeFlattener.flatten(line, recurrence, stages);
  }

  /**
   * Parses a graph line into the expressions between its arrows, without building edges.
   *
   * @param input the graph line
   * @return one expression per arrow-separated stage, left to right
   * @throws GraphParseException if the line is invalid
   */
  public static List<ExprNode> parseChain(String input) throws GraphParseException {
    return new Parser(input, null, Lexer.tokenize(input)).parseLine();
  }

  private List<ExprNode> parseLine() throws GraphParseException {
    if (tokens.isEmpty()) {
      throw parseError(ErrorKind.MISSING_TASK, "(empty line)", new Span(0, 0));
    }

    List<ExprNode> stages = new ArrayList<>();
    stages.add(parseStage());
    if (stageSuicide != null) {
      throw parseError(ErrorKind.MISPLACED_SUICIDE, null, stageSuicide.span());
    }

    while (check(TokenKind.ARROW)) {
      pos++;
      stages.add(parseStage());
      if (stageSuicide != null && check(TokenKind.ARROW)) {
        throw parseError(ErrorKind.MISPLACED_SUICIDE, null, stageSuicide.span());
      }
    }

    Token tok = peek();
    if (tok != null) {
      if (tok.kind() == TokenKind.RPAREN) {
        throw parseError(ErrorKind.UNBALANCED_GROUPING, "(unmatched ')')", tok.span());
      }
      throw parseError(ErrorKind.UNEXPECTED_TOKEN, null, tok.span());
    }

    return stages;
  }

  private ExprNode parseStage() throws GraphParseException {
    stageSuicide = null;
    return parseOr();
  }

  private ExprNode parseOr() throws GraphParseException {
    List<ExprNode> operands = new ArrayList<>();
    operands.add(parseAnd());
    while (check(TokenKind.OR)) {
      pos++;
      operands.add(parseAnd());
    }
    return operands.size() == 1 ? operands.get(0) : new OrNode(operands);
  }

  private ExprNode parseAnd() throws GraphParseException {
    List<ExprNode> operands = new ArrayList<>();
    operands.add(parsePrimary());
    while (check(TokenKind.AND)) {
      pos++;
      operands.add(parsePrimary());
    }
    return operands.size() == 1 ? operands.get(0) : new AndNode(operands);
  }

  private ExprNode parsePrimary() throws GraphParseException {
    Token tok = peek();
    Token prev = previous();

    if (tok == null) {
      if (prev != null && prev.kind() == TokenKind.ARROW) {
        throw parseError(ErrorKind.MALFORMED_ARROW, "(no task on its right)", prev.span());
      }
      throw parseError(ErrorKind.MISSING_TASK, null, prev != null ? prev.span() : endSpan());
    }

    return switch (tok.kind()) {
      case NAME -> {
        pos++;
        if (tok.suicide() && stageSuicide == null) {
          stageSuicide = tok;
        }
        yield new Leaf(tok.task(), tok.suicide());
      }
      case LPAREN -> parseGroup(tok);
      case ARROW -> {
        if (prev == null || prev.kind() == TokenKind.ARROW) {
          throw parseError(ErrorKind.MALFORMED_ARROW, "(no task on its left)", tok.span());
        }
        throw parseError(ErrorKind.MISSING_TASK, null, tok.span());
      }
      case RPAREN -> {
        if (depth == 0) {
          throw parseError(ErrorKind.UNBALANCED_GROUPING, "(unmatched ')')", tok.span());
        }
        throw parseError(ErrorKind.MISSING_TASK, null, tok.span());
      }
      default -> throw parseError(ErrorKind.MISSING_TASK, null, tok.span());
    };
  }

  private ExprNode parseGroup(Token open) throws GraphParseException {
    pos++;
    depth++;
    Token first = peek();
    if (first != null && first.kind() == TokenKind.RPAREN) {
      throw parseError(
          ErrorKind.MISSING_TASK,
          "(empty parentheses)",
          new Span(open.span().start(), first.span().end()));
    }

    ExprNode inner = parseOr();

    Token close = peek();
    if (close == null) {
      throw parseError(ErrorKind.UNBALANCED_GROUPING, "(unmatched '(')", open.span());
    }
    if (close.kind() == TokenKind.ARROW) {
      if (!closedLater()) {
        throw parseError(ErrorKind.UNBALANCED_GROUPING, "(unmatched '(')", open.span());
      }
      throw parseError(ErrorKind.MALFORMED_ARROW, "(arrows cannot be grouped)", close.span());
    }
    if (close.kind() != TokenKind.RPAREN) {
      throw parseError(ErrorKind.UNEXPECTED_TOKEN, null, close.span());
    }
    pos++;
    depth--;
    return inner;
  }

  // Helper methods

  private Token peek() {
    return pos < tokens.size() ? tokens.get(pos) : null;
  }

  private Token previous() {
    return pos > 0 ? tokens.get(pos - 1) : null;
  }

  private boolean closedLater() {
    for (int i = pos; i < tokens.size(); i++) {
      if (tokens.get(i).kind() == TokenKind.RPAREN) {
        return true;
      }
    }
    return false;
  }

  private boolean check(TokenKind kind) {
    Token tok = peek();
    return tok != null && tok.kind() == kind;
  }

  private Span endSpan() {
    if (tokens.isEmpty()) {
      return new Span(0, 0);
    }
    Span lastSpan = tokens.get(tokens.size() - 1).span();
    return new Span(lastSpan.end(), lastSpan.end());
  }

  private GraphParseException parseError(ErrorKind kind, String detail, Span span) {
    return GraphParseException.structural(kind, detail, span, input, recurrence);
  }
}
