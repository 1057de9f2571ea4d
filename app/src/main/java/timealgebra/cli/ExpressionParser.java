package timealgebra.cli;

import java.util.Map;
import java.util.Objects;
import timealgebra.core.Timeline;
import timealgebra.ops.Composition;
import timealgebra.ops.TimelineCompositionException;

/**
 * Recursive-descent parser for timeline expressions over named operands.
 *
 * <pre>
 * expr  := term ('|' term)*
 * term  := diff ('&amp;' diff)*
 * diff  := unary ('-' unary)*
 * unary := '~' unary | 'flatten' '(' expr ')' | '(' expr ')' | NAME
 * </pre>
 *
 * <p>Names resolve to timelines or filters registered with the parser; operators combine them
 * through {@link Composition}, so {@code busy & long} filters the {@code busy} timeline with the
 * {@code long} filter. Whitespace is ignored.
 */
public final class ExpressionParser {
  private static final String FLATTEN = "flatten";

  private final Map<String, ?> operands;
  private String input;
  private int pos;

  public ExpressionParser(Map<String, ?> operands) {
    this.operands = Map.copyOf(Objects.requireNonNull(operands, "operands"));
  }

  /** Parses an expression that must evaluate to a timeline. */
  public Timeline<?> parseTimeline(String expression) {
    Object result = parse(expression);
    if (result instanceof Timeline<?> timeline) {
      return timeline;
    }
    throw new ExpressionParseException(
        "Expression evaluates to a filter, not a timeline", expression, 0);
  }

  /** Parses an expression into a timeline or a filter. */
  public Object parse(String expression) {
    Objects.requireNonNull(expression, "expression");
    this.input = expression;
    this.pos = 0;
    skipWhitespace();
    if (atEnd()) {
      throw error("Empty expression");
    }
    Object result = expr();
    skipWhitespace();
    if (!atEnd()) {
      throw error("Unexpected '" + input.charAt(pos) + "'");
    }
    return result;
  }

  private Object expr() {
    Object left = term();
    while (consume('|')) {
      int at = pos;
      Object right = term();
      left = apply('|', left, right, at);
    }
    return left;
  }

  private Object term() {
    Object left = diff();
    while (consume('&')) {
      int at = pos;
      Object right = diff();
      left = apply('&', left, right, at);
    }
    return left;
  }

  private Object diff() {
    Object left = unary();
    while (consume('-')) {
      int at = pos;
      Object right = unary();
      left = apply('-', left, right, at);
    }
    return left;
  }

  private Object unary() {
    skipWhitespace();
    int at = pos;
    if (consume('~')) {
      Object operand = unary();
      return apply('~', operand, null, at);
    }
    if (consume('(')) {
      Object inner = expr();
      expect(')');
      return inner;
    }
    String name = name();
    if (FLATTEN.equals(name) && peek('(')) {
      expect('(');
      Object inner = expr();
      expect(')');
      return apply('f', inner, null, at);
    }
    Object operand = operands.get(name);
    if (operand == null) {
      pos = at;
      throw error("Unknown name '" + name + "'");
    }
    return operand;
  }

  private String name() {
    skipWhitespace();
    int begin = pos;
    while (!atEnd() && isNameChar(input.charAt(pos))) {
      pos++;
    }
    if (begin == pos) {
      throw error(atEnd() ? "Unexpected end of expression" : "Expected a name");
    }
    return input.substring(begin, pos);
  }

  private static boolean isNameChar(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '.';
  }

  private Object apply(char operator, Object left, Object right, int at) {
    try {
      return switch (operator) {
        case '|' -> Composition.either(left, right);
        case '&' -> Composition.both(left, right);
        case '-' -> Composition.without(left, right);
        case '~' -> Composition.complement(left);
        case 'f' -> Composition.flatten(left);
        default -> throw new IllegalStateException("Unknown operator " + operator);
      };
    } catch (TimelineCompositionException ex) {
      throw new ExpressionParseException(ex.getMessage(), input, at);
    }
  }

  private boolean consume(char c) {
    skipWhitespace();
    if (!atEnd() && input.charAt(pos) == c) {
      pos++;
      return true;
    }
    return false;
  }

  private boolean peek(char c) {
    skipWhitespace();
    return !atEnd() && input.charAt(pos) == c;
  }

  private void expect(char c) {
    if (!consume(c)) {
      throw error("Expected '" + c + "'");
    }
  }

  private void skipWhitespace() {
    while (!atEnd() && Character.isWhitespace(input.charAt(pos))) {
      pos++;
    }
  }

  private boolean atEnd() {
    return pos >= input.length();
  }

  private ExpressionParseException error(String message) {
    return new ExpressionParseException(message, input, pos);
  }
}
