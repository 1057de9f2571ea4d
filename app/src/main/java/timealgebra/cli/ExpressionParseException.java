package timealgebra.cli;

/** Malformed timeline expression. Carries the character offset where parsing stopped. */
public final class ExpressionParseException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final int position;

  public ExpressionParseException(String message, String expression, int position) {
    super(message + " at position " + position + " in '" + expression + "'");
    this.position = position;
  }

  public int position() {
    return position;
  }
}
