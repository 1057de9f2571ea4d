package timealgebra.ops;

/** Raised when operands are combined by a rule that does not accept their kinds. */
public class TimelineCompositionException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public TimelineCompositionException(String message) {
    super(message);
  }
}
