package timealgebra.core.model;

/** Raised when an interval would start after it ends. */
public class InvalidIntervalException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public InvalidIntervalException(String message) {
    super(message);
  }
}
