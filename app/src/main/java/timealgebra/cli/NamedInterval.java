package timealgebra.cli;

import java.util.Objects;
import timealgebra.core.model.Interval;

/** Interval tagged with the name of the command-line source it came from. */
public final class NamedInterval extends Interval {
  private final String source;

  public NamedInterval(long start, long end, String source) {
    super(start, end);
    this.source = Objects.requireNonNull(source, "source");
  }

  public String source() {
    return source;
  }

  @Override
  public NamedInterval withBounds(long newStart, long newEnd) {
    return new NamedInterval(newStart, newEnd, source);
  }

  @Override
  public boolean equals(Object o) {
    return super.equals(o) && source.equals(((NamedInterval) o).source);
  }

  @Override
  public int hashCode() {
    return 31 * super.hashCode() + source.hashCode();
  }

  @Override
  public String toString() {
    return source + "[" + boundText(finiteStart()) + ", " + boundText(finiteEnd()) + ")";
  }
}
