package timealgebra.ops;

import timealgebra.core.model.Interval;

/**
 * Builds the metadata-free intervals produced by {@link Complement} and {@link Flatten}. Lets a
 * collaborator choose the concrete class of gap intervals; the result is still treated as a mask.
 */
@FunctionalInterface
public interface MaskFactory {
  MaskFactory PLAIN = Interval::new;

  Interval create(long start, long end);
}
