package timealgebra.core.coerce;

/**
 * Converts a caller-supplied query bound into canonical seconds.
 *
 * <p>Implementations are injected into leaf timelines at construction time and consulted only by
 * the query entry point; operators never see anything but canonical {@code long} bounds. A {@code
 * null} bound means the side is unbounded and must map to {@link BoundEdge#unboundedValue()}.
 */
@FunctionalInterface
public interface BoundCoercer {

  long coerce(Object bound, BoundEdge edge);
}
