package timealgebra.ops;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Iterators;
import com.google.common.collect.PeekingIterator;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.PriorityQueue;
import timealgebra.core.model.Interval;
import timealgebra.core.model.IntervalOrder;

/**
 * K-way merge of ascending interval streams.
 *
 * <p>Always advances the stream whose head is smallest by {@code (start, end)}; heads in the same
 * position are taken in stream order, so the output is deterministic. Nothing is deduplicated.
 */
final class MergingIterator<T extends Interval> extends AbstractIterator<T> {
  private final PriorityQueue<Cursor<T>> heads;

  MergingIterator(List<? extends Iterator<? extends T>> streams) {
    Comparator<Cursor<T>> order =
        Comparator.<Cursor<T>, Interval>comparing(c -> c.stream.peek(), IntervalOrder.NATURAL)
            .thenComparingInt(c -> c.index);
    this.heads = new PriorityQueue<>(Math.max(1, streams.size()), order);
    for (int i = 0; i < streams.size(); i++) {
      PeekingIterator<T> stream = Iterators.peekingIterator(streams.get(i));
      if (stream.hasNext()) {
        heads.add(new Cursor<>(i, stream));
      }
    }
  }

  static <T extends Interval> Iterator<T> merge(List<? extends Iterator<? extends T>> streams) {
    if (streams.size() == 1) {
      return Iterators.unmodifiableIterator(streams.get(0));
    }
    return new MergingIterator<>(streams);
  }

  @Override
  protected T computeNext() {
    Cursor<T> cursor = heads.poll();
    if (cursor == null) {
      return endOfData();
    }
    T next = cursor.stream.next();
    if (cursor.stream.hasNext()) {
      heads.add(cursor);
    }
    return next;
  }

  private static final class Cursor<T> {
    private final int index;
    private final PeekingIterator<T> stream;

    private Cursor(int index, PeekingIterator<T> stream) {
      this.index = index;
      this.stream = stream;
    }
  }
}
