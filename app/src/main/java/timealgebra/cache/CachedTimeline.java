package timealgebra.cache;

import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import timealgebra.core.Timeline;
import timealgebra.core.coerce.BoundCoercer;
import timealgebra.core.model.Interval;
import timealgebra.core.model.IntervalOrder;
import timealgebra.core.model.Intervals;

/**
 * Remembers what a timeline returned for the ranges already fetched and serves repeated queries
 * from memory until the entries are older than the TTL.
 *
 * <p>Coverage is kept as non-overlapping segments keyed by start. A fetch computes the parts of
 * the requested range that no fresh segment covers and asks the wrapped timeline only for those
 * parts, one call per uncovered range. Stale segments that overlap a refetched range are cut down
 * to the pieces outside it; those pieces keep their original fetch time and expire on their own
 * schedule. Every fetch also drops the expired segments lying outside the requested range, so
 * the segment map does not grow with ranges that are never queried again.
 *
 * <p>An interval that spans several segments is stored in each of them and served once, from the
 * segment holding the first instant of the interval inside the requested range.
 *
 * <p>Point queries through {@link #overlapping(long)} bypass the cache. Instances are not
 * thread-safe.
 */
public final class CachedTimeline<T extends Interval> implements Timeline<T> {
  private static final Logger LOG = LoggerFactory.getLogger(CachedTimeline.class);

  private final Timeline<? extends T> source;
  private final Ticker ticker;
  private final long ttlNanos;
  private final NavigableMap<Long, CacheSegment<T>> segments = new TreeMap<>();
  private final CacheStats stats = new CacheStats();

  public CachedTimeline(Timeline<? extends T> source, CacheOptions options) {
    this.source = Objects.requireNonNull(source, "source");
    CacheOptions normalized = CacheOptions.normalize(options);
    this.ticker = normalized.ticker();
    this.ttlNanos = normalized.ttlNanos();
  }

  public CachedTimeline(Timeline<? extends T> source) {
    this(source, CacheOptions.defaults());
  }

  public Timeline<? extends T> source() {
    return source;
  }

  @Override
  public Iterator<T> fetch(long start, long end) {
    if (start >= end) {
      return Collections.emptyIterator();
    }
    long now = ticker.read();
    evictExpiredOutside(start, end, now);
    List<long[]> misses = uncovered(start, end, now);
    if (misses.isEmpty()) {
      stats.recordHit();
      LOG.debug("Cache hit for [{}, {})", start, end);
    }
    for (long[] miss : misses) {
      LOG.debug("Cache miss for [{}, {}), fetching from {}", miss[0], miss[1], source);
      List<T> fetched = ImmutableList.copyOf(source.fetch(miss[0], miss[1]));
      stats.recordMiss();
      store(CacheSegment.of(miss[0], miss[1], fetched, now));
    }
    return serve(start, end).iterator();
  }

  @Override
  public Iterator<T> overlapping(long point) {
    return ImmutableList.<T>copyOf(source.overlapping(point)).iterator();
  }

  @Override
  public boolean isMask() {
    return source.isMask();
  }

  @Override
  public BoundCoercer boundCoercer() {
    return source.boundCoercer();
  }

  /** Drops every segment whose TTL has elapsed; returns how many were dropped. */
  public int evictExpired() {
    return evictExpiredOutside(0, 0, ticker.read());
  }

  /**
   * Drops expired segments that do not overlap {@code [start, end)}. Expired segments inside the
   * range are left for {@link #store} to fracture.
   */
  private int evictExpiredOutside(long start, long end, long now) {
    int removed = 0;
    Iterator<CacheSegment<T>> it = segments.values().iterator();
    while (it.hasNext()) {
      CacheSegment<T> segment = it.next();
      boolean inRange = start < end && segment.overlaps(start, end);
      if (!segment.isFresh(now, ttlNanos) && !inRange) {
        it.remove();
        stats.recordEviction();
        removed++;
      }
    }
    if (removed > 0) {
      LOG.debug("Evicted {} expired cache segments", removed);
    }
    return removed;
  }

  public void invalidate() {
    segments.clear();
  }

  /** Snapshot of the current segments, fresh and stale, in start order. */
  public List<CacheSegment<T>> segments() {
    return ImmutableList.copyOf(segments.values());
  }

  public CacheStats stats() {
    return stats.snapshot();
  }

  /** Ranges inside {@code [start, end)} not covered by a fresh segment, in order. */
  private List<long[]> uncovered(long start, long end, long now) {
    List<long[]> gaps = new ArrayList<>();
    long cursor = start;
    for (CacheSegment<T> segment : overlappingSegments(start, end)) {
      if (!segment.isFresh(now, ttlNanos)) {
        continue;
      }
      if (segment.start() > cursor) {
        gaps.add(new long[] {cursor, segment.start()});
      }
      cursor = Math.max(cursor, segment.end());
      if (cursor >= end) {
        break;
      }
    }
    if (cursor < end) {
      gaps.add(new long[] {cursor, end});
    }
    return gaps;
  }

  private void store(CacheSegment<T> fresh) {
    for (CacheSegment<T> stale : overlappingSegments(fresh.start(), fresh.end())) {
      segments.remove(stale.start());
      boolean fractured = false;
      if (stale.start() < fresh.start()) {
        CacheSegment<T> head = stale.restrict(stale.start(), fresh.start());
        segments.put(head.start(), head);
        fractured = true;
      }
      if (stale.end() > fresh.end()) {
        CacheSegment<T> tail = stale.restrict(fresh.end(), stale.end());
        segments.put(tail.start(), tail);
        fractured = true;
      }
      if (fractured) {
        stats.recordFracture();
        LOG.debug(
            "Fractured stale segment [{}, {}) around [{}, {})",
            stale.start(),
            stale.end(),
            fresh.start(),
            fresh.end());
      } else {
        stats.recordEviction();
      }
    }
    segments.put(fresh.start(), fresh);
  }

  private List<T> serve(long start, long end) {
    List<T> out = new ArrayList<>();
    for (CacheSegment<T> segment : overlappingSegments(start, end)) {
      for (T interval : segment.intervals()) {
        long firstInstant = Math.max(interval.finiteStart(), start);
        if (!segment.contains(firstInstant)) {
          continue;
        }
        Optional<T> clipped = Intervals.clip(interval, start, end);
        clipped.ifPresent(out::add);
      }
    }
    out.sort(IntervalOrder.NATURAL);
    return out;
  }

  private List<CacheSegment<T>> overlappingSegments(long start, long end) {
    List<CacheSegment<T>> found = new ArrayList<>();
    Map.Entry<Long, CacheSegment<T>> floor = segments.floorEntry(start);
    if (floor != null && floor.getValue().overlaps(start, end)) {
      found.add(floor.getValue());
    }
    for (CacheSegment<T> segment : segments.subMap(start, false, end, false).values()) {
      found.add(segment);
    }
    return found;
  }

  @Override
  public String toString() {
    return "Cached[" + source + ", ttl=" + ttlNanos + "ns]";
  }
}
