package timealgebra.cache;

/**
 * Counters for a {@link CachedTimeline}.
 *
 * <p>A hit is a fetch answered entirely from cached segments. A miss is one call to the wrapped
 * timeline, so a single fetch spanning several uncovered ranges records several misses.
 */
public final class CacheStats {
  private long hits;
  private long misses;
  private long fractures;
  private long evictions;

  public CacheStats() {}

  private CacheStats(long hits, long misses, long fractures, long evictions) {
    this.hits = hits;
    this.misses = misses;
    this.fractures = fractures;
    this.evictions = evictions;
  }

  public static CacheStats of(long hits, long misses, long fractures, long evictions) {
    return new CacheStats(hits, misses, fractures, evictions);
  }

  void recordHit() {
    hits++;
  }

  void recordMiss() {
    misses++;
  }

  void recordFracture() {
    fractures++;
  }

  void recordEviction() {
    evictions++;
  }

  public long hits() {
    return hits;
  }

  public long misses() {
    return misses;
  }

  /** Stale segments split because only part of them was refetched. */
  public long fractures() {
    return fractures;
  }

  /** Segments dropped whole, either replaced by a refetch or removed as expired. */
  public long evictions() {
    return evictions;
  }

  public long lookups() {
    return hits + misses;
  }

  public double hitRate() {
    long total = lookups();
    return total == 0 ? 0.0 : hits / (double) total;
  }

  public CacheStats snapshot() {
    return CacheStats.of(hits, misses, fractures, evictions);
  }

  @Override
  public String toString() {
    return "CacheStats[hits="
        + hits
        + ", misses="
        + misses
        + ", fractures="
        + fractures
        + ", evictions="
        + evictions
        + "]";
  }
}
