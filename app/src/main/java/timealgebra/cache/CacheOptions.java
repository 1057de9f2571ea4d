package timealgebra.cache;

import com.google.common.base.Ticker;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for a {@link CachedTimeline}.
 *
 * @param ttl how long a fetched segment may be served; must be positive
 * @param ticker nanosecond time source used to stamp and age segments
 */
public record CacheOptions(Duration ttl, Ticker ticker) {

  public CacheOptions {
    Objects.requireNonNull(ttl, "ttl");
    if (ttl.isZero() || ttl.isNegative()) {
      throw new IllegalArgumentException("Cache TTL must be positive, got " + ttl);
    }
    ticker = ticker == null ? Ticker.systemTicker() : ticker;
  }

  public static CacheOptions defaults() {
    return new CacheOptions(CacheDefaults.ttl(), Ticker.systemTicker());
  }

  public static CacheOptions withTtl(Duration ttl) {
    return new CacheOptions(ttl, Ticker.systemTicker());
  }

  public static CacheOptions normalize(CacheOptions options) {
    return options == null ? defaults() : options;
  }

  public CacheOptions withTicker(Ticker ticker) {
    return new CacheOptions(ttl, ticker);
  }

  long ttlNanos() {
    return ttl.toNanos();
  }
}
