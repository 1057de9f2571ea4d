package timealgebra.cache;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default cache settings. The TTL can be overridden with the system property {@code
 * timealgebra.cache.ttlSeconds} or the environment variable {@code TIMEALGEBRA_CACHE_TTL_SECONDS};
 * the property wins when both are set.
 */
public final class CacheDefaults {
  private static final Logger LOG = LoggerFactory.getLogger(CacheDefaults.class);

  static final String TTL_PROPERTY = "timealgebra.cache.ttlSeconds";
  static final String TTL_ENV = "TIMEALGEBRA_CACHE_TTL_SECONDS";
  static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

  private CacheDefaults() {}

  public static Duration ttl() {
    Duration fromProperty = parseSeconds(System.getProperty(TTL_PROPERTY), TTL_PROPERTY);
    if (fromProperty != null) {
      return fromProperty;
    }
    Duration fromEnv = parseSeconds(System.getenv(TTL_ENV), TTL_ENV);
    if (fromEnv != null) {
      return fromEnv;
    }
    return DEFAULT_TTL;
  }

  static Duration parseSeconds(String value, String source) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      long seconds = Long.parseLong(value.trim());
      if (seconds > 0) {
        return Duration.ofSeconds(seconds);
      }
      LOG.warn("Ignoring non-positive cache TTL {}={}", source, value);
    } catch (NumberFormatException ex) {
      LOG.warn("Ignoring unparseable cache TTL {}={}", source, value);
    }
    return null;
  }
}
