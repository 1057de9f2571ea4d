package timealgebra.cli;

import com.google.common.collect.ImmutableMap;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import timealgebra.core.Direction;

record CliOptions(
    Map<String, String> intervals,
    Map<String, String> masks,
    Map<String, String> filters,
    String expression,
    String start,
    String end,
    Direction direction,
    Duration ttl,
    int repeat) {

  CliOptions {
    intervals = ImmutableMap.copyOf(intervals);
    masks = ImmutableMap.copyOf(masks);
    filters = ImmutableMap.copyOf(filters);
    Objects.requireNonNull(expression, "expression");
    direction = direction == null ? Direction.ASCENDING : direction;
    if (ttl != null && (ttl.isZero() || ttl.isNegative())) {
      throw new IllegalArgumentException("--ttl must be positive");
    }
    if (repeat < 1) {
      throw new IllegalArgumentException("--repeat must be at least 1");
    }
  }

  boolean cached() {
    return ttl != null;
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private final Map<String, String> intervals = new LinkedHashMap<>();
    private final Map<String, String> masks = new LinkedHashMap<>();
    private final Map<String, String> filters = new LinkedHashMap<>();
    private String expression;
    private String start;
    private String end;
    private Direction direction = Direction.ASCENDING;
    private Duration ttl;
    private int repeat = 1;

    Builder intervals(Map<String, String> specs) {
      putAll(intervals, specs);
      return this;
    }

    Builder masks(Map<String, String> specs) {
      putAll(masks, specs);
      return this;
    }

    Builder filters(Map<String, String> specs) {
      putAll(filters, specs);
      return this;
    }

    Builder expression(String expression) {
      this.expression = expression;
      return this;
    }

    Builder start(String start) {
      this.start = start;
      return this;
    }

    Builder end(String end) {
      this.end = end;
      return this;
    }

    Builder direction(Direction direction) {
      this.direction = direction;
      return this;
    }

    Builder ttl(Duration ttl) {
      this.ttl = ttl;
      return this;
    }

    Builder repeat(int repeat) {
      this.repeat = repeat;
      return this;
    }

    CliOptions build() {
      if (expression == null || expression.isBlank()) {
        throw new IllegalArgumentException("Provide an expression with --expr");
      }
      if (intervals.isEmpty() && masks.isEmpty()) {
        throw new IllegalArgumentException(
            "Provide at least one source with --intervals or --masks");
      }
      return new CliOptions(
          intervals, masks, filters, expression, start, end, direction, ttl, repeat);
    }

    private void putAll(Map<String, String> target, Map<String, String> specs) {
      for (Map.Entry<String, String> entry : specs.entrySet()) {
        String name = entry.getKey();
        if (intervals.containsKey(name) || masks.containsKey(name) || filters.containsKey(name)) {
          throw new IllegalArgumentException("Name defined twice: " + name);
        }
        target.put(name, entry.getValue());
      }
    }
  }
}
