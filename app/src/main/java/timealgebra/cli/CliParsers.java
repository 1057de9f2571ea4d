package timealgebra.cli;

import com.google.common.base.Splitter;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import timealgebra.core.model.Interval;
import timealgebra.core.model.IntervalOrder;
import timealgebra.filter.ComparableProperty;
import timealgebra.filter.Filter;
import timealgebra.filter.Properties;

/** Shared helpers for turning command-line values into intervals, bounds and filters. */
final class CliParsers {
  private static final Splitter ENTRY_SPLITTER =
      Splitter.on(';').trimResults().omitEmptyStrings();
  private static final Splitter NAME_SPLITTER = Splitter.on('=').trimResults().limit(2);
  private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();
  private static final Splitter BOUND_SPLITTER = Splitter.on(':').trimResults().limit(2);
  private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");
  private static final Pattern FILTER =
      Pattern.compile("([a-z]+)\\s*(>=|<=|==|!=|>|<)\\s*(-?\\d+(?:\\.\\d+)?)");

  private CliParsers() {}

  /** {@code name=body;name=body} into an ordered map. */
  static Map<String, String> parseNamedSpecs(String raw, String option) {
    Map<String, String> specs = new LinkedHashMap<>();
    for (String entry : ENTRY_SPLITTER.split(raw)) {
      List<String> parts = NAME_SPLITTER.splitToList(entry);
      if (parts.size() != 2 || parts.get(0).isEmpty()) {
        throw new IllegalArgumentException(
            "Expected name=value for " + option + ", got '" + entry + "'");
      }
      String name = parts.get(0);
      if (!NAME.matcher(name).matches()) {
        throw new IllegalArgumentException("Invalid name for " + option + ": " + name);
      }
      if (specs.put(name, parts.get(1)) != null) {
        throw new IllegalArgumentException("Name defined twice: " + name);
      }
    }
    return specs;
  }

  /**
   * {@code s1:e1,s2:e2} into intervals sorted by position. An empty side is unbounded, so {@code
   * :100} reads as everything before 100.
   */
  static List<NamedInterval> parseIntervals(String raw, String source) {
    List<NamedInterval> intervals = new ArrayList<>();
    for (String item : LIST_SPLITTER.split(raw)) {
      List<String> bounds = BOUND_SPLITTER.splitToList(item);
      if (bounds.size() != 2) {
        throw new IllegalArgumentException(
            "Expected start:end in " + source + ", got '" + item + "'");
      }
      long start = parseEdge(bounds.get(0), Interval.UNBOUNDED_START, source);
      long end = parseEdge(bounds.get(1), Interval.UNBOUNDED_END, source);
      intervals.add(new NamedInterval(start, end, source));
    }
    intervals.sort(IntervalOrder.NATURAL);
    return intervals;
  }

  /**
   * Query bound as accepted by the standard coercer: epoch seconds, an ISO instant or offset
   * date-time, or an ISO date. Blank means unbounded.
   */
  static Object parseBound(String raw, String option) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    String value = raw.trim();
    try {
      if (value.matches("-?\\d+")) {
        return Long.parseLong(value);
      }
      if (value.endsWith("Z") || value.endsWith("z")) {
        return Instant.parse(value);
      }
      if (value.indexOf('T') > 0) {
        return OffsetDateTime.parse(value);
      }
      return LocalDate.parse(value);
    } catch (NumberFormatException | DateTimeParseException ex) {
      throw new IllegalArgumentException("Invalid bound for " + option + ": " + raw, ex);
    }
  }

  /** {@code property op number}, e.g. {@code hours>=2} or {@code start<86400}. */
  static Filter<Interval> parseFilter(String raw, String name) {
    Matcher matcher = FILTER.matcher(raw.trim());
    if (!matcher.matches()) {
      throw new IllegalArgumentException(
          "Invalid filter " + name + ": '" + raw + "' (expected e.g. hours>=2)");
    }
    String property = matcher.group(1);
    String operator = matcher.group(2);
    String number = matcher.group(3);
    return switch (property.toLowerCase(Locale.ROOT)) {
      case "start" -> compare(Properties.start(), operator, parseLong(number, property));
      case "end" -> compare(Properties.end(), operator, parseLong(number, property));
      case "seconds" -> compare(Properties.seconds(), operator, Double.parseDouble(number));
      case "minutes" -> compare(Properties.minutes(), operator, Double.parseDouble(number));
      case "hours" -> compare(Properties.hours(), operator, Double.parseDouble(number));
      case "days" -> compare(Properties.days(), operator, Double.parseDouble(number));
      default -> throw new IllegalArgumentException(
          "Unknown property in filter " + name + ": " + property);
    };
  }

  static Duration parseSeconds(String raw, String option) {
    long seconds = parseLong(raw, option);
    if (seconds <= 0) {
      throw new IllegalArgumentException(option + " must be positive, got " + raw);
    }
    return Duration.ofSeconds(seconds);
  }

  static int parseInt(String raw, String option) {
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + option + ": " + raw);
    }
  }

  static long parseLong(String raw, String option) {
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid long for " + option + ": " + raw);
    }
  }

  private static long parseEdge(String raw, long unbounded, String source) {
    return raw.isEmpty() ? unbounded : parseLong(raw, source);
  }

  private static <V extends Comparable<? super V>> Filter<Interval> compare(
      ComparableProperty<Interval, V> property, String operator, V value) {
    return switch (operator) {
      case ">=" -> property.atLeast(value);
      case "<=" -> property.atMost(value);
      case ">" -> property.greaterThan(value);
      case "<" -> property.lessThan(value);
      case "==" -> property.isEqualTo(value);
      case "!=" -> property.isNotEqualTo(value);
      default -> throw new IllegalArgumentException("Unknown operator: " + operator);
    };
  }
}
