package timealgebra.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import timealgebra.cache.CacheStats;
import timealgebra.core.model.Interval;

final class JsonReportBuilder {
  private static final String VERSION = "1.0.0";
  private final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

  String build(QueryReport report) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("meta", meta(report));
    root.put("count", report.intervals().size());
    root.put("intervals", intervals(report.intervals()));
    if (!report.cacheStats().isEmpty()) {
      root.put("cache", cache(report.cacheStats()));
    }
    return gson.toJson(root);
  }

  private Map<String, Object> meta(QueryReport report) {
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("version", VERSION);
    meta.put("expression", report.expression());
    meta.put("start", bound(report.start()));
    meta.put("end", bound(report.end()));
    meta.put("direction", report.direction().name().toLowerCase(Locale.ROOT));
    meta.put("mask", report.mask());
    meta.put("repeat", report.repeat());
    meta.put("time_ms", report.elapsedMillis());
    return meta;
  }

  private List<Map<String, Object>> intervals(List<? extends Interval> intervals) {
    List<Map<String, Object>> list = new ArrayList<>(intervals.size());
    for (Interval interval : intervals) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("start", bound(interval.finiteStart()));
      map.put("end", bound(interval.finiteEnd()));
      if (interval instanceof NamedInterval named) {
        map.put("source", named.source());
      }
      list.add(map);
    }
    return list;
  }

  private Map<String, Object> cache(Map<String, CacheStats> stats) {
    Map<String, Object> cache = new LinkedHashMap<>();
    for (Map.Entry<String, CacheStats> entry : stats.entrySet()) {
      CacheStats value = entry.getValue();
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("hits", value.hits());
      map.put("misses", value.misses());
      map.put("fractures", value.fractures());
      map.put("evictions", value.evictions());
      map.put("hit_rate", value.hitRate());
      cache.put(entry.getKey(), map);
    }
    return cache;
  }

  /** Unbounded ends are rendered as {@code null}. */
  private static Long bound(long value) {
    if (value == Interval.UNBOUNDED_START || value == Interval.UNBOUNDED_END) {
      return null;
    }
    return value;
  }
}
