package timealgebra.cli;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import timealgebra.cache.CacheOptions;
import timealgebra.cache.CacheStats;
import timealgebra.cache.CachedTimeline;
import timealgebra.core.Direction;
import timealgebra.core.Timeline;
import timealgebra.core.TimelineQuery;
import timealgebra.core.model.Interval;
import timealgebra.source.StaticTimeline;

/** Builds named sources from the arguments, evaluates the expression and prints a JSON report. */
final class QueryCommand {
  private static final Logger LOG = LoggerFactory.getLogger(QueryCommand.class);

  int execute(String[] args, PrintStream out) {
    CliOptions options = parseArgs(args);
    Map<String, Object> operands = new LinkedHashMap<>();
    Map<String, CachedTimeline<?>> caches = new LinkedHashMap<>();

    options.intervals().forEach(
        (name, body) -> {
          Timeline<NamedInterval> timeline =
              StaticTimeline.of(CliParsers.parseIntervals(body, name));
          operands.put(name, maybeCache(name, timeline, options, caches));
        });
    options.masks().forEach(
        (name, body) -> {
          List<Interval> coverage = new ArrayList<>();
          for (NamedInterval interval : CliParsers.parseIntervals(body, name)) {
            coverage.add(Interval.of(interval.finiteStart(), interval.finiteEnd()));
          }
          operands.put(name, maybeCache(name, StaticTimeline.masks(coverage), options, caches));
        });
    options.filters().forEach(
        (name, body) -> operands.put(name, CliParsers.parseFilter(body, name)));

    Timeline<?> root = new ExpressionParser(operands).parseTimeline(options.expression());
    LOG.info("Evaluating {} as {}", options.expression(), root);

    long started = System.nanoTime();
    List<? extends Interval> results = List.of();
    long start = 0;
    long end = 0;
    for (int i = 0; i < options.repeat(); i++) {
      TimelineQuery<?> query =
          root.query()
              .between(
                  CliParsers.parseBound(options.start(), "--start"),
                  CliParsers.parseBound(options.end(), "--end"))
              .direction(options.direction());
      start = query.startSeconds();
      end = query.endSeconds();
      results = query.list();
    }
    long elapsedMillis = (System.nanoTime() - started) / 1_000_000;
    LOG.info("Query returned {} intervals in {} ms", results.size(), elapsedMillis);

    Map<String, CacheStats> stats = new LinkedHashMap<>();
    caches.forEach((name, cache) -> stats.put(name, cache.stats()));
    stats.forEach((name, value) -> LOG.info("Cache {}: {}", name, value));

    QueryReport report =
        new QueryReport(
            options.expression(),
            start,
            end,
            options.direction(),
            root.isMask(),
            results,
            stats,
            options.repeat(),
            elapsedMillis);
    out.println(new JsonReportBuilder().build(report));
    return 0;
  }

  private static Timeline<?> maybeCache(
      String name,
      Timeline<? extends Interval> timeline,
      CliOptions options,
      Map<String, CachedTimeline<?>> caches) {
    if (!options.cached()) {
      return timeline;
    }
    CachedTimeline<Interval> cached =
        new CachedTimeline<>(timeline, CacheOptions.withTtl(options.ttl()));
    caches.put(name, cached);
    return cached;
  }

  CliOptions parseArgs(String[] args) {
    String[] effectiveArgs = stripCommand(args);
    CliOptions.Builder builder = CliOptions.builder();
    Map<String, OptionSpec> specs = optionSpecs();

    for (int i = 0; i < effectiveArgs.length; i++) {
      ParsedArg parsed = ParsedArg.parse(effectiveArgs[i]);
      OptionSpec spec = specs.get(parsed.option());
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + effectiveArgs[i]);
      }

      String value = parsed.value();
      if (spec.requiresValue() && (value == null || value.isBlank())) {
        if (i + 1 >= effectiveArgs.length) {
          throw new IllegalArgumentException("Missing value for " + parsed.option());
        }
        value = effectiveArgs[++i];
      }
      spec.apply(builder, value);
    }
    return builder.build();
  }

  private Map<String, OptionSpec> optionSpecs() {
    Map<String, OptionSpec> specs = new LinkedHashMap<>();
    specs.put(
        "--intervals",
        OptionSpec.withValue(
            (b, raw) -> b.intervals(CliParsers.parseNamedSpecs(raw, "--intervals"))));
    specs.put(
        "--masks",
        OptionSpec.withValue((b, raw) -> b.masks(CliParsers.parseNamedSpecs(raw, "--masks"))));
    specs.put(
        "--filters",
        OptionSpec.withValue(
            (b, raw) -> b.filters(CliParsers.parseNamedSpecs(raw, "--filters"))));
    specs.put("--expr", OptionSpec.withValue((b, raw) -> b.expression(raw)));
    specs.put("--start", OptionSpec.withValue((b, raw) -> b.start(raw)));
    specs.put("--end", OptionSpec.withValue((b, raw) -> b.end(raw)));
    specs.put("--desc", OptionSpec.flag(b -> b.direction(Direction.DESCENDING)));
    specs.put(
        "--ttl", OptionSpec.withValue((b, raw) -> b.ttl(CliParsers.parseSeconds(raw, "--ttl"))));
    specs.put(
        "--repeat",
        OptionSpec.withValue((b, raw) -> b.repeat(CliParsers.parseInt(raw, "--repeat"))));
    return specs;
  }

  private String[] stripCommand(String[] args) {
    if (args == null || args.length == 0) {
      return new String[0];
    }
    if ("query".equalsIgnoreCase(args[0])) {
      return Arrays.copyOfRange(args, 1, args.length);
    }
    return args;
  }

  private record ParsedArg(String option, String value) {
    static ParsedArg parse(String raw) {
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException("Unknown option: " + raw);
      }
      if (raw.startsWith("--")) {
        int equalsIndex = raw.indexOf('=');
        if (equalsIndex > 0) {
          String option = raw.substring(0, equalsIndex);
          String value = raw.substring(equalsIndex + 1);
          return new ParsedArg(option, value.isEmpty() ? null : value);
        }
      }
      return new ParsedArg(raw, null);
    }
  }

  private record OptionSpec(boolean requiresValue, BiConsumer<CliOptions.Builder, String> apply) {
    static OptionSpec withValue(BiConsumer<CliOptions.Builder, String> consumer) {
      return new OptionSpec(true, consumer);
    }

    static OptionSpec flag(Consumer<CliOptions.Builder> consumer) {
      return new OptionSpec(false, (builder, ignored) -> consumer.accept(builder));
    }

    void apply(CliOptions.Builder builder, String value) {
      apply.accept(builder, value);
    }
  }
}
