package timealgebra.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

final class MainTest {

  private static final class Run {
    private final int exitCode;
    private final String output;

    private Run(int exitCode, String output) {
      this.exitCode = exitCode;
      this.output = output;
    }

    JsonObject json() {
      return JsonParser.parseString(output).getAsJsonObject();
    }
  }

  private static Run run(String... args) {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    int exitCode = Main.run(args, out);
    return new Run(exitCode, buffer.toString(StandardCharsets.UTF_8));
  }

  @Test
  void freeTimeIsTheDayMinusBusyIntervals() {
    Run run =
        run(
            "--intervals", "busy=0:3600,7200:9000",
            "--masks", "day=0:86400",
            "--expr", "day - busy",
            "--start", "0",
            "--end", "86400");

    assertEquals(0, run.exitCode, run.output);
    JsonObject json = run.json();
    assertEquals(2, json.get("count").getAsInt());
    JsonArray intervals = json.getAsJsonArray("intervals");
    assertEquals(3600, intervals.get(0).getAsJsonObject().get("start").getAsLong());
    assertEquals(7200, intervals.get(0).getAsJsonObject().get("end").getAsLong());
    assertEquals(9000, intervals.get(1).getAsJsonObject().get("start").getAsLong());
    assertTrue(json.getAsJsonObject("meta").get("mask").getAsBoolean());
    assertFalse(json.has("cache"), "No cache section without --ttl");
  }

  @Test
  void richSourcesAreNamedInTheOutput() {
    Run run = run("query", "--intervals=a=0:10;b=5:15", "--expr=a & b", "--start=0", "--end=20");

    assertEquals(0, run.exitCode, run.output);
    JsonArray intervals = run.json().getAsJsonArray("intervals");
    assertEquals(2, intervals.size(), "One copy per rich source");
    assertEquals("a", intervals.get(0).getAsJsonObject().get("source").getAsString());
    assertEquals("b", intervals.get(1).getAsJsonObject().get("source").getAsString());
  }

  @Test
  void descendingAndFilters() {
    Run run =
        run(
            "--intervals", "x=0:50,100:300,400:410",
            "--filters", "long=seconds>=100",
            "--expr", "x & long",
            "--start", "0",
            "--end", "1000",
            "--desc");

    assertEquals(0, run.exitCode, run.output);
    JsonObject json = run.json();
    assertEquals(1, json.get("count").getAsInt());
    assertEquals("descending", json.getAsJsonObject("meta").get("direction").getAsString());
  }

  @Test
  void openBoundsAreRenderedAsNull() {
    Run run = run("--masks", "x=100:", "--expr", "~x");

    assertEquals(0, run.exitCode, run.output);
    JsonObject first = run.json().getAsJsonArray("intervals").get(0).getAsJsonObject();
    assertTrue(first.get("start").isJsonNull(), "Open start should be null");
    assertEquals(100, first.get("end").getAsLong());
  }

  @Test
  void repeatedQueriesAreServedFromTheCache() {
    Run run =
        run(
            "--intervals", "busy=0:3600",
            "--masks", "day=0:86400",
            "--expr", "day - busy",
            "--start", "0",
            "--end", "86400",
            "--ttl", "60",
            "--repeat", "3");

    assertEquals(0, run.exitCode, run.output);
    JsonObject busy = run.json().getAsJsonObject("cache").getAsJsonObject("busy");
    assertEquals(2, busy.get("hits").getAsLong());
    assertEquals(1, busy.get("misses").getAsLong());
  }

  @Test
  void sourcesKeepTheOrderTheyWereDefinedIn() {
    String[] args = {
      "--intervals", "zeta=0:10;beta=5:15;alpha=8:20",
      "--expr", "zeta | beta | alpha",
      "--start", "0",
      "--end", "20",
      "--ttl", "60"
    };

    CliOptions options = new QueryCommand().parseArgs(args);
    Run run = run(args);

    List<String> defined = List.of("zeta", "beta", "alpha");
    assertEquals(defined, List.copyOf(options.intervals().keySet()));
    assertEquals(0, run.exitCode, run.output);
    assertEquals(defined, List.copyOf(run.json().getAsJsonObject("cache").keySet()));
  }

  @Test
  void invalidInputExitsWithUsage() {
    Run badExpression = run("--masks", "x=0:10", "--expr", "x | y");
    Run badInterval = run("--masks", "x=10:0", "--expr", "x");
    Run unknownOption = run("--masks", "x=0:10", "--expr", "x", "--bogus");
    Run missingExpression = run("--masks", "x=0:10");

    assertEquals(2, badExpression.exitCode);
    assertEquals(2, badInterval.exitCode);
    assertEquals(2, unknownOption.exitCode);
    assertEquals(2, missingExpression.exitCode);
    assertTrue(badExpression.output.startsWith("Usage:"));
  }

  @Test
  void helpPrintsUsage() {
    Run run = run("--help");

    assertEquals(0, run.exitCode);
    assertTrue(run.output.contains("--intervals"));
  }
}
