package timealgebra.cli;

import java.io.PrintStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point: evaluates one timeline expression over intervals given inline.
 *
 * <p>Usage:
 *
 * <pre>
 * Main [query] --intervals 'busy=0:3600,7200:9000' --masks 'day=0:86400' \
 *     --filters 'long=hours&gt;=1' --expr 'day - busy' --start 0 --end 86400 [--desc] \
 *     [--ttl 60 --repeat 3]
 * </pre>
 *
 * <p>{@code --intervals} sources are rich (each result names the source it came from); {@code
 * --masks} sources are plain coverage. Exit codes: 0 on success, 2 on invalid input.
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  static final String USAGE =
      "Usage: Main [query] --intervals name=s:e,...;... [--masks name=s:e,...]"
          + " [--filters name=property>=n] --expr EXPR [--start BOUND] [--end BOUND] [--desc]"
          + " [--ttl SECONDS] [--repeat N]";

  private Main() {}

  public static void main(String[] args) {
    int exitCode = run(args, System.out);
    if (exitCode != 0) {
      System.exit(exitCode);
    }
  }

  static int run(String[] args, PrintStream out) {
    if (args == null || args.length == 0 || "--help".equals(args[0])) {
      out.println(USAGE);
      return args == null || args.length == 0 ? 2 : 0;
    }
    try {
      return new QueryCommand().execute(args, out);
    } catch (IllegalArgumentException ex) {
      LOG.error("{}", ex.getMessage());
      out.println(USAGE);
      return 2;
    }
  }
}
