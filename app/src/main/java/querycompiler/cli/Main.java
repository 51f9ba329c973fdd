package querycompiler.cli;

import java.io.IOException;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import querycompiler.core.QueryCompilationException;

/**
 * Command-line entrypoint.
 *
 * <p>Usage:
 *
 * <ul>
 *   <li>{@code compile --graph g.json [--capabilities c.json] [--out o.json] [--report r.json]
 *       [--weights visited=1,exclude=10] [--max-checks 200] [--downstream-of node] [--edge id]
 *       [--parallelism n]}
 *   <li>{@code query --condition "visited(b).from(a).to(c)"} prints the canonical form
 *   <li>{@code query --graph g.json --edge id [--condition ...] [--connection name --provider
 *       p]}
 * </ul>
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args));
  }

  static int run(String[] args) {
    if (args == null || args.length == 0) {
      printUsage();
      return 1;
    }
    String command = args[0].toLowerCase(Locale.ROOT);
    String[] rest = Arrays.copyOfRange(args, 1, args.length);
    try {
      return switch (command) {
        case "compile" -> new CompileCommand().execute(rest);
        case "query" -> new QueryCommand().execute(rest);
        case "help", "--help", "-h" -> {
          printUsage();
          yield 0;
        }
        default -> {
          LOG.error("Unknown command: {}", args[0]);
          printUsage();
          yield 1;
        }
      };
    } catch (IllegalArgumentException ex) {
      LOG.error("{}", ex.getMessage());
      return 1;
    } catch (QueryCompilationException ex) {
      LOG.error("Compilation failed: {}", ex.getMessage());
      return 2;
    } catch (IOException ex) {
      LOG.error("I/O failure: {}", ex.getMessage(), ex);
      return 3;
    }
  }

  private static void printUsage() {
    System.err.println("Usage: querycompiler <compile|query> [options]");
    System.err.println("  compile --graph <file> [--capabilities <file>] [--out <file>]");
    System.err.println("          [--report <file>] [--weights visited=1,exclude=1]");
    System.err.println("          [--max-checks n] [--downstream-of node] [--edge id]");
    System.err.println("          [--parallelism n] [--no-sibling-exclusion]");
    System.err.println("  query   --condition <dsl>");
    System.err.println("  query   --graph <file> --edge <id> [--condition <dsl>]");
    System.err.println("          [--connection name] [--provider type] [--capabilities <file>]");
  }
}
