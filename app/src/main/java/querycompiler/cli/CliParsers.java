package querycompiler.cli;

import com.google.common.base.Splitter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import querycompiler.capability.CapabilityTable;
import querycompiler.capability.CapabilityTableLoader;
import querycompiler.core.LiteralWeights;

/** Shared helpers for CLI argument parsing. */
final class CliParsers {
  private static final Splitter PAIRS = Splitter.on(',').trimResults().omitEmptyStrings();

  private CliParsers() {}

  static CliOptions parse(String[] args, String command, Map<String, OptionSpec> specs) {
    String[] effectiveArgs = stripCommand(args, command);
    CliOptions.Builder builder = CliOptions.builder();
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

  static int parseInt(String raw, int defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + optionName + ": " + raw);
    }
  }

  /**
   * Parses {@code visited=1,exclude=10}. Missing keys keep their default; {@code inf} marks a
   * literal as unavailable.
   */
  static LiteralWeights parseWeights(String raw) {
    LiteralWeights weights = LiteralWeights.defaults();
    if (raw == null || raw.isBlank()) {
      return weights;
    }
    for (String pair : PAIRS.split(raw)) {
      int separator = pair.indexOf('=');
      if (separator <= 0) {
        throw new IllegalArgumentException("Invalid weight (expected key=value): " + pair);
      }
      String key = pair.substring(0, separator).trim().toLowerCase(Locale.ROOT);
      double value = parseCost(pair.substring(separator + 1).trim(), key);
      weights =
          switch (key) {
            case "visited" -> weights.withVisitedCost(value);
            case "exclude" -> weights.withExcludeCost(value);
            default -> throw new IllegalArgumentException("Unknown weight: " + key);
          };
    }
    return weights;
  }

  static CapabilityTable loadCapabilities(Path path) throws IOException {
    return path == null ? CapabilityTableLoader.loadDefaults() : CapabilityTableLoader.load(path);
  }

  private static double parseCost(String raw, String key) {
    if ("inf".equalsIgnoreCase(raw) || "infinity".equalsIgnoreCase(raw)) {
      return Double.POSITIVE_INFINITY;
    }
    try {
      double value = Double.parseDouble(raw);
      if (value < 0 || Double.isNaN(value)) {
        throw new IllegalArgumentException("Weight must be >= 0 for " + key + ": " + raw);
      }
      return value;
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid number for weight " + key + ": " + raw);
    }
  }

  private static String[] stripCommand(String[] args, String command) {
    if (args == null || args.length == 0) {
      return new String[0];
    }
    if (command.equalsIgnoreCase(args[0])) {
      return Arrays.copyOfRange(args, 1, args.length);
    }
    return args;
  }

  record ParsedArg(String option, String value) {
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

  record OptionSpec(boolean requiresValue, BiConsumer<CliOptions.Builder, String> apply) {
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
