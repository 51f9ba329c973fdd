package querycompiler.dsl;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A {@code window(start:end)} or {@code cohort(start:end)} clause. Bounds are kept as written;
 * an empty bound is open.
 */
public record DateRange(Mode mode, String start, String end) {

  private static final Pattern RELATIVE = Pattern.compile("(-?\\d+)([dwmy])");
  private static final Pattern ISO = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
  private static final DateTimeFormatter UK_SHORT =
      new DateTimeFormatterBuilder()
          .parseCaseInsensitive()
          .appendPattern("d-MMM-")
          .appendValueReduced(ChronoField.YEAR, 2, 2, 2000)
          .toFormatter(Locale.ENGLISH)
          .withResolverStyle(ResolverStyle.STRICT);

  public enum Mode {
    WINDOW("window"),
    COHORT("cohort");

    private final String dslName;

    Mode(String dslName) {
      this.dslName = dslName;
    }

    public String dslName() {
      return dslName;
    }
  }

  public DateRange {
    Objects.requireNonNull(mode, "mode");
    start = start == null ? "" : start;
    end = end == null ? "" : end;
  }

  /** Returns true when the bound is empty, a relative offset or a recognised absolute date. */
  public static boolean isValidBound(String bound) {
    if (bound == null || bound.isEmpty()) {
      return true;
    }
    if (RELATIVE.matcher(bound).matches()) {
      return true;
    }
    return parseAbsolute(bound).isPresent();
  }

  private static Optional<LocalDate> parseAbsolute(String bound) {
    try {
      if (ISO.matcher(bound).matches()) {
        return Optional.of(LocalDate.parse(bound));
      }
      return Optional.of(LocalDate.parse(bound, UK_SHORT));
    } catch (DateTimeParseException ex) {
      return Optional.empty();
    }
  }
}
