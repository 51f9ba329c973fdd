package querycompiler.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Stopwatch for a compilation pass, with named phase laps. */
public final class Timing {
  private final long startedAt;
  private long lapStartedAt;
  private final Map<String, Long> phases = new LinkedHashMap<>();

  private Timing(long startedAt) {
    this.startedAt = startedAt;
    this.lapStartedAt = startedAt;
  }

  public static Timing start() {
    return new Timing(System.nanoTime());
  }

  /** Records the time since the previous lap (or the start) under {@code phase}. */
  public void lap(String phase) {
    long now = System.nanoTime();
    phases.merge(phase, (now - lapStartedAt) / 1_000_000L, Long::sum);
    lapStartedAt = now;
  }

  public long elapsedMillis() {
    return (System.nanoTime() - startedAt) / 1_000_000L;
  }

  /** Phase durations in milliseconds, in the order the phases were first recorded. */
  public Map<String, Long> phases() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(phases));
  }
}
