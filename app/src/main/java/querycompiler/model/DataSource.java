package querycompiler.model;

import java.util.Comparator;
import java.util.Objects;

/** A named connection and its provider type, as attached to a parameter. */
public record DataSource(String connectionName, String provider) implements Comparable<DataSource> {

  private static final Comparator<DataSource> ORDER =
      Comparator.comparing(DataSource::connectionName).thenComparing(DataSource::provider);

  public DataSource {
    connectionName = connectionName == null ? "" : connectionName;
    provider = provider == null ? "" : provider;
  }

  @Override
  public int compareTo(DataSource other) {
    return ORDER.compare(this, Objects.requireNonNull(other, "other"));
  }
}
