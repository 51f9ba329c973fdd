package querycompiler.model;

/**
 * One fetchable value on an edge. Every field may be absent: a parameter without a data source is
 * never fetched, and a parameter without an id is reported under a synthetic id.
 */
public record Parameter(String id, DataSource dataSource, String query) {

  public static Parameter empty() {
    return new Parameter(null, null, null);
  }

  public Parameter withQuery(String newQuery) {
    return new Parameter(id, dataSource, newQuery);
  }

  public boolean hasDataSource() {
    return dataSource != null;
  }
}
