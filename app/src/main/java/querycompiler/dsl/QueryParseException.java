package querycompiler.dsl;

import querycompiler.core.QueryCompilationException;

/** Raised for malformed DSL text. Carries the offending fragment and its position. */
public final class QueryParseException extends QueryCompilationException {
  private final String fragment;
  private final int position;

  public QueryParseException(String reason, String fragment, int position) {
    super(reason + " at position " + position + " near '" + fragment + "'");
    this.fragment = fragment;
    this.position = position;
  }

  public String fragment() {
    return fragment;
  }

  /** Zero-based offset into the parsed text. */
  public int position() {
    return position;
  }
}
