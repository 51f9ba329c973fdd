package querycompiler.core;

/** Base type for failures raised while parsing or compiling a single query. */
public class QueryCompilationException extends RuntimeException {

  public QueryCompilationException(String message) {
    super(message);
  }

  public QueryCompilationException(String message, Throwable cause) {
    super(message, cause);
  }
}
