package querycompiler.graph;

import querycompiler.core.QueryCompilationException;

/** Raised for conditions that parse but cannot describe any journey on the edge. */
public final class InvalidConditionException extends QueryCompilationException {

  public InvalidConditionException(String message) {
    super(message);
  }
}
