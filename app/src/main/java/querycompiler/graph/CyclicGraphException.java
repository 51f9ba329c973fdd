package querycompiler.graph;

import java.util.List;
import querycompiler.core.QueryCompilationException;

/** Raised when a graph snapshot is not acyclic. */
public final class CyclicGraphException extends QueryCompilationException {
  private final List<String> unresolved;

  public CyclicGraphException(List<String> unresolved) {
    super("Graph contains a cycle through " + unresolved);
    this.unresolved = List.copyOf(unresolved);
  }

  /** Nodes that could not be placed in topological order. */
  public List<String> unresolved() {
    return unresolved;
  }
}
