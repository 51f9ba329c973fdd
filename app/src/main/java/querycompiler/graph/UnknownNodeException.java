package querycompiler.graph;

import querycompiler.core.QueryCompilationException;

/** Raised when a condition or edge references a node absent from the graph. */
public final class UnknownNodeException extends QueryCompilationException {
  private final String nodeId;

  public UnknownNodeException(String nodeId) {
    super("Unknown node: " + nodeId);
    this.nodeId = nodeId;
  }

  public String nodeId() {
    return nodeId;
  }
}
