package querycompiler.graph;

import java.util.Objects;

/** Canonical endpoints of one edge, after uuid resolution. */
public record EdgeEndpoints(String edgeId, String from, String to) {

  public EdgeEndpoints {
    Objects.requireNonNull(edgeId, "edgeId");
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
  }
}
