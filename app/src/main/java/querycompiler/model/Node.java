package querycompiler.model;

import java.util.Objects;

/** A funnel step. {@code uuid} and {@code caseDefinition} are optional. */
public record Node(String id, String uuid, CaseDefinition caseDefinition) {

  public Node {
    Objects.requireNonNull(id, "id");
  }

  public static Node of(String id) {
    return new Node(id, null, null);
  }

  public boolean isCase() {
    return caseDefinition != null;
  }

  public Node withCaseDefinition(CaseDefinition updated) {
    return new Node(id, uuid, updated);
  }
}
