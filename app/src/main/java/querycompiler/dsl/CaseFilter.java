package querycompiler.dsl;

import java.util.Objects;

/** A {@code case(caseId:variant)} clause. */
public record CaseFilter(String caseId, String variant) {

  public CaseFilter {
    Objects.requireNonNull(caseId, "caseId");
    Objects.requireNonNull(variant, "variant");
  }
}
