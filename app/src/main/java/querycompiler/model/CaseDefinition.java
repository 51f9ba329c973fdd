package querycompiler.model;

import java.util.List;
import java.util.Objects;

/** Experiment definition attached to a case node. */
public record CaseDefinition(String id, List<CaseVariant> variants) {

  public CaseDefinition {
    Objects.requireNonNull(id, "id");
    variants = variants == null ? List.of() : List.copyOf(variants);
  }

  public CaseDefinition withVariants(List<CaseVariant> updated) {
    return new CaseDefinition(id, updated);
  }
}
