package querycompiler.model;

import java.util.Objects;

/**
 * Identifies one slot on an edge. {@code index} is the conditional-probability position, {@code
 * name} the cost dimension or the case variant; unused fields are -1 / null.
 */
public record SlotRef(SlotKind kind, int index, String name) {

  public SlotRef {
    Objects.requireNonNull(kind, "kind");
  }

  public static SlotRef baseProbability() {
    return new SlotRef(SlotKind.BASE_PROBABILITY, -1, null);
  }

  public static SlotRef conditional(int index) {
    return new SlotRef(SlotKind.CONDITIONAL_PROBABILITY, index, null);
  }

  public static SlotRef cost(String dimension) {
    return new SlotRef(SlotKind.COST, -1, Objects.requireNonNull(dimension, "dimension"));
  }

  public static SlotRef caseVariant(String variant) {
    return new SlotRef(SlotKind.CASE_VARIANT, -1, Objects.requireNonNull(variant, "variant"));
  }

  /** Short form used in synthetic ids and reports: p, conditional_p[0], cost_gbp, case[x]. */
  public String label() {
    return switch (kind) {
      case BASE_PROBABILITY -> "p";
      case CONDITIONAL_PROBABILITY -> "conditional_p[" + index + "]";
      case COST -> name;
      case CASE_VARIANT -> "case[" + name + "]";
    };
  }

  @Override
  public String toString() {
    return label();
  }
}
