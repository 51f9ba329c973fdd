package querycompiler.model;

/** The kinds of parameter slots an edge carries. */
public enum SlotKind {
  BASE_PROBABILITY("edge_base_p"),
  CONDITIONAL_PROBABILITY("edge_conditional_p"),
  COST("edge_cost"),
  CASE_VARIANT("case_variant");

  private final String label;

  SlotKind(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
