package querycompiler.pipeline;

import java.util.Objects;
import querycompiler.model.SlotRef;

/** A slot that could not be compiled; its previous query is left in place. */
public record SlotFailure(String edgeId, SlotRef slot, String errorType, String message) {

  public SlotFailure {
    Objects.requireNonNull(edgeId, "edgeId");
    Objects.requireNonNull(slot, "slot");
    Objects.requireNonNull(errorType, "errorType");
  }
}
