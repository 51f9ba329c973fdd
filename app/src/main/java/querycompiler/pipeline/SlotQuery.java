package querycompiler.pipeline;

import java.util.Objects;
import querycompiler.compile.CompiledQuery;
import querycompiler.model.SlotRef;

/**
 * Compiled query for one slot.
 *
 * @param parameterId the slot's parameter id, or {@code synthetic:<edge>:<slot>} when it has none
 * @param condition the condition text the slot was compiled from
 */
public record SlotQuery(
    String edgeId,
    String edgeKey,
    SlotRef slot,
    String parameterId,
    String condition,
    CompiledQuery compiled) {

  public SlotQuery {
    Objects.requireNonNull(edgeId, "edgeId");
    Objects.requireNonNull(slot, "slot");
    Objects.requireNonNull(parameterId, "parameterId");
    Objects.requireNonNull(compiled, "compiled");
    condition = condition == null ? "" : condition;
  }

  public String query() {
    return compiled.query();
  }
}
