package querycompiler.model;

import java.util.Objects;

/** A probability that applies only when {@code condition} holds for the journey. */
public record ConditionalProbability(String condition, Parameter probability) {

  public ConditionalProbability {
    Objects.requireNonNull(condition, "condition");
    probability = probability == null ? Parameter.empty() : probability;
  }

  public ConditionalProbability withProbability(Parameter updated) {
    return new ConditionalProbability(condition, updated);
  }
}
