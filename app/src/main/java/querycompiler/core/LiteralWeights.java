package querycompiler.core;

/**
 * Relative cost of expressing a constraint with a {@code visited} or an {@code exclude} literal.
 * An infinite cost marks the literal as unavailable.
 */
public record LiteralWeights(double visitedCost, double excludeCost) {

  public LiteralWeights {
    if (Double.isNaN(visitedCost) || visitedCost < 0) {
      throw new IllegalArgumentException("visitedCost must be >= 0: " + visitedCost);
    }
    if (Double.isNaN(excludeCost) || excludeCost < 0) {
      throw new IllegalArgumentException("excludeCost must be >= 0: " + excludeCost);
    }
  }

  public static LiteralWeights defaults() {
    return new LiteralWeights(1.0, 1.0);
  }

  public LiteralWeights withExcludeCost(double cost) {
    return new LiteralWeights(visitedCost, cost);
  }

  public LiteralWeights withVisitedCost(double cost) {
    return new LiteralWeights(cost, excludeCost);
  }

  @Override
  public String toString() {
    return "visited=" + visitedCost + ",exclude=" + excludeCost;
  }
}
