package querycompiler.dsl;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/** Function names accepted by the query DSL. */
public enum QueryFunction {
  FROM("from"),
  TO("to"),
  VISITED("visited"),
  VISITED_ANY("visitedAny"),
  EXCLUDE("exclude"),
  CONTEXT("context"),
  WINDOW("window"),
  COHORT("cohort"),
  CASE("case"),
  MINUS("minus"),
  PLUS("plus");

  private static final Map<String, QueryFunction> BY_NAME =
      Arrays.stream(values())
          .collect(Collectors.toMap(QueryFunction::dslName, Function.identity()));

  private final String dslName;

  QueryFunction(String dslName) {
    this.dslName = dslName;
  }

  public String dslName() {
    return dslName;
  }

  public static Optional<QueryFunction> byName(String name) {
    return Optional.ofNullable(BY_NAME.get(name));
  }
}
