package querycompiler.dsl;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class ConditionEvaluatorTest {

  @Test
  void visitedIsConjunction() {
    Condition condition = QueryParser.parse("visited(a,b)");
    assertTrue(ConditionEvaluator.matches(condition, Set.of("a", "b", "c")));
    assertFalse(ConditionEvaluator.matches(condition, Set.of("a", "c")));
  }

  @Test
  void visitedAnyGroupsAreDisjunctionsAndedTogether() {
    Condition condition = QueryParser.parse("visitedAny(a,b).visitedAny(c,d)");
    assertTrue(ConditionEvaluator.matches(condition, Set.of("b", "c")));
    assertFalse(
        ConditionEvaluator.matches(condition, Set.of("a", "b")),
        "Second group has no visited member");
  }

  @Test
  void excludeRejectsAnyExcludedNode() {
    Condition condition = QueryParser.parse("visited(a).exclude(x,y)");
    assertTrue(ConditionEvaluator.matches(condition, Set.of("a")));
    assertFalse(ConditionEvaluator.matches(condition, Set.of("a", "y")));
  }

  @Test
  void contextAndCaseMustMatch() {
    Condition condition = QueryParser.parse("context(device:mobile).case(checkout:treatment)");
    assertTrue(
        ConditionEvaluator.matches(
            condition, Set.of(), Map.of("device", "mobile"), Map.of("checkout", "treatment")));
    assertFalse(
        ConditionEvaluator.matches(
            condition, Set.of(), Map.of("device", "desktop"), Map.of("checkout", "treatment")));
    assertFalse(
        ConditionEvaluator.matches(
            condition, Set.of(), Map.of("device", "mobile"), Map.of("checkout", "control")));
  }
}
