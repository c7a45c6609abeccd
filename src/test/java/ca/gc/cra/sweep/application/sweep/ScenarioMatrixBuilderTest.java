package ca.gc.cra.sweep.application.sweep;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.sweep.domain.scenario.ScenarioConfig;
import ca.gc.cra.sweep.domain.scenario.ScenarioFamily;
import ca.gc.cra.sweep.domain.scenario.ScenarioSpec;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ScenarioMatrixBuilderTest {
  private final ScenarioMatrixBuilder builder = new ScenarioMatrixBuilder();

  @Test
  void fullMatrixFollowsDeclaredOrder() {
    List<ScenarioSpec> scenarios = builder.build(baseConfig());

    List<String> ids = scenarios.stream().map(ScenarioSpec::id).toList();
    assertEquals(List.of(
        "baseline",
        "threshold_0.40", "threshold_0.45", "threshold_0.50", "threshold_0.55", "threshold_0.60",
        "threshold_0.65", "threshold_0.70", "threshold_0.75", "threshold_0.80",
        "sensitivity_x0.80", "sensitivity_x1.20",
        "weights_focus_robustness", "weights_focus_coverage"), ids);
    assertEquals(ScenarioFamily.BASELINE, scenarios.get(0).family());
    assertEquals(ScenarioFamily.THRESHOLD_SWEEP, scenarios.get(1).family());
    assertEquals(ScenarioFamily.SENSITIVITY_SCALE, scenarios.get(10).family());
    assertEquals(ScenarioFamily.WEIGHT_PERMUTATION, scenarios.get(13).family());
  }

  @Test
  void buildingTwiceYieldsEqualMatrices() {
    List<ScenarioSpec> first = builder.build(baseConfig());
    List<ScenarioSpec> second = new ScenarioMatrixBuilder().build(baseConfig());

    assertEquals(first.stream().map(ScenarioSpec::id).toList(), second.stream().map(ScenarioSpec::id).toList());
    for (int i = 0; i < first.size(); i++) {
      assertEquals(first.get(i).config(), second.get(i).config(), first.get(i).id());
    }
  }

  @Test
  void threeWeightDimensionsYieldFifteenScenarios() {
    Map<String, Object> weights = new LinkedHashMap<>();
    weights.put("robustness", 0.4);
    weights.put("coverage", 0.3);
    weights.put("parsimony", 0.3);
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("evaluation", Map.of("dimension_weights", weights));

    List<ScenarioSpec> scenarios = builder.build(ScenarioConfig.of(root));

    assertEquals(15, scenarios.size());
    assertEquals(List.of("weights_focus_robustness", "weights_focus_coverage", "weights_focus_parsimony"),
        scenarios.subList(12, 15).stream().map(ScenarioSpec::id).toList());
  }

  @Test
  void matrixWithoutWeightsHasTwelveScenarios() {
    assertEquals(12, builder.build(ScenarioConfig.empty()).size());
  }

  @Test
  void thresholdScenarioRewritesEveryBatteryEntry() {
    ScenarioSpec spec = builder.build(baseConfig()).get(3);

    assertEquals("threshold_0.50", spec.id());
    Map<?, ?> disconfirmation = (Map<?, ?>) spec.config().asMap().get("disconfirmation");
    List<?> battery = (List<?>) disconfirmation.get("perturbation_battery");
    for (Object entry : battery) {
      assertEquals(0.5, ((Map<?, ?>) entry).get("failure_threshold"));
    }
  }

  @Test
  void sensitivityScaleMultipliesNumericSensitivities() {
    ScenarioSpec spec = builder.build(baseConfig()).get(11);

    Map<?, ?> models = (Map<?, ?>) spec.config().asMap().get("models");
    Map<?, ?> sensitivities = (Map<?, ?>) ((Map<?, ?>) models.get("adjacency_grammar")).get("sensitivities");
    assertEquals(0.6, (Double) sensitivities.get("noise"), 1e-9);
    assertEquals("high", sensitivities.get("label"));
  }

  @Test
  void weightFocusRenormalizesWeights() {
    ScenarioSpec spec = builder.build(baseConfig()).get(12);

    Map<?, ?> evaluation = (Map<?, ?>) spec.config().asMap().get("evaluation");
    Map<?, ?> weights = (Map<?, ?>) evaluation.get("dimension_weights");
    double robustness = (Double) weights.get("robustness");
    double coverage = (Double) weights.get("coverage");
    assertEquals(1.0, robustness + coverage, 1e-9);
    assertEquals(0.6 / 1.1, robustness, 1e-9);
  }

  @Test
  void derivedScenariosLeaveBaseUntouched() {
    ScenarioConfig base = baseConfig();
    Map<String, Object> before = base.mutableCopy();

    builder.build(base);

    assertEquals(before, base.mutableCopy());
  }

  @Test
  void reducedMatrixKeepsAllowListInMatrixOrder() {
    List<String> ids = builder.buildReduced(baseConfig()).stream().map(ScenarioSpec::id).toList();

    assertEquals(List.of(
        "baseline", "threshold_0.50", "threshold_0.70", "sensitivity_x1.20", "weights_focus_robustness"), ids);
  }

  @Test
  void reduceFallsBackToFullListWhenNothingMatches() {
    List<ScenarioSpec> custom = List.of(
        new ScenarioSpec("custom_a", ScenarioFamily.BASELINE, ScenarioConfig.empty()),
        new ScenarioSpec("custom_b", ScenarioFamily.BASELINE, ScenarioConfig.empty()));

    assertEquals(custom, ScenarioMatrixBuilder.reduce(custom));
  }

  @Test
  void nonNumericWeightIsRejected() {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("evaluation", Map.of("dimension_weights", Map.of("robustness", "heavy")));

    assertThrows(IllegalArgumentException.class, () -> builder.build(ScenarioConfig.of(root)));
  }

  @Test
  void normalizeLeavesNonPositiveTotalsAlone() {
    Map<String, Double> zero = Map.of("a", 0.0);
    assertSame(zero, ScenarioMatrixBuilder.normalize(zero));
  }

  private static ScenarioConfig baseConfig() {
    Map<String, Object> weights = new LinkedHashMap<>();
    weights.put("robustness", 0.5);
    weights.put("coverage", 0.5);
    Map<String, Object> sensitivities = new LinkedHashMap<>();
    sensitivities.put("noise", 0.5);
    sensitivities.put("label", "high");
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("disconfirmation", Map.of("perturbation_battery", List.of(
        Map.of("name", "shuffle", "failure_threshold", 0.6),
        Map.of("name", "drop", "failure_threshold", 0.6))));
    root.put("models", Map.of("adjacency_grammar", Map.of("sensitivities", sensitivities)));
    root.put("evaluation", Map.of("dimension_weights", weights));
    return ScenarioConfig.of(root);
  }
}
