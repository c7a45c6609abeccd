package ca.gc.cra.sweep.application.sweep;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sweep.domain.policy.WarningPolicy;
import ca.gc.cra.sweep.domain.result.QualityFlag;
import ca.gc.cra.sweep.domain.result.ScenarioMetrics;
import ca.gc.cra.sweep.domain.result.ScenarioResult;
import ca.gc.cra.sweep.domain.result.WarningCategory;
import ca.gc.cra.sweep.domain.result.WarningSummary;
import ca.gc.cra.sweep.domain.robustness.RobustnessDecision;
import ca.gc.cra.sweep.domain.robustness.RobustnessSummary;
import ca.gc.cra.sweep.domain.scenario.ScenarioFamily;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class RobustnessEvaluatorTest {
  private static final ScenarioMetrics STABLE = new ScenarioMetrics("adjacency_grammar", 0.82, 2, 4, true, true);
  private final RobustnessEvaluator evaluator = new RobustnessEvaluator();

  @Test
  void agreeingCleanResultsPass() {
    List<ScenarioResult> results = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      results.add(clean("scenario_" + i, STABLE));
    }

    RobustnessSummary summary = evaluator.evaluate(results, WarningPolicy.defaults());

    assertEquals(RobustnessDecision.PASS, summary.decision());
    assertTrue(summary.robust());
    assertTrue(summary.qualityGatePassed());
    assertTrue(summary.robustnessConclusive());
    assertTrue(summary.warningPolicyPass());
    assertEquals(1.0, summary.validScenarioRate());
    assertEquals(1.0, summary.topModelMatchRate());
    assertEquals(1.0, summary.anomalyMatchRate());
    assertEquals(Optional.of("scenario_0"), summary.baselineScenarioId());
    assertEquals(Optional.of("adjacency_grammar"), summary.baselineTopModel());
    assertEquals(Optional.of(true), summary.baselineAnomalyConfirmed());
    assertEquals(List.of(), summary.caveats());
  }

  @Test
  void emptyResultsAreInconclusive() {
    RobustnessSummary summary = evaluator.evaluate(List.of(), WarningPolicy.defaults());

    assertEquals(RobustnessDecision.INCONCLUSIVE, summary.decision());
    assertEquals(0, summary.totalScenarios());
    assertFalse(summary.qualityGatePassed());
    assertFalse(summary.robustnessConclusive());
    assertEquals(Optional.empty(), summary.baselineScenarioId());
    assertEquals(List.of(RobustnessEvaluator.NO_SCENARIOS_CAVEAT), summary.caveats());
  }

  @Test
  void allModelsFalsifiedEverywhereIsInconclusive() {
    ScenarioMetrics falsified = new ScenarioMetrics("adjacency_grammar", 0.1, 0, 6, false, true);
    List<ScenarioResult> results = List.of(
        result("baseline", falsified, WarningSummary.empty(), EnumSet.of(QualityFlag.ALL_MODELS_FALSIFIED)),
        result("threshold_0.40", falsified, WarningSummary.empty(), EnumSet.of(QualityFlag.ALL_MODELS_FALSIFIED)));

    RobustnessSummary summary = evaluator.evaluate(results, WarningPolicy.defaults());

    assertEquals(RobustnessDecision.INCONCLUSIVE, summary.decision());
    assertTrue(summary.allModelsFalsifiedEverywhere());
    assertFalse(summary.qualityGatePassed());
    assertFalse(summary.robust());
    assertEquals(List.of(
        RobustnessEvaluator.ALL_FALSIFIED_CAVEAT,
        "Valid scenario rate 0.00% is below required 80%."), summary.caveats());
  }

  @Test
  void invalidBaselineMovesAnchorToFirstValidScenario() {
    WarningSummary insufficient = new WarningSummary(1,
        Map.of(WarningCategory.INSUFFICIENT_DATA, 1), 1, 1.0, List.of("Insufficient data for x"));
    List<ScenarioResult> results = new ArrayList<>();
    results.add(result("baseline", new ScenarioMetrics("glossalial_system", 0.5, 1, 5, false, true),
        insufficient, EnumSet.of(QualityFlag.INSUFFICIENT_DATA)));
    for (int i = 1; i < 10; i++) {
      results.add(clean("scenario_" + i, STABLE));
    }

    RobustnessSummary summary = evaluator.evaluate(results, WarningPolicy.defaults());

    assertEquals(Optional.of("scenario_1"), summary.baselineScenarioId());
    assertEquals(Optional.of("adjacency_grammar"), summary.baselineTopModel());
    assertEquals(0.9, summary.validScenarioRate(), 1e-9);
    assertEquals(1.0, summary.topModelMatchRate());
    assertEquals(1, summary.insufficientDataScenarios());
    assertFalse(summary.warningPolicyPass());
    assertEquals(RobustnessDecision.FAIL, summary.decision());
    assertTrue(summary.robustnessConclusive());
    assertEquals(List.of(
        "1/10 scenarios emitted insufficient-data warnings.",
        "Insufficient-data scenario count 1 exceeds policy max 0."), summary.caveats());
  }

  @Test
  void topModelDisagreementFailsButStaysConclusive() {
    List<ScenarioResult> results = new ArrayList<>();
    for (int i = 0; i < 8; i++) {
      results.add(clean("scenario_" + i, STABLE));
    }
    ScenarioMetrics shifted = new ScenarioMetrics("procedural_generation", 0.79, 2, 4, true, true);
    results.add(clean("scenario_8", shifted));
    results.add(clean("scenario_9", shifted));

    RobustnessSummary summary = evaluator.evaluate(results, WarningPolicy.defaults());

    assertEquals(0.8, summary.topModelMatchRate(), 1e-9);
    assertEquals(RobustnessDecision.FAIL, summary.decision());
    assertFalse(summary.robust());
    assertTrue(summary.qualityGatePassed());
    assertTrue(summary.robustnessConclusive());
  }

  @Test
  void unflaggedWarningsAddQualifiedEvidenceCaveat() {
    WarningSummary noise = new WarningSummary(2, Map.of(), 0, 0.0, List.of("a", "b"));
    List<ScenarioResult> results = List.of(
        result("baseline", STABLE, noise, EnumSet.noneOf(QualityFlag.class)),
        result("threshold_0.40", STABLE, noise, EnumSet.noneOf(QualityFlag.class)));

    RobustnessSummary summary = evaluator.evaluate(results, WarningPolicy.defaults());

    assertEquals(RobustnessDecision.PASS, summary.decision());
    assertEquals(4L, summary.totalWarningCount());
    assertEquals(2.0, summary.warningDensityPerScenario());
    assertEquals(List.of(RobustnessEvaluator.QUALIFIED_EVIDENCE_CAVEAT), summary.caveats());
  }

  @Test
  void warningCeilingsBreachFailWarningPolicy() {
    WarningPolicy strict = new WarningPolicy(3, 1.0, 0, 0, 0, 0, 3, 0.25);
    WarningSummary noise = new WarningSummary(2, Map.of(), 0, 0.0, List.of("a", "b"));
    List<ScenarioResult> results = List.of(
        result("baseline", STABLE, noise, EnumSet.noneOf(QualityFlag.class)),
        result("threshold_0.40", STABLE, noise, EnumSet.noneOf(QualityFlag.class)));

    RobustnessSummary summary = evaluator.evaluate(results, strict);

    assertFalse(summary.warningPolicyPass());
    assertFalse(summary.qualityGatePassed());
    assertEquals(RobustnessDecision.FAIL, summary.decision());
    assertEquals(strict, summary.warningPolicyLimits());
    assertEquals(List.of(
        RobustnessEvaluator.QUALIFIED_EVIDENCE_CAVEAT,
        "Total warnings 4 exceed policy max 3.",
        "Warning density per scenario 2.00 exceeds policy max 1.00."), summary.caveats());
  }

  @Test
  void customValidRateFloorIsHonoured() {
    RobustnessEvaluator lenient = new RobustnessEvaluator(0.5);
    WarningSummary sparse = new WarningSummary(1, Map.of(WarningCategory.SPARSE_DATA, 1), 1, 1.0, List.of());
    List<ScenarioResult> results = List.of(
        clean("baseline", STABLE),
        result("threshold_0.40", STABLE, sparse, EnumSet.of(QualityFlag.SPARSE_DATA)));

    RobustnessSummary summary = lenient.evaluate(results, new WarningPolicy(400, 20.0, 0, 5, 0, 0, 3, 0.25));

    assertEquals(0.5, summary.validScenarioRate());
    assertTrue(summary.qualityGatePassed());
    assertEquals(RobustnessDecision.PASS, summary.decision());
  }

  @Test
  void rejectsValidRateOutsideUnitInterval() {
    assertThrows(IllegalArgumentException.class, () -> new RobustnessEvaluator(1.5));
    assertThrows(IllegalArgumentException.class, () -> new RobustnessEvaluator(Double.NaN));
  }

  private static ScenarioResult clean(String id, ScenarioMetrics metrics) {
    return result(id, metrics, WarningSummary.empty(), EnumSet.noneOf(QualityFlag.class));
  }

  private static ScenarioResult result(
      String id, ScenarioMetrics metrics, WarningSummary warnings, Set<QualityFlag> flags) {
    return new ScenarioResult(id, ScenarioFamily.THRESHOLD_SWEEP, metrics, warnings, flags);
  }
}
