package ca.gc.cra.sweep.domain.robustness;

import ca.gc.cra.sweep.domain.policy.WarningPolicy;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Aggregated robustness statistics over every scenario result.
 * <p><strong>Role:</strong> Produced by the robustness evaluator; embedded in the run summary and consumed by
 * the readiness gate.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param totalScenarios number of results evaluated
 * @param validScenarios results with no quality flag
 * @param validScenarioRate {@code validScenarios / totalScenarios}, zero when nothing ran
 * @param baselineScenarioId reference scenario for match rates
 * @param baselineTopModel reference top model
 * @param baselineAnomalyConfirmed reference anomaly flag
 * @param topModelMatchRate share of valid results agreeing on the top model
 * @param anomalyMatchRate share of valid results agreeing on the anomaly flag
 * @param allModelsFalsifiedEverywhere every result reported zero surviving models
 * @param qualityGatePassed quality gate outcome
 * @param robustnessConclusive decision is PASS or FAIL
 * @param insufficientDataScenarios scenarios flagged insufficient_data
 * @param sparseDataScenarios scenarios flagged sparse_data
 * @param nanSanitizedScenarios scenarios flagged nan_sanitized
 * @param fallbackHeavyScenarios scenarios flagged fallback_heavy
 * @param fallbackRatioExceededScenarios scenarios flagged fallback_ratio_exceeded
 * @param totalWarningCount warnings summed over all scenarios
 * @param warningDensityPerScenario average warnings per scenario
 * @param warningPolicyPass no warning ceiling was breached
 * @param warningPolicyLimits ceilings applied
 * @param robust robustness gate outcome
 * @param decision verdict
 * @param caveats advisory notes, deduplicated, in evaluation order
 * @since 0.1.0
 */
public record RobustnessSummary(
    int totalScenarios,
    int validScenarios,
    double validScenarioRate,
    Optional<String> baselineScenarioId,
    Optional<String> baselineTopModel,
    Optional<Boolean> baselineAnomalyConfirmed,
    double topModelMatchRate,
    double anomalyMatchRate,
    boolean allModelsFalsifiedEverywhere,
    boolean qualityGatePassed,
    boolean robustnessConclusive,
    int insufficientDataScenarios,
    int sparseDataScenarios,
    int nanSanitizedScenarios,
    int fallbackHeavyScenarios,
    int fallbackRatioExceededScenarios,
    long totalWarningCount,
    double warningDensityPerScenario,
    boolean warningPolicyPass,
    WarningPolicy warningPolicyLimits,
    boolean robust,
    RobustnessDecision decision,
    List<String> caveats) {

  public RobustnessSummary {
    Objects.requireNonNull(baselineScenarioId, "baselineScenarioId");
    Objects.requireNonNull(baselineTopModel, "baselineTopModel");
    Objects.requireNonNull(baselineAnomalyConfirmed, "baselineAnomalyConfirmed");
    Objects.requireNonNull(warningPolicyLimits, "warningPolicyLimits");
    Objects.requireNonNull(decision, "decision");
    caveats = List.copyOf(Objects.requireNonNull(caveats, "caveats"));
  }
}
