package ca.gc.cra.sweep.domain.robustness;

import ca.gc.cra.sweep.domain.run.SweepMode;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Already-computed facts the readiness gate decides on.
 *
 * @param mode execution mode
 * @param maxScenarios scenario cap, if one was applied
 * @param scenarioCountExpected scenarios in the full matrix for this mode
 * @param scenarioCountExecuted scenarios that produced results
 * @param qualityGatePassed quality gate outcome
 * @param robustnessConclusive whether the verdict was PASS or FAIL
 * @param datasetPolicyPass dataset policy outcome
 * @param warningPolicyPass warning policy outcome
 * @since 0.1.0
 */
public record ReadinessEvidence(
    SweepMode mode,
    OptionalInt maxScenarios,
    int scenarioCountExpected,
    int scenarioCountExecuted,
    boolean qualityGatePassed,
    boolean robustnessConclusive,
    boolean datasetPolicyPass,
    boolean warningPolicyPass) {
  public ReadinessEvidence {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(maxScenarios, "maxScenarios");
  }
}
