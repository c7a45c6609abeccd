package ca.gc.cra.sweep.application.sweep;

import ca.gc.cra.sweep.domain.robustness.ReadinessEvidence;
import ca.gc.cra.sweep.domain.robustness.ReadinessFailure;
import ca.gc.cra.sweep.domain.robustness.ReadinessVerdict;
import ca.gc.cra.sweep.domain.run.SweepMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Decides whether a run's artifacts qualify as release evidence.
 *
 * <p>Pure over already-computed state, so the audit CLI can re-run it from a stored summary without
 * executing any scenario. Failure tokens are collected in a fixed order.</p>
 *
 * @since 0.1.0
 */
public final class ReleaseReadinessGate {
  private ReleaseReadinessGate() {
    // Utility
  }

  /**
   * Collects readiness failures.
   *
   * @param evidence execution metadata and summary gates
   * @return verdict; ready when no failure applies
   */
  public static ReadinessVerdict evaluate(ReadinessEvidence evidence) {
    Objects.requireNonNull(evidence, "evidence");
    List<ReadinessFailure> failures = new ArrayList<>();
    if (evidence.mode() != SweepMode.RELEASE) {
      failures.add(ReadinessFailure.EXECUTION_MODE_NOT_RELEASE);
    }
    if (evidence.maxScenarios().isPresent()) {
      failures.add(ReadinessFailure.MAX_SCENARIOS_OVERRIDE_PRESENT);
    }
    if (evidence.scenarioCountExecuted() != evidence.scenarioCountExpected()) {
      failures.add(ReadinessFailure.INCOMPLETE_SCENARIO_EXECUTION);
    }
    if (!evidence.qualityGatePassed()) {
      failures.add(ReadinessFailure.QUALITY_GATE_FAILED);
    }
    if (!evidence.robustnessConclusive()) {
      failures.add(ReadinessFailure.ROBUSTNESS_NOT_CONCLUSIVE);
    }
    if (!evidence.datasetPolicyPass()) {
      failures.add(ReadinessFailure.DATASET_POLICY_FAILED);
    }
    if (!evidence.warningPolicyPass()) {
      failures.add(ReadinessFailure.WARNING_POLICY_FAILED);
    }
    return new ReadinessVerdict(failures);
  }
}
