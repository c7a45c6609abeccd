package ca.gc.cra.sweep.domain.robustness;

import ca.gc.cra.sweep.domain.dataset.DatasetPolicyEvaluation;
import ca.gc.cra.sweep.domain.dataset.DatasetProfile;
import ca.gc.cra.sweep.domain.run.SweepMode;
import java.time.Instant;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> Final run summary: robustness statistics plus execution metadata and the readiness
 * verdict.
 * <p><strong>Role:</strong> Written as the run's evidence document; re-readable by the readiness audit.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param runId run identifier
 * @param generatedUtc time the summary was produced
 * @param policyVersion release evidence policy version
 * @param mode execution mode
 * @param artifactClass release candidate or latest snapshot
 * @param datasetProfile dataset profile
 * @param datasetPolicy dataset policy evaluation
 * @param robustness robustness statistics
 * @param maxScenarios scenario cap, if any
 * @param scenarioCountExpected scenarios in the full matrix for this mode
 * @param scenarioCountExecuted scenarios with results
 * @param resumedScenarios scenarios reused from the checkpoint
 * @param readiness readiness verdict
 * @since 0.1.0
 */
public record RunSummary(
    String runId,
    Instant generatedUtc,
    String policyVersion,
    SweepMode mode,
    ArtifactClass artifactClass,
    DatasetProfile datasetProfile,
    DatasetPolicyEvaluation datasetPolicy,
    RobustnessSummary robustness,
    OptionalInt maxScenarios,
    int scenarioCountExpected,
    int scenarioCountExecuted,
    int resumedScenarios,
    ReadinessVerdict readiness) {

  public RunSummary {
    Objects.requireNonNull(runId, "runId");
    Objects.requireNonNull(generatedUtc, "generatedUtc");
    Objects.requireNonNull(policyVersion, "policyVersion");
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(artifactClass, "artifactClass");
    Objects.requireNonNull(datasetProfile, "datasetProfile");
    Objects.requireNonNull(datasetPolicy, "datasetPolicy");
    Objects.requireNonNull(robustness, "robustness");
    Objects.requireNonNull(maxScenarios, "maxScenarios");
    Objects.requireNonNull(readiness, "readiness");
  }

  /**
   * Shortcut for the readiness outcome.
   *
   * @return {@code true} when the run is release evidence
   */
  public boolean releaseEvidenceReady() {
    return readiness.releaseEvidenceReady();
  }
}
