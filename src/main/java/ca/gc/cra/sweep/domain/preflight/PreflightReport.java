package ca.gc.cra.sweep.domain.preflight;

import ca.gc.cra.sweep.domain.dataset.DatasetPolicyEvaluation;
import ca.gc.cra.sweep.domain.dataset.DatasetProfile;
import ca.gc.cra.sweep.domain.run.SweepMode;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> Standalone preflight artifact describing whether a release run may start.
 * <p><strong>Why:</strong> Dataset and policy preconditions are checked, and a blocked outcome is written to
 * disk, without executing any scenario.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param generatedUtc time of evaluation
 * @param runId run identifier used for the snapshot file
 * @param status OK or BLOCKED
 * @param reasons reasons in evaluation order; empty when OK
 * @param mode execution mode
 * @param datasetId dataset requested
 * @param datasetProfile loaded profile, absent when loading failed
 * @param datasetPolicy dataset policy evaluation
 * @param policyVersion policy version
 * @param scenarioCountExpected scenarios the release run would execute
 * @param maxScenarios scenario cap, if any
 * @since 0.1.0
 */
public record PreflightReport(
    Instant generatedUtc,
    String runId,
    PreflightStatus status,
    List<PreflightReason> reasons,
    SweepMode mode,
    String datasetId,
    Optional<DatasetProfile> datasetProfile,
    DatasetPolicyEvaluation datasetPolicy,
    String policyVersion,
    int scenarioCountExpected,
    OptionalInt maxScenarios) {

  public PreflightReport {
    Objects.requireNonNull(generatedUtc, "generatedUtc");
    Objects.requireNonNull(runId, "runId");
    Objects.requireNonNull(status, "status");
    reasons = List.copyOf(Objects.requireNonNull(reasons, "reasons"));
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(datasetId, "datasetId");
    Objects.requireNonNull(datasetProfile, "datasetProfile");
    Objects.requireNonNull(datasetPolicy, "datasetPolicy");
    Objects.requireNonNull(policyVersion, "policyVersion");
    Objects.requireNonNull(maxScenarios, "maxScenarios");
  }

  /**
   * Indicates whether the release run may proceed.
   *
   * @return {@code true} when the status is {@link PreflightStatus#PREFLIGHT_OK}
   */
  public boolean passed() {
    return status == PreflightStatus.PREFLIGHT_OK;
  }
}
