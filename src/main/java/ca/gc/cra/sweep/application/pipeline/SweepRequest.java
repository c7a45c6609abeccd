package ca.gc.cra.sweep.application.pipeline;

import ca.gc.cra.sweep.domain.policy.ReleaseEvidencePolicy;
import ca.gc.cra.sweep.domain.run.SweepMode;
import ca.gc.cra.sweep.domain.scenario.ScenarioConfig;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Normalized inputs for one sweep or preflight run. Mode rules (quick shortcut, default caps and dataset
 * swaps) have already been applied by the configuration layer.
 *
 * @param mode execution mode
 * @param datasetId dataset to evaluate
 * @param maxScenarios scenario cap, absent for a full run
 * @param quick whether the quick shortcut was requested
 * @param resume whether checkpoint resume is allowed
 * @param baseConfig model parameters the scenario matrix is derived from
 * @param policy release evidence policy
 * @since 0.1.0
 */
public record SweepRequest(
    SweepMode mode,
    String datasetId,
    OptionalInt maxScenarios,
    boolean quick,
    boolean resume,
    ScenarioConfig baseConfig,
    ReleaseEvidencePolicy policy) {

  public SweepRequest {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(datasetId, "datasetId");
    Objects.requireNonNull(maxScenarios, "maxScenarios");
    if (maxScenarios.isPresent() && maxScenarios.getAsInt() < 1) {
      throw new IllegalArgumentException("maxScenarios must be positive");
    }
    Objects.requireNonNull(baseConfig, "baseConfig");
    Objects.requireNonNull(policy, "policy");
  }
}
