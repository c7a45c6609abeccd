package ca.gc.cra.sweep.domain.checkpoint;

import ca.gc.cra.sweep.domain.robustness.RobustnessDecision;
import java.util.Objects;

/**
 * Headline outcome copied into a completed checkpoint.
 *
 * @param releaseEvidenceReady readiness gate outcome
 * @param robustnessDecision robustness verdict
 * @param qualityGatePassed quality gate outcome
 * @since 0.1.0
 */
public record CheckpointSummary(
    boolean releaseEvidenceReady, RobustnessDecision robustnessDecision, boolean qualityGatePassed) {
  public CheckpointSummary {
    Objects.requireNonNull(robustnessDecision, "robustnessDecision");
  }
}
