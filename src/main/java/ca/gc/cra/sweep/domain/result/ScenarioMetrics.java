package ca.gc.cra.sweep.domain.result;

import java.util.Objects;

/**
 * <strong>What:</strong> Cross-model outcome of one scenario.
 * <p><strong>Why:</strong> The robustness verdict compares these values against the baseline reference.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param topModel highest-ranked candidate model
 * @param topScore score of the top model
 * @param survivingModels number of models not falsified
 * @param falsifiedModels number of falsified models
 * @param anomalyConfirmed whether the anomaly was confirmed
 * @param anomalyStable whether every anomaly probe was stable
 * @since 0.1.0
 */
public record ScenarioMetrics(
    String topModel,
    double topScore,
    int survivingModels,
    int falsifiedModels,
    boolean anomalyConfirmed,
    boolean anomalyStable) {
  public ScenarioMetrics {
    Objects.requireNonNull(topModel, "topModel");
    if (survivingModels < 0 || falsifiedModels < 0) {
      throw new IllegalArgumentException("model counts must be non-negative");
    }
  }
}
