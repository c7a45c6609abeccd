package ca.gc.cra.sweep.domain.robustness;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of the release readiness gate.
 *
 * @param failures failure tokens in gate order; empty when the run is release evidence
 * @since 0.1.0
 */
public record ReadinessVerdict(List<ReadinessFailure> failures) {
  public ReadinessVerdict {
    failures = List.copyOf(Objects.requireNonNull(failures, "failures"));
  }

  /**
   * Indicates whether the run qualifies as release evidence.
   *
   * @return {@code true} when no failure was collected
   */
  public boolean releaseEvidenceReady() {
    return failures.isEmpty();
  }

  /**
   * Returns the failure tokens as written into summaries.
   *
   * @return token strings in gate order
   */
  public List<String> tokens() {
    return failures.stream().map(ReadinessFailure::token).toList();
  }
}
