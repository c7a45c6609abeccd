package ca.gc.cra.sweep.domain.dataset;

import ca.gc.cra.sweep.domain.policy.DatasetPolicy;
import java.util.List;
import java.util.Objects;

/**
 * Result of checking a dataset profile against the dataset policy.
 *
 * @param pass {@code true} when no constraint was violated
 * @param reasons human-readable violations in evaluation order
 * @param constraints the constraints that were applied
 * @since 0.1.0
 */
public record DatasetPolicyEvaluation(boolean pass, List<String> reasons, DatasetPolicy constraints) {
  public DatasetPolicyEvaluation {
    reasons = List.copyOf(Objects.requireNonNull(reasons, "reasons"));
    Objects.requireNonNull(constraints, "constraints");
  }
}
