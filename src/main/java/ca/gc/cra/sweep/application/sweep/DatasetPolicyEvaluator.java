package ca.gc.cra.sweep.application.sweep;

import ca.gc.cra.sweep.domain.dataset.DatasetPolicyEvaluation;
import ca.gc.cra.sweep.domain.dataset.DatasetProfile;
import ca.gc.cra.sweep.domain.policy.DatasetPolicy;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Checks a dataset profile against the release dataset policy.
 *
 * @since 0.1.0
 */
public final class DatasetPolicyEvaluator {
  private DatasetPolicyEvaluator() {
    // Utility
  }

  /**
   * Evaluates allowed ids, minimum pages and minimum tokens. An empty allow-list admits every dataset.
   *
   * @param profile dataset profile
   * @param policy release dataset policy
   * @return pass flag, human-readable reasons and the constraints applied
   */
  public static DatasetPolicyEvaluation evaluate(DatasetProfile profile, DatasetPolicy policy) {
    Objects.requireNonNull(profile, "profile");
    Objects.requireNonNull(policy, "policy");
    List<String> reasons = new ArrayList<>();
    List<String> allowed = policy.allowedDatasetIds();
    if (!allowed.isEmpty() && !allowed.contains(profile.datasetId())) {
      reasons.add("dataset_id='" + profile.datasetId() + "' is not in allowed release datasets: "
          + allowed.stream().map(id -> "'" + id + "'").collect(Collectors.joining(", ", "[", "]")));
    }
    if (profile.pages() < policy.minPages()) {
      reasons.add("dataset_pages=" + profile.pages() + " below minimum " + policy.minPages());
    }
    if (profile.tokens() < policy.minTokens()) {
      reasons.add("dataset_tokens=" + profile.tokens() + " below minimum " + policy.minTokens());
    }
    return new DatasetPolicyEvaluation(reasons.isEmpty(), reasons, policy);
  }
}
