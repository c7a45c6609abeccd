package ca.gc.cra.sweep.domain.policy;

import java.util.Objects;

/**
 * <strong>What:</strong> Versioned bundle of dataset and warning ceilings governing release evidence.
 * <p><strong>Why:</strong> The version participates in the checkpoint signature so stored progress is never
 * reused across policy changes.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param policyVersion version label of the policy document
 * @param datasetPolicy dataset admissibility constraints
 * @param warningPolicy warning ceilings
 * @since 0.1.0
 */
public record ReleaseEvidencePolicy(
    String policyVersion, DatasetPolicy datasetPolicy, WarningPolicy warningPolicy) {

  /** Version of the built-in policy. */
  public static final String DEFAULT_VERSION = "2026-02-10";

  public ReleaseEvidencePolicy {
    Objects.requireNonNull(policyVersion, "policyVersion");
    Objects.requireNonNull(datasetPolicy, "datasetPolicy");
    Objects.requireNonNull(warningPolicy, "warningPolicy");
  }

  /**
   * Returns the built-in policy used when no document is configured.
   *
   * @return default policy
   */
  public static ReleaseEvidencePolicy defaults() {
    return new ReleaseEvidencePolicy(DEFAULT_VERSION, DatasetPolicy.defaults(), WarningPolicy.defaults());
  }
}
