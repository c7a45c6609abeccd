package ca.gc.cra.sweep.domain.preflight;

/**
 * Reason codes explaining a blocked preflight.
 *
 * @since 0.1.0
 */
public enum PreflightReason {
  /** The run is not in release mode. */
  MODE_NOT_RELEASE,
  /** A scenario cap is present. */
  MAX_SCENARIOS_OVERRIDE_PRESENT,
  /** The dataset violates the dataset policy. */
  DATASET_POLICY_FAILED,
  /** The dataset profile could not be loaded. */
  DATASET_PROFILE_UNAVAILABLE
}
