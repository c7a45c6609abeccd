package ca.gc.cra.sweep.domain.run;

/**
 * Reason codes attached to release-run status writes. Several may apply at once.
 *
 * @since 0.1.0
 */
public enum ReleaseRunReason {
  RELEASE_RUN_STARTED,
  RELEASE_RUN_RESUMED,
  RELEASE_RUN_SCENARIO_DISPATCHED,
  RELEASE_RUN_SCENARIO_IN_PROGRESS,
  RELEASE_RUN_SCENARIO_COMPLETED,
  RELEASE_RUN_COMPLETED,
  RELEASE_RUN_FAILED
}
