package ca.gc.cra.sweep.domain.checkpoint;

/**
 * Lifecycle of a checkpoint document. {@link #FAILED} still permits resumption.
 *
 * @since 0.1.0
 */
public enum CheckpointStatus {
  /** Scenarios are being executed. */
  IN_PROGRESS,
  /** Every scenario finished and the summary was written. */
  COMPLETED,
  /** A scenario raised; completed rows remain reusable. */
  FAILED
}
