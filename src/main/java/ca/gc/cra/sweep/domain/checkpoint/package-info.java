/**
 * Checkpoint model: signature, lifecycle status, rows, and failure/completion notes.
 * <p>State machine: {@code IN_PROGRESS -> IN_PROGRESS} per scenario, {@code IN_PROGRESS -> FAILED} on an
 * uncaught error, {@code IN_PROGRESS -> COMPLETED} when the run finishes. A failed checkpoint with a matching
 * signature is resumed like an in-progress one.</p>
 */
package ca.gc.cra.sweep.domain.checkpoint;
