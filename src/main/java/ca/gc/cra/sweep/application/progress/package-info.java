/**
 * <strong>Purpose:</strong> Liveness signals for long sweeps: the progress snapshot, the release-run status
 * file and the scoped heartbeat worker.
 * <p><strong>Concurrency:</strong> The heartbeat is the only background thread in a sweep; reporter and
 * tracker writes are synchronized because heartbeat events reach them from that thread.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.sweep.application.progress;
