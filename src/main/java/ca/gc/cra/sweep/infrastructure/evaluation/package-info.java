/**
 * <strong>Purpose:</strong> Evaluation collaborator adapters.
 * <p><strong>Concurrency:</strong> Each step is a blocking child process on the orchestrator thread; the
 * heartbeat worker is the only other thread alive while a battery runs.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.sweep.infrastructure.evaluation;
