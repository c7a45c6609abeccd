/**
 * <strong>Purpose:</strong> Use cases composing the sweep: the orchestrator loop and the release preflight.
 * <p><strong>Concurrency:</strong> Single-threaded and synchronous; the only background activity is the
 * heartbeat scoped inside scenario execution.</p>
 * <p><strong>Observability:</strong> Use cases put {@code sweep.runId}, {@code sweep.mode} and
 * {@code sweep.scenarioId} into the MDC.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.sweep.application.pipeline;
