/**
 * <strong>Purpose:</strong> Scenario-level sweep logic: matrix construction, execution, warning
 * classification, robustness aggregation and the release readiness gate.
 * <p><strong>Concurrency:</strong> Everything here is pure or single-threaded except the heartbeat owned by
 * {@link ca.gc.cra.sweep.application.sweep.ScenarioExecutor}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.sweep.application.sweep;
