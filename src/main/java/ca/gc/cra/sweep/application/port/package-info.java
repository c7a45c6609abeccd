/**
 * Ports decoupling the sweep orchestrator from persistence, datasets, the evaluation battery, time, and
 * metrics.
 * <p>Adapters live under {@code ca.gc.cra.sweep.infrastructure}; tests substitute in-memory fakes.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.sweep.application.port;
