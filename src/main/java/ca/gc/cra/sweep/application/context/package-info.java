/**
 * Explicit per-run context threaded through the orchestrator and its progress components.
 *
 * @since 0.1.0
 */
package ca.gc.cra.sweep.application.context;
