/**
 * Logging helpers shared by the sweep CLIs and the orchestrator: the {@code --verbose} switch and truncation of
 * evaluator output before it reaches a log line.
 *
 * @since 0.1.0
 */
package ca.gc.cra.sweep.logging;
