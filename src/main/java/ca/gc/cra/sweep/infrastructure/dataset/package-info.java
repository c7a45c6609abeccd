/**
 * Dataset profile sources (SnakeYAML catalog).
 *
 * @since 0.1.0
 */
package ca.gc.cra.sweep.infrastructure.dataset;
