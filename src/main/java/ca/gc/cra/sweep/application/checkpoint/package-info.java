/**
 * Checkpoint lifecycle for a sweep run: validate, resume, record, fail, complete.
 *
 * @since 0.1.0
 */
package ca.gc.cra.sweep.application.checkpoint;
