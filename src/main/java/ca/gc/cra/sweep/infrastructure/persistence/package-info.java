/**
 * <strong>Purpose:</strong> File-system adapters for checkpoints, progress, release run status and evidence
 * documents.
 * <p><strong>Concurrency:</strong> One writer per document; every write goes through a temp file and an atomic
 * rename so concurrent readers see whole documents only.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.sweep.infrastructure.persistence;
