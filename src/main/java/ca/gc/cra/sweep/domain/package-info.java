/**
 * Core domain model for sensitivity sweeps: scenarios, per-scenario results, checkpoint state, release-run
 * status, and the robustness verdict.
 * <p><strong>Role:</strong> Domain layer values shared by the orchestrator and adapters without infrastructure
 * dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; {@code CheckpointState} is the only mutable
 * aggregate and is owned by a single orchestrator thread.</p>
 * <p><strong>Metrics:</strong> Domain attributes feed tagging on {@code sweep.*} metrics.</p>
 */
package ca.gc.cra.sweep.domain;
