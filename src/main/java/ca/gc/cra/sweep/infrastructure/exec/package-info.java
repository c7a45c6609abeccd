/**
 * Executor factories for background workers.
 * <p><strong>Role:</strong> Infrastructure utilities that build the single-thread executor behind the battery
 * heartbeat.</p>
 * <p><strong>Concurrency:</strong> Threads are daemon threads named after their owner so a stuck heartbeat
 * never keeps the JVM alive.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.sweep.infrastructure.exec;
