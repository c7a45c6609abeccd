/**
 * Command-line adapters: the {@code sweep} and {@code readiness} commands and their shared argument
 * handling.
 *
 * <p>Every command returns an {@link ca.gc.cra.sweep.api.ExitCode} from a package-private {@code run}
 * method so tests can drive it without terminating the JVM.</p>
 */
package ca.gc.cra.sweep.api;
