/**
 * Configuration loading, merging and wiring for the sweep command-line tools.
 *
 * <p>Defaults, YAML and CLI sources are flattened to string maps, merged with CLI precedence and then bound
 * to typed records. {@link ca.gc.cra.sweep.config.CompositionRoot} turns the typed configuration into
 * ready-to-run use cases.</p>
 */
package ca.gc.cra.sweep.config;
