/**
 * Argument checks for CLI and YAML values: dataset ids, model names, numeric ranges, and the artifact and
 * input paths a sweep reads or writes.
 *
 * <p>Every helper throws {@link java.lang.IllegalArgumentException} with the offending setting named, which
 * the CLIs map to a configuration exit code.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.sweep.validation;
