/**
 * JSON codec (jackson-core streaming) and the snake_case document mapping for sweep artifacts.
 *
 * @since 0.1.0
 */
package ca.gc.cra.sweep.infrastructure.persistence.json;
