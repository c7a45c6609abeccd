/**
 * Wall-clock adapters for {@link ca.gc.cra.sweep.application.port.ClockPort}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.sweep.infrastructure.time;
