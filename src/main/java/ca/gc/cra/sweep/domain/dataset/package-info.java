/**
 * Dataset profile values and the fatal dataset error.
 */
package ca.gc.cra.sweep.domain.dataset;
