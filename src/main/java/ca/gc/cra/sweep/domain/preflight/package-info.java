/**
 * Release preflight report and reason codes.
 */
package ca.gc.cra.sweep.domain.preflight;
