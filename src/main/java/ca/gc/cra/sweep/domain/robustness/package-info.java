/**
 * Robustness verdict, readiness gate values, and the run summary.
 */
package ca.gc.cra.sweep.domain.robustness;
