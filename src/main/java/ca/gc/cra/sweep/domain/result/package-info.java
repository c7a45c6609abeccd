/**
 * Per-scenario outcomes: metrics, classified warnings, and quality flags.
 */
package ca.gc.cra.sweep.domain.result;
