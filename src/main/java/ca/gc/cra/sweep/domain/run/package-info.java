/**
 * Run-level values: execution mode, progress snapshots and timing, executor events, and release-run status.
 */
package ca.gc.cra.sweep.domain.run;
