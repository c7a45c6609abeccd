/**
 * Release evidence policy values: dataset constraints and warning ceilings.
 * <p>Policy breaches are reported as flags and reason strings, never as exceptions.</p>
 */
package ca.gc.cra.sweep.domain.policy;
