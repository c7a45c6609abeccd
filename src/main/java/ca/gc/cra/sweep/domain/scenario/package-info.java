/**
 * Scenario matrix values: identifiers, families, and immutable parameter trees.
 */
package ca.gc.cra.sweep.domain.scenario;
