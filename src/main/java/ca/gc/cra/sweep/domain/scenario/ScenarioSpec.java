package ca.gc.cra.sweep.domain.scenario;

import java.util.Objects;

/**
 * <strong>What:</strong> One entry of the scenario matrix.
 * <p><strong>Role:</strong> Domain value created once per sweep by the matrix builder and consumed by the
 * executor.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param id stable scenario identifier such as {@code threshold_0.55}
 * @param family perturbation family
 * @param config fully materialized parameters for this scenario
 * @since 0.1.0
 */
public record ScenarioSpec(String id, ScenarioFamily family, ScenarioConfig config) {
  public ScenarioSpec {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(family, "family");
    Objects.requireNonNull(config, "config");
  }
}
