package ca.gc.cra.sweep.domain.scenario;

/**
 * Perturbation family a scenario belongs to.
 *
 * @since 0.1.0
 */
public enum ScenarioFamily {
  /** Unmodified base configuration. */
  BASELINE("baseline"),
  /** Perturbation battery failure threshold override. */
  THRESHOLD_SWEEP("threshold_sweep"),
  /** Uniform scaling of model sensitivities. */
  SENSITIVITY_SCALE("sensitivity_scale"),
  /** One evaluation dimension weighted up, then renormalized. */
  WEIGHT_PERMUTATION("weight_permutation");

  private final String wireName;

  ScenarioFamily(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Returns the name used in artifacts.
   *
   * @return wire name such as {@code threshold_sweep}
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Resolves a family from its wire name.
   *
   * @param value wire name as stored in a checkpoint
   * @return matching family
   * @throws IllegalArgumentException when the name is unknown
   */
  public static ScenarioFamily fromWireName(String value) {
    for (ScenarioFamily family : values()) {
      if (family.wireName.equals(value)) {
        return family;
      }
    }
    throw new IllegalArgumentException("Unknown scenario family: " + value);
  }
}
