package ca.gc.cra.sweep.domain.result;

/**
 * <strong>What:</strong> Conditions that disqualify a scenario result from the valid set.
 * <p><strong>Role:</strong> Derived by the scenario executor; counted by the robustness evaluator.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum QualityFlag {
  /** At least one insufficient-data warning. */
  INSUFFICIENT_DATA("insufficient_data"),
  /** At least one sparse-data warning. */
  SPARSE_DATA("sparse_data"),
  /** At least one NaN-sanitized warning. */
  NAN_SANITIZED("nan_sanitized"),
  /** Fallback-estimate warnings reached the per-scenario threshold. */
  FALLBACK_HEAVY("fallback_heavy"),
  /** Fallback-related share of warnings exceeded the configured ratio. */
  FALLBACK_RATIO_EXCEEDED("fallback_ratio_exceeded"),
  /** Total warnings exceeded the per-scenario ceiling. */
  WARNING_DENSITY_EXCEEDED("warning_density_exceeded"),
  /** No candidate model survived. */
  ALL_MODELS_FALSIFIED("all_models_falsified");

  private final String wireName;

  QualityFlag(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Returns the name used in artifacts.
   *
   * @return wire name such as {@code fallback_heavy}
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Resolves a flag from its wire name.
   *
   * @param value stored flag name
   * @return matching flag
   * @throws IllegalArgumentException when the name is unknown
   */
  public static QualityFlag fromWireName(String value) {
    for (QualityFlag flag : values()) {
      if (flag.wireName.equals(value)) {
        return flag;
      }
    }
    throw new IllegalArgumentException("Unknown quality flag: " + value);
  }
}
