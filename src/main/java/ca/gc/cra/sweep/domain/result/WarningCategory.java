package ca.gc.cra.sweep.domain.result;

/**
 * <strong>What:</strong> Named categories of diagnostic warnings emitted by the evaluation collaborator.
 * <p><strong>Role:</strong> Classification key used by the warning classifier and quality-flag derivation.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum WarningCategory {
  /** Too few observations for a statistic. */
  INSUFFICIENT_DATA("insufficient_data", "Insufficient data for"),
  /** Observations present but sparse. */
  SPARSE_DATA("sparse_data", "Sparse data for"),
  /** NaN values replaced during degradation scoring. */
  NAN_SANITIZED("nan_sanitized", "NaN degradation detected"),
  /** Degradation estimated through the fallback path. */
  FALLBACK_ESTIMATE("fallback_estimate", "fallback estimated degradation");

  private final String wireName;
  private final String marker;

  WarningCategory(String wireName, String marker) {
    this.wireName = wireName;
    this.marker = marker;
  }

  /**
   * Returns the name used in artifacts.
   *
   * @return wire name such as {@code sparse_data}
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Tests whether a warning message belongs to this category.
   *
   * @param message warning text; {@code null} never matches
   * @return {@code true} when the category marker occurs in the message
   */
  public boolean matches(String message) {
    return message != null && message.contains(marker);
  }
}
