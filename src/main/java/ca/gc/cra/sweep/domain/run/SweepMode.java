package ca.gc.cra.sweep.domain.run;

import java.util.Locale;

/**
 * <strong>What:</strong> Execution mode of a sensitivity sweep.
 * <p><strong>Why:</strong> Release runs produce gating evidence; smoke and iterative runs are capped previews
 * that never qualify as release evidence.</p>
 * <p><strong>Role:</strong> Domain enumeration consumed by configuration, checkpoint signatures, and the
 * readiness gate.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum SweepMode {
  /** Full scenario matrix, strict evidence rules. */
  RELEASE,
  /** Single-scenario sanity run unless an explicit cap is given. */
  SMOKE,
  /** Reduced allow-listed matrix against the synthetic dataset. */
  ITERATIVE;

  /**
   * Returns the lowercase name written into artifacts.
   *
   * @return wire name such as {@code release}
   */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a mode name case-insensitively.
   *
   * @param value textual mode; must not be {@code null}
   * @return matching mode
   * @throws IllegalArgumentException if the value is not release, smoke, or iterative
   */
  public static SweepMode fromString(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("mode must not be blank");
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    for (SweepMode mode : values()) {
      if (mode.name().equals(normalized)) {
        return mode;
      }
    }
    throw new IllegalArgumentException(
        "Unsupported sensitivity sweep mode: " + value + " (expected release|smoke|iterative)");
  }
}
