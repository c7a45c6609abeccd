package ca.gc.cra.sweep.domain.result;

import ca.gc.cra.sweep.domain.scenario.ScenarioFamily;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Outcome of executing one scenario, or a row reused verbatim from a validated
 * checkpoint.
 * <p><strong>Why:</strong> Validity is derived from the flags so the two can never disagree.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param id scenario identifier
 * @param family scenario family
 * @param metrics cross-model metrics
 * @param warnings classified warnings
 * @param qualityFlags quality flags, kept in declaration order
 * @since 0.1.0
 */
public record ScenarioResult(
    String id,
    ScenarioFamily family,
    ScenarioMetrics metrics,
    WarningSummary warnings,
    Set<QualityFlag> qualityFlags) {

  public ScenarioResult {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(family, "family");
    Objects.requireNonNull(metrics, "metrics");
    Objects.requireNonNull(warnings, "warnings");
    qualityFlags = copyFlags(Objects.requireNonNull(qualityFlags, "qualityFlags"));
  }

  /**
   * Indicates whether the result may take part in match-rate comparisons.
   *
   * @return {@code true} when no quality flag applies
   */
  public boolean valid() {
    return qualityFlags.isEmpty();
  }

  /**
   * Tests for a single flag.
   *
   * @param flag flag to look up
   * @return {@code true} if the flag applies
   */
  public boolean hasFlag(QualityFlag flag) {
    return qualityFlags.contains(flag);
  }

  private static Set<QualityFlag> copyFlags(Collection<QualityFlag> flags) {
    EnumSet<QualityFlag> copy = EnumSet.noneOf(QualityFlag.class);
    copy.addAll(flags);
    return Collections.unmodifiableSet(copy);
  }
}
