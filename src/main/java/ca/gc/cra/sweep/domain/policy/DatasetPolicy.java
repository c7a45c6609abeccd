package ca.gc.cra.sweep.domain.policy;

import java.util.List;
import java.util.Objects;

/**
 * Dataset admissibility constraints for release evidence.
 *
 * @param allowedDatasetIds permitted dataset ids; empty means any id is allowed
 * @param minPages minimum page count
 * @param minTokens minimum token count
 * @since 0.1.0
 */
public record DatasetPolicy(List<String> allowedDatasetIds, long minPages, long minTokens) {
  private static final DatasetPolicy DEFAULTS = new DatasetPolicy(List.of("voynich_real"), 200, 200_000);

  public DatasetPolicy {
    allowedDatasetIds = List.copyOf(Objects.requireNonNull(allowedDatasetIds, "allowedDatasetIds"));
    if (minPages < 0 || minTokens < 0) {
      throw new IllegalArgumentException("dataset policy minimums must be non-negative");
    }
  }

  /**
   * Returns the built-in dataset constraints.
   *
   * @return default dataset policy
   */
  public static DatasetPolicy defaults() {
    return DEFAULTS;
  }
}
