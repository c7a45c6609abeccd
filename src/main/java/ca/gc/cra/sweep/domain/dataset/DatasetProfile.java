package ca.gc.cra.sweep.domain.dataset;

import java.util.Objects;

/**
 * Size profile of the dataset a sweep evaluates.
 *
 * @param datasetId dataset identifier
 * @param pages number of pages
 * @param tokens number of transcription tokens
 * @since 0.1.0
 */
public record DatasetProfile(String datasetId, long pages, long tokens) {
  public DatasetProfile {
    Objects.requireNonNull(datasetId, "datasetId");
  }
}
