package ca.gc.cra.sweep.application.port;

import ca.gc.cra.sweep.domain.dataset.DatasetException;
import ca.gc.cra.sweep.domain.dataset.DatasetProfile;

/**
 * Port resolving dataset size profiles.
 *
 * @since 0.1.0
 */
public interface DatasetProfilePort {
  /**
   * Loads the profile of a dataset.
   *
   * @param datasetId dataset identifier
   * @return profile with positive page and token counts
   * @throws DatasetException when the dataset is missing, has zero pages or tokens, or cannot be read
   */
  DatasetProfile load(String datasetId) throws DatasetException;
}
