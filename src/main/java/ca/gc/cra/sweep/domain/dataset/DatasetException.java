package ca.gc.cra.sweep.domain.dataset;

/**
 * Signals that a dataset cannot support a sweep: it is missing, has zero pages, has zero tokens, or its
 * catalog cannot be read.
 *
 * @since 0.1.0
 */
public class DatasetException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String datasetId;

  /**
   * Creates an exception for the given dataset.
   *
   * @param datasetId dataset that failed to load
   * @param message detail message
   */
  public DatasetException(String datasetId, String message) {
    super(message);
    this.datasetId = datasetId;
  }

  /**
   * Creates an exception with an underlying cause.
   *
   * @param datasetId dataset that failed to load
   * @param message detail message
   * @param cause root cause
   */
  public DatasetException(String datasetId, String message, Throwable cause) {
    super(message, cause);
    this.datasetId = datasetId;
  }

  /**
   * Returns the dataset id that failed.
   *
   * @return dataset id
   */
  public String datasetId() {
    return datasetId;
  }
}
