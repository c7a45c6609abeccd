package ca.gc.cra.sweep.domain.robustness;

/**
 * Classification of a run summary artifact.
 *
 * @since 0.1.0
 */
public enum ArtifactClass {
  /** Produced by a release-mode run. */
  RELEASE_CANDIDATE("release_candidate"),
  /** Produced by a smoke or iterative run. */
  LATEST_SNAPSHOT("latest_snapshot");

  private final String wireName;

  ArtifactClass(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }
}
