package ca.gc.cra.sweep.domain.checkpoint;

import ca.gc.cra.sweep.domain.result.ScenarioResult;
import java.util.Objects;

/**
 * A checkpoint row.
 *
 * @param id scenario id
 * @param index one-based position in the executed scenario list
 * @param result stored result
 * @since 0.1.0
 */
public record CompletedScenario(String id, int index, ScenarioResult result) {
  public CompletedScenario {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(result, "result");
    if (!id.equals(result.id())) {
      throw new IllegalArgumentException("row id " + id + " does not match result id " + result.id());
    }
  }
}
