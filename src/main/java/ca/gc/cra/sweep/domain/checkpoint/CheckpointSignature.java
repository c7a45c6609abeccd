package ca.gc.cra.sweep.domain.checkpoint;

import ca.gc.cra.sweep.domain.run.SweepMode;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Compound key deciding whether stored checkpoint rows may be reused.
 * <p><strong>Why:</strong> Any change to the dataset, mode, scenario list, or policy version changes what a
 * result means, so equality must hold field-for-field before a row is trusted.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; record equality is the comparison used on resume.</p>
 *
 * @param datasetId dataset identifier
 * @param mode execution mode
 * @param scenarioIds ordered scenario ids of this run
 * @param policyVersion release evidence policy version
 * @since 0.1.0
 */
public record CheckpointSignature(
    String datasetId, SweepMode mode, List<String> scenarioIds, String policyVersion) {
  public CheckpointSignature {
    Objects.requireNonNull(datasetId, "datasetId");
    Objects.requireNonNull(mode, "mode");
    scenarioIds = List.copyOf(Objects.requireNonNull(scenarioIds, "scenarioIds"));
    Objects.requireNonNull(policyVersion, "policyVersion");
  }
}
