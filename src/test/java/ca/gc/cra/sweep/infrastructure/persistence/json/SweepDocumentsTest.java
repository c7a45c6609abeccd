package ca.gc.cra.sweep.infrastructure.persistence.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sweep.application.sweep.WarningClassifier;
import ca.gc.cra.sweep.domain.checkpoint.CheckpointFailure;
import ca.gc.cra.sweep.domain.checkpoint.CheckpointSignature;
import ca.gc.cra.sweep.domain.checkpoint.CheckpointState;
import ca.gc.cra.sweep.domain.checkpoint.CheckpointStatus;
import ca.gc.cra.sweep.domain.checkpoint.CompletedScenario;
import ca.gc.cra.sweep.domain.policy.ReleaseEvidencePolicy;
import ca.gc.cra.sweep.domain.policy.WarningPolicy;
import ca.gc.cra.sweep.domain.result.QualityFlag;
import ca.gc.cra.sweep.domain.result.ScenarioMetrics;
import ca.gc.cra.sweep.domain.result.ScenarioResult;
import ca.gc.cra.sweep.domain.result.WarningCategory;
import ca.gc.cra.sweep.domain.result.WarningSummary;
import ca.gc.cra.sweep.domain.robustness.ReadinessEvidence;
import ca.gc.cra.sweep.domain.run.SweepMode;
import ca.gc.cra.sweep.domain.scenario.ScenarioFamily;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SweepDocumentsTest {
  private static final Instant NOW = Instant.parse("2026-02-10T08:15:00.750Z");

  private final JsonSupport json = new JsonSupport();

  @Test
  void utcTruncatesToSeconds() {
    assertEquals("2026-02-10T08:15:00Z", SweepDocuments.utc(NOW));
  }

  @Test
  void checkpointSurvivesAWriteReadCycle() {
    CheckpointSignature signature = new CheckpointSignature(
        "voynich_real", SweepMode.RELEASE, List.of("baseline", "threshold_0.50"), "2026-02-10");
    CheckpointState state = CheckpointState.fresh(signature, 2);
    ScenarioResult baseline = new ScenarioResult(
        "baseline",
        ScenarioFamily.BASELINE,
        new ScenarioMetrics("adjacency_grammar", 0.82, 2, 4, true, true),
        new WarningSummary(2, Map.of(WarningCategory.SPARSE_DATA, 2), 2, 1.0,
            List.of("Sparse data for a", "Sparse data for b")),
        Set.of(QualityFlag.SPARSE_DATA));
    state.record(new CompletedScenario("baseline", 1, baseline));
    state.markFailed(new CheckpointFailure(NOW, "threshold_0.50", 2, "IOException", "boom"));

    Map<String, Object> doc = json.parseObject(json.render(SweepDocuments.checkpoint(state, NOW), true));
    CheckpointState restored = SweepDocuments.checkpointFrom(doc);

    assertEquals("FAILED", doc.get("status"));
    assertEquals(List.of("baseline"), doc.get("completed_scenario_ids"));
    assertEquals(signature, restored.signature());
    assertEquals(CheckpointStatus.FAILED, restored.status());
    assertEquals(List.of("baseline"), restored.completedScenarioIds());
    assertEquals(baseline, restored.result("baseline").orElseThrow());
    assertEquals(OptionalInt.of(1), restored.lastCompletedIndex());
    CheckpointFailure failure = restored.failure().orElseThrow();
    assertEquals("threshold_0.50", failure.scenarioId());
    assertEquals(Instant.parse("2026-02-10T08:15:00Z"), failure.timestamp());
    assertFalse(restored.summary().isPresent());
  }

  @Test
  void malformedFailureTimestampIsAnArgumentError() {
    CheckpointState state = CheckpointState.fresh(new CheckpointSignature(
        "voynich_real", SweepMode.RELEASE, List.of("baseline"), "2026-02-10"), 1);
    Map<String, Object> doc = json.parseObject(json.render(SweepDocuments.checkpoint(state, NOW), true));
    doc.put("failure", Map.of(
        "timestamp", "yesterday", "scenario_id", "baseline", "scenario_index", 1, "error_type", "IOException"));

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> SweepDocuments.checkpointFrom(doc));
    assertTrue(ex.getMessage().contains("timestamp"), ex.getMessage());
  }

  @Test
  void decodedWarningsEqualTheClassifiedOriginal() {
    WarningSummary fresh = WarningClassifier.summarize(List.of("Sparse data for glossalial_system", "other"));

    WarningSummary decoded = SweepDocuments.warningsFrom(
        json.parseObject(json.render(SweepDocuments.warnings(fresh), false)));

    assertEquals(fresh, decoded);
    assertTrue(decoded.categoryCounts().containsKey(WarningCategory.NAN_SANITIZED));
  }

  @Test
  void checkpointWithoutSignatureIsMalformed() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> SweepDocuments.checkpointFrom(json.parseObject("{\"status\": \"COMPLETED\"}")));
    assertEquals("Field 'signature' must be a object but found nothing", ex.getMessage());
  }

  @Test
  void metricsFromRejectsWrongTypes() {
    Map<String, Object> report = json.parseObject("{\"top_model\": \"m\", \"top_score\": \"high\","
        + "\"surviving_models\": 1, \"falsified_models\": 0,"
        + "\"anomaly_confirmed\": true, \"anomaly_stable\": true}");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> SweepDocuments.metricsFrom(report));
    assertTrue(ex.getMessage().contains("top_score"), ex.getMessage());
  }

  @Test
  void readinessEvidenceAcceptsEveryWrapperShape() {
    String block = "{\"execution_mode\": \"release\", \"max_scenarios\": null,"
        + "\"scenario_count_expected\": 17, \"scenario_count_executed\": 17,"
        + "\"quality_gate_passed\": true, \"robustness_conclusive\": true,"
        + "\"dataset_policy_pass\": true, \"warning_policy_pass\": false}";
    ReadinessEvidence expected = new ReadinessEvidence(
        SweepMode.RELEASE, OptionalInt.empty(), 17, 17, true, true, true, false);

    assertEquals(expected, SweepDocuments.readinessEvidence(json.parseObject(block)));
    assertEquals(expected, SweepDocuments.readinessEvidence(json.parseObject("{\"summary\": " + block + "}")));
    assertEquals(expected, SweepDocuments.readinessEvidence(
        json.parseObject("{\"provenance\": {}, \"results\": {\"summary\": " + block + "}}")));
  }

  @Test
  void readinessEvidenceRequiresEveryGateField() {
    Map<String, Object> doc = json.parseObject("{\"execution_mode\": \"release\","
        + "\"scenario_count_expected\": 17, \"scenario_count_executed\": 17}");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> SweepDocuments.readinessEvidence(doc));
    assertTrue(ex.getMessage().contains("quality_gate_passed"), ex.getMessage());
  }

  @Test
  void releaseEvidencePolicyOverlaysPresentKeysOnly() {
    Map<String, Object> doc = json.parseObject("{\"policy_version\": \"2026-03-01\","
        + "\"dataset_policy\": {\"min_pages\": 150},"
        + "\"warning_policy\": {\"max_total_warning_count\": 50, \"max_fallback_warning_ratio_per_scenario\": 0.5}}");

    ReleaseEvidencePolicy policy = SweepDocuments.releaseEvidencePolicy(doc, ReleaseEvidencePolicy.defaults());

    assertEquals("2026-03-01", policy.policyVersion());
    assertEquals(List.of("voynich_real"), policy.datasetPolicy().allowedDatasetIds());
    assertEquals(150, policy.datasetPolicy().minPages());
    assertEquals(200_000, policy.datasetPolicy().minTokens());
    WarningPolicy warnings = policy.warningPolicy();
    assertEquals(50, warnings.maxTotalWarningCount());
    assertEquals(0.5, warnings.maxFallbackWarningRatioPerScenario());
    assertEquals(WarningPolicy.defaults().maxWarningDensityPerScenario(), warnings.maxWarningDensityPerScenario());
    assertEquals(3, warnings.fallbackHeavyThresholdPerScenario());
  }

  @Test
  void releaseEvidencePolicyRejectsWrongTypes() {
    Map<String, Object> doc = json.parseObject("{\"dataset_policy\": {\"min_tokens\": \"lots\"}}");

    assertThrows(IllegalArgumentException.class,
        () -> SweepDocuments.releaseEvidencePolicy(doc, ReleaseEvidencePolicy.defaults()));
  }
}
