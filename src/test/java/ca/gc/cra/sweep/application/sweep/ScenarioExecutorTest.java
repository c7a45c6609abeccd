package ca.gc.cra.sweep.application.sweep;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sweep.application.progress.HeartbeatSettings;
import ca.gc.cra.sweep.domain.dataset.DatasetProfile;
import ca.gc.cra.sweep.domain.policy.WarningPolicy;
import ca.gc.cra.sweep.domain.result.QualityFlag;
import ca.gc.cra.sweep.domain.result.ScenarioMetrics;
import ca.gc.cra.sweep.domain.result.ScenarioResult;
import ca.gc.cra.sweep.domain.result.WarningCategory;
import ca.gc.cra.sweep.domain.result.WarningSummary;
import ca.gc.cra.sweep.domain.run.ProgressEvent;
import ca.gc.cra.sweep.domain.scenario.ScenarioConfig;
import ca.gc.cra.sweep.domain.scenario.ScenarioFamily;
import ca.gc.cra.sweep.domain.scenario.ScenarioSpec;
import ca.gc.cra.sweep.testutil.ManualClock;
import ca.gc.cra.sweep.testutil.RecordingMetricsPort;
import ca.gc.cra.sweep.testutil.ScriptedEvaluationPort;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class ScenarioExecutorTest {
  private static final DatasetProfile DATASET = new DatasetProfile("voynich_real", 240, 250_000);
  private static final ScenarioSpec BASELINE =
      new ScenarioSpec("baseline", ScenarioFamily.BASELINE, ScenarioConfig.of(Map.of("seed", 42)));
  private static final HeartbeatSettings SLOW_HEARTBEAT =
      new HeartbeatSettings(Duration.ofSeconds(30), Duration.ofMillis(500));

  @Test
  void emitsScenarioEventSequenceAndReturnsCleanResult() throws Exception {
    ScriptedEvaluationPort evaluation = new ScriptedEvaluationPort();
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    ScenarioExecutor executor =
        new ScenarioExecutor(evaluation, new ManualClock(0L, 250L), metrics, SLOW_HEARTBEAT);
    List<ProgressEvent> events = new ArrayList<>();

    ScenarioResult result = executor.execute(BASELINE, DATASET, WarningPolicy.defaults(), events::add);

    assertEquals(List.of(
        ProgressEvent.SCENARIO_STARTED,
        ProgressEvent.MODEL_STARTED,
        ProgressEvent.PREDICTION_TESTS_COMPLETED,
        ProgressEvent.MODEL_COMPLETED,
        ProgressEvent.MODEL_STARTED,
        ProgressEvent.PREDICTION_TESTS_COMPLETED,
        ProgressEvent.MODEL_COMPLETED,
        ProgressEvent.SCENARIO_COMPLETED),
        events.stream().map(ProgressEvent::stage).collect(Collectors.toList()));
    assertEquals(2, events.get(0).attributes().get("model_total"));
    assertEquals("glossalial_system", events.get(4).attributes().get("model_name"));
    assertEquals(2, events.get(4).attributes().get("model_index"));
    assertTrue(events.get(3).attributes().containsKey("model_elapsed_sec"));
    assertTrue(events.get(7).attributes().containsKey("scenario_elapsed_sec"));

    assertEquals("baseline", result.id());
    assertEquals(ScenarioFamily.BASELINE, result.family());
    assertSame(ScriptedEvaluationPort.DEFAULT_METRICS, result.metrics());
    assertTrue(result.valid());
    assertEquals(0, result.warnings().totalWarnings());
    assertEquals(1, metrics.observed("sweep.scenario.latencyMillis").size());
    assertEquals(1, evaluation.closedSessions());
    assertEquals(List.of(
        "predict:adjacency_grammar", "battery:adjacency_grammar",
        "predict:glossalial_system", "battery:glossalial_system", "report"), evaluation.calls());
  }

  @Test
  void handsScenarioConfigToCollaboratorUnchanged() throws Exception {
    ScriptedEvaluationPort evaluation = new ScriptedEvaluationPort();
    ScenarioExecutor executor =
        new ScenarioExecutor(evaluation, new ManualClock(), new RecordingMetricsPort(), SLOW_HEARTBEAT);

    executor.execute(BASELINE, DATASET, WarningPolicy.defaults(), event -> {});

    assertSame(BASELINE, evaluation.spec("baseline"));
  }

  @Test
  void capturedWarningsBecomeQualityFlags() throws Exception {
    ScriptedEvaluationPort evaluation = new ScriptedEvaluationPort()
        .warnings("baseline", List.of(
            "Insufficient data for containment_grammar",
            "Using fallback estimated degradation for a",
            "Using fallback estimated degradation for b",
            "Using fallback estimated degradation for c"));
    ScenarioExecutor executor =
        new ScenarioExecutor(evaluation, new ManualClock(), new RecordingMetricsPort(), SLOW_HEARTBEAT);

    ScenarioResult result = executor.execute(BASELINE, DATASET, WarningPolicy.defaults(), event -> {});

    assertEquals(4, result.warnings().totalWarnings());
    assertEquals(3, result.warnings().count(WarningCategory.FALLBACK_ESTIMATE));
    assertEquals(EnumSet.of(
        QualityFlag.INSUFFICIENT_DATA, QualityFlag.FALLBACK_HEAVY, QualityFlag.FALLBACK_RATIO_EXCEEDED),
        result.qualityFlags());
    assertFalse(result.valid());
  }

  @Test
  void emitsHeartbeatsWhileFullBatteryRuns() throws Exception {
    ScriptedEvaluationPort evaluation =
        new ScriptedEvaluationPort(List.of("adjacency_grammar")).batteryMillis(400);
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    ScenarioExecutor executor = new ScenarioExecutor(evaluation, new ManualClock(), metrics,
        new HeartbeatSettings(Duration.ofMillis(50), Duration.ofMillis(500)));
    List<ProgressEvent> events = Collections.synchronizedList(new ArrayList<>());

    executor.execute(BASELINE, DATASET, WarningPolicy.defaults(), events::add);

    List<ProgressEvent> beats;
    synchronized (events) {
      beats = events.stream()
          .filter(event -> ProgressEvent.FULL_BATTERY_HEARTBEAT.equals(event.stage()))
          .collect(Collectors.toList());
    }
    assertTrue(beats.size() >= 2, "expected several heartbeats, got " + beats.size());
    assertEquals(1, beats.get(0).attributes().get("heartbeat_index"));
    assertEquals(0.05, (double) beats.get(0).attributes().get("heartbeat_period_sec"), 1e-9);
    assertEquals("adjacency_grammar", beats.get(0).attributes().get("model_name"));
    assertEquals(beats.size(), metrics.count("sweep.heartbeat.emitted"));
    int afterReturn = beats.size();
    Thread.sleep(150);
    long lateBeats = events.stream()
        .filter(event -> ProgressEvent.FULL_BATTERY_HEARTBEAT.equals(event.stage()))
        .count();
    assertEquals(afterReturn, lateBeats);
  }

  @Test
  void failingFullBatteryStillStopsHeartbeats() throws Exception {
    IOException failure = new IOException("battery aborted");
    ScriptedEvaluationPort evaluation = new ScriptedEvaluationPort(List.of("adjacency_grammar"))
        .batteryMillis(450)
        .failBattery("baseline", failure);
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    ScenarioExecutor executor = new ScenarioExecutor(evaluation, new ManualClock(), metrics,
        new HeartbeatSettings(Duration.ofMillis(100), Duration.ofMillis(500)));
    List<ProgressEvent> events = Collections.synchronizedList(new ArrayList<>());

    IOException thrown = assertThrows(IOException.class,
        () -> executor.execute(BASELINE, DATASET, WarningPolicy.defaults(), events::add));

    assertSame(failure, thrown);
    assertEquals(1, evaluation.closedSessions());
    long beatsAtReturn = heartbeatCount(events);
    assertTrue(beatsAtReturn >= 3, "expected at least three heartbeats, got " + beatsAtReturn);
    assertTrue(Thread.getAllStackTraces().keySet().stream()
        .noneMatch(thread -> thread.isAlive() && thread.getName().startsWith("sweep-heartbeat")));
    Thread.sleep(250);
    assertEquals(beatsAtReturn, heartbeatCount(events));
    assertEquals(beatsAtReturn, metrics.count("sweep.heartbeat.emitted"));
  }

  @Test
  void collaboratorFailurePropagatesUnchangedAndClosesSession() {
    IOException failure = new IOException("evaluator crashed");
    ScriptedEvaluationPort evaluation = new ScriptedEvaluationPort().failOn("baseline", failure);
    ScenarioExecutor executor =
        new ScenarioExecutor(evaluation, new ManualClock(), new RecordingMetricsPort(), SLOW_HEARTBEAT);

    IOException thrown = assertThrows(IOException.class,
        () -> executor.execute(BASELINE, DATASET, WarningPolicy.defaults(), event -> {}));

    assertSame(failure, thrown);
    assertEquals(1, evaluation.closedSessions());
  }

  @Test
  void deriveFlagsAppliesEachRuleIndependently() {
    ScenarioMetrics allFalsified = new ScenarioMetrics("none", 0.0, 0, 6, false, false);
    WarningSummary dense = new WarningSummary(21,
        Map.of(WarningCategory.SPARSE_DATA, 1, WarningCategory.NAN_SANITIZED, 2), 3, 3.0 / 21.0, List.of());

    Set<QualityFlag> flags = ScenarioExecutor.deriveFlags(dense, allFalsified, WarningPolicy.defaults());

    assertEquals(EnumSet.of(
        QualityFlag.SPARSE_DATA,
        QualityFlag.NAN_SANITIZED,
        QualityFlag.WARNING_DENSITY_EXCEEDED,
        QualityFlag.ALL_MODELS_FALSIFIED), flags);
  }

  @Test
  void deriveFlagsKeepsBoundaryValuesClean() {
    WarningSummary atLimits = new WarningSummary(20,
        Map.of(WarningCategory.FALLBACK_ESTIMATE, 2), 5, 0.25, List.of());

    Set<QualityFlag> flags = ScenarioExecutor.deriveFlags(
        atLimits, ScriptedEvaluationPort.DEFAULT_METRICS, WarningPolicy.defaults());

    assertTrue(flags.isEmpty(), flags.toString());
  }

  private static long heartbeatCount(List<ProgressEvent> events) {
    synchronized (events) {
      return events.stream()
          .filter(event -> ProgressEvent.FULL_BATTERY_HEARTBEAT.equals(event.stage()))
          .count();
    }
  }
}
