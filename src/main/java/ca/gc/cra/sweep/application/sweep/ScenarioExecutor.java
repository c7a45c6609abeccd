package ca.gc.cra.sweep.application.sweep;

import ca.gc.cra.sweep.application.port.ClockPort;
import ca.gc.cra.sweep.application.port.DiagnosticSink;
import ca.gc.cra.sweep.application.port.EvaluationPort;
import ca.gc.cra.sweep.application.port.EvaluationSession;
import ca.gc.cra.sweep.application.port.MetricsPort;
import ca.gc.cra.sweep.application.port.ProgressListener;
import ca.gc.cra.sweep.application.progress.HeartbeatSettings;
import ca.gc.cra.sweep.application.progress.HeartbeatWorker;
import ca.gc.cra.sweep.domain.dataset.DatasetProfile;
import ca.gc.cra.sweep.domain.policy.WarningPolicy;
import ca.gc.cra.sweep.domain.result.QualityFlag;
import ca.gc.cra.sweep.domain.result.ScenarioMetrics;
import ca.gc.cra.sweep.domain.result.ScenarioResult;
import ca.gc.cra.sweep.domain.result.WarningCategory;
import ca.gc.cra.sweep.domain.result.WarningSummary;
import ca.gc.cra.sweep.domain.run.ProgressEvent;
import ca.gc.cra.sweep.domain.scenario.ScenarioSpec;
import ca.gc.cra.sweep.logging.Logs;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs one scenario against the evaluation collaborator and derives its quality flags.
 * <p><strong>Why:</strong> Degraded evaluator output is still evidence; warnings are captured and classified
 * instead of aborting the scenario.</p>
 * <p><strong>Role:</strong> Application service invoked by the orchestrator once per pending scenario.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Drive prediction tests and the full battery for every candidate model.</li>
 *   <li>Keep a heartbeat worker alive for exactly the duration of each full battery.</li>
 *   <li>Emit the scenario progress event sequence through the supplied listener.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless between calls; one scenario at a time.</p>
 * <p><strong>Observability:</strong> Records {@code sweep.scenario.latencyMillis} and
 * {@code sweep.heartbeat.emitted}.</p>
 *
 * @since 0.1.0
 */
public final class ScenarioExecutor {
  private static final Logger log = LoggerFactory.getLogger(ScenarioExecutor.class);

  private final EvaluationPort evaluation;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final HeartbeatSettings heartbeat;

  /**
   * Creates an executor.
   *
   * @param evaluation evaluation collaborator
   * @param clock time source for elapsed attributes
   * @param metrics metrics sink
   * @param heartbeat heartbeat period and join timeout
   */
  public ScenarioExecutor(
      EvaluationPort evaluation, ClockPort clock, MetricsPort metrics, HeartbeatSettings heartbeat) {
    this.evaluation = Objects.requireNonNull(evaluation, "evaluation");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.heartbeat = Objects.requireNonNull(heartbeat, "heartbeat");
  }

  /**
   * Executes a scenario.
   *
   * @param scenario scenario to run; its config is handed to the collaborator directly
   * @param dataset dataset under evaluation
   * @param policy warning thresholds used for flag derivation
   * @param listener receives progress events; may be invoked from the heartbeat thread
   * @return scenario result with metrics, warning summary and quality flags
   * @throws Exception any failure raised by the evaluation collaborator, unchanged
   */
  public ScenarioResult execute(
      ScenarioSpec scenario, DatasetProfile dataset, WarningPolicy policy, ProgressListener listener)
      throws Exception {
    Objects.requireNonNull(scenario, "scenario");
    Objects.requireNonNull(dataset, "dataset");
    Objects.requireNonNull(policy, "policy");
    Objects.requireNonNull(listener, "listener");

    String scenarioId = scenario.id();
    List<String> models = evaluation.candidateModels();
    int modelTotal = models.size();
    long scenarioStart = clock.nowMillis();
    emit(listener, ProgressEvent.SCENARIO_STARTED, scenarioId, Map.of("model_total", modelTotal));
    log.info("Starting scenario {} on dataset {} ({} models)", scenarioId, dataset.datasetId(), modelTotal);

    List<String> captured = Collections.synchronizedList(new ArrayList<>());
    DiagnosticSink sink = message -> captured.add(message == null ? "" : message);

    ScenarioMetrics scenarioMetrics;
    try (EvaluationSession session = evaluation.openSession(dataset, scenario, sink)) {
      for (int i = 0; i < modelTotal; i++) {
        String model = models.get(i);
        int modelIndex = i + 1;
        long modelStart = clock.nowMillis();
        emit(listener, ProgressEvent.MODEL_STARTED, scenarioId, modelAttributes(modelIndex, modelTotal, model));
        log.debug("[{}] model {}/{} {}: prediction tests", scenarioId, modelIndex, modelTotal, model);
        session.runPredictionTests(model);
        emit(listener, ProgressEvent.PREDICTION_TESTS_COMPLETED, scenarioId,
            modelAttributes(modelIndex, modelTotal, model));

        log.debug("[{}] model {}/{} {}: full battery", scenarioId, modelIndex, modelTotal, model);
        runFullBattery(session, scenarioId, modelIndex, modelTotal, model, listener);

        Map<String, Object> completed = modelAttributes(modelIndex, modelTotal, model);
        completed.put("model_elapsed_sec", seconds(clock.nowMillis() - modelStart));
        emit(listener, ProgressEvent.MODEL_COMPLETED, scenarioId, completed);
      }
      scenarioMetrics = session.report();
    }

    List<String> messages;
    synchronized (captured) {
      messages = new ArrayList<>(captured);
    }
    WarningSummary warnings = WarningClassifier.summarize(messages);
    Set<QualityFlag> flags = deriveFlags(warnings, scenarioMetrics, policy);
    if (warnings.totalWarnings() > 0) {
      log.warn("Scenario {} captured {} evaluator warnings; first: {}",
          scenarioId, warnings.totalWarnings(), Logs.truncate(warnings.sampleMessages().get(0)));
    }

    long elapsed = clock.nowMillis() - scenarioStart;
    metrics.observe("sweep.scenario.latencyMillis", elapsed);
    emit(listener, ProgressEvent.SCENARIO_COMPLETED, scenarioId, Map.of("scenario_elapsed_sec", seconds(elapsed)));
    log.info("Scenario {} complete in {} s (top model {}, flags {})",
        scenarioId, seconds(elapsed), scenarioMetrics.topModel(), flags);
    return new ScenarioResult(scenarioId, scenario.family(), scenarioMetrics, warnings, flags);
  }

  /**
   * Derives quality flags. Each rule is evaluated independently.
   *
   * @param warnings classified warnings for the scenario
   * @param metrics evaluator metrics
   * @param policy warning thresholds
   * @return flags in declaration order
   */
  static Set<QualityFlag> deriveFlags(WarningSummary warnings, ScenarioMetrics metrics, WarningPolicy policy) {
    EnumSet<QualityFlag> flags = EnumSet.noneOf(QualityFlag.class);
    if (warnings.count(WarningCategory.INSUFFICIENT_DATA) > 0) {
      flags.add(QualityFlag.INSUFFICIENT_DATA);
    }
    if (warnings.count(WarningCategory.SPARSE_DATA) > 0) {
      flags.add(QualityFlag.SPARSE_DATA);
    }
    if (warnings.count(WarningCategory.NAN_SANITIZED) > 0) {
      flags.add(QualityFlag.NAN_SANITIZED);
    }
    if (warnings.count(WarningCategory.FALLBACK_ESTIMATE) >= policy.fallbackHeavyThresholdPerScenario()) {
      flags.add(QualityFlag.FALLBACK_HEAVY);
    }
    if (warnings.fallbackWarningRatio() > policy.maxFallbackWarningRatioPerScenario()) {
      flags.add(QualityFlag.FALLBACK_RATIO_EXCEEDED);
    }
    if (warnings.totalWarnings() > policy.maxWarningDensityPerScenario()) {
      flags.add(QualityFlag.WARNING_DENSITY_EXCEEDED);
    }
    if (metrics.survivingModels() == 0) {
      flags.add(QualityFlag.ALL_MODELS_FALSIFIED);
    }
    return flags;
  }

  private void runFullBattery(
      EvaluationSession session,
      String scenarioId,
      int modelIndex,
      int modelTotal,
      String model,
      ProgressListener listener) throws Exception {
    double periodSec = heartbeat.period().toMillis() / 1000.0;
    try (HeartbeatWorker worker = HeartbeatWorker.start(heartbeat, beat -> {
      Map<String, Object> attributes = modelAttributes(modelIndex, modelTotal, model);
      attributes.put("heartbeat_index", beat);
      attributes.put("heartbeat_period_sec", periodSec);
      metrics.increment("sweep.heartbeat.emitted");
      emit(listener, ProgressEvent.FULL_BATTERY_HEARTBEAT, scenarioId, attributes);
    })) {
      session.runFullBattery(model);
      log.debug("[{}] full battery for {} finished after {} heartbeats", scenarioId, model, worker.beats());
    }
  }

  private static Map<String, Object> modelAttributes(int modelIndex, int modelTotal, String model) {
    Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("model_index", modelIndex);
    attributes.put("model_total", modelTotal);
    attributes.put("model_name", model);
    return attributes;
  }

  private static void emit(
      ProgressListener listener, String stage, String scenarioId, Map<String, Object> attributes) {
    listener.onEvent(new ProgressEvent(stage, scenarioId, attributes));
  }

  private static double seconds(long millis) {
    return millis / 1000.0;
  }
}
