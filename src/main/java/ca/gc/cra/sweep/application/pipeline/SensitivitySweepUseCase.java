package ca.gc.cra.sweep.application.pipeline;

import ca.gc.cra.sweep.application.checkpoint.CheckpointStore;
import ca.gc.cra.sweep.application.context.SweepContext;
import ca.gc.cra.sweep.application.port.CheckpointPort;
import ca.gc.cra.sweep.application.port.ClockPort;
import ca.gc.cra.sweep.application.port.DatasetProfilePort;
import ca.gc.cra.sweep.application.port.EvidencePort;
import ca.gc.cra.sweep.application.port.EvidencePort.EvidenceLocations;
import ca.gc.cra.sweep.application.port.MetricsPort;
import ca.gc.cra.sweep.application.port.ProgressPort;
import ca.gc.cra.sweep.application.port.ReleaseRunStatusPort;
import ca.gc.cra.sweep.application.progress.ProgressReporter;
import ca.gc.cra.sweep.application.progress.ReleaseRunStatusTracker;
import ca.gc.cra.sweep.application.sweep.DatasetPolicyEvaluator;
import ca.gc.cra.sweep.application.sweep.ReleaseReadinessGate;
import ca.gc.cra.sweep.application.sweep.RobustnessEvaluator;
import ca.gc.cra.sweep.application.sweep.ScenarioExecutor;
import ca.gc.cra.sweep.application.sweep.ScenarioMatrixBuilder;
import ca.gc.cra.sweep.domain.checkpoint.CheckpointSignature;
import ca.gc.cra.sweep.domain.checkpoint.CheckpointState;
import ca.gc.cra.sweep.domain.checkpoint.CheckpointSummary;
import ca.gc.cra.sweep.domain.dataset.DatasetException;
import ca.gc.cra.sweep.domain.dataset.DatasetPolicyEvaluation;
import ca.gc.cra.sweep.domain.dataset.DatasetProfile;
import ca.gc.cra.sweep.domain.policy.ReleaseEvidencePolicy;
import ca.gc.cra.sweep.domain.result.QualityFlag;
import ca.gc.cra.sweep.domain.result.ScenarioResult;
import ca.gc.cra.sweep.domain.robustness.ArtifactClass;
import ca.gc.cra.sweep.domain.robustness.ReadinessEvidence;
import ca.gc.cra.sweep.domain.robustness.ReadinessVerdict;
import ca.gc.cra.sweep.domain.robustness.RobustnessSummary;
import ca.gc.cra.sweep.domain.robustness.RunSummary;
import ca.gc.cra.sweep.domain.run.ProgressEvent;
import ca.gc.cra.sweep.domain.run.ReleaseRunReason;
import ca.gc.cra.sweep.domain.run.SweepMode;
import ca.gc.cra.sweep.domain.scenario.ScenarioSpec;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Orchestrates a sensitivity sweep from scenario matrix to release evidence.
 * <p><strong>Why:</strong> Sweeps run for hours against an external evaluator; the loop must survive restarts
 * through checkpoint resume and leave an inspectable artifact on every exit path.</p>
 * <p><strong>Role:</strong> Application-layer use case composing the checkpoint store, scenario executor,
 * progress reporter, release-run status tracker, robustness evaluator and readiness gate.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Build the scenario matrix and apply the scenario cap.</li>
 *   <li>Reuse checkpointed results whose signature matches; execute the rest strictly in order.</li>
 *   <li>Persist the checkpoint after every scenario and record failures before propagating them.</li>
 *   <li>Aggregate results, gate release readiness and write the run summary.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one run at a time.</p>
 * <p><strong>Observability:</strong> Metrics {@code sweep.scenario.executed}, {@code sweep.scenario.resumed},
 * {@code sweep.scenario.failed}; MDC keys {@code sweep.runId}, {@code sweep.mode},
 * {@code sweep.scenarioId}.</p>
 *
 * @since 0.1.0
 */
public final class SensitivitySweepUseCase {
  private static final Logger log = LoggerFactory.getLogger(SensitivitySweepUseCase.class);
  static final String MDC_RUN_ID = "sweep.runId";
  static final String MDC_MODE = "sweep.mode";
  static final String MDC_SCENARIO_ID = "sweep.scenarioId";

  private final DatasetProfilePort datasets;
  private final CheckpointPort checkpointPort;
  private final EvidencePort evidence;
  private final ScenarioMatrixBuilder matrixBuilder;
  private final ScenarioExecutor executor;
  private final RobustnessEvaluator robustnessEvaluator;
  private final ProgressReporter progress;
  private final ReleaseRunStatusTracker releaseStatus;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final Supplier<String> runIds;

  /**
   * Creates the orchestrator with random UUID run ids.
   *
   * @param datasets dataset profile source
   * @param checkpointPort checkpoint persistence
   * @param progressPort progress snapshot persistence
   * @param releaseStatusPort release-run status persistence
   * @param evidence run summary persistence
   * @param executor scenario executor
   * @param robustnessEvaluator robustness evaluator
   * @param clock time source
   * @param metrics metrics sink
   */
  public SensitivitySweepUseCase(
      DatasetProfilePort datasets,
      CheckpointPort checkpointPort,
      ProgressPort progressPort,
      ReleaseRunStatusPort releaseStatusPort,
      EvidencePort evidence,
      ScenarioExecutor executor,
      RobustnessEvaluator robustnessEvaluator,
      ClockPort clock,
      MetricsPort metrics) {
    this(datasets, checkpointPort, progressPort, releaseStatusPort, evidence, executor, robustnessEvaluator,
        clock, metrics, () -> UUID.randomUUID().toString());
  }

  SensitivitySweepUseCase(
      DatasetProfilePort datasets,
      CheckpointPort checkpointPort,
      ProgressPort progressPort,
      ReleaseRunStatusPort releaseStatusPort,
      EvidencePort evidence,
      ScenarioExecutor executor,
      RobustnessEvaluator robustnessEvaluator,
      ClockPort clock,
      MetricsPort metrics,
      Supplier<String> runIds) {
    this.datasets = Objects.requireNonNull(datasets, "datasets");
    this.checkpointPort = Objects.requireNonNull(checkpointPort, "checkpointPort");
    this.evidence = Objects.requireNonNull(evidence, "evidence");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.robustnessEvaluator = Objects.requireNonNull(robustnessEvaluator, "robustnessEvaluator");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.runIds = Objects.requireNonNull(runIds, "runIds");
    this.matrixBuilder = new ScenarioMatrixBuilder();
    this.progress = new ProgressReporter(Objects.requireNonNull(progressPort, "progressPort"), clock);
    this.releaseStatus = new ReleaseRunStatusTracker(
        Objects.requireNonNull(releaseStatusPort, "releaseStatusPort"), clock);
  }

  /**
   * Runs the sweep to completion.
   *
   * @param request normalized run inputs
   * @return summary, results and artifact locations
   * @throws DatasetException if the dataset profile is unavailable
   * @throws ScenarioExecutionException if a scenario fails; checkpoint, progress and release-run status
   *     already record the failure
   * @throws IOException if an artifact cannot be written
   */
  public SweepOutcome run(SweepRequest request)
      throws DatasetException, ScenarioExecutionException, IOException {
    Objects.requireNonNull(request, "request");
    String runId = runIds.get();
    String previousRunId = MDC.get(MDC_RUN_ID);
    String previousMode = MDC.get(MDC_MODE);
    try {
      MDC.put(MDC_RUN_ID, runId);
      MDC.put(MDC_MODE, request.mode().wireName());
      return execute(runId, request);
    } finally {
      restore(MDC_RUN_ID, previousRunId);
      restore(MDC_MODE, previousMode);
    }
  }

  private SweepOutcome execute(String runId, SweepRequest request)
      throws DatasetException, ScenarioExecutionException, IOException {
    ReleaseEvidencePolicy policy = request.policy();
    DatasetProfile dataset = datasets.load(request.datasetId());
    DatasetPolicyEvaluation datasetPolicy = DatasetPolicyEvaluator.evaluate(dataset, policy.datasetPolicy());
    if (!datasetPolicy.pass()) {
      log.warn("Dataset {} fails release dataset policy: {}", dataset.datasetId(), datasetPolicy.reasons());
    }

    List<ScenarioSpec> all = request.mode() == SweepMode.ITERATIVE
        ? matrixBuilder.buildReduced(request.baseConfig())
        : matrixBuilder.build(request.baseConfig());
    int expected = all.size();
    List<ScenarioSpec> scenarios = applyCap(all, request.maxScenarios());
    List<String> scenarioIds = scenarios.stream().map(ScenarioSpec::id).toList();

    SweepContext context = SweepContext.start(
        runId, clock, request.mode(), request.datasetId(), request.maxScenarios(), scenarios.size());
    CheckpointStore checkpoint = new CheckpointStore(checkpointPort, clock, metrics);
    CheckpointState state = checkpoint.begin(
        new CheckpointSignature(request.datasetId(), request.mode(), scenarioIds, policy.policyVersion()),
        scenarios.size(),
        request.resume());
    Map<String, ScenarioResult> resumable = new LinkedHashMap<>();
    for (String id : scenarioIds) {
      state.result(id).ifPresent(result -> resumable.put(id, result));
    }

    Map<String, Object> started = new LinkedHashMap<>();
    started.put("max_scenarios", boxed(request.maxScenarios()));
    started.put("quick", request.quick());
    started.put("resume_from_checkpoint", request.resume());
    started.put("resumed_scenarios", resumable.size());
    started.put("checkpoint_path", checkpointPort.location().toString());
    progress.publish(context, ProgressReporter.RUN_STARTED, started);
    releaseStatus.started(context, request.resume(), resumable.size());
    log.info("Sweep started: dataset={} mode={} scenarios={}/{} resumable={}",
        request.datasetId(), request.mode().wireName(), scenarios.size(), expected, resumable.size());

    List<ScenarioResult> results = new ArrayList<>(scenarios.size());
    int executed = 0;
    for (int i = 0; i < scenarios.size(); i++) {
      ScenarioSpec scenario = scenarios.get(i);
      int index = i + 1;
      context.enterScenario(scenario.id(), index);
      ScenarioResult reused = resumable.get(scenario.id());
      if (reused != null) {
        results.add(reused);
        context.scenarioResumed();
        metrics.increment("sweep.scenario.resumed");
        progress.publishScenario(context, ProgressReporter.SCENARIO_RESUMED, scenario.id(), index, Map.of());
        releaseStatus.running(context, ReleaseRunReason.RELEASE_RUN_RESUMED, ProgressReporter.SCENARIO_RESUMED);
        log.debug("Scenario {} reused from checkpoint", scenario.id());
        continue;
      }

      progress.publishScenario(context, ProgressReporter.SCENARIO_DISPATCH, scenario.id(), index, Map.of());
      releaseStatus.running(
          context, ReleaseRunReason.RELEASE_RUN_SCENARIO_DISPATCHED, ProgressReporter.SCENARIO_DISPATCH);
      ScenarioResult result = executeScenario(context, checkpoint, scenario, index, dataset, policy);
      results.add(result);
      executed++;
      context.scenarioCompleted();
      checkpoint.record(scenario.id(), index, result);
      metrics.increment("sweep.scenario.executed");

      Map<String, Object> completed = new LinkedHashMap<>();
      completed.put("warning_total", result.warnings().totalWarnings());
      completed.put("quality_flags", result.qualityFlags().stream().map(QualityFlag::wireName).toList());
      progress.publishScenario(context, ProgressReporter.SCENARIO_COMPLETED, scenario.id(), index, completed);
      releaseStatus.running(
          context, ReleaseRunReason.RELEASE_RUN_SCENARIO_COMPLETED, ProgressReporter.SCENARIO_COMPLETED);
      log.info("Scenario {}/{} {} done: top={} surviving={} warnings={} eta={}",
          index, scenarios.size(), scenario.id(), result.metrics().topModel(),
          result.metrics().survivingModels(), result.warnings().totalWarnings(), context.timing().etaSec());
    }
    if (context.resumed()) {
      log.info("Resumed {} scenario(s) from checkpoint", context.resumedScenarios());
    }

    RobustnessSummary robustness = robustnessEvaluator.evaluate(results, policy.warningPolicy());
    ReadinessVerdict readiness = ReleaseReadinessGate.evaluate(new ReadinessEvidence(
        request.mode(),
        request.maxScenarios(),
        expected,
        results.size(),
        robustness.qualityGatePassed(),
        robustness.robustnessConclusive(),
        datasetPolicy.pass(),
        robustness.warningPolicyPass()));
    RunSummary summary = new RunSummary(
        runId,
        clock.now(),
        policy.policyVersion(),
        request.mode(),
        request.mode() == SweepMode.RELEASE ? ArtifactClass.RELEASE_CANDIDATE : ArtifactClass.LATEST_SNAPSHOT,
        dataset,
        datasetPolicy,
        robustness,
        request.maxScenarios(),
        expected,
        results.size(),
        context.resumedScenarios(),
        readiness);
    EvidenceLocations locations = evidence.writeRunSummary(summary, results);
    context.finish();

    Map<String, Object> gates = new LinkedHashMap<>();
    gates.put("release_evidence_ready", summary.releaseEvidenceReady());
    gates.put("robustness_decision", robustness.decision().name());
    gates.put("quality_gate_passed", robustness.qualityGatePassed());
    gates.put("dataset_policy_pass", datasetPolicy.pass());
    gates.put("warning_policy_pass", robustness.warningPolicyPass());
    Map<String, Object> finished = new LinkedHashMap<>();
    finished.put("resumed_scenarios", context.resumedScenarios());
    finished.put("summary", gates);
    progress.publish(context, ProgressReporter.RUN_COMPLETED, finished);

    Map<String, Object> details = new LinkedHashMap<>();
    details.put("release_evidence_ready", summary.releaseEvidenceReady());
    details.put("robustness_decision", robustness.decision().name());
    details.put("quality_gate_passed", robustness.qualityGatePassed());
    releaseStatus.completed(context, details);
    checkpoint.markCompleted(new CheckpointSummary(
        summary.releaseEvidenceReady(), robustness.decision(), robustness.qualityGatePassed()));

    log.info("Sweep finished: decision={} ready={} failures={} artifact={}",
        robustness.decision(), summary.releaseEvidenceReady(), readiness.tokens(), locations.latest());
    return new SweepOutcome(summary, results, locations, executed, context.resumedScenarios());
  }

  private ScenarioResult executeScenario(
      SweepContext context,
      CheckpointStore checkpoint,
      ScenarioSpec scenario,
      int index,
      DatasetProfile dataset,
      ReleaseEvidencePolicy policy) throws ScenarioExecutionException {
    String previousScenario = MDC.get(MDC_SCENARIO_ID);
    try {
      MDC.put(MDC_SCENARIO_ID, scenario.id());
      return executor.execute(scenario, dataset, policy.warningPolicy(),
          event -> onScenarioEvent(context, index, event));
    } catch (Exception ex) {
      if (ex instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      metrics.increment("sweep.scenario.failed");
      log.error("Scenario {} ({}/{}) failed", scenario.id(), index, context.scenarioTotal(), ex);
      recordFailure(context, checkpoint, scenario.id(), index, ex);
      throw new ScenarioExecutionException(scenario.id(), index, ex);
    } finally {
      restore(MDC_SCENARIO_ID, previousScenario);
    }
  }

  private void recordFailure(
      SweepContext context, CheckpointStore checkpoint, String scenarioId, int index, Exception failure) {
    String errorType = failure.getClass().getSimpleName();
    String errorMessage = failure.getMessage() == null ? "" : failure.getMessage();
    try {
      checkpoint.markFailed(scenarioId, index, failure);
      Map<String, Object> attributes = new LinkedHashMap<>();
      attributes.put("error_type", errorType);
      attributes.put("error_message", errorMessage);
      progress.publishScenario(context, ProgressReporter.RUN_FAILED, scenarioId, index, attributes);
      releaseStatus.failed(context, errorType, errorMessage);
    } catch (IOException | RuntimeException recordEx) {
      log.error("Could not record failure of scenario {}", scenarioId, recordEx);
      failure.addSuppressed(recordEx);
    }
  }

  private void onScenarioEvent(SweepContext context, int index, ProgressEvent event) {
    try {
      progress.publishScenario(context, event.stage(), event.scenarioId(), index, event.attributes());
      releaseStatus.running(context, ReleaseRunReason.RELEASE_RUN_SCENARIO_IN_PROGRESS, event.stage());
    } catch (IOException ex) {
      throw new UncheckedIOException("Unable to publish " + event.stage() + " for " + event.scenarioId(), ex);
    }
  }

  private static List<ScenarioSpec> applyCap(List<ScenarioSpec> all, OptionalInt maxScenarios) {
    if (maxScenarios.isEmpty()) {
      return all;
    }
    return all.subList(0, Math.min(maxScenarios.getAsInt(), all.size()));
  }

  private static Integer boxed(OptionalInt value) {
    return value.isPresent() ? value.getAsInt() : null;
  }

  private static void restore(String key, String previous) {
    if (previous == null) {
      MDC.remove(key);
    } else {
      MDC.put(key, previous);
    }
  }
}
