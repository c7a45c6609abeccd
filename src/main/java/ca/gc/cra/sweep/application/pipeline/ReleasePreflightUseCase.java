package ca.gc.cra.sweep.application.pipeline;

import ca.gc.cra.sweep.application.port.ClockPort;
import ca.gc.cra.sweep.application.port.DatasetProfilePort;
import ca.gc.cra.sweep.application.port.EvidencePort;
import ca.gc.cra.sweep.application.port.MetricsPort;
import ca.gc.cra.sweep.application.port.ProgressPort;
import ca.gc.cra.sweep.application.progress.ProgressReporter;
import ca.gc.cra.sweep.application.sweep.DatasetPolicyEvaluator;
import ca.gc.cra.sweep.application.sweep.ScenarioMatrixBuilder;
import ca.gc.cra.sweep.domain.dataset.DatasetException;
import ca.gc.cra.sweep.domain.dataset.DatasetPolicyEvaluation;
import ca.gc.cra.sweep.domain.dataset.DatasetProfile;
import ca.gc.cra.sweep.domain.preflight.PreflightReason;
import ca.gc.cra.sweep.domain.preflight.PreflightReport;
import ca.gc.cra.sweep.domain.preflight.PreflightStatus;
import ca.gc.cra.sweep.domain.run.SweepMode;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Validates release preconditions without executing any scenario.
 * <p><strong>Why:</strong> A release sweep takes hours; dataset and policy problems should block it before the
 * first scenario, with the reason on disk.</p>
 * <p><strong>Role:</strong> Application-layer use case behind {@code --preflight-only}.</p>
 * <p><strong>Observability:</strong> Increments {@code sweep.preflight.blocked}; writes a progress snapshot with
 * stage {@code preflight_completed} or {@code preflight_blocked}.</p>
 *
 * @since 0.1.0
 */
public final class ReleasePreflightUseCase {
  private static final Logger log = LoggerFactory.getLogger(ReleasePreflightUseCase.class);

  private final DatasetProfilePort datasets;
  private final EvidencePort evidence;
  private final ProgressReporter progress;
  private final ScenarioMatrixBuilder matrixBuilder = new ScenarioMatrixBuilder();
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final Supplier<String> runIds;

  public ReleasePreflightUseCase(
      DatasetProfilePort datasets,
      EvidencePort evidence,
      ProgressPort progressPort,
      ClockPort clock,
      MetricsPort metrics) {
    this(datasets, evidence, progressPort, clock, metrics, () -> UUID.randomUUID().toString());
  }

  ReleasePreflightUseCase(
      DatasetProfilePort datasets,
      EvidencePort evidence,
      ProgressPort progressPort,
      ClockPort clock,
      MetricsPort metrics,
      Supplier<String> runIds) {
    this.datasets = Objects.requireNonNull(datasets, "datasets");
    this.evidence = Objects.requireNonNull(evidence, "evidence");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.runIds = Objects.requireNonNull(runIds, "runIds");
    this.progress = new ProgressReporter(Objects.requireNonNull(progressPort, "progressPort"), clock);
  }

  /**
   * Runs the preflight and writes its report. A dataset error becomes a BLOCKED report instead of an
   * exception.
   *
   * @param request normalized run inputs
   * @return preflight report as written
   * @throws IOException if the report or progress snapshot cannot be written
   */
  public PreflightReport run(SweepRequest request) throws IOException {
    Objects.requireNonNull(request, "request");
    String runId = runIds.get();
    String policyVersion = request.policy().policyVersion();

    DatasetProfile dataset;
    try {
      dataset = datasets.load(request.datasetId());
    } catch (DatasetException ex) {
      String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
      PreflightReport blocked = new PreflightReport(
          clock.now(),
          runId,
          PreflightStatus.BLOCKED,
          List.of(PreflightReason.DATASET_PROFILE_UNAVAILABLE),
          request.mode(),
          request.datasetId(),
          Optional.empty(),
          new DatasetPolicyEvaluation(false, List.of(message), request.policy().datasetPolicy()),
          policyVersion,
          0,
          request.maxScenarios());
      evidence.writePreflight(blocked);
      Map<String, Object> attributes = new LinkedHashMap<>();
      attributes.put("preflight_status", blocked.status().name());
      attributes.put("reason_codes", reasonNames(blocked.reasons()));
      attributes.put("error_message", message);
      progress.publishPreflight(ProgressReporter.PREFLIGHT_BLOCKED, request.datasetId(), request.mode(), attributes);
      metrics.increment("sweep.preflight.blocked");
      log.error("Release preflight blocked: {}", message);
      return blocked;
    }

    DatasetPolicyEvaluation datasetPolicy =
        DatasetPolicyEvaluator.evaluate(dataset, request.policy().datasetPolicy());
    int expected = matrixBuilder.build(request.baseConfig()).size();
    List<PreflightReason> reasons = new ArrayList<>();
    if (request.mode() != SweepMode.RELEASE) {
      reasons.add(PreflightReason.MODE_NOT_RELEASE);
    }
    if (request.maxScenarios().isPresent()) {
      reasons.add(PreflightReason.MAX_SCENARIOS_OVERRIDE_PRESENT);
    }
    if (!datasetPolicy.pass()) {
      reasons.add(PreflightReason.DATASET_POLICY_FAILED);
    }
    PreflightStatus status = reasons.isEmpty() ? PreflightStatus.PREFLIGHT_OK : PreflightStatus.BLOCKED;
    PreflightReport report = new PreflightReport(
        clock.now(),
        runId,
        status,
        reasons,
        request.mode(),
        request.datasetId(),
        Optional.of(dataset),
        datasetPolicy,
        policyVersion,
        expected,
        request.maxScenarios());
    evidence.writePreflight(report);

    Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("preflight_status", status.name());
    attributes.put("reason_codes", reasonNames(reasons));
    attributes.put("scenario_total", request.maxScenarios().isPresent()
        ? Math.min(request.maxScenarios().getAsInt(), expected) : expected);
    attributes.put("max_scenarios", request.maxScenarios().isPresent() ? request.maxScenarios().getAsInt() : null);
    progress.publishPreflight(ProgressReporter.PREFLIGHT_COMPLETED, request.datasetId(), request.mode(), attributes);

    if (report.passed()) {
      log.info("Release preflight passed (dataset={}, scenarios={})", request.datasetId(), expected);
    } else {
      metrics.increment("sweep.preflight.blocked");
      log.error("Release preflight blocked: reason_codes={} dataset_policy_reasons={}",
          reasonNames(reasons), datasetPolicy.reasons());
    }
    return report;
  }

  private static List<String> reasonNames(List<PreflightReason> reasons) {
    return reasons.stream().map(PreflightReason::name).toList();
  }
}
