package ca.gc.cra.sweep.infrastructure.persistence.json;

import ca.gc.cra.sweep.domain.checkpoint.CheckpointFailure;
import ca.gc.cra.sweep.domain.checkpoint.CheckpointSignature;
import ca.gc.cra.sweep.domain.checkpoint.CheckpointState;
import ca.gc.cra.sweep.domain.checkpoint.CheckpointStatus;
import ca.gc.cra.sweep.domain.checkpoint.CheckpointSummary;
import ca.gc.cra.sweep.domain.checkpoint.CompletedScenario;
import ca.gc.cra.sweep.domain.dataset.DatasetPolicyEvaluation;
import ca.gc.cra.sweep.domain.dataset.DatasetProfile;
import ca.gc.cra.sweep.domain.policy.DatasetPolicy;
import ca.gc.cra.sweep.domain.policy.ReleaseEvidencePolicy;
import ca.gc.cra.sweep.domain.policy.WarningPolicy;
import ca.gc.cra.sweep.domain.preflight.PreflightReason;
import ca.gc.cra.sweep.domain.preflight.PreflightReport;
import ca.gc.cra.sweep.domain.result.QualityFlag;
import ca.gc.cra.sweep.domain.result.ScenarioMetrics;
import ca.gc.cra.sweep.domain.result.ScenarioResult;
import ca.gc.cra.sweep.domain.result.WarningCategory;
import ca.gc.cra.sweep.domain.result.WarningSummary;
import ca.gc.cra.sweep.domain.robustness.ReadinessEvidence;
import ca.gc.cra.sweep.domain.robustness.RobustnessDecision;
import ca.gc.cra.sweep.domain.robustness.RobustnessSummary;
import ca.gc.cra.sweep.domain.robustness.RunSummary;
import ca.gc.cra.sweep.domain.run.ProgressSnapshot;
import ca.gc.cra.sweep.domain.run.ProgressTiming;
import ca.gc.cra.sweep.domain.run.ReleaseRunReason;
import ca.gc.cra.sweep.domain.run.ReleaseRunStatus;
import ca.gc.cra.sweep.domain.run.SweepMode;
import ca.gc.cra.sweep.domain.scenario.ScenarioFamily;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;

/**
 * <strong>What:</strong> Maps domain records to and from the snake_case JSON trees persisted on disk.
 * <p><strong>Why:</strong> The artifact layout is read by release tooling outside this process, so field names
 * and envelope keys ({@code schema_version}, {@code generated_utc}, {@code generated_by}) are fixed here in one
 * place.</p>
 * <p><strong>Role:</strong> Infrastructure helper behind the file adapters and the readiness audit.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class SweepDocuments {
  /** Schema version stamped on every document. */
  public static final String SCHEMA_VERSION = "2026-02-10";
  /** Producer identifier stamped on every document. */
  public static final String GENERATED_BY = "ca.gc.cra.sweep";

  private SweepDocuments() {
    // Utility
  }

  /**
   * Formats an instant as second-precision UTC ISO-8601, e.g. {@code 2026-02-10T08:15:00Z}.
   *
   * @param instant instant to format
   * @return formatted timestamp
   */
  public static String utc(Instant instant) {
    return instant.truncatedTo(ChronoUnit.SECONDS).toString();
  }


  public static Map<String, Object> resultRow(ScenarioResult result) {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("id", result.id());
    row.put("family", result.family().wireName());
    ScenarioMetrics metrics = result.metrics();
    row.put("top_model", metrics.topModel());
    row.put("top_score", metrics.topScore());
    row.put("surviving_models", metrics.survivingModels());
    row.put("falsified_models", metrics.falsifiedModels());
    row.put("anomaly_confirmed", metrics.anomalyConfirmed());
    row.put("anomaly_stable", metrics.anomalyStable());
    row.put("warnings", warnings(result.warnings()));
    row.put("quality_flags", flagNames(result.qualityFlags()));
    row.put("valid", result.valid());
    return row;
  }

  public static ScenarioResult resultFromRow(Map<String, Object> row) {
    ScenarioMetrics metrics = metricsFrom(row);
    Set<QualityFlag> flags = EnumSet.noneOf(QualityFlag.class);
    for (Object name : requireList(row, "quality_flags")) {
      flags.add(QualityFlag.fromWireName(String.valueOf(name)));
    }
    return new ScenarioResult(
        requireString(row, "id"),
        ScenarioFamily.fromWireName(requireString(row, "family")),
        metrics,
        warningsFrom(requireMap(row, "warnings")),
        flags);
  }

  /**
   * Reads evaluator metrics from a cross-model report document.
   *
   * @param doc report document with {@code top_model}, {@code top_score}, model counts and anomaly flags
   * @return metrics
   * @throws IllegalArgumentException if a field is missing or malformed
   */
  public static ScenarioMetrics metricsFrom(Map<String, Object> doc) {
    return new ScenarioMetrics(
        requireString(doc, "top_model"),
        requireDouble(doc, "top_score"),
        requireInt(doc, "surviving_models"),
        requireInt(doc, "falsified_models"),
        requireBoolean(doc, "anomaly_confirmed"),
        requireBoolean(doc, "anomaly_stable"));
  }

  static Map<String, Object> warnings(WarningSummary summary) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("total_warnings", summary.totalWarnings());
    for (WarningCategory category : WarningCategory.values()) {
      out.put(category.wireName() + "_warnings", summary.count(category));
    }
    out.put("fallback_related_warnings", summary.fallbackRelatedWarnings());
    out.put("fallback_warning_ratio", summary.fallbackWarningRatio());
    out.put("sample_messages", summary.sampleMessages());
    return out;
  }

  static WarningSummary warningsFrom(Map<String, Object> doc) {
    Map<WarningCategory, Integer> counts = new EnumMap<>(WarningCategory.class);
    for (WarningCategory category : WarningCategory.values()) {
      counts.put(category, optionalInt(doc, category.wireName() + "_warnings").orElse(0));
    }
    List<String> samples = new ArrayList<>();
    for (Object sample : optionalList(doc, "sample_messages")) {
      samples.add(String.valueOf(sample));
    }
    return new WarningSummary(
        requireInt(doc, "total_warnings"),
        counts,
        optionalInt(doc, "fallback_related_warnings").orElse(0),
        doc.get("fallback_warning_ratio") == null ? 0.0 : requireDouble(doc, "fallback_warning_ratio"),
        samples);
  }

  public static Map<String, Object> checkpoint(CheckpointState state, Instant generatedUtc) {
    Map<String, Object> doc = envelope(generatedUtc);
    doc.put("status", state.status().name());
    doc.put("signature", signature(state.signature()));
    doc.put("scenario_total", state.scenarioTotal());
    doc.put("completed_count", state.completedCount());
    doc.put("completed_scenario_ids", state.completedScenarioIds());
    List<Map<String, Object>> rows = new ArrayList<>();
    for (CompletedScenario completed : state.completedScenarios()) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("id", completed.id());
      entry.put("scenario_index", completed.index());
      entry.put("result", resultRow(completed.result()));
      rows.add(entry);
    }
    doc.put("completed_scenarios", rows);
    state.lastCompletedIndex().ifPresent(index -> doc.put("last_completed_index", index));
    state.failure().ifPresent(failure -> {
      Map<String, Object> block = new LinkedHashMap<>();
      block.put("timestamp", utc(failure.timestamp()));
      block.put("scenario_id", failure.scenarioId());
      block.put("scenario_index", failure.scenarioIndex());
      block.put("error_type", failure.errorType());
      block.put("error_message", failure.errorMessage());
      doc.put("failure", block);
    });
    state.summary().ifPresent(summary -> doc.put("summary", checkpointSummary(summary)));
    return doc;
  }

  /**
   * Restores a checkpoint document.
   *
   * @param doc parsed checkpoint document
   * @return restored state
   * @throws IllegalArgumentException if a required field is missing or malformed
   */
  public static CheckpointState checkpointFrom(Map<String, Object> doc) {
    Map<String, Object> sig = requireMap(doc, "signature");
    List<String> ids = new ArrayList<>();
    for (Object id : requireList(sig, "scenario_ids")) {
      ids.add(String.valueOf(id));
    }
    CheckpointSignature signature = new CheckpointSignature(
        requireString(sig, "dataset_id"),
        SweepMode.fromString(requireString(sig, "mode")),
        ids,
        requireString(sig, "policy_version"));

    List<CompletedScenario> rows = new ArrayList<>();
    for (Object raw : optionalList(doc, "completed_scenarios")) {
      Map<String, Object> entry = asMap(raw, "completed_scenarios[]");
      rows.add(new CompletedScenario(
          requireString(entry, "id"),
          optionalInt(entry, "scenario_index").orElse(0),
          resultFromRow(requireMap(entry, "result"))));
    }

    Optional<CheckpointFailure> failure = Optional.empty();
    if (doc.get("failure") instanceof Map) {
      Map<String, Object> block = requireMap(doc, "failure");
      failure = Optional.of(new CheckpointFailure(
          requireInstant(block, "timestamp"),
          requireString(block, "scenario_id"),
          optionalInt(block, "scenario_index").orElse(0),
          requireString(block, "error_type"),
          block.get("error_message") == null ? "" : String.valueOf(block.get("error_message"))));
    }

    Optional<CheckpointSummary> summary = Optional.empty();
    if (doc.get("summary") instanceof Map) {
      Map<String, Object> block = requireMap(doc, "summary");
      summary = Optional.of(new CheckpointSummary(
          requireBoolean(block, "release_evidence_ready"),
          RobustnessDecision.valueOf(requireString(block, "robustness_decision")),
          requireBoolean(block, "quality_gate_passed")));
    }

    return CheckpointState.restore(
        signature,
        requireInt(doc, "scenario_total"),
        CheckpointStatus.valueOf(requireString(doc, "status")),
        rows,
        optionalInt(doc, "last_completed_index"),
        failure,
        summary);
  }

  static Map<String, Object> signature(CheckpointSignature signature) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("dataset_id", signature.datasetId());
    out.put("mode", signature.mode().wireName());
    out.put("scenario_ids", signature.scenarioIds());
    out.put("policy_version", signature.policyVersion());
    return out;
  }

  static Map<String, Object> checkpointSummary(CheckpointSummary summary) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("release_evidence_ready", summary.releaseEvidenceReady());
    out.put("robustness_decision", summary.robustnessDecision().name());
    out.put("quality_gate_passed", summary.qualityGatePassed());
    return out;
  }


  /**
   * Flattens a progress snapshot; event attributes are merged last and win on key collisions.
   *
   * @param snapshot snapshot to render
   * @return progress document
   */
  public static Map<String, Object> progress(ProgressSnapshot snapshot) {
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("schema_version", SCHEMA_VERSION);
    doc.put("timestamp", utc(snapshot.timestamp()));
    doc.put("stage", snapshot.stage());
    doc.put("dataset_id", snapshot.datasetId());
    doc.put("mode", snapshot.mode().wireName());
    snapshot.scenarioId().ifPresent(id -> doc.put("scenario_id", id));
    snapshot.scenarioIndex().ifPresent(index -> doc.put("scenario_index", index));
    snapshot.scenarioTotal().ifPresent(total -> doc.put("scenario_total", total));
    snapshot.timing().ifPresent(timing -> timing(doc, timing));
    doc.putAll(snapshot.attributes());
    return doc;
  }

  private static void timing(Map<String, Object> doc, ProgressTiming timing) {
    doc.put("elapsed_sec", timing.elapsedSec());
    doc.put("completed_scenarios", timing.completedScenarios());
    doc.put("remaining_scenarios", timing.remainingScenarios());
    doc.put("eta_sec", boxed(timing.etaSec()));
  }

  public static Map<String, Object> releaseRunStatus(ReleaseRunStatus status, Map<String, Object> extras) {
    Map<String, Object> doc = envelope(status.generatedUtc());
    doc.put("run_id", status.runId());
    doc.put("run_started_utc", utc(status.runStartedUtc()));
    doc.put("status", status.status().name());
    Set<String> codes = new TreeSet<>();
    for (ReleaseRunReason reason : status.reasonCodes()) {
      codes.add(reason.name());
    }
    doc.put("reason_codes", new ArrayList<>(codes));
    doc.put("mode", status.mode().wireName());
    doc.put("dataset_id", status.datasetId());
    doc.put("stage", status.stage());
    doc.put("max_scenarios", boxed(status.maxScenarios()));
    doc.put("scenario_total", status.scenarioTotal());
    doc.put("completed_scenarios", status.completedScenarios());
    doc.put("last_scenario_id", status.lastScenarioId().orElse(null));
    doc.put("preflight_status", status.preflightStatus());
    doc.put("elapsed_sec", status.elapsedSec());
    doc.put("eta_sec", boxed(status.etaSec()));
    doc.putAll(extras);
    if (!status.details().isEmpty()) {
      doc.put("details", status.details());
    }
    return doc;
  }


  public static Map<String, Object> preflight(PreflightReport report, Map<String, Object> extras) {
    Map<String, Object> doc = envelope(report.generatedUtc());
    doc.put("run_id", report.runId());
    doc.put("status", report.status().name());
    doc.put("reason_codes", report.reasons().stream().map(PreflightReason::name).toList());
    doc.put("mode", report.mode().wireName());
    doc.put("dataset_id", report.datasetId());
    doc.put("dataset_profile", report.datasetProfile()
        .map(SweepDocuments::datasetProfile)
        .orElseGet(() -> {
          Map<String, Object> partial = new LinkedHashMap<>();
          partial.put("dataset_id", report.datasetId());
          return partial;
        }));
    datasetPolicy(doc, report.datasetPolicy());
    doc.put("policy_version", report.policyVersion());
    doc.put("scenario_count_expected", report.scenarioCountExpected());
    doc.put("max_scenarios", boxed(report.maxScenarios()));
    doc.putAll(extras);
    return doc;
  }


  public static Map<String, Object> datasetProfile(DatasetProfile profile) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("dataset_id", profile.datasetId());
    out.put("pages", profile.pages());
    out.put("tokens", profile.tokens());
    return out;
  }

  static Map<String, Object> datasetConstraints(DatasetPolicy policy) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("allowed_dataset_ids", policy.allowedDatasetIds());
    out.put("min_pages", policy.minPages());
    out.put("min_tokens", policy.minTokens());
    return out;
  }

  private static void datasetPolicy(Map<String, Object> doc, DatasetPolicyEvaluation evaluation) {
    doc.put("dataset_policy_pass", evaluation.pass());
    doc.put("dataset_policy_reasons", evaluation.reasons());
    doc.put("dataset_policy_constraints", datasetConstraints(evaluation.constraints()));
  }

  static Map<String, Object> warningPolicy(WarningPolicy policy) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("max_total_warning_count", policy.maxTotalWarningCount());
    out.put("max_warning_density_per_scenario", policy.maxWarningDensityPerScenario());
    out.put("max_insufficient_data_scenarios", policy.maxInsufficientDataScenarios());
    out.put("max_sparse_data_scenarios", policy.maxSparseDataScenarios());
    out.put("max_nan_sanitized_scenarios", policy.maxNanSanitizedScenarios());
    out.put("max_fallback_heavy_scenarios", policy.maxFallbackHeavyScenarios());
    out.put("fallback_heavy_threshold_per_scenario", policy.fallbackHeavyThresholdPerScenario());
    out.put("max_fallback_warning_ratio_per_scenario", policy.maxFallbackWarningRatioPerScenario());
    return out;
  }

  static Map<String, Object> robustness(RobustnessSummary summary) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("total_scenarios", summary.totalScenarios());
    out.put("valid_scenarios", summary.validScenarios());
    out.put("valid_scenario_rate", summary.validScenarioRate());
    out.put("baseline_scenario_id", summary.baselineScenarioId().orElse(null));
    out.put("baseline_top_model", summary.baselineTopModel().orElse(null));
    out.put("baseline_anomaly_confirmed", summary.baselineAnomalyConfirmed().orElse(null));
    out.put("top_model_match_rate", summary.topModelMatchRate());
    out.put("anomaly_match_rate", summary.anomalyMatchRate());
    out.put("all_models_falsified_everywhere", summary.allModelsFalsifiedEverywhere());
    out.put("quality_gate_passed", summary.qualityGatePassed());
    out.put("robustness_conclusive", summary.robustnessConclusive());
    out.put("insufficient_data_scenarios", summary.insufficientDataScenarios());
    out.put("sparse_data_scenarios", summary.sparseDataScenarios());
    out.put("nan_sanitized_scenarios", summary.nanSanitizedScenarios());
    out.put("fallback_heavy_scenarios", summary.fallbackHeavyScenarios());
    out.put("fallback_ratio_exceeded_scenarios", summary.fallbackRatioExceededScenarios());
    out.put("total_warning_count", summary.totalWarningCount());
    out.put("warning_density_per_scenario", summary.warningDensityPerScenario());
    out.put("warning_policy_pass", summary.warningPolicyPass());
    out.put("warning_policy_limits", warningPolicy(summary.warningPolicyLimits()));
    out.put("robust", summary.robust());
    out.put("robustness_decision", summary.decision().name());
    out.put("caveats", summary.caveats());
    return out;
  }

  /**
   * Renders the {@code summary} block of a run summary document.
   *
   * @param summary run summary
   * @param paths artifact paths keyed by document field (e.g. {@code artifact_path})
   * @return summary block
   */
  public static Map<String, Object> runSummary(RunSummary summary, Map<String, String> paths) {
    Map<String, Object> doc = robustness(summary.robustness());
    String generated = utc(summary.generatedUtc());
    doc.put("date", generated);
    doc.put("generated_utc", generated);
    doc.put("generated_by", GENERATED_BY);
    doc.put("schema_version", SCHEMA_VERSION);
    doc.put("run_id", summary.runId());
    doc.put("policy_version", summary.policyVersion());
    doc.put("dataset_id", summary.datasetProfile().datasetId());
    doc.put("dataset_pages", summary.datasetProfile().pages());
    doc.put("dataset_tokens", summary.datasetProfile().tokens());
    datasetPolicy(doc, summary.datasetPolicy());
    doc.put("execution_mode", summary.mode().wireName());
    doc.put("artifact_class", summary.artifactClass().wireName());
    doc.put("max_scenarios", boxed(summary.maxScenarios()));
    doc.put("scenario_count_expected", summary.scenarioCountExpected());
    doc.put("scenario_count_executed", summary.scenarioCountExecuted());
    doc.put("resumed_scenarios", summary.resumedScenarios());
    doc.put("release_readiness_failures", summary.readiness().tokens());
    doc.put("release_evidence_ready", summary.releaseEvidenceReady());
    doc.putAll(paths);
    return doc;
  }

  /**
   * Renders the quality diagnostics document.
   *
   * @param summaryBlock rendered summary block from {@link #runSummary}
   * @param profile dataset profile
   * @param results result rows in execution order
   * @return diagnostics document
   */
  public static Map<String, Object> diagnostics(
      Map<String, Object> summaryBlock, DatasetProfile profile, List<ScenarioResult> results) {
    Map<String, Object> gates = new LinkedHashMap<>();
    for (String key : List.of(
        "schema_version",
        "policy_version",
        "generated_utc",
        "generated_by",
        "release_readiness_failures",
        "release_evidence_ready",
        "warning_policy_pass",
        "warning_density_per_scenario",
        "total_warning_count",
        "insufficient_data_scenarios",
        "sparse_data_scenarios",
        "nan_sanitized_scenarios",
        "fallback_heavy_scenarios",
        "fallback_ratio_exceeded_scenarios",
        "caveats")) {
      gates.put(key, summaryBlock.get(key));
    }
    List<Map<String, Object>> scenarios = new ArrayList<>();
    for (ScenarioResult result : results) {
      Map<String, Object> row = new LinkedHashMap<>();
      row.put("id", result.id());
      row.put("family", result.family().wireName());
      row.put("valid", result.valid());
      row.put("quality_flags", flagNames(result.qualityFlags()));
      row.put("warnings", warnings(result.warnings()));
      scenarios.add(row);
    }
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("generated_at", summaryBlock.get("date"));
    doc.put("dataset_profile", datasetProfile(profile));
    doc.put("summary", gates);
    doc.put("scenarios", scenarios);
    return doc;
  }

  /**
   * Extracts readiness inputs from a persisted run summary document.
   *
   * <p>Accepts either the full payload ({@code {"summary": ...}}), the snapshot wrapper
   * ({@code {"results": {"summary": ...}}}) or a bare summary block.</p>
   *
   * @param doc parsed document
   * @return readiness evidence
   * @throws IllegalArgumentException if a required field is missing or malformed
   */
  public static ReadinessEvidence readinessEvidence(Map<String, Object> doc) {
    Map<String, Object> summary = doc;
    if (summary.get("results") instanceof Map) {
      summary = requireMap(summary, "results");
    }
    if (summary.get("summary") instanceof Map) {
      summary = requireMap(summary, "summary");
    }
    return new ReadinessEvidence(
        SweepMode.fromString(requireString(summary, "execution_mode")),
        optionalInt(summary, "max_scenarios"),
        requireInt(summary, "scenario_count_expected"),
        requireInt(summary, "scenario_count_executed"),
        requireBoolean(summary, "quality_gate_passed"),
        requireBoolean(summary, "robustness_conclusive"),
        requireBoolean(summary, "dataset_policy_pass"),
        requireBoolean(summary, "warning_policy_pass"));
  }


  /**
   * Overlays a policy document on top of defaults; each section present overrides key by key.
   *
   * @param doc parsed policy document
   * @param defaults policy used for absent keys
   * @return effective policy
   * @throws IllegalArgumentException if a present value has the wrong type or violates a policy bound
   */
  public static ReleaseEvidencePolicy releaseEvidencePolicy(
      Map<String, Object> doc, ReleaseEvidencePolicy defaults) {
    String version = doc.get("policy_version") instanceof String s ? s : defaults.policyVersion();

    DatasetPolicy dataset = defaults.datasetPolicy();
    if (doc.get("dataset_policy") instanceof Map) {
      Map<String, Object> section = requireMap(doc, "dataset_policy");
      List<String> allowed = dataset.allowedDatasetIds();
      if (section.containsKey("allowed_dataset_ids")) {
        allowed = new ArrayList<>();
        for (Object id : requireList(section, "allowed_dataset_ids")) {
          allowed.add(String.valueOf(id));
        }
      }
      dataset = new DatasetPolicy(
          allowed,
          section.containsKey("min_pages") ? requireLong(section, "min_pages") : dataset.minPages(),
          section.containsKey("min_tokens") ? requireLong(section, "min_tokens") : dataset.minTokens());
    }

    WarningPolicy warning = defaults.warningPolicy();
    if (doc.get("warning_policy") instanceof Map) {
      Map<String, Object> s = requireMap(doc, "warning_policy");
      warning = new WarningPolicy(
          longOr(s, "max_total_warning_count", warning.maxTotalWarningCount()),
          doubleOr(s, "max_warning_density_per_scenario", warning.maxWarningDensityPerScenario()),
          longOr(s, "max_insufficient_data_scenarios", warning.maxInsufficientDataScenarios()),
          longOr(s, "max_sparse_data_scenarios", warning.maxSparseDataScenarios()),
          longOr(s, "max_nan_sanitized_scenarios", warning.maxNanSanitizedScenarios()),
          longOr(s, "max_fallback_heavy_scenarios", warning.maxFallbackHeavyScenarios()),
          (int) longOr(s, "fallback_heavy_threshold_per_scenario", warning.fallbackHeavyThresholdPerScenario()),
          doubleOr(s, "max_fallback_warning_ratio_per_scenario", warning.maxFallbackWarningRatioPerScenario()));
    }
    return new ReleaseEvidencePolicy(version, dataset, warning);
  }


  private static Map<String, Object> envelope(Instant generatedUtc) {
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("schema_version", SCHEMA_VERSION);
    doc.put("generated_utc", utc(generatedUtc));
    doc.put("generated_by", GENERATED_BY);
    return doc;
  }

  private static List<String> flagNames(Set<QualityFlag> flags) {
    return flags.stream().map(QualityFlag::wireName).toList();
  }

  private static Object boxed(OptionalInt value) {
    return value.isPresent() ? value.getAsInt() : null;
  }

  private static Object boxed(OptionalDouble value) {
    return value.isPresent() ? value.getAsDouble() : null;
  }

  private static long longOr(Map<String, Object> map, String key, long fallback) {
    return map.containsKey(key) ? requireLong(map, key) : fallback;
  }

  private static double doubleOr(Map<String, Object> map, String key, double fallback) {
    return map.containsKey(key) ? requireDouble(map, key) : fallback;
  }

  static String requireString(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (!(value instanceof String s)) {
      throw malformed(key, "string", value);
    }
    return s;
  }

  static boolean requireBoolean(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (!(value instanceof Boolean b)) {
      throw malformed(key, "boolean", value);
    }
    return b;
  }

  static long requireLong(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (!(value instanceof Number n) || n.doubleValue() != Math.rint(n.doubleValue())) {
      throw malformed(key, "integer", value);
    }
    return n.longValue();
  }

  static int requireInt(Map<String, Object> map, String key) {
    long value = requireLong(map, key);
    if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
      throw malformed(key, "32-bit integer", value);
    }
    return (int) value;
  }

  static OptionalInt optionalInt(Map<String, Object> map, String key) {
    return map.get(key) == null ? OptionalInt.empty() : OptionalInt.of(requireInt(map, key));
  }

  static double requireDouble(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (!(value instanceof Number n)) {
      throw malformed(key, "number", value);
    }
    return n.doubleValue();
  }

  static Instant requireInstant(Map<String, Object> map, String key) {
    String text = requireString(map, key);
    try {
      return Instant.parse(text);
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException("Field '" + key + "' must be an ISO-8601 instant but found " + text, ex);
    }
  }

  static Map<String, Object> requireMap(Map<String, Object> map, String key) {
    return asMap(map.get(key), key);
  }

  private static Map<String, Object> asMap(Object value, String key) {
    if (!(value instanceof Map<?, ?> raw)) {
      throw malformed(key, "object", value);
    }
    Map<String, Object> map = new LinkedHashMap<>();
    raw.forEach((k, v) -> map.put(String.valueOf(k), v));
    return map;
  }

  static List<?> requireList(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (!(value instanceof List<?> list)) {
      throw malformed(key, "array", value);
    }
    return list;
  }

  private static List<?> optionalList(Map<String, Object> map, String key) {
    return map.get(key) == null ? List.of() : requireList(map, key);
  }

  private static IllegalArgumentException malformed(String key, String expected, Object actual) {
    String found = actual == null ? "nothing" : actual.getClass().getSimpleName().toLowerCase(Locale.ROOT);
    return new IllegalArgumentException("Field '" + key + "' must be a " + expected + " but found " + found);
  }
}
