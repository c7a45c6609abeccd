package ca.gc.cra.sweep.infrastructure.persistence;

import ca.gc.cra.sweep.domain.run.SweepMode;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * File names of every sweep artifact under one output directory.
 *
 * <p>Release runs write their summary and diagnostics to {@code _release} variants so an iterative run never
 * overwrites release evidence. Progress and checkpoint paths are shared by all modes; the checkpoint
 * signature carries the mode.</p>
 *
 * @param outDir directory that receives every artifact
 * @since 0.1.0
 */
public record ArtifactLayout(Path outDir) {
  public ArtifactLayout {
    Objects.requireNonNull(outDir, "outDir");
  }

  public Path summary(SweepMode mode) {
    return outDir.resolve(mode == SweepMode.RELEASE ? "sensitivity_sweep_release.json" : "sensitivity_sweep.json");
  }

  public Path diagnostics(SweepMode mode) {
    return outDir.resolve(mode == SweepMode.RELEASE
        ? "sensitivity_quality_diagnostics_release.json"
        : "sensitivity_quality_diagnostics.json");
  }

  public Path progress() {
    return outDir.resolve("sensitivity_progress.json");
  }

  public Path checkpoint() {
    return outDir.resolve("sensitivity_checkpoint.json");
  }

  public Path preflight() {
    return outDir.resolve("sensitivity_release_preflight.json");
  }

  public Path releaseRunStatus() {
    return outDir.resolve("sensitivity_release_run_status.json");
  }

  /**
   * Returns the release evidence targets advertised in preflight and run-status documents.
   *
   * @return target paths keyed by document field
   */
  Map<String, Object> releaseTargets() {
    Map<String, Object> targets = new LinkedHashMap<>();
    targets.put("release_status_path", summary(SweepMode.RELEASE).toString());
    targets.put("release_diagnostics_path", diagnostics(SweepMode.RELEASE).toString());
    return targets;
  }

  /**
   * Returns the files that change while a run is in flight.
   *
   * @return runtime paths keyed by document field
   */
  Map<String, Object> runtimePaths() {
    Map<String, Object> paths = new LinkedHashMap<>();
    paths.put("progress_path", progress().toString());
    paths.put("checkpoint_path", checkpoint().toString());
    return paths;
  }
}
