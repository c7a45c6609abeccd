package ca.gc.cra.sweep.domain.run;

/**
 * Coarse release-run status polled by external gates.
 * <p>Transitions: {@code STARTED -> RUNNING -> {COMPLETED, FAILED}}; {@code RUNNING} is re-entered on every
 * dispatch, resume, in-scenario progress event, and completion.</p>
 *
 * @since 0.1.0
 */
public enum ReleaseRunState {
  STARTED,
  RUNNING,
  COMPLETED,
  FAILED
}
