package ca.gc.cra.sweep.application.port;

import ca.gc.cra.sweep.domain.run.ProgressEvent;

/**
 * Callback receiving executor progress events. Heartbeat events arrive on the heartbeat thread.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ProgressListener {
  /**
   * Handles one event.
   *
   * @param event progress event
   */
  void onEvent(ProgressEvent event);

  /** Listener that ignores every event. */
  ProgressListener NONE = event -> {};
}
