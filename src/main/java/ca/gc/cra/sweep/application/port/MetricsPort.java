package ca.gc.cra.sweep.application.port;

/**
 * <strong>What:</strong> Port abstracting sweep metrics emission.
 * <p><strong>Why:</strong> Lets the orchestrator count executed, resumed, and failed scenarios without binding
 * to a vendor SDK.</p>
 * <p><strong>Role:</strong> Domain port implemented by {@code OpenTelemetryMetricsAdapter} and
 * {@code NoOpMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept updates from the heartbeat thread as well as
 * the orchestrator thread.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code sweep.scenario.executed}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value in caller-defined units
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
