package ca.gc.cra.sweep.infrastructure.metrics;

import ca.gc.cra.sweep.application.port.MetricsPort;

/**
 * Metrics adapter selected by {@code metricsExporter=none}; scenario counters and latencies are dropped.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort, AutoCloseable {
  public static final NoOpMetricsAdapter INSTANCE = new NoOpMetricsAdapter();

  private NoOpMetricsAdapter() {}

  @Override
  public void increment(String key) {
    // discarded
  }

  @Override
  public void observe(String key, long value) {
    // discarded
  }

  @Override
  public void close() {
    // no exporter to flush
  }
}
