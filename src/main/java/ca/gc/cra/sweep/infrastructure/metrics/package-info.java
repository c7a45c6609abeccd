/**
 * <strong>Purpose:</strong> Metrics adapters for {@link ca.gc.cra.sweep.application.port.MetricsPort}.
 * <p><strong>Observability:</strong> OpenTelemetry SDK with the OTLP gRPC exporter; a noop adapter when export is
 * disabled.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.sweep.infrastructure.metrics;
