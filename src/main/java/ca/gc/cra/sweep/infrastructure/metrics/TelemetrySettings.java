package ca.gc.cra.sweep.infrastructure.metrics;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Exporter selection and resource metadata for the OpenTelemetry meter provider.
 *
 * <p>Blank values fall back to the {@code otel.*} system properties and then to the standard
 * {@code OTEL_*} environment variables, so a sweep launched from a managed scheduler picks up the
 * collector configured for the host.</p>
 *
 * @param exporter {@code otlp} or {@code none}
 * @param endpoint OTLP gRPC endpoint
 * @param resourceAttributes extra {@code key=value} pairs separated by commas; may be empty
 * @param exportInterval periodic reader interval
 * @since 0.1.0
 */
public record TelemetrySettings(
    String exporter, String endpoint, String resourceAttributes, Duration exportInterval) {

  static final String DEFAULT_EXPORTER = "otlp";
  static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);

  public TelemetrySettings {
    exporter = normalize(exporter);
    if (!exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    Objects.requireNonNull(endpoint, "endpoint");
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes.trim();
    Objects.requireNonNull(exportInterval, "exportInterval");
    if (exportInterval.isZero() || exportInterval.isNegative()) {
      throw new IllegalArgumentException("exportInterval must be positive");
    }
  }

  /**
   * Resolves settings, preferring explicit values over system properties and the environment.
   *
   * @param exporter explicit exporter or {@code null}
   * @param endpoint explicit endpoint or {@code null}
   * @param resourceAttributes explicit resource attributes or {@code null}
   * @return resolved settings
   */
  public static TelemetrySettings resolve(String exporter, String endpoint, String resourceAttributes) {
    return new TelemetrySettings(
        firstNonBlank(exporter, System.getProperty("otel.metrics.exporter"),
            System.getenv("OTEL_METRICS_EXPORTER"), DEFAULT_EXPORTER),
        firstNonBlank(endpoint, System.getProperty("otel.exporter.otlp.endpoint"),
            System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT"), DEFAULT_ENDPOINT),
        firstNonBlank(resourceAttributes, System.getProperty("otel.resource.attributes"),
            System.getenv("OTEL_RESOURCE_ATTRIBUTES"), ""),
        DEFAULT_INTERVAL);
  }

  /**
   * Returns settings that resolve entirely from system properties and the environment.
   *
   * @return resolved settings
   */
  public static TelemetrySettings fromEnvironment() {
    return resolve(null, null, null);
  }

  /**
   * Reports whether metrics export is disabled.
   *
   * @return {@code true} when the exporter is {@code none}
   */
  public boolean disabled() {
    return exporter.equals("none");
  }

  private static String normalize(String raw) {
    if (raw == null || raw.isBlank()) {
      return DEFAULT_EXPORTER;
    }
    return raw.trim().toLowerCase(Locale.ROOT);
  }

  private static String firstNonBlank(String... candidates) {
    for (String candidate : candidates) {
      if (candidate != null && !candidate.isBlank()) {
        return candidate.trim();
      }
    }
    return "";
  }
}
