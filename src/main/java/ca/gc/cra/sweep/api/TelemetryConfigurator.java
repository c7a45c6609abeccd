package ca.gc.cra.sweep.api;

import ca.gc.cra.sweep.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.sweep.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts and validates telemetry settings from the effective configuration map.
 *
 * <p>The telemetry keys are removed from the map so the remaining entries bind cleanly to the command's
 * configuration record. Blank values fall back to {@code otel.*} system properties and {@code OTEL_*}
 * environment variables.</p>
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Removes {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes} from
   * {@code args} and resolves them.
   *
   * @param args mutable effective configuration
   * @return resolved telemetry settings
   * @throws IllegalArgumentException if a supplied value is invalid
   */
  static TelemetrySettings configureMetrics(Map<String, String> args) {
    String exporter = trimToNull(args.remove("metricsExporter"));
    if (exporter != null) {
      exporter = exporter.toLowerCase(Locale.ROOT);
      if (!exporter.equals("otlp") && !exporter.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
      log.debug("Configuring OpenTelemetry metrics exporter: {}", exporter);
    }

    String endpoint = trimToNull(args.remove("otelEndpoint"));
    if (endpoint != null) {
      validateEndpoint(endpoint);
      log.debug("Configuring OTLP endpoint: {}", endpoint);
    }

    String resourceAttributes = trimToNull(args.remove("otelResourceAttributes"));
    if (resourceAttributes != null) {
      Strings.requirePrintableAscii("otelResourceAttributes", resourceAttributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      log.debug("Configuring OTEL resource attributes override");
    }
    return TelemetrySettings.resolve(exporter, endpoint, resourceAttributes);
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }

  private static String trimToNull(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return value.trim();
  }
}
