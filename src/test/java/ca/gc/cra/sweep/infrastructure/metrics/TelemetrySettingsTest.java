package ca.gc.cra.sweep.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TelemetrySettingsTest {
  private final String previousExporter = System.getProperty("otel.metrics.exporter");

  @AfterEach
  void resetProperties() {
    if (previousExporter == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", previousExporter);
    }
  }

  @Test
  void explicitValuesWinOverSystemProperties() {
    System.setProperty("otel.metrics.exporter", "otlp");

    TelemetrySettings settings = TelemetrySettings.resolve(" NONE ", "http://collector:4317", "team=sweep");

    assertTrue(settings.disabled());
    assertEquals("http://collector:4317", settings.endpoint());
    assertEquals("team=sweep", settings.resourceAttributes());
  }

  @Test
  void systemPropertySelectsExporterWhenNoFlagGiven() {
    System.setProperty("otel.metrics.exporter", "none");

    assertTrue(TelemetrySettings.resolve(null, null, null).disabled());
  }

  @Test
  void rejectsUnknownExporterAndNonPositiveInterval() {
    assertThrows(IllegalArgumentException.class,
        () -> new TelemetrySettings("prometheus", "http://localhost:4317", "", Duration.ofSeconds(30)));
    assertThrows(IllegalArgumentException.class,
        () -> new TelemetrySettings("otlp", "http://localhost:4317", "", Duration.ZERO));
  }

  @Test
  void disabledSettingsBootstrapANoopProvider() {
    TelemetrySettings settings = new TelemetrySettings("none", "http://localhost:4317", null, Duration.ofSeconds(5));

    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize(settings);

    assertEquals("", settings.resourceAttributes());
    assertTrue(result.isNoop(), "Expected noop metrics bootstrap when exporter=none");
    result.close();
  }

  @Test
  void resourceAttributesSkipMalformedEntries() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes("env=ci, bogus, =x, region = ca ");

    assertEquals(2, attributes.size());
    assertEquals("ci", attributes.get(AttributeKey.stringKey("env")));
    assertEquals("ca", attributes.get(AttributeKey.stringKey("region")));
  }
}
