package ca.gc.cra.ingest.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ConfigCliUtilsTest {

  @AfterEach
  void clearTelemetryProperties() {
    System.clearProperty("otel.metrics.exporter");
    System.clearProperty("otel.exporter.otlp.endpoint");
    System.clearProperty("otel.resource.attributes");
  }

  @Test
  void extractConfigPathRemovesKey() {
    Map<String, String> args = new HashMap<>(Map.of("config", " ingest.yaml ", "pageSize", "5"));

    assertEquals("ingest.yaml", ConfigCliUtils.extractConfigPath(args));
    assertFalse(args.containsKey("config"));
    assertNull(ConfigCliUtils.extractConfigPath(new HashMap<>()));
  }

  @Test
  void parseBooleanOnlyAcceptsTrue() {
    assertTrue(ConfigCliUtils.parseBoolean(Map.of("dryRun", " TRUE "), "dryRun"));
    assertFalse(ConfigCliUtils.parseBoolean(Map.of("dryRun", "yes"), "dryRun"));
    assertFalse(ConfigCliUtils.parseBoolean(null, "dryRun"));
  }

  @Test
  void redactedLinesAreSortedAlignedAndMasked() {
    Map<String, String> effective = new HashMap<>();
    effective.put("token", "abc");
    effective.put("baseUrl", "https://h.test");
    effective.put("awsSecretAccessKey", "");

    List<String> lines = ConfigCliUtils.redactedLines(effective);

    assertEquals(List.of(
        " awsSecretAccessKey : <unset>",
        " baseUrl            : https://h.test",
        " token              : [REDACTED]"), lines);
  }

  @Test
  void telemetryDefaultsToNone() {
    Map<String, String> args = new HashMap<>(Map.of("metricsExporter", "", "pageSize", "5"));

    assertEquals("none", TelemetryConfigurator.configureMetrics(args));
    assertEquals("none", System.getProperty("otel.metrics.exporter"));
    assertFalse(args.containsKey("metricsExporter"));
  }

  @Test
  void telemetryPublishesOtlpSettings() {
    Map<String, String> args = new HashMap<>(Map.of(
        "metricsExporter", "OTLP",
        "otelEndpoint", "http://collector:4317",
        "otelResourceAttributes", "deployment.environment=test"));

    assertEquals("otlp", TelemetryConfigurator.configureMetrics(args));
    assertEquals("http://collector:4317", System.getProperty("otel.exporter.otlp.endpoint"));
    assertEquals("deployment.environment=test", System.getProperty("otel.resource.attributes"));
    assertTrue(args.isEmpty());
  }
}
