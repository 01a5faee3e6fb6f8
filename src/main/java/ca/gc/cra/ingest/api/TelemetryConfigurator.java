package ca.gc.cra.ingest.api;

import ca.gc.cra.ingest.validation.Strings;
import ca.gc.cra.ingest.validation.Urls;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves telemetry keys out of the effective configuration into the {@code otel.*} system properties read by the
 * OpenTelemetry bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Applies and removes {@code metricsExporter}, {@code otelEndpoint}, and {@code otelResourceAttributes}.
   *
   * @param args mutable configuration map
   * @return normalized exporter name, {@code none} when unset
   * @throws IllegalArgumentException for an unknown exporter or a malformed endpoint
   */
  static String configureMetrics(Map<String, String> args) {
    String exporter = blankToNull(args.remove("metricsExporter"));
    String normalized = exporter == null ? "none" : exporter.toLowerCase(Locale.ROOT);
    if (!normalized.equals("otlp") && !normalized.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    System.setProperty("otel.metrics.exporter", normalized);
    log.debug("Metrics exporter: {}", normalized);

    String endpoint = blankToNull(args.remove("otelEndpoint"));
    if (endpoint != null) {
      Urls.requireHttp("otelEndpoint", endpoint);
      System.setProperty("otel.exporter.otlp.endpoint", endpoint);
      log.debug("OTLP endpoint: {}", endpoint);
    }

    String resourceAttributes = blankToNull(args.remove("otelResourceAttributes"));
    if (resourceAttributes != null) {
      Strings.requirePrintableAscii("otelResourceAttributes", resourceAttributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      System.setProperty("otel.resource.attributes", resourceAttributes);
    }
    return normalized;
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
