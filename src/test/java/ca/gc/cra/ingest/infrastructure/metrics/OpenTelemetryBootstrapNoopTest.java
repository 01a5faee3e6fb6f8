package ca.gc.cra.ingest.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapNoopTest {
  private String previous;

  @BeforeEach
  void setUp() {
    previous = System.getProperty("otel.metrics.exporter");
    System.setProperty("otel.metrics.exporter", "none");
  }

  @AfterEach
  void tearDown() {
    if (previous == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", previous);
    }
  }

  @Test
  void noneExporterYieldsNoopAdapter() {
    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize();
    assertTrue(result.isNoop());

    OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter(result);
    assertDoesNotThrow(() -> {
      adapter.increment("ingest.run.outcome.completed_data");
      adapter.observe("ingest.api.page.bytes", 10);
      adapter.close();
    });
  }
}
