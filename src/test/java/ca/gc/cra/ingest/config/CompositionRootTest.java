package ca.gc.cra.ingest.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.ingest.application.ingest.ApiPaginator;
import ca.gc.cra.ingest.application.port.DatasetSource;
import ca.gc.cra.ingest.application.source.LocalDatasetSource;
import ca.gc.cra.ingest.application.source.ObjectStoreDatasetSource;
import ca.gc.cra.ingest.domain.ingest.IngestOutcome;
import ca.gc.cra.ingest.domain.ingest.IngestResult;
import ca.gc.cra.ingest.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.ingest.testing.FixedClock;
import ca.gc.cra.ingest.testing.InMemoryObjectStore;
import ca.gc.cra.ingest.testing.RecordingMetrics;
import ca.gc.cra.ingest.testing.RecordingSleeper;
import ca.gc.cra.ingest.testing.ScriptedExchange;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {
  @TempDir
  Path dir;

  private final RecordingMetrics metrics = new RecordingMetrics();
  private final RecordingSleeper sleeper = new RecordingSleeper();
  private final CompositionRoot root = new CompositionRoot(metrics, sleeper, new FixedClock(0));

  @Test
  void metricsExporterSelection() {
    assertInstanceOf(NoOpMetricsAdapter.class, CompositionRoot.metricsFor(null));
    assertInstanceOf(NoOpMetricsAdapter.class, CompositionRoot.metricsFor(" NONE "));
    assertThrows(IllegalArgumentException.class, () -> CompositionRoot.metricsFor("prometheus"));
  }

  @Test
  void apiSourceWiresRetriesAndSleeper() {
    ApiIngestConfig config = ApiIngestConfig.fromMap(
        Map.of("baseUrl", "https://api.example.test", "token", "abc", "maxRetries", "2"), name -> null);
    ScriptedExchange exchange = new ScriptedExchange()
        .respond(503, "")
        .respond(200, "{\"data\":[{\"sku\":\"A\",\"quantity\":1}]}")
        .respond(200, "{\"data\":[]}");

    try (ApiPaginator source = root.apiSource(config, exchange)) {
      IngestResult result = source.ingest();

      assertEquals(IngestOutcome.COMPLETED_DATA, result.outcome());
      assertEquals(List.of(Duration.ofSeconds(1)), sleeper.waits());
    }
    assertTrue(exchange.closed());
  }

  @Test
  void sourceDispatchesOnMode() throws IOException {
    Files.writeString(dir.resolve("a.csv"), "sku,quantity\nA,1\n");

    DatasetSource source = root.source(IngestMode.LOCAL, Map.of("localPath", dir.toString()));

    assertInstanceOf(LocalDatasetSource.class, source);
    assertEquals(1, source.ingest().dataset().size());
  }

  @Test
  void objectStoreSourceUsesSuppliedStore() {
    S3IngestConfig config = S3IngestConfig.fromMap(Map.of("s3Bucket", "inventory-exports"));
    InMemoryObjectStore store = new InMemoryObjectStore(5).put("a.csv", "sku\nA\n");

    ObjectStoreDatasetSource source = root.objectStoreSource(config, store);

    assertEquals(1, source.ingest().dataset().size());
    assertEquals(1, metrics.count("ingest.run.outcome.completed_data"));
  }

  @Test
  void invalidSettingsFailFast() {
    assertThrows(IllegalArgumentException.class, () -> root.source(IngestMode.API, Map.of()));
    assertThrows(IllegalArgumentException.class,
        () -> root.source(IngestMode.LOCAL, Map.of("fileType", "parquet")));
  }

  @Test
  void exposesMetrics() {
    assertEquals(metrics, root.metrics());
  }

  @Test
  void defaultConstructorUsesProductionAdapters() {
    CompositionRoot production = new CompositionRoot(new NoOpMetricsAdapter());

    assertInstanceOf(NoOpMetricsAdapter.class, production.metrics());
  }
}
