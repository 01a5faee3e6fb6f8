package ca.gc.cra.ingest.config;

import ca.gc.cra.ingest.application.ingest.ApiPaginator;
import ca.gc.cra.ingest.application.ingest.PayloadGuard;
import ca.gc.cra.ingest.application.ingest.RecordExtractor;
import ca.gc.cra.ingest.application.ingest.RetryPolicy;
import ca.gc.cra.ingest.application.ingest.RetryingPageFetcher;
import ca.gc.cra.ingest.application.ingest.SchemaFilter;
import ca.gc.cra.ingest.application.json.JsonSupport;
import ca.gc.cra.ingest.application.port.ClockPort;
import ca.gc.cra.ingest.application.port.DatasetSource;
import ca.gc.cra.ingest.application.port.HttpExchangePort;
import ca.gc.cra.ingest.application.port.MetricsPort;
import ca.gc.cra.ingest.application.port.ObjectStorePort;
import ca.gc.cra.ingest.application.port.SleeperPort;
import ca.gc.cra.ingest.application.source.CsvRecordReader;
import ca.gc.cra.ingest.application.source.LocalDatasetSource;
import ca.gc.cra.ingest.application.source.ObjectStoreDatasetSource;
import ca.gc.cra.ingest.infrastructure.http.OkHttpExchangeAdapter;
import ca.gc.cra.ingest.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.ingest.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.ingest.infrastructure.objectstore.S3ObjectStoreAdapter;
import ca.gc.cra.ingest.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.ingest.infrastructure.time.ThreadSleeperAdapter;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Central composition root that wires dataset sources to concrete adapters.
 * <p><strong>Why:</strong> Keeps adapter construction in one place so the CLI and tests only deal with ports.</p>
 * <p><strong>Role:</strong> Adapter composition root for the {@code api}, {@code local}, and {@code s3} modes.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Translate an effective key/value map into a validated config and a {@link DatasetSource}.</li>
 *   <li>Share one metrics port, sleeper, and clock across the sources it builds.</li>
 *   <li>Accept port overrides so tests can run sources without network access.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds immutable references; factory methods create new instances per call.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final MetricsPort metrics;
  private final SleeperPort sleeper;
  private final ClockPort clock;

  /**
   * Creates a composition root with the thread sleeper and system clock.
   *
   * @param metrics metrics adapter shared by every source
   */
  public CompositionRoot(MetricsPort metrics) {
    this(metrics, new ThreadSleeperAdapter(), new SystemClockAdapter());
  }

  /**
   * Creates a composition root with explicit time adapters.
   *
   * @param metrics metrics adapter shared by every source
   * @param sleeper wait implementation used between attempts
   * @param clock time source
   */
  public CompositionRoot(MetricsPort metrics, SleeperPort sleeper, ClockPort clock) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Selects the metrics adapter for a {@code metricsExporter} value.
   *
   * @param exporter {@code none} or {@code otlp}; blank means {@code none}
   * @return no-op adapter for {@code none}, otherwise the OpenTelemetry adapter
   * @throws IllegalArgumentException for any other exporter
   */
  public static MetricsPort metricsFor(String exporter) {
    String normalized = exporter == null ? "" : exporter.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "", "none" -> new NoOpMetricsAdapter();
      case "otlp" -> new OpenTelemetryMetricsAdapter();
      default -> throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    };
  }

  /**
   * Returns the shared metrics adapter.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Builds the source for a mode from an effective configuration map.
   *
   * @param mode ingestion mode
   * @param effective merged key/value configuration
   * @return dataset source; the caller closes it
   * @throws IllegalArgumentException when the configuration is invalid
   */
  public DatasetSource source(IngestMode mode, Map<String, String> effective) {
    Objects.requireNonNull(mode, "mode");
    return switch (mode) {
      case API -> apiSource(ApiIngestConfig.fromMap(effective));
      case LOCAL -> localSource(LocalIngestConfig.fromMap(effective));
      case S3 -> objectStoreSource(S3IngestConfig.fromMap(effective));
    };
  }

  /**
   * Builds the paginated API source over OkHttp.
   *
   * @param config API settings
   * @return paginator owning its HTTP client
   */
  public ApiPaginator apiSource(ApiIngestConfig config) {
    return apiSource(config, OkHttpExchangeAdapter.fromConfig(config));
  }

  /**
   * Builds the paginated API source over a supplied exchange.
   *
   * @param config API settings
   * @param exchange single-attempt HTTP port
   * @return paginator closing {@code exchange} on close
   */
  public ApiPaginator apiSource(ApiIngestConfig config, HttpExchangePort exchange) {
    Objects.requireNonNull(config, "config");
    RetryingPageFetcher fetcher =
        new RetryingPageFetcher(exchange, sleeper, clock, metrics, RetryPolicy.from(config));
    return new ApiPaginator(
        config,
        fetcher,
        new JsonSupport(),
        new PayloadGuard(config.maxPayloadBytes(), config.maxDepth()),
        new RecordExtractor(config.dataField()),
        new SchemaFilter(),
        metrics);
  }

  /**
   * Builds the local directory source.
   *
   * @param config local settings
   * @return local source
   */
  public LocalDatasetSource localSource(LocalIngestConfig config) {
    return new LocalDatasetSource(config, new CsvRecordReader(), metrics);
  }

  /**
   * Builds the object-store source over the AWS SDK.
   *
   * @param config S3 settings
   * @return object-store source owning its client
   */
  public ObjectStoreDatasetSource objectStoreSource(S3IngestConfig config) {
    return objectStoreSource(config, S3ObjectStoreAdapter.fromConfig(config));
  }

  /**
   * Builds the object-store source over a supplied store.
   *
   * @param config S3 settings
   * @param store object store port
   * @return object-store source closing {@code store} on close
   */
  public ObjectStoreDatasetSource objectStoreSource(S3IngestConfig config, ObjectStorePort store) {
    return new ObjectStoreDatasetSource(config, store, new CsvRecordReader(), metrics);
  }
}
