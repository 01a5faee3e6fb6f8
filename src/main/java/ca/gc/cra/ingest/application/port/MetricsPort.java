package ca.gc.cra.ingest.application.port;

/**
 * <strong>What:</strong> Port abstracting ingestion metrics emission.
 * <p><strong>Why:</strong> Lets the fetcher and paginator count pages, retries, and dropped records without binding
 * to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter} and {@code NoOpMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent updates.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code ingest.api.page.fetched}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code ingest.api.retry}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Increments the named counter by {@code delta}.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param delta non-negative amount to add
   */
  default void increment(String key, long delta) {
    for (long i = 0; i < delta; i++) {
      increment(key);
    }
  }

  /**
   * Records an observation for a histogram-style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (bytes, milliseconds); semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
