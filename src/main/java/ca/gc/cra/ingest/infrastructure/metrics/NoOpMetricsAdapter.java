package ca.gc.cra.ingest.infrastructure.metrics;

import ca.gc.cra.ingest.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations; selected when {@code metricsExporter=none}.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort, AutoCloseable {
  /** Creates a no-op metrics adapter. */
  public NoOpMetricsAdapter() {}

  @Override
  public void increment(String key) {}

  @Override
  public void increment(String key, long delta) {}

  @Override
  public void observe(String key, long value) {}

  @Override
  public void close() {}
}
