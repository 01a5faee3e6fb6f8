package ca.gc.cra.ingest.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock time to the ingestion pipeline.
 * <p><strong>Why:</strong> Attempt latency and {@code Retry-After} HTTP-dates are computed against this clock, so
 * tests can pin it.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.ingest.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /** Default clock backed by {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
