package ca.gc.cra.ingest.infrastructure.time;

import ca.gc.cra.ingest.application.port.ClockPort;

/**
 * {@link ClockPort} implementation backed by {@link System#currentTimeMillis()}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  /** Creates a system clock adapter. */
  public SystemClockAdapter() {}

  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
