package ca.gc.cra.ingest.infrastructure.time;

import ca.gc.cra.ingest.application.port.SleeperPort;
import java.time.Duration;

/**
 * {@link SleeperPort} implementation that parks the calling thread with {@link Thread#sleep(long)}.
 *
 * @since 0.1.0
 */
public final class ThreadSleeperAdapter implements SleeperPort {
  /** Creates a thread sleeper. */
  public ThreadSleeperAdapter() {}

  @Override
  public void sleep(Duration duration) throws InterruptedException {
    if (duration == null || duration.isZero() || duration.isNegative()) {
      if (Thread.currentThread().isInterrupted()) {
        throw new InterruptedException("interrupted before sleep");
      }
      return;
    }
    Thread.sleep(duration.toMillis());
  }
}
