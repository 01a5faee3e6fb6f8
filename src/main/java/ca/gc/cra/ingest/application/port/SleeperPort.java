package ca.gc.cra.ingest.application.port;

import java.time.Duration;

/**
 * Port for the only blocking waits in a run: rate-limit pauses and retry backoff.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SleeperPort {
  /**
   * Blocks the calling thread.
   *
   * @param duration time to wait; zero or negative returns immediately
   * @throws InterruptedException if the thread is interrupted while waiting
   */
  void sleep(Duration duration) throws InterruptedException;
}
