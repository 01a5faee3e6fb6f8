package ca.gc.cra.ingest.application.ingest;

import ca.gc.cra.ingest.config.ApiIngestConfig;
import java.time.Duration;
import java.util.Objects;

/**
 * Attempt and waiting limits applied to one page fetch.
 *
 * @param maxRetries attempts consumed by server errors and network failures before giving up
 * @param backoffInitial delay after the first failed attempt
 * @param backoffMax cap for the doubling delay
 * @param rateLimitBudget total {@code Retry-After} waiting tolerated for one page
 * @since 0.1.0
 */
public record RetryPolicy(int maxRetries, Duration backoffInitial, Duration backoffMax, Duration rateLimitBudget) {
  /** Smallest wait applied to a rate-limited response, so a run of {@code Retry-After: 0} still drains the budget. */
  static final Duration MIN_RATE_LIMIT_WAIT = Duration.ofSeconds(1);

  /**
   * Validates limits.
   */
  public RetryPolicy {
    if (maxRetries < 1) {
      throw new IllegalArgumentException("maxRetries must be >= 1");
    }
    Objects.requireNonNull(backoffInitial, "backoffInitial");
    Objects.requireNonNull(backoffMax, "backoffMax");
    Objects.requireNonNull(rateLimitBudget, "rateLimitBudget");
    if (backoffInitial.isNegative() || backoffMax.compareTo(backoffInitial) < 0) {
      throw new IllegalArgumentException("backoff must satisfy 0 <= initial <= max");
    }
    if (rateLimitBudget.isNegative()) {
      throw new IllegalArgumentException("rateLimitBudget must not be negative");
    }
  }

  /**
   * Derives the policy from an API configuration.
   *
   * @param config validated configuration
   * @return matching retry policy
   */
  public static RetryPolicy from(ApiIngestConfig config) {
    return new RetryPolicy(
        config.maxRetries(), config.backoffInitial(), config.backoffMax(), config.rateLimitBudget());
  }

  /**
   * Returns the delay following {@code current} in the doubling sequence.
   *
   * @param current delay just used
   * @return doubled delay, capped at {@link #backoffMax()}
   */
  Duration nextBackoff(Duration current) {
    Duration doubled = current.multipliedBy(2);
    return doubled.compareTo(backoffMax) > 0 ? backoffMax : doubled;
  }
}
