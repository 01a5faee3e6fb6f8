package ca.gc.cra.ingest.application.ingest;

import ca.gc.cra.ingest.application.port.ClockPort;
import ca.gc.cra.ingest.application.port.HttpExchangePort;
import ca.gc.cra.ingest.application.port.MetricsPort;
import ca.gc.cra.ingest.application.port.SleeperPort;
import ca.gc.cra.ingest.domain.ingest.DiagnosticKind;
import ca.gc.cra.ingest.domain.ingest.HaltReason;
import ca.gc.cra.ingest.domain.ingest.IngestDiagnostic;
import ca.gc.cra.ingest.domain.ingest.PageFetch;
import ca.gc.cra.ingest.domain.ingest.PageRequest;
import ca.gc.cra.ingest.domain.ingest.RawResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs the bounded attempt sequence for a single page.
 * <p><strong>Why:</strong> Transient server and network failures are retried with exponential backoff while
 * authorization and client errors stop the run at once.</p>
 * <p><strong>Role:</strong> Application service between {@code ApiPaginator} and {@link HttpExchangePort}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>401 halts with {@link HaltReason#UNAUTHORIZED}; other 4xx (except 429) halt with
 *   {@link HaltReason#CLIENT_ERROR}.</li>
 *   <li>429 waits for {@code Retry-After} (or the current backoff) without consuming an attempt, bounded by the
 *   rate-limit budget.</li>
 *   <li>5xx and {@link IOException} consume an attempt and wait for the doubling backoff, except after the final
 *   attempt.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds no per-page state; safe to reuse sequentially.</p>
 * <p><strong>Observability:</strong> Emits {@code ingest.api.retry}, {@code ingest.api.rateLimited},
 * {@code ingest.api.page.fetched}, {@code ingest.api.page.bytes}, and {@code ingest.api.attempt.latency.ms}.</p>
 *
 * @since 0.1.0
 */
public final class RetryingPageFetcher {
  private static final Logger log = LoggerFactory.getLogger(RetryingPageFetcher.class);

  private final HttpExchangePort exchange;
  private final SleeperPort sleeper;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final RetryPolicy policy;

  /**
   * Creates a fetcher.
   *
   * @param exchange single-attempt HTTP port
   * @param sleeper wait implementation; tests inject a recording sleeper
   * @param clock time source for latency and HTTP-date parsing
   * @param metrics metrics sink
   * @param policy attempt and waiting limits
   */
  public RetryingPageFetcher(
      HttpExchangePort exchange,
      SleeperPort sleeper,
      ClockPort clock,
      MetricsPort metrics,
      RetryPolicy policy) {
    this.exchange = Objects.requireNonNull(exchange, "exchange");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.policy = Objects.requireNonNull(policy, "policy");
  }

  /**
   * Fetches one page, retrying transient failures.
   *
   * @param request page cursor
   * @param diagnostics run diagnostics; receives one entry per retry and per rate-limit wait
   * @return the first non-error response, or a halt
   */
  public PageFetch fetchPage(PageRequest request, DiagnosticsCollector diagnostics) {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(diagnostics, "diagnostics");
    int page = request.page();
    int attempts = 0;
    int lastStatus = -1;
    Duration backoff = policy.backoffInitial();
    Duration rateLimitWaited = Duration.ZERO;

    while (true) {
      RawResponse response;
      long started = clock.nowMillis();
      try {
        log.debug("GET page {} (attempt {}/{})", page, attempts + 1, policy.maxRetries());
        response = exchange.fetch(request);
      } catch (IOException ex) {
        metrics.observe("ingest.api.attempt.latency.ms", clock.nowMillis() - started);
        attempts++;
        diagnostics.record(IngestDiagnostic.page(
            DiagnosticKind.NETWORK_ERROR, page, describeAttempt(attempts) + describe(ex)));
        if (attempts >= policy.maxRetries()) {
          return PageFetch.halted(HaltReason.RETRIES_EXHAUSTED, lastStatus);
        }
        if (!pause(backoff)) {
          return PageFetch.halted(HaltReason.INTERRUPTED, lastStatus);
        }
        metrics.increment("ingest.api.retry");
        backoff = policy.nextBackoff(backoff);
        continue;
      }
      metrics.observe("ingest.api.attempt.latency.ms", clock.nowMillis() - started);

      int status = response.status();
      lastStatus = status;
      if (status == 401) {
        return PageFetch.halted(HaltReason.UNAUTHORIZED, status);
      }
      if (status == 429) {
        metrics.increment("ingest.api.rateLimited");
        Duration wait = RetryAfter.parse(response.retryAfter(), clock.nowMillis()).orElse(backoff);
        if (wait.compareTo(RetryPolicy.MIN_RATE_LIMIT_WAIT) < 0) {
          wait = RetryPolicy.MIN_RATE_LIMIT_WAIT;
        }
        if (wait.compareTo(policy.rateLimitBudget().minus(rateLimitWaited)) > 0) {
          return PageFetch.halted(HaltReason.RATE_LIMIT_BUDGET_EXHAUSTED, status);
        }
        diagnostics.record(IngestDiagnostic.status(
            DiagnosticKind.RATE_LIMITED, page, status, "waiting " + wait.toSeconds() + "s before retrying"));
        if (!pause(wait)) {
          return PageFetch.halted(HaltReason.INTERRUPTED, status);
        }
        rateLimitWaited = rateLimitWaited.plus(wait);
        continue;
      }
      if (status >= 400 && status < 500) {
        return PageFetch.halted(HaltReason.CLIENT_ERROR, status);
      }
      if (status >= 500) {
        attempts++;
        diagnostics.record(IngestDiagnostic.status(
            DiagnosticKind.SERVER_ERROR, page, status, describeAttempt(attempts) + "server error"));
        if (attempts >= policy.maxRetries()) {
          return PageFetch.halted(HaltReason.RETRIES_EXHAUSTED, status);
        }
        if (!pause(backoff)) {
          return PageFetch.halted(HaltReason.INTERRUPTED, status);
        }
        metrics.increment("ingest.api.retry");
        backoff = policy.nextBackoff(backoff);
        continue;
      }

      metrics.increment("ingest.api.page.fetched");
      metrics.observe("ingest.api.page.bytes", response.byteLength());
      log.debug("Page {} fetched: status={}, bytes={}", page, status, response.byteLength());
      return PageFetch.success(response);
    }
  }

  /**
   * Releases the underlying HTTP client.
   */
  public void close() {
    exchange.close();
  }

  private boolean pause(Duration duration) {
    try {
      sleeper.sleep(duration);
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting {} between attempts", duration);
      return false;
    }
  }

  private String describeAttempt(int attempts) {
    return "attempt " + attempts + "/" + policy.maxRetries() + ": ";
  }

  private static String describe(IOException ex) {
    String message = ex.getMessage();
    return message == null || message.isBlank()
        ? ex.getClass().getSimpleName()
        : ex.getClass().getSimpleName() + ": " + message;
  }
}
