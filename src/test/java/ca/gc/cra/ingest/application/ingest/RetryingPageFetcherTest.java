package ca.gc.cra.ingest.application.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.ingest.domain.ingest.DiagnosticKind;
import ca.gc.cra.ingest.domain.ingest.HaltReason;
import ca.gc.cra.ingest.domain.ingest.IngestDiagnostic;
import ca.gc.cra.ingest.domain.ingest.PageFetch;
import ca.gc.cra.ingest.domain.ingest.PageRequest;
import ca.gc.cra.ingest.testing.FixedClock;
import ca.gc.cra.ingest.testing.RecordingMetrics;
import ca.gc.cra.ingest.testing.RecordingSleeper;
import ca.gc.cra.ingest.testing.ScriptedExchange;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RetryingPageFetcherTest {
  private static final long NOW = Instant.parse("2024-03-01T12:00:00Z").toEpochMilli();

  private ScriptedExchange exchange;
  private RecordingSleeper sleeper;
  private RecordingMetrics metrics;
  private FixedClock clock;
  private DiagnosticsCollector diagnostics;

  @BeforeEach
  void setUp() {
    exchange = new ScriptedExchange();
    sleeper = new RecordingSleeper();
    metrics = new RecordingMetrics();
    clock = new FixedClock(NOW);
    diagnostics = new DiagnosticsCollector("api");
  }

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
  }

  @Test
  void successOnFirstAttemptDoesNotWait() {
    exchange.respond(200, "{\"data\":[]}");

    PageFetch fetch = fetcher(policy(3)).fetchPage(PageRequest.first(10), diagnostics);

    assertFalse(fetch.isHalted());
    assertEquals(200, fetch.response().status());
    assertTrue(sleeper.waits().isEmpty());
    assertEquals(1, metrics.count("ingest.api.page.fetched"));
    assertEquals(1, metrics.observed("ingest.api.page.bytes").size());
    assertTrue(diagnostics.snapshot().isEmpty());
  }

  @Test
  void unauthorizedHaltsWithoutRetry() {
    exchange.respond(401, "{\"error\":\"expired\"}");

    PageFetch fetch = fetcher(policy(3)).fetchPage(PageRequest.first(10), diagnostics);

    assertTrue(fetch.isHalted());
    assertEquals(HaltReason.UNAUTHORIZED, fetch.haltReason());
    assertEquals(401, fetch.status().getAsInt());
    assertEquals(1, exchange.attempts());
    assertTrue(sleeper.waits().isEmpty());
  }

  @Test
  void otherClientErrorsHaltWithoutRetry() {
    exchange.respond(404, "not found");

    PageFetch fetch = fetcher(policy(3)).fetchPage(PageRequest.first(10), diagnostics);

    assertEquals(HaltReason.CLIENT_ERROR, fetch.haltReason());
    assertEquals(404, fetch.status().getAsInt());
    assertEquals(1, exchange.attempts());
  }

  @Test
  void serverErrorsRetryWithDoublingBackoff() {
    exchange.respond(503, "").respond(502, "").respond(200, "[]");

    PageFetch fetch = fetcher(policy(3)).fetchPage(PageRequest.first(10), diagnostics);

    assertFalse(fetch.isHalted());
    assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeper.waits());
    assertEquals(2, metrics.count("ingest.api.retry"));
    assertEquals(2, countKind(DiagnosticKind.SERVER_ERROR));
  }

  @Test
  void exhaustedRetriesDoNotSleepAfterFinalAttempt() {
    exchange.respond(500, "").respond(500, "").respond(500, "");

    PageFetch fetch = fetcher(policy(3)).fetchPage(PageRequest.first(10), diagnostics);

    assertEquals(HaltReason.RETRIES_EXHAUSTED, fetch.haltReason());
    assertEquals(500, fetch.status().getAsInt());
    assertEquals(3, exchange.attempts());
    assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeper.waits());
  }

  @Test
  void backoffIsCappedAtMaximum() {
    RetryPolicy capped = new RetryPolicy(5, Duration.ofSeconds(1), Duration.ofSeconds(3), Duration.ofMinutes(15));
    for (int i = 0; i < 5; i++) {
      exchange.respond(500, "");
    }

    fetcher(capped).fetchPage(PageRequest.first(10), diagnostics);

    assertEquals(
        List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(3), Duration.ofSeconds(3)),
        sleeper.waits());
  }

  @Test
  void networkFailuresConsumeAttempts() {
    exchange.fail(new SocketTimeoutException("timeout"))
        .fail(new SocketTimeoutException("timeout"));

    PageFetch fetch = fetcher(policy(2)).fetchPage(PageRequest.first(10), diagnostics);

    assertEquals(HaltReason.RETRIES_EXHAUSTED, fetch.haltReason());
    assertTrue(fetch.status().isEmpty());
    assertEquals(2, countKind(DiagnosticKind.NETWORK_ERROR));
    assertEquals(List.of(Duration.ofSeconds(1)), sleeper.waits());
    String detail = diagnostics.snapshot().get(0).detail();
    assertTrue(detail.contains("SocketTimeoutException"), detail);
  }

  @Test
  void rateLimitDoesNotConsumeRetries() {
    exchange.rateLimited("2").rateLimited("3").respond(200, "[]");

    PageFetch fetch = fetcher(policy(1)).fetchPage(PageRequest.first(10), diagnostics);

    assertFalse(fetch.isHalted());
    assertEquals(3, exchange.attempts());
    assertEquals(List.of(Duration.ofSeconds(2), Duration.ofSeconds(3)), sleeper.waits());
    assertEquals(2, metrics.count("ingest.api.rateLimited"));
    assertEquals(0, metrics.count("ingest.api.retry"));
    assertEquals(2, countKind(DiagnosticKind.RATE_LIMITED));
  }

  @Test
  void rateLimitWithoutHeaderWaitsCurrentBackoffWithoutAdvancingIt() {
    exchange.rateLimited(null).rateLimited(null).respond(500, "").respond(200, "[]");

    fetcher(policy(3)).fetchPage(PageRequest.first(10), diagnostics);

    assertEquals(
        List.of(Duration.ofSeconds(1), Duration.ofSeconds(1), Duration.ofSeconds(1)),
        sleeper.waits());
  }

  @Test
  void zeroRetryAfterStillWaitsMinimum() {
    exchange.rateLimited("0").respond(200, "[]");

    fetcher(policy(3)).fetchPage(PageRequest.first(10), diagnostics);

    assertEquals(List.of(RetryPolicy.MIN_RATE_LIMIT_WAIT), sleeper.waits());
  }

  @Test
  void httpDateRetryAfterIsRelativeToClock() {
    String at = DateTimeFormatter.RFC_1123_DATE_TIME.format(
        Instant.ofEpochMilli(NOW).plusSeconds(7).atZone(ZoneOffset.UTC));
    exchange.rateLimited(at).respond(200, "[]");

    fetcher(policy(3)).fetchPage(PageRequest.first(10), diagnostics);

    assertEquals(List.of(Duration.ofSeconds(7)), sleeper.waits());
  }

  @Test
  void rateLimitBudgetBoundsTotalWaiting() {
    RetryPolicy budgeted = new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30), Duration.ofSeconds(5));
    exchange.rateLimited("3").rateLimited("3").respond(200, "[]");

    PageFetch fetch = fetcher(budgeted).fetchPage(PageRequest.first(10), diagnostics);

    assertEquals(HaltReason.RATE_LIMIT_BUDGET_EXHAUSTED, fetch.haltReason());
    assertEquals(429, fetch.status().getAsInt());
    assertEquals(List.of(Duration.ofSeconds(3)), sleeper.waits());
    assertEquals(1, exchange.remaining());
  }

  @Test
  void endlessZeroRetryAfterEventuallyExhaustsBudget() {
    RetryPolicy budgeted = new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30), Duration.ofSeconds(4));
    for (int i = 0; i < 10; i++) {
      exchange.rateLimited("0");
    }

    PageFetch fetch = fetcher(budgeted).fetchPage(PageRequest.first(10), diagnostics);

    assertEquals(HaltReason.RATE_LIMIT_BUDGET_EXHAUSTED, fetch.haltReason());
    assertEquals(Duration.ofSeconds(4), sleeper.total());
  }

  @Test
  void hugeRetryAfterAfterEarlierWaitHaltsOnBudget() {
    exchange.rateLimited("1").rateLimited("9223372036854775807").respond(200, "[]");

    PageFetch fetch = fetcher(policy(3)).fetchPage(PageRequest.first(10), diagnostics);

    assertEquals(HaltReason.RATE_LIMIT_BUDGET_EXHAUSTED, fetch.haltReason());
    assertEquals(429, fetch.status().getAsInt());
    assertEquals(List.of(Duration.ofSeconds(1)), sleeper.waits());
    assertEquals(1, exchange.remaining());
  }

  @Test
  void interruptedWaitHaltsAndRestoresFlag() {
    sleeper.interruptOnCall(1);
    exchange.respond(503, "").respond(200, "[]");

    PageFetch fetch = fetcher(policy(3)).fetchPage(PageRequest.first(10), diagnostics);

    assertEquals(HaltReason.INTERRUPTED, fetch.haltReason());
    assertTrue(Thread.currentThread().isInterrupted());
    assertEquals(1, exchange.attempts());
  }

  @Test
  void closeReleasesExchange() {
    fetcher(policy(1)).close();

    assertTrue(exchange.closed());
  }

  private RetryingPageFetcher fetcher(RetryPolicy policy) {
    return new RetryingPageFetcher(exchange, sleeper, clock, metrics, policy);
  }

  private static RetryPolicy policy(int maxRetries) {
    return new RetryPolicy(maxRetries, Duration.ofSeconds(1), Duration.ofSeconds(30), Duration.ofMinutes(15));
  }

  private long countKind(DiagnosticKind kind) {
    return diagnostics.snapshot().stream().map(IngestDiagnostic::kind).filter(kind::equals).count();
  }
}
