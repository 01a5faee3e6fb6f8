package ca.gc.cra.ingest.application.ingest;

import ca.gc.cra.ingest.application.json.JsonSupport;
import ca.gc.cra.ingest.application.port.DatasetSource;
import ca.gc.cra.ingest.application.port.MetricsPort;
import ca.gc.cra.ingest.config.ApiIngestConfig;
import ca.gc.cra.ingest.domain.ingest.DiagnosticKind;
import ca.gc.cra.ingest.domain.ingest.IngestDiagnostic;
import ca.gc.cra.ingest.domain.ingest.IngestOutcome;
import ca.gc.cra.ingest.domain.ingest.IngestResult;
import ca.gc.cra.ingest.domain.ingest.PageFetch;
import ca.gc.cra.ingest.domain.ingest.PageRequest;
import ca.gc.cra.ingest.domain.ingest.RawResponse;
import ca.gc.cra.ingest.domain.json.JsonValue;
import ca.gc.cra.ingest.domain.record.DataRecord;
import ca.gc.cra.ingest.domain.record.Dataset;
import ca.gc.cra.ingest.logging.Logs;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Drives page-by-page ingestion from the remote API into a dataset.
 * <p><strong>Why:</strong> Owns the only mutable state of a run (page cursor and dataset builder) and decides after
 * each page whether to continue, complete, or abort.</p>
 * <p><strong>Role:</strong> {@link DatasetSource} for {@code api} mode.</p>
 * <p><strong>Responsibilities:</strong> per page, in order:
 * <ol>
 *   <li>fetch; a transport halt aborts with {@link IngestOutcome#ABORTED_TRANSPORT};</li>
 *   <li>size check; failure aborts with {@link IngestOutcome#ABORTED_SIZE_LIMIT} before any parsing;</li>
 *   <li>parse; failure aborts with {@link IngestOutcome#ABORTED_MALFORMED};</li>
 *   <li>depth check; failure aborts with {@link IngestOutcome#ABORTED_DEPTH_LIMIT};</li>
 *   <li>extract; zero candidates completes the run;</li>
 *   <li>batch limit; too many candidates aborts with {@link IngestOutcome#ABORTED_BATCH_TOO_LARGE} and the page
 *   contributes nothing;</li>
 *   <li>schema filter and append; advance to the next page.</li>
 * </ol>
 * Aborts keep the rows accepted from earlier pages.
 * <p><strong>Thread-safety:</strong> One {@link #ingest()} at a time; every call starts again at page one.</p>
 * <p><strong>Observability:</strong> Puts {@code page} in the MDC while a page is processed; emits
 * {@code ingest.api.records.accepted}, {@code ingest.api.records.dropped}, and {@code ingest.run.outcome.*}.</p>
 *
 * @since 0.1.0
 */
public final class ApiPaginator implements DatasetSource {
  private static final Logger log = LoggerFactory.getLogger(ApiPaginator.class);
  private static final String NAME = "api";
  private static final int DETAIL_BYTES = 256;

  private final RetryingPageFetcher fetcher;
  private final JsonSupport json;
  private final PayloadGuard guard;
  private final RecordExtractor extractor;
  private final SchemaFilter filter;
  private final MetricsPort metrics;
  private final int pageSize;
  private final int maxBatchRecords;
  private final Set<String> requiredFields;

  /**
   * Creates a paginator with explicit collaborators.
   *
   * @param config validated API settings
   * @param fetcher retrying page fetcher
   * @param json JSON parser
   * @param guard size and depth limits
   * @param extractor record extractor
   * @param filter schema filter
   * @param metrics metrics sink
   */
  public ApiPaginator(
      ApiIngestConfig config,
      RetryingPageFetcher fetcher,
      JsonSupport json,
      PayloadGuard guard,
      RecordExtractor extractor,
      SchemaFilter filter,
      MetricsPort metrics) {
    Objects.requireNonNull(config, "config");
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    this.json = Objects.requireNonNull(json, "json");
    this.guard = Objects.requireNonNull(guard, "guard");
    this.extractor = Objects.requireNonNull(extractor, "extractor");
    this.filter = Objects.requireNonNull(filter, "filter");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.pageSize = config.pageSize();
    this.maxBatchRecords = config.maxBatchRecords();
    this.requiredFields = config.requiredFields();
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public IngestResult ingest() {
    DiagnosticsCollector diagnostics = new DiagnosticsCollector(NAME);
    Dataset.Builder dataset = Dataset.builder();
    PageRequest request = PageRequest.first(pageSize);
    int pagesFetched = 0;
    IngestOutcome outcome;

    while (true) {
      MDC.put("page", Integer.toString(request.page()));
      try {
        PageFetch fetch = fetcher.fetchPage(request, diagnostics);
        if (fetch.isHalted()) {
          diagnostics.record(new IngestDiagnostic(
              fetch.haltReason().diagnosticKind(),
              null,
              request.page(),
              fetch.status().orElse(-1),
              -1,
              null,
              "transport halted"));
          outcome = IngestOutcome.ABORTED_TRANSPORT;
          break;
        }
        pagesFetched++;
        outcome = processPage(request.page(), fetch.response(), dataset, diagnostics);
        if (outcome != null) {
          break;
        }
      } finally {
        MDC.remove("page");
      }
      request = request.next();
    }

    metrics.increment("ingest.run.outcome." + outcome.metricLabel());
    Dataset built = dataset.build();
    log.info("API ingestion finished: outcome={}, rows={}, columns={}, pages={}",
        outcome, built.size(), built.columns().size(), pagesFetched);
    return new IngestResult(NAME, built, outcome, diagnostics.snapshot(), pagesFetched);
  }

  /**
   * Runs the guard, parse, extract, and filter stages for one fetched page.
   *
   * @return terminal outcome, or {@code null} to continue with the next page
   */
  private IngestOutcome processPage(
      int page, RawResponse response, Dataset.Builder dataset, DiagnosticsCollector diagnostics) {
    if (!guard.checkSize(response)) {
      diagnostics.record(IngestDiagnostic.page(
          DiagnosticKind.PAYLOAD_TOO_LARGE,
          page,
          "body of " + response.byteLength() + " bytes exceeds limit of " + guard.maxPayloadBytes()));
      return IngestOutcome.ABORTED_SIZE_LIMIT;
    }

    JsonValue payload;
    try {
      payload = json.parse(response.body());
    } catch (IllegalArgumentException ex) {
      log.debug("Unparsable body on page {}: {}", page, Logs.preview(response.body(), DETAIL_BYTES));
      diagnostics.record(IngestDiagnostic.page(DiagnosticKind.MALFORMED_BODY, page, describe(ex)));
      return IngestOutcome.ABORTED_MALFORMED;
    }

    if (!guard.checkDepth(payload)) {
      diagnostics.record(IngestDiagnostic.page(
          DiagnosticKind.TOO_DEEPLY_NESTED,
          page,
          "nesting depth " + PayloadGuard.depth(payload) + " exceeds limit of " + guard.maxDepth()));
      return IngestOutcome.ABORTED_DEPTH_LIMIT;
    }

    List<JsonValue> candidates = extractor.extract(payload);
    if (candidates.isEmpty()) {
      log.debug("Page {} returned no records; pagination complete", page);
      return IngestOutcome.completed(dataset.size());
    }
    if (candidates.size() > maxBatchRecords) {
      diagnostics.record(IngestDiagnostic.page(
          DiagnosticKind.BATCH_TOO_LARGE,
          page,
          candidates.size() + " records exceed limit of " + maxBatchRecords));
      return IngestOutcome.ABORTED_BATCH_TOO_LARGE;
    }

    List<DataRecord> kept = filter.filter(candidates, requiredFields, page, diagnostics);
    dataset.addAll(kept);
    metrics.increment("ingest.api.records.accepted", kept.size());
    metrics.increment("ingest.api.records.dropped", candidates.size() - kept.size());
    log.debug("Page {}: {} candidates, {} kept", page, candidates.size(), kept.size());
    return null;
  }

  @Override
  public void close() {
    fetcher.close();
  }

  private static String describe(IllegalArgumentException ex) {
    String message = ex.getMessage();
    Throwable cause = ex.getCause();
    if (cause != null && cause.getMessage() != null) {
      message = message + ": " + cause.getMessage();
    }
    return Logs.truncate(message, DETAIL_BYTES);
  }
}
