/**
 * <strong>Purpose:</strong> Resilient paginated API ingestion: retrying transport, payload guards, record extraction,
 * schema filtering, and the paginator that ties them together.
 * <p><strong>Pipeline role:</strong> Application services behind the {@code DatasetSource} port; all I/O goes through
 * {@code HttpExchangePort}, {@code SleeperPort}, {@code ClockPort}, and {@code MetricsPort}.</p>
 * <p><strong>Concurrency:</strong> One run at a time per paginator; collaborators hold no per-run state.</p>
 * <p><strong>Telemetry:</strong> Counters and histograms under {@code ingest.api.*} and {@code ingest.run.outcome.*}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.ingest.application.ingest;
