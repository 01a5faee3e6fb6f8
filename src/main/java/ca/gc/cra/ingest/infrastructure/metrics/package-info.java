/**
 * <strong>Purpose:</strong> Metrics adapters implementing {@code MetricsPort}.
 * <p><strong>Observability:</strong> The OpenTelemetry adapter exports through OTLP when
 * {@code metricsExporter=otlp}; otherwise metrics are dropped.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.ingest.infrastructure.metrics;
