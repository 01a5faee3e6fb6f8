/**
 * <strong>Purpose:</strong> Ports between the ingestion pipeline and the outside world: HTTP, object storage, time,
 * sleeping, and metrics, plus the {@code DatasetSource} contract every source implements.
 * <p><strong>Pipeline role:</strong> Application layer; infrastructure adapters implement these interfaces.</p>
 * <p><strong>Security:</strong> Credentials stay inside adapters; ports carry no secrets.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.ingest.application.port;
