/**
 * <strong>Purpose:</strong> Value types describing one ingestion run: page cursors, raw responses, fetch results,
 * diagnostics, and the terminal outcome.
 * <p><strong>Pipeline role:</strong> Domain layer shared by the API paginator and the file and object-store sources.</p>
 * <p><strong>Concurrency:</strong> Immutable values.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.ingest.domain.ingest;
