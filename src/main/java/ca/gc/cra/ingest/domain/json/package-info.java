/**
 * <strong>Purpose:</strong> Immutable JSON value model (object, array, scalar) used by the ingestion pipeline.
 * <p><strong>Pipeline role:</strong> Domain layer; produced by {@code JsonSupport}, validated by {@code PayloadGuard},
 * and flattened into dataset records.</p>
 * <p><strong>Concurrency:</strong> All types are immutable and safe to share.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.ingest.domain.json;
