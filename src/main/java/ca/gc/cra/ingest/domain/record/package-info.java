/**
 * <strong>Purpose:</strong> Row and dataset types returned by every ingestion source.
 * <p><strong>Pipeline role:</strong> Domain layer; the dataset is the only externally visible output of a run.</p>
 * <p><strong>Concurrency:</strong> Records and datasets are immutable; {@code Dataset.Builder} is confined to the
 * run that owns it.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.ingest.domain.record;
