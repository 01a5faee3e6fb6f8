/**
 * Wall-clock and sleeping adapters used by the retrying fetcher.
 *
 * @since 0.1.0
 */
package ca.gc.cra.ingest.infrastructure.time;
