/**
 * AWS SDK v2 adapter for listing and reading bucket objects.
 *
 * @since 0.1.0
 */
package ca.gc.cra.ingest.infrastructure.objectstore;
