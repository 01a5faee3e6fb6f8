/**
 * OkHttp adapter performing single HTTP attempts for the paginated API.
 *
 * @since 0.1.0
 */
package ca.gc.cra.ingest.infrastructure.http;
