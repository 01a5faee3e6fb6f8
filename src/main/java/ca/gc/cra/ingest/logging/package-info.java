/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and sanitize values before emission.
 * <p><strong>Concurrency:</strong> Stateless helpers.</p>
 * <p><strong>Security:</strong> Redaction helpers keep bearer tokens and AWS secrets out of logs.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.ingest.logging;
