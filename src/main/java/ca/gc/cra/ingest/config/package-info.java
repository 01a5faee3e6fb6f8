/**
 * Configuration records, YAML loading, precedence merging, and composition root wiring for the ingestion CLI.
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Secret values are redacted by {@code toString()} and by dry-run output.</p>
 */
package ca.gc.cra.ingest.config;
