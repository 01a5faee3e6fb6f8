/**
 * <strong>Purpose:</strong> Validation helpers used during CLI parsing and configuration bootstrap.
 * <p><strong>Security:</strong> Insecure base URLs, control characters, and unreadable directories are rejected before
 * the HTTP client, filesystem walk, or object-store client is created.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.ingest.validation;
