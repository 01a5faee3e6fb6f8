/**
 * JSON parsing into the domain {@code JsonValue} model, backed by the Jackson streaming parser.
 *
 * @since 0.1.0
 */
package ca.gc.cra.ingest.application.json;
