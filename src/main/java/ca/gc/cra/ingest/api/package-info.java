/**
 * Command-line entry points for the ingestion modes.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging and telemetry,
 * wires a source through {@code CompositionRoot}, and reports the result.</p>
 * <p><strong>Security:</strong> Tokens and secret keys are redacted from dry-run plans and never logged.</p>
 */
package ca.gc.cra.ingest.api;
