package ca.gc.cra.ingest.domain.ingest;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> One structured observation made during a run.
 * <p><strong>Why:</strong> Aborts and dropped records are returned with the dataset instead of being thrown, so the
 * caller can tell "no data" apart from "failed".</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 * <p><strong>Observability:</strong> Also written to the log by {@code DiagnosticsCollector}; never carries record
 * contents or credentials.</p>
 *
 * @param kind classification
 * @param severity severity; defaults to {@link DiagnosticKind#defaultSeverity()}
 * @param page page number the observation belongs to, or {@code 0} when not page-scoped
 * @param status HTTP status code, or {@code -1} when absent
 * @param recordIndex zero-based index within the page batch, or {@code -1} when absent
 * @param resource file path or object key for source-side diagnostics, or {@code null}
 * @param detail human-readable detail; never {@code null}
 * @since 0.1.0
 */
public record IngestDiagnostic(
    DiagnosticKind kind,
    DiagnosticKind.Severity severity,
    int page,
    int status,
    int recordIndex,
    String resource,
    String detail) {

  /**
   * Validates required components.
   */
  public IngestDiagnostic {
    Objects.requireNonNull(kind, "kind");
    severity = severity != null ? severity : kind.defaultSeverity();
    detail = detail != null ? detail : "";
  }

  /**
   * Creates a page-scoped diagnostic with the kind's default severity.
   *
   * @param kind classification
   * @param page page number
   * @param detail detail text
   * @return diagnostic
   */
  public static IngestDiagnostic page(DiagnosticKind kind, int page, String detail) {
    return new IngestDiagnostic(kind, null, page, -1, -1, null, detail);
  }

  /**
   * Creates a page-scoped diagnostic carrying an HTTP status.
   *
   * @param kind classification
   * @param page page number
   * @param status HTTP status code
   * @param detail detail text
   * @return diagnostic
   */
  public static IngestDiagnostic status(DiagnosticKind kind, int page, int status, String detail) {
    return new IngestDiagnostic(kind, null, page, status, -1, null, detail);
  }

  /**
   * Creates a diagnostic about one record in a page batch.
   *
   * @param kind classification
   * @param page page number
   * @param recordIndex zero-based index within the batch
   * @param detail detail text
   * @return diagnostic
   */
  public static IngestDiagnostic record(DiagnosticKind kind, int page, int recordIndex, String detail) {
    return new IngestDiagnostic(kind, null, page, -1, recordIndex, null, detail);
  }

  /**
   * Creates a diagnostic about a file or object.
   *
   * @param kind classification
   * @param resource path or key
   * @param detail detail text
   * @return diagnostic
   */
  public static IngestDiagnostic resource(DiagnosticKind kind, String resource, String detail) {
    return new IngestDiagnostic(kind, null, 0, -1, -1, resource, detail);
  }

  /**
   * Returns the HTTP status when present.
   *
   * @return status code
   */
  public OptionalInt statusCode() {
    return status < 0 ? OptionalInt.empty() : OptionalInt.of(status);
  }

  /**
   * Returns the batch index when present.
   *
   * @return record index
   */
  public OptionalInt index() {
    return recordIndex < 0 ? OptionalInt.empty() : OptionalInt.of(recordIndex);
  }

  /**
   * Renders the diagnostic as a single log-friendly line.
   *
   * @return summary such as {@code SCHEMA_VIOLATION page=2 index=4: missing [sku]}
   */
  public String summary() {
    StringBuilder sb = new StringBuilder(kind.name());
    if (page > 0) {
      sb.append(" page=").append(page);
    }
    if (status >= 0) {
      sb.append(" status=").append(status);
    }
    if (recordIndex >= 0) {
      sb.append(" index=").append(recordIndex);
    }
    if (resource != null) {
      sb.append(" resource=").append(resource);
    }
    if (!detail.isEmpty()) {
      sb.append(": ").append(detail);
    }
    return sb.toString();
  }
}
