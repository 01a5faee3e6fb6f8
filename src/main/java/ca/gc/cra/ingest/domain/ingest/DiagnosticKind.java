package ca.gc.cra.ingest.domain.ingest;

/**
 * Classification of everything worth reporting during a run.
 *
 * @since 0.1.0
 */
public enum DiagnosticKind {
  UNAUTHORIZED(Severity.ERROR),
  RATE_LIMITED(Severity.INFO),
  CLIENT_ERROR(Severity.ERROR),
  SERVER_ERROR(Severity.WARN),
  NETWORK_ERROR(Severity.WARN),
  RETRIES_EXHAUSTED(Severity.ERROR),
  RATE_LIMIT_BUDGET_EXHAUSTED(Severity.ERROR),
  INTERRUPTED(Severity.ERROR),
  PAYLOAD_TOO_LARGE(Severity.ERROR),
  MALFORMED_BODY(Severity.ERROR),
  TOO_DEEPLY_NESTED(Severity.ERROR),
  BATCH_TOO_LARGE(Severity.ERROR),
  SCHEMA_VIOLATION(Severity.WARN),
  SOURCE_READ_ERROR(Severity.WARN),
  SOURCE_EMPTY(Severity.WARN);

  private final Severity defaultSeverity;

  DiagnosticKind(Severity defaultSeverity) {
    this.defaultSeverity = defaultSeverity;
  }

  /**
   * Returns the severity used when a diagnostic of this kind is recorded without an explicit one.
   *
   * @return default severity
   */
  public Severity defaultSeverity() {
    return defaultSeverity;
  }

  /** Diagnostic severity; maps one-to-one onto SLF4J levels. */
  public enum Severity {
    INFO,
    WARN,
    ERROR
  }
}
