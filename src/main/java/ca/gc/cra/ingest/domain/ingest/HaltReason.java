package ca.gc.cra.ingest.domain.ingest;

/**
 * Why the transport gave up on a page. Every halt terminates the run.
 *
 * @since 0.1.0
 */
public enum HaltReason {
  /** Server answered 401; credentials are wrong or expired. */
  UNAUTHORIZED(DiagnosticKind.UNAUTHORIZED),
  /** Non-retryable 4xx other than 401 and 429. */
  CLIENT_ERROR(DiagnosticKind.CLIENT_ERROR),
  /** Every attempt failed with a server error or network failure. */
  RETRIES_EXHAUSTED(DiagnosticKind.RETRIES_EXHAUSTED),
  /** Cumulative {@code Retry-After} waits for one page exceeded the configured budget. */
  RATE_LIMIT_BUDGET_EXHAUSTED(DiagnosticKind.RATE_LIMIT_BUDGET_EXHAUSTED),
  /** The thread was interrupted while waiting between attempts. */
  INTERRUPTED(DiagnosticKind.INTERRUPTED);

  private final DiagnosticKind diagnosticKind;

  HaltReason(DiagnosticKind diagnosticKind) {
    this.diagnosticKind = diagnosticKind;
  }

  /**
   * Returns the diagnostic kind reported when this halt ends a run.
   *
   * @return matching diagnostic kind
   */
  public DiagnosticKind diagnosticKind() {
    return diagnosticKind;
  }
}
