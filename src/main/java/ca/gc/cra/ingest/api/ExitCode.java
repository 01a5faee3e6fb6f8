package ca.gc.cra.ingest.api;

/**
 * <strong>What:</strong> Process exit codes returned by the ingestion CLI.
 * <p><strong>Why:</strong> Schedulers and scripts can tell bad arguments, bad configuration, and an aborted run apart
 * without parsing logs.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Run completed, with or without data. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** An I/O failure occurred outside the ingestion run itself. */
  IO_ERROR(3),
  /** Configuration was missing or malformed, or the API rejected the credentials. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** Run stopped on an abort outcome; the partial dataset was still reported. */
  INGEST_ABORTED(6),
  /** Process was interrupted. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric process status.
   *
   * @return exit status
   */
  public int code() {
    return code;
  }
}
