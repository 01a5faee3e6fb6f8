package ca.gc.cra.ingest.domain.ingest;

import java.util.Locale;

/**
 * Terminal state of an ingestion run.
 *
 * @since 0.1.0
 */
public enum IngestOutcome {
  /** Natural end of data with no accepted rows. */
  COMPLETED_EMPTY,
  /** Natural end of data with at least one accepted row. */
  COMPLETED_DATA,
  /** A page body exceeded the byte limit. */
  ABORTED_SIZE_LIMIT,
  /** A parsed page exceeded the nesting-depth limit. */
  ABORTED_DEPTH_LIMIT,
  /** A page body was not valid JSON. */
  ABORTED_MALFORMED,
  /** A page carried more records than the batch limit. */
  ABORTED_BATCH_TOO_LARGE,
  /** The transport halted (auth failure, client error, exhausted retries, rate-limit budget, interrupt). */
  ABORTED_TRANSPORT,
  /** A file or object-store source failed before producing data. */
  ABORTED_SOURCE;

  /**
   * Indicates whether the run stopped before reaching the natural end of data.
   *
   * @return {@code true} for every {@code ABORTED_*} state
   */
  public boolean isAbort() {
    return this != COMPLETED_EMPTY && this != COMPLETED_DATA;
  }

  /**
   * Picks the completion state for a dataset of the given size.
   *
   * @param rows accepted row count
   * @return {@link #COMPLETED_DATA} when {@code rows > 0}, otherwise {@link #COMPLETED_EMPTY}
   */
  public static IngestOutcome completed(int rows) {
    return rows > 0 ? COMPLETED_DATA : COMPLETED_EMPTY;
  }

  /**
   * Returns the lower-case label used in metric names.
   *
   * @return metric label such as {@code aborted_size_limit}
   */
  public String metricLabel() {
    return name().toLowerCase(Locale.ROOT);
  }
}
