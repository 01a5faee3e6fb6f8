package ca.gc.cra.ingest.domain.ingest;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> Result of fetching one page: either a usable response or a halt.
 * <p><strong>Role:</strong> Return type of {@code RetryingPageFetcher#fetchPage}; the paginator branches on
 * {@link #isHalted()}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class PageFetch {
  private final RawResponse response;
  private final HaltReason haltReason;
  private final int status;

  private PageFetch(RawResponse response, HaltReason haltReason, int status) {
    this.response = response;
    this.haltReason = haltReason;
    this.status = status;
  }

  /**
   * Wraps a response that the pipeline should process.
   *
   * @param response fetched response; must not be {@code null}
   * @return successful fetch
   */
  public static PageFetch success(RawResponse response) {
    Objects.requireNonNull(response, "response");
    return new PageFetch(response, null, response.status());
  }

  /**
   * Records a halt.
   *
   * @param reason halt reason; must not be {@code null}
   * @param status last HTTP status seen, or {@code -1} when none applies
   * @return halted fetch
   */
  public static PageFetch halted(HaltReason reason, int status) {
    return new PageFetch(null, Objects.requireNonNull(reason, "reason"), status);
  }

  /**
   * Indicates whether the transport gave up.
   *
   * @return {@code true} for halts
   */
  public boolean isHalted() {
    return haltReason != null;
  }

  /**
   * Returns the response of a successful fetch.
   *
   * @return response
   * @throws IllegalStateException if the fetch halted
   */
  public RawResponse response() {
    if (response == null) {
      throw new IllegalStateException("fetch halted: " + haltReason);
    }
    return response;
  }

  /**
   * Returns the halt reason.
   *
   * @return halt reason
   * @throws IllegalStateException if the fetch succeeded
   */
  public HaltReason haltReason() {
    if (haltReason == null) {
      throw new IllegalStateException("fetch succeeded");
    }
    return haltReason;
  }

  /**
   * Returns the last HTTP status observed, if any.
   *
   * @return status code
   */
  public OptionalInt status() {
    return status < 0 ? OptionalInt.empty() : OptionalInt.of(status);
  }

  @Override
  public String toString() {
    return isHalted()
        ? "PageFetch[halted=" + haltReason + ", status=" + status + "]"
        : "PageFetch[status=" + status + ", bytes=" + response.byteLength() + "]";
  }
}
