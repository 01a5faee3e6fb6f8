package ca.gc.cra.ingest.domain.ingest;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Undecoded HTTP response captured for a single fetch attempt.
 * <p><strong>Why:</strong> Lets the payload guard judge the raw byte size before any parsing happens.</p>
 * <p><strong>Role:</strong> Ephemeral value produced by {@code HttpExchangePort} and consumed within one page.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the body is copied on construction.</p>
 *
 * @param status HTTP status code
 * @param body response body bytes; possibly truncated to the read cap, never {@code null}
 * @param byteLength number of body bytes observed on the wire (may exceed {@code body.length} when truncated)
 * @param retryAfter raw {@code Retry-After} header value, or {@code null} when absent
 * @since 0.1.0
 */
public record RawResponse(int status, byte[] body, long byteLength, String retryAfter) {

  /**
   * Copies the body and checks the length bookkeeping.
   */
  public RawResponse {
    body = body != null ? body.clone() : new byte[0];
    if (byteLength < body.length) {
      throw new IllegalArgumentException("byteLength must cover the body");
    }
  }

  /**
   * Creates a response whose length equals the supplied body.
   *
   * @param status HTTP status code
   * @param body response body
   * @return response without a {@code Retry-After} header
   */
  public static RawResponse of(int status, byte[] body) {
    byte[] safe = body != null ? body : new byte[0];
    return new RawResponse(status, safe, safe.length, null);
  }

  /**
   * Returns the body bytes.
   *
   * @return internal body array; callers must not mutate it
   */
  @Override
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Body is copied on construction; pages are read once by the parser.")
  public byte[] body() {
    return body;
  }

  /**
   * Returns the {@code Retry-After} header when the server sent one.
   *
   * @return header value
   */
  public Optional<String> retryAfterHeader() {
    return Optional.ofNullable(retryAfter);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RawResponse that)) {
      return false;
    }
    return status == that.status
        && byteLength == that.byteLength
        && Arrays.equals(body, that.body)
        && Objects.equals(retryAfter, that.retryAfter);
  }

  @Override
  public int hashCode() {
    int result = Integer.hashCode(status);
    result = 31 * result + Long.hashCode(byteLength);
    result = 31 * result + Arrays.hashCode(body);
    result = 31 * result + Objects.hashCode(retryAfter);
    return result;
  }

  @Override
  public String toString() {
    return "RawResponse{status=" + status + ", byteLength=" + byteLength + ", retryAfter=" + retryAfter + '}';
  }
}
