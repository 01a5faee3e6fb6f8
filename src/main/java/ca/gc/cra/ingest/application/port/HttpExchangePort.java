package ca.gc.cra.ingest.application.port;

import ca.gc.cra.ingest.domain.ingest.PageRequest;
import ca.gc.cra.ingest.domain.ingest.RawResponse;
import java.io.IOException;

/**
 * <strong>What:</strong> Port performing exactly one HTTP attempt for one page.
 * <p><strong>Why:</strong> Separates retry policy from the HTTP client so the policy can be tested with scripted
 * responses.</p>
 * <p><strong>Role:</strong> Implemented by {@code OkHttpExchangeAdapter}; consumed by {@code RetryingPageFetcher}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Build the page URL and the authorization, accept, and user-agent headers.</li>
 *   <li>Apply the per-attempt timeout.</li>
 *   <li>Read at most the configured byte cap plus one byte of the body, reporting the observed length.</li>
 * </ul>
 * <p><strong>Security:</strong> Owns the bearer token; implementations must never log it.</p>
 *
 * @since 0.1.0
 */
public interface HttpExchangePort extends AutoCloseable {
  /**
   * Executes one GET for the page.
   *
   * @param request page cursor
   * @return response of any status; never {@code null}
   * @throws IOException on timeout, connection failure, or an unreadable body
   */
  RawResponse fetch(PageRequest request) throws IOException;

  /**
   * Releases connection pools. Default is a no-op.
   */
  @Override
  default void close() {}
}
