package ca.gc.cra.ingest.domain.ingest;

/**
 * <strong>What:</strong> Cursor identifying one page of a paginated listing.
 * <p><strong>Role:</strong> Domain value owned by the paginator and handed to the fetcher per page.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param page 1-based page number; strictly increasing within a run
 * @param pageSize records requested per page
 * @since 0.1.0
 */
public record PageRequest(int page, int pageSize) {

  /**
   * Validates the cursor.
   *
   * @throws IllegalArgumentException if {@code page} or {@code pageSize} is below one
   */
  public PageRequest {
    if (page < 1) {
      throw new IllegalArgumentException("page must be >= 1");
    }
    if (pageSize < 1) {
      throw new IllegalArgumentException("pageSize must be >= 1");
    }
  }

  /**
   * Returns the cursor for the first page.
   *
   * @param pageSize records requested per page
   * @return cursor for page one
   */
  public static PageRequest first(int pageSize) {
    return new PageRequest(1, pageSize);
  }

  /**
   * Returns the cursor for the following page.
   *
   * @return cursor with {@code page + 1}
   */
  public PageRequest next() {
    return new PageRequest(page + 1, pageSize);
  }
}
