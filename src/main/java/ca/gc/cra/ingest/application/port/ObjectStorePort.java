package ca.gc.cra.ingest.application.port;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Port for listing and reading objects from a bucket-style store.
 * <p><strong>Role:</strong> Implemented by {@code S3ObjectStoreAdapter}; consumed by {@code ObjectStoreDatasetSource}.</p>
 * <p><strong>Thread-safety:</strong> Implementations should be safe for sequential reuse.</p>
 *
 * @since 0.1.0
 */
public interface ObjectStorePort extends AutoCloseable {
  /**
   * Lists one page of keys under a prefix.
   *
   * @param bucket bucket name
   * @param prefix key prefix; empty for the whole bucket
   * @param continuationToken token from the previous page, or {@code null} for the first page
   * @return keys in store order plus the next continuation token
   * @throws IOException if the listing fails
   */
  Listing list(String bucket, String prefix, String continuationToken) throws IOException;

  /**
   * Reads a whole object.
   *
   * @param bucket bucket name
   * @param key object key
   * @return object bytes
   * @throws IOException if the object cannot be read
   */
  byte[] read(String bucket, String key) throws IOException;

  /**
   * Releases the underlying client. Default is a no-op.
   */
  @Override
  default void close() {}

  /**
   * One page of a key listing.
   *
   * @param keys object keys in store order
   * @param nextToken continuation token, or {@code null} when this is the last page
   */
  record Listing(List<String> keys, String nextToken) {
    /**
     * Copies the keys.
     */
    public Listing {
      keys = List.copyOf(Objects.requireNonNull(keys, "keys"));
    }

    /**
     * Returns the continuation token when more pages remain.
     *
     * @return token for the next page
     */
    public Optional<String> next() {
      return Optional.ofNullable(nextToken).filter(t -> !t.isEmpty());
    }
  }
}
