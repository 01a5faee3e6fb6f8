package ca.gc.cra.ingest.application.port;

import ca.gc.cra.ingest.domain.ingest.IngestResult;
import java.io.Closeable;
import java.io.IOException;

/**
 * <strong>What:</strong> Port for anything that can produce a dataset in one call.
 * <p><strong>Why:</strong> The paginated API, local files, and object storage are interchangeable behind the same
 * {@code ingest()} contract, so the CLI wires one of them and treats the result uniformly.</p>
 * <p><strong>Role:</strong> Application port implemented by {@code ApiPaginator}, {@code LocalDatasetSource}, and
 * {@code ObjectStoreDatasetSource}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Accumulate every accepted record before returning (no streaming).</li>
 *   <li>Report runtime failures as diagnostics and an outcome; never throw for them.</li>
 *   <li>Release held clients on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations are single-threaded; one {@code ingest()} at a time.</p>
 *
 * @since 0.1.0
 */
public interface DatasetSource extends Closeable {
  /**
   * Runs the ingestion from the beginning.
   *
   * @return dataset, outcome, and diagnostics; never {@code null}
   */
  IngestResult ingest();

  /**
   * Returns a short identifier used in logs and results.
   *
   * @return source name such as {@code api}
   */
  String name();

  /**
   * Releases resources held by the source. Default is a no-op.
   *
   * @throws IOException if a held client fails to close
   */
  @Override
  default void close() throws IOException {}
}
