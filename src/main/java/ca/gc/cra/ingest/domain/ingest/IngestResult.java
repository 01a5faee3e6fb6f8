package ca.gc.cra.ingest.domain.ingest;

import ca.gc.cra.ingest.domain.record.Dataset;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Everything an ingestion run hands back to its caller.
 * <p><strong>Why:</strong> Aborts return the partial dataset together with the reason instead of throwing, so
 * callers always see what was accepted before the stop.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param source name of the source that produced the result
 * @param dataset accepted rows; possibly partial on abort
 * @param outcome terminal state
 * @param diagnostics ordered observations made during the run
 * @param pagesFetched pages (or files/objects) successfully fetched
 * @since 0.1.0
 */
public record IngestResult(
    String source,
    Dataset dataset,
    IngestOutcome outcome,
    List<IngestDiagnostic> diagnostics,
    int pagesFetched) {

  /**
   * Validates and copies components.
   */
  public IngestResult {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(dataset, "dataset");
    Objects.requireNonNull(outcome, "outcome");
    diagnostics = List.copyOf(diagnostics);
  }

  /**
   * Indicates whether the run aborted.
   *
   * @return {@code true} for {@code ABORTED_*} outcomes
   */
  public boolean aborted() {
    return outcome.isAbort();
  }

  /**
   * Counts diagnostics of one kind.
   *
   * @param kind kind to count
   * @return number of matching diagnostics
   */
  public long count(DiagnosticKind kind) {
    return diagnostics.stream().filter(d -> d.kind() == kind).count();
  }

  /**
   * Indicates whether any diagnostic of the given kind was recorded.
   *
   * @param kind kind to look for
   * @return {@code true} when at least one matches
   */
  public boolean has(DiagnosticKind kind) {
    return count(kind) > 0;
  }
}
