package ca.gc.cra.ingest.application.ingest;

import ca.gc.cra.ingest.domain.ingest.IngestDiagnostic;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Ordered sink for the diagnostics of one run.
 * <p><strong>Why:</strong> Every observation is both returned to the caller inside the result and logged at the level
 * matching its severity.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; owned by a single run.</p>
 *
 * @since 0.1.0
 */
public final class DiagnosticsCollector {
  private static final Logger log = LoggerFactory.getLogger(DiagnosticsCollector.class);

  private final String source;
  private final List<IngestDiagnostic> diagnostics = new ArrayList<>();

  /**
   * Creates a collector for one run.
   *
   * @param source source name prefixed to log lines
   */
  public DiagnosticsCollector(String source) {
    this.source = Objects.requireNonNull(source, "source");
  }

  /**
   * Appends and logs a diagnostic.
   *
   * @param diagnostic observation to record; must not be {@code null}
   */
  public void record(IngestDiagnostic diagnostic) {
    Objects.requireNonNull(diagnostic, "diagnostic");
    diagnostics.add(diagnostic);
    switch (diagnostic.severity()) {
      case INFO -> log.info("[{}] {}", source, diagnostic.summary());
      case WARN -> log.warn("[{}] {}", source, diagnostic.summary());
      case ERROR -> log.error("[{}] {}", source, diagnostic.summary());
    }
  }

  /**
   * Returns the number of diagnostics recorded so far.
   *
   * @return diagnostic count
   */
  public int size() {
    return diagnostics.size();
  }

  /**
   * Returns an immutable copy of the recorded diagnostics in order.
   *
   * @return diagnostics snapshot
   */
  public List<IngestDiagnostic> snapshot() {
    return List.copyOf(diagnostics);
  }
}
