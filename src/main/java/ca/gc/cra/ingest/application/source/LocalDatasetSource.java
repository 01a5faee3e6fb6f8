package ca.gc.cra.ingest.application.source;

import ca.gc.cra.ingest.application.ingest.DiagnosticsCollector;
import ca.gc.cra.ingest.application.port.DatasetSource;
import ca.gc.cra.ingest.application.port.MetricsPort;
import ca.gc.cra.ingest.config.LocalIngestConfig;
import ca.gc.cra.ingest.config.SourceFormat;
import ca.gc.cra.ingest.domain.ingest.DiagnosticKind;
import ca.gc.cra.ingest.domain.ingest.IngestDiagnostic;
import ca.gc.cra.ingest.domain.ingest.IngestOutcome;
import ca.gc.cra.ingest.domain.ingest.IngestResult;
import ca.gc.cra.ingest.domain.record.DataRecord;
import ca.gc.cra.ingest.domain.record.Dataset;
import ca.gc.cra.ingest.validation.Paths;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link DatasetSource} that concatenates every CSV file under a local directory.
 * <p><strong>Why:</strong> Lets the same pipeline run against exported files when the API is not in play.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Walk the directory (recursively unless disabled) and keep regular files matching the format extension.</li>
 *   <li>Read files in path order; an unreadable or unparsable file is skipped with {@code SOURCE_READ_ERROR}.</li>
 *   <li>No matching files completes empty with a {@code SOURCE_EMPTY} warning; a missing directory aborts with
 *   {@link IngestOutcome#ABORTED_SOURCE}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless between runs.</p>
 *
 * @since 0.1.0
 */
public final class LocalDatasetSource implements DatasetSource {
  private static final Logger log = LoggerFactory.getLogger(LocalDatasetSource.class);
  private static final String NAME = "local";

  private final Path directory;
  private final SourceFormat format;
  private final boolean recursive;
  private final Charset fallbackCharset;
  private final CsvRecordReader reader;
  private final MetricsPort metrics;

  /**
   * Creates a local source.
   *
   * @param config validated local settings
   * @param reader CSV parser
   * @param metrics metrics sink
   */
  public LocalDatasetSource(LocalIngestConfig config, CsvRecordReader reader, MetricsPort metrics) {
    Objects.requireNonNull(config, "config");
    this.directory = config.directory();
    this.format = config.format();
    this.recursive = config.recursive();
    this.fallbackCharset = config.fallbackCharset();
    this.reader = Objects.requireNonNull(reader, "reader");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public IngestResult ingest() {
    DiagnosticsCollector diagnostics = new DiagnosticsCollector(NAME);
    List<Path> files;
    try {
      files = listFiles(Paths.requireReadableDir(directory));
    } catch (IllegalArgumentException | IOException | UncheckedIOException ex) {
      diagnostics.record(IngestDiagnostic.resource(
          DiagnosticKind.SOURCE_READ_ERROR, directory.toString(), "cannot list directory: " + ex.getMessage()));
      return finish(diagnostics, Dataset.empty(), IngestOutcome.ABORTED_SOURCE, 0);
    }

    if (files.isEmpty()) {
      diagnostics.record(IngestDiagnostic.resource(
          DiagnosticKind.SOURCE_EMPTY, directory.toString(), "no ." + format.extension() + " files found"));
      return finish(diagnostics, Dataset.empty(), IngestOutcome.COMPLETED_EMPTY, 0);
    }

    Dataset.Builder dataset = Dataset.builder();
    int filesRead = 0;
    for (Path file : files) {
      try {
        List<DataRecord> rows = reader.read(TextDecoding.decode(Files.readAllBytes(file), fallbackCharset));
        dataset.addAll(rows);
        filesRead++;
        log.debug("Read {} rows from {}", rows.size(), file);
      } catch (IOException | RuntimeException ex) {
        diagnostics.record(IngestDiagnostic.resource(
            DiagnosticKind.SOURCE_READ_ERROR, file.toString(), ex.getClass().getSimpleName() + ": " + ex.getMessage()));
      }
    }
    return finish(diagnostics, dataset.build(), IngestOutcome.completed(dataset.size()), filesRead);
  }

  private List<Path> listFiles(Path root) throws IOException {
    try (Stream<Path> walk = Files.walk(root, recursive ? Integer.MAX_VALUE : 1)) {
      return walk
          .filter(Files::isRegularFile)
          .filter(p -> format.matches(p.getFileName().toString()))
          .sorted()
          .collect(Collectors.toList());
    }
  }

  private IngestResult finish(
      DiagnosticsCollector diagnostics, Dataset dataset, IngestOutcome outcome, int filesRead) {
    metrics.increment("ingest.run.outcome." + outcome.metricLabel());
    log.info("Local ingestion finished: outcome={}, rows={}, columns={}, files={}",
        outcome, dataset.size(), dataset.columns().size(), filesRead);
    return new IngestResult(NAME, dataset, outcome, diagnostics.snapshot(), filesRead);
  }
}
