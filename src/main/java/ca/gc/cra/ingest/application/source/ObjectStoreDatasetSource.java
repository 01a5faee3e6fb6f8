package ca.gc.cra.ingest.application.source;

import ca.gc.cra.ingest.application.ingest.DiagnosticsCollector;
import ca.gc.cra.ingest.application.port.DatasetSource;
import ca.gc.cra.ingest.application.port.MetricsPort;
import ca.gc.cra.ingest.application.port.ObjectStorePort;
import ca.gc.cra.ingest.config.S3IngestConfig;
import ca.gc.cra.ingest.config.SourceFormat;
import ca.gc.cra.ingest.domain.ingest.DiagnosticKind;
import ca.gc.cra.ingest.domain.ingest.IngestDiagnostic;
import ca.gc.cra.ingest.domain.ingest.IngestOutcome;
import ca.gc.cra.ingest.domain.ingest.IngestResult;
import ca.gc.cra.ingest.domain.record.DataRecord;
import ca.gc.cra.ingest.domain.record.Dataset;
import java.io.IOException;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link DatasetSource} that concatenates every CSV object under a bucket prefix.
 * <p><strong>Responsibilities:</strong> follows listing continuation tokens to the end, keeps keys matching the format
 * extension in listing order, and parses each object with the shared {@link CsvRecordReader}. An unreadable object is
 * skipped with {@code SOURCE_READ_ERROR}; a failed listing aborts with {@link IngestOutcome#ABORTED_SOURCE}.</p>
 * <p><strong>Thread-safety:</strong> Stateless between runs; owns the store client and closes it.</p>
 *
 * @since 0.1.0
 */
public final class ObjectStoreDatasetSource implements DatasetSource {
  private static final Logger log = LoggerFactory.getLogger(ObjectStoreDatasetSource.class);
  private static final String NAME = "s3";

  private final ObjectStorePort store;
  private final String bucket;
  private final String prefix;
  private final SourceFormat format;
  private final Charset fallbackCharset;
  private final CsvRecordReader reader;
  private final MetricsPort metrics;

  /**
   * Creates an object-store source.
   *
   * @param config validated S3 settings
   * @param store object store client
   * @param reader CSV parser
   * @param metrics metrics sink
   */
  public ObjectStoreDatasetSource(
      S3IngestConfig config, ObjectStorePort store, CsvRecordReader reader, MetricsPort metrics) {
    Objects.requireNonNull(config, "config");
    this.store = Objects.requireNonNull(store, "store");
    this.bucket = config.bucket();
    this.prefix = config.prefix();
    this.format = config.format();
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
    String location = "s3://" + bucket + "/" + prefix;
    List<String> keys;
    try {
      keys = listKeys();
    } catch (IOException | RuntimeException ex) {
      diagnostics.record(IngestDiagnostic.resource(
          DiagnosticKind.SOURCE_READ_ERROR, location, "cannot list objects: " + ex.getMessage()));
      return finish(diagnostics, Dataset.empty(), IngestOutcome.ABORTED_SOURCE, 0);
    }

    if (keys.isEmpty()) {
      diagnostics.record(IngestDiagnostic.resource(
          DiagnosticKind.SOURCE_EMPTY, location, "no ." + format.extension() + " objects found"));
      return finish(diagnostics, Dataset.empty(), IngestOutcome.COMPLETED_EMPTY, 0);
    }

    Dataset.Builder dataset = Dataset.builder();
    int objectsRead = 0;
    for (String key : keys) {
      try {
        List<DataRecord> rows = reader.read(TextDecoding.decode(store.read(bucket, key), fallbackCharset));
        dataset.addAll(rows);
        objectsRead++;
        log.debug("Read {} rows from s3://{}/{}", rows.size(), bucket, key);
      } catch (IOException | RuntimeException ex) {
        diagnostics.record(IngestDiagnostic.resource(
            DiagnosticKind.SOURCE_READ_ERROR, key, ex.getClass().getSimpleName() + ": " + ex.getMessage()));
      }
    }
    return finish(diagnostics, dataset.build(), IngestOutcome.completed(dataset.size()), objectsRead);
  }

  @Override
  public void close() {
    store.close();
  }

  private List<String> listKeys() throws IOException {
    List<String> keys = new ArrayList<>();
    String token = null;
    do {
      ObjectStorePort.Listing listing = store.list(bucket, prefix, token);
      for (String key : listing.keys()) {
        if (format.matches(key)) {
          keys.add(key);
        }
      }
      token = listing.next().orElse(null);
    } while (token != null);
    return keys;
  }

  private IngestResult finish(
      DiagnosticsCollector diagnostics, Dataset dataset, IngestOutcome outcome, int objectsRead) {
    metrics.increment("ingest.run.outcome." + outcome.metricLabel());
    log.info("Object store ingestion finished: outcome={}, rows={}, columns={}, objects={}",
        outcome, dataset.size(), dataset.columns().size(), objectsRead);
    return new IngestResult(NAME, dataset, outcome, diagnostics.snapshot(), objectsRead);
  }
}
