package ca.gc.cra.ingest.api;

import ca.gc.cra.ingest.application.port.DatasetSource;
import ca.gc.cra.ingest.application.port.MetricsPort;
import ca.gc.cra.ingest.config.ApiIngestConfig;
import ca.gc.cra.ingest.config.CompositionRoot;
import ca.gc.cra.ingest.config.ConfigMerger;
import ca.gc.cra.ingest.config.DefaultsForMode;
import ca.gc.cra.ingest.config.IngestMode;
import ca.gc.cra.ingest.config.LocalIngestConfig;
import ca.gc.cra.ingest.config.S3IngestConfig;
import ca.gc.cra.ingest.config.YamlConfigLoader;
import ca.gc.cra.ingest.domain.ingest.DiagnosticKind;
import ca.gc.cra.ingest.domain.ingest.IngestDiagnostic;
import ca.gc.cra.ingest.domain.ingest.IngestResult;
import ca.gc.cra.ingest.domain.record.Dataset;
import ca.gc.cra.ingest.logging.LoggingConfigurator;
import ca.gc.cra.ingest.validation.Numbers;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs one ingestion for a mode and reports the result on the console.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Merge CLI arguments, the optional YAML file, and built-in defaults.</li>
 *   <li>Print a redacted plan for {@code --dry-run}; otherwise run the source and print a summary.</li>
 *   <li>Print up to {@code previewRows} rows as JSON lines for {@code --preview}.</li>
 *   <li>Map the outcome to an {@link ExitCode}.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class IngestCli {
  private static final Logger log = LoggerFactory.getLogger(IngestCli.class);
  private static final ObjectMapper JSON = new ObjectMapper();
  private static final int MAX_PREVIEW_ROWS = 10_000;

  private IngestCli() {}

  /**
   * Runs a mode with production wiring.
   *
   * @param mode ingestion mode
   * @param args arguments after the mode name
   * @return exit code
   */
  static ExitCode run(IngestMode mode, String[] args) {
    return run(mode, args, CompositionRoot::new);
  }

  /**
   * Runs a mode with a caller-supplied composition root.
   *
   * @param mode ingestion mode
   * @param args arguments after the mode name
   * @param rootFactory builds the composition root around the selected metrics adapter
   * @return exit code
   */
  static ExitCode run(IngestMode mode, String[] args, Function<MetricsPort, CompositionRoot> rootFactory) {
    return runWith(mode, args, (metrics, m, effective) -> rootFactory.apply(metrics).source(m, effective));
  }

  /**
   * Runs a mode with a caller-supplied source factory.
   *
   * @param mode ingestion mode
   * @param args arguments after the mode name
   * @param sources builds the source; an {@link IllegalArgumentException} from it is a configuration error
   * @return exit code
   */
  static ExitCode runWith(IngestMode mode, String[] args, SourceFactory sources) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(helpText(mode));
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {} ingestion", mode.key());
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage(mode));
      return ExitCode.INVALID_ARGS;
    }

    Optional<Map<String, String>> yaml = Optional.empty();
    String configPath = ConfigCliUtils.extractConfigPath(kv);
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yaml = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    Map<String, String> effective;
    int previewRows;
    String exporter;
    try {
      effective = new LinkedHashMap<>(
          ConfigMerger.buildEffectiveConfig(mode, yaml, kv, DefaultsForMode.asFlatMap(mode), log::warn));
      previewRows = Numbers.parseInt("previewRows", effective.remove("previewRows"), 20, 0, MAX_PREVIEW_ROWS);
      exporter = TelemetryConfigurator.configureMetrics(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", mode.key(), ex.getMessage());
      CliPrinter.println(usage(mode));
      return ExitCode.CONFIG_ERROR;
    }

    boolean dryRun = input.hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(effective, "dryRun");
    boolean preview = input.hasFlag("--preview");
    effective.remove("dryRun");

    if (dryRun) {
      return dryRun(mode, effective, exporter);
    }

    MetricsPort metrics;
    try {
      metrics = CompositionRoot.metricsFor(exporter);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid metrics configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    DatasetSource built;
    try {
      built = sources.create(metrics, mode, effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", mode.key(), ex.getMessage());
      closeMetrics(metrics);
      return ExitCode.CONFIG_ERROR;
    }

    try (DatasetSource source = built) {
      log.info("Starting {} ingestion (metricsExporter={})", source.name(), exporter);
      IngestResult result = source.ingest();
      printSummary(result);
      if (preview) {
        printPreview(result.dataset(), previewRows);
      }
      return exitCodeFor(result);
    } catch (IOException ex) {
      log.error("I/O failure during {} ingestion", mode.key(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure during {} ingestion", mode.key(), ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      closeMetrics(metrics);
    }
  }

  /**
   * Maps a finished run to a process status.
   *
   * @param result ingestion result
   * @return exit code
   */
  static ExitCode exitCodeFor(IngestResult result) {
    if (!result.aborted()) {
      return ExitCode.SUCCESS;
    }
    if (result.has(DiagnosticKind.UNAUTHORIZED)) {
      return ExitCode.CONFIG_ERROR;
    }
    if (result.has(DiagnosticKind.INTERRUPTED)) {
      return ExitCode.INTERRUPTED;
    }
    return ExitCode.INGEST_ABORTED;
  }

  private static ExitCode dryRun(IngestMode mode, Map<String, String> effective, String exporter) {
    try {
      // Validate without opening clients.
      switch (mode) {
        case API -> ApiIngestConfig.fromMap(effective);
        case LOCAL -> LocalIngestConfig.fromMap(effective);
        case S3 -> S3IngestConfig.fromMap(effective);
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", mode.key(), ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }
    List<String> lines = new ArrayList<>();
    lines.add("Ingest dry-run (" + mode.key() + "): no requests will be made.");
    lines.addAll(ConfigCliUtils.redactedLines(effective));
    lines.add(" metricsExporter : " + exporter);
    lines.add(" Re-run without --dry-run to ingest.");
    CliPrinter.printLines(lines.toArray(String[]::new));
    return ExitCode.SUCCESS;
  }

  private static void printSummary(IngestResult result) {
    Dataset dataset = result.dataset();
    Map<DiagnosticKind, Integer> counts = new EnumMap<>(DiagnosticKind.class);
    for (IngestDiagnostic diagnostic : result.diagnostics()) {
      counts.merge(diagnostic.kind(), 1, Integer::sum);
    }
    List<String> lines = new ArrayList<>();
    lines.add("Ingest " + result.source() + " finished: " + result.outcome());
    lines.add(" Rows        : " + dataset.size());
    lines.add(" Columns     : " + dataset.columns());
    lines.add(" Pages/files : " + result.pagesFetched());
    lines.add(" Diagnostics : " + (counts.isEmpty() ? "none" : counts));
    CliPrinter.printLines(lines.toArray(String[]::new));
  }

  private static void printPreview(Dataset dataset, int limit) throws IOException {
    List<Map<String, Object>> rows = dataset.toRowMaps();
    int shown = Math.min(limit, rows.size());
    for (int i = 0; i < shown; i++) {
      CliPrinter.println(JSON.writeValueAsString(rows.get(i)));
    }
    if (rows.size() > shown) {
      CliPrinter.println("... " + (rows.size() - shown) + " more rows");
    }
  }

  private static void closeMetrics(MetricsPort metrics) {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to flush metrics on shutdown", ex);
      }
    }
  }

  /** Builds the source for one run around the selected metrics adapter. */
  @FunctionalInterface
  interface SourceFactory {
    DatasetSource create(MetricsPort metrics, IngestMode mode, Map<String, String> effective);
  }

  private static String usage(IngestMode mode) {
    return switch (mode) {
      case API -> "usage: ingest api baseUrl=https://HOST [endpoint=/PATH] [token=...] [pageSize=N] "
          + "[requiredFields=a,b] [config=FILE] [--dry-run] [--preview] [--verbose]";
      case LOCAL -> "usage: ingest local [localPath=DIR] [recursive=true|false] [fileType=csv] "
          + "[fallbackCharset=NAME] [config=FILE] [--dry-run] [--preview] [--verbose]";
      case S3 -> "usage: ingest s3 s3Bucket=NAME [s3Prefix=PREFIX] [awsRegion=REGION] [s3Endpoint=URL] "
          + "[config=FILE] [--dry-run] [--preview] [--verbose]";
    };
  }

  private static String helpText(IngestMode mode) {
    String common = """

        Common:
          config=FILE                YAML file with common and %s sections
          previewRows=N              Rows printed by --preview (default 20)
          metricsExporter=otlp|none  Metrics exporter (default none)
          otelEndpoint=URL           OTLP endpoint when metricsExporter=otlp
          --dry-run                  Validate and print the redacted plan
          --preview                  Print the first rows as JSON lines
          --verbose                  Enable DEBUG logging
          --help                     Show this message
        """.formatted(mode.key());
    String specific = switch (mode) {
      case API -> """
          Paginated API ingestion

          Required:
            baseUrl=https://HOST       API base URL (https only)
            token=...                  Bearer token (or INGEST_API_TOKEN)

          Optional:
            endpoint=/PATH             Endpoint path (default /)
            pageSize=N                 Records per page (default 100)
            timeoutSeconds=N           Per-attempt timeout (default 30)
            maxRetries=N               Attempts per page (default 3)
            requiredFields=a,b         Fields every record must carry (default sku,quantity)
            dataField=NAME             Array field in object responses (default data)
            maxPayloadBytes=N          Largest accepted body (default 5242880)
            maxDepth=N                 Deepest accepted nesting (default 5)
            maxBatchRecords=N          Most records per page (default 10000)
            backoffInitialSeconds=N    First retry wait (default 1)
            backoffMaxSeconds=N        Retry wait cap (default 30)
            rateLimitBudgetSeconds=N   Total 429 wait per page (default 900)
          """;
      case LOCAL -> """
          Local CSV ingestion

          Optional:
            localPath=DIR              Directory to scan (default ./data/raw)
            recursive=true|false       Scan sub-directories (default true)
            fileType=csv               File format (only csv)
            fallbackCharset=NAME       Charset for non-UTF-8 files (default windows-1252)
          """;
      case S3 -> """
          S3 CSV ingestion

          Required:
            s3Bucket=NAME              Bucket to read

          Optional:
            s3Prefix=PREFIX            Key prefix
            awsRegion=REGION           Region (default us-east-1)
            awsAccessKeyId=ID          Static credentials (with awsSecretAccessKey)
            awsSecretAccessKey=SECRET
            s3Endpoint=URL             Endpoint override for S3-compatible stores
            s3PathStyle=true|false     Path-style addressing
            fileType=csv               Object format (only csv)
            fallbackCharset=NAME       Charset for non-UTF-8 objects (default windows-1252)
          """;
    };
    return (specific + common).stripTrailing();
  }
}
