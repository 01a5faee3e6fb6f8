package ca.gc.cra.ingest.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each ingestion mode.
 *
 * <p>The defaults are the lowest precedence layer under YAML and CLI values. Keys with no sensible default
 * ({@code baseUrl}, {@code token}, {@code s3Bucket}) are absent.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target ingestion mode
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(IngestMode mode) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (mode) {
      case API -> buildApiDefaults();
      case LOCAL -> buildLocalDefaults();
      case S3 -> buildS3Defaults();
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("previewRows", "20");
    map.put("dryRun", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildApiDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("endpoint", "/");
    map.put("pageSize", "100");
    map.put("timeoutSeconds", "30");
    map.put("maxRetries", "3");
    map.put("requiredFields", String.join(",", ApiIngestConfig.DEFAULT_REQUIRED_FIELDS));
    map.put("dataField", "data");
    map.put("maxPayloadBytes", Long.toString(ApiIngestConfig.DEFAULT_MAX_PAYLOAD_BYTES));
    map.put("maxDepth", Integer.toString(ApiIngestConfig.DEFAULT_MAX_DEPTH));
    map.put("maxBatchRecords", Integer.toString(ApiIngestConfig.DEFAULT_MAX_BATCH_RECORDS));
    map.put("backoffInitialSeconds", "1");
    map.put("backoffMaxSeconds", "30");
    map.put("rateLimitBudgetSeconds", Long.toString(Duration.ofMinutes(15).toSeconds()));
    map.put("userAgent", ApiIngestConfig.DEFAULT_USER_AGENT);
    return map;
  }

  private static Map<String, String> buildLocalDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("localPath", LocalIngestConfig.DEFAULT_PATH);
    map.put("fileType", SourceFormat.CSV.extension());
    map.put("recursive", "true");
    map.put("fallbackCharset", LocalIngestConfig.DEFAULT_FALLBACK_CHARSET);
    return map;
  }

  private static Map<String, String> buildS3Defaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("s3Prefix", "");
    map.put("fileType", SourceFormat.CSV.extension());
    map.put("awsRegion", S3IngestConfig.DEFAULT_REGION);
    map.put("fallbackCharset", LocalIngestConfig.DEFAULT_FALLBACK_CHARSET);
    return map;
  }
}
