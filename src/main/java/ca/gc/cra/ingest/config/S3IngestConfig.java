package ca.gc.cra.ingest.config;

import ca.gc.cra.ingest.logging.Logs;
import ca.gc.cra.ingest.validation.Strings;
import ca.gc.cra.ingest.validation.Urls;
import java.net.URI;
import java.nio.charset.Charset;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Settings for ingesting CSV objects from an S3 bucket.
 * <p><strong>Why:</strong> Mirrors the local source so the same CSV reader serves both.</p>
 * <p><strong>Role:</strong> Configuration aggregate consumed by {@link CompositionRoot#objectStoreSource(S3IngestConfig)}.</p>
 * <p><strong>Security:</strong> Static credentials are optional; without them the AWS default provider chain applies.
 * {@link #toString()} redacts the secret.</p>
 *
 * @param bucket bucket name
 * @param prefix key prefix; empty for the whole bucket
 * @param format object format; selects which keys are read
 * @param region AWS region id
 * @param accessKeyId optional static access key id
 * @param secretAccessKey optional static secret key; present exactly when {@code accessKeyId} is
 * @param endpoint optional endpoint override for S3-compatible stores
 * @param pathStyle whether to use path-style addressing
 * @param fallbackCharset charset used when an object is not valid UTF-8
 * @since 0.1.0
 */
public record S3IngestConfig(
    String bucket,
    String prefix,
    SourceFormat format,
    String region,
    Optional<String> accessKeyId,
    Optional<String> secretAccessKey,
    Optional<URI> endpoint,
    boolean pathStyle,
    Charset fallbackCharset) {

  private static final Pattern BUCKET_PATTERN = Pattern.compile("^[a-z0-9][a-z0-9.-]{1,61}[a-z0-9]$");
  private static final Pattern REGION_PATTERN = Pattern.compile("^[a-z]{2}(-[a-z]+)+-\\d+$");

  /** Default region. */
  public static final String DEFAULT_REGION = "us-east-1";

  /**
   * Validates components.
   *
   * @throws IllegalArgumentException if the bucket or region is malformed or only one credential half is supplied
   */
  public S3IngestConfig {
    bucket = Strings.requireNonBlank("s3Bucket", bucket);
    if (!BUCKET_PATTERN.matcher(bucket).matches()) {
      throw new IllegalArgumentException("s3Bucket is not a valid bucket name: " + bucket);
    }
    prefix = prefix == null ? "" : prefix.trim();
    format = Objects.requireNonNullElse(format, SourceFormat.CSV);
    region = Strings.requireNonBlank("awsRegion", region);
    if (!REGION_PATTERN.matcher(region).matches()) {
      throw new IllegalArgumentException("awsRegion is not a valid region id: " + region);
    }
    accessKeyId = Objects.requireNonNullElse(accessKeyId, Optional.<String>empty()).filter(v -> !v.isBlank());
    secretAccessKey = Objects.requireNonNullElse(secretAccessKey, Optional.<String>empty()).filter(v -> !v.isBlank());
    if (accessKeyId.isPresent() != secretAccessKey.isPresent()) {
      throw new IllegalArgumentException("awsAccessKeyId and awsSecretAccessKey must be supplied together");
    }
    endpoint = Objects.requireNonNullElse(endpoint, Optional.empty());
    Objects.requireNonNull(fallbackCharset, "fallbackCharset");
  }

  /**
   * Creates a configuration from key/value pairs.
   *
   * @param options keys {@code s3Bucket}, {@code s3Prefix}, {@code fileType}, {@code awsRegion},
   *     {@code awsAccessKeyId}, {@code awsSecretAccessKey}, {@code s3Endpoint}, {@code s3PathStyle},
   *     {@code fallbackCharset}
   * @return validated configuration
   * @throws IllegalArgumentException when a value is invalid or the bucket is missing
   */
  public static S3IngestConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String bucket = options.get("s3Bucket");
    if (bucket == null || bucket.isBlank()) {
      throw new IllegalArgumentException("s3Bucket is required");
    }
    Optional<URI> endpoint = optional(options.get("s3Endpoint")).map(raw -> Urls.requireHttp("s3Endpoint", raw));
    String region = optional(options.get("awsRegion")).orElse(DEFAULT_REGION);
    return new S3IngestConfig(
        bucket,
        options.getOrDefault("s3Prefix", ""),
        SourceFormat.fromString(options.get("fileType")),
        region,
        optional(options.get("awsAccessKeyId")),
        optional(options.get("awsSecretAccessKey")),
        endpoint,
        LocalIngestConfig.parseBoolean(options.get("s3PathStyle"), endpoint.isPresent()),
        LocalIngestConfig.parseCharset(options.get("fallbackCharset")));
  }

  @Override
  public String toString() {
    return "S3IngestConfig[bucket=" + bucket
        + ", prefix=" + prefix
        + ", format=" + format
        + ", region=" + region
        + ", accessKeyId=" + accessKeyId.orElse("<default chain>")
        + ", secretAccessKey=" + secretAccessKey.map(Logs::redact).orElse("<default chain>")
        + ", endpoint=" + endpoint.map(URI::toString).orElse("<aws>")
        + ", pathStyle=" + pathStyle
        + ", fallbackCharset=" + fallbackCharset + "]";
  }

  private static Optional<String> optional(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
  }
}
