package ca.gc.cra.ingest.config;

import ca.gc.cra.ingest.logging.Logs;
import ca.gc.cra.ingest.validation.Numbers;
import ca.gc.cra.ingest.validation.Strings;
import ca.gc.cra.ingest.validation.Urls;
import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * <strong>What:</strong> Validated settings for one paginated API ingestion run.
 * <p><strong>Why:</strong> The retrying fetcher, payload guard, and paginator all read their limits from one
 * immutable object that was checked once at startup.</p>
 * <p><strong>Role:</strong> Configuration aggregate consumed by {@link CompositionRoot#apiSource(ApiIngestConfig)}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject non-https base URLs before any request is made.</li>
 *   <li>Resolve the bearer token from {@code token} or the {@value #TOKEN_ENV} environment variable.</li>
 *   <li>Bound page size, timeout, retries, depth, and batch limits.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 * <p><strong>Security:</strong> {@link #toString()} never prints the token.</p>
 *
 * @param baseUrl API root; scheme is always {@code https}; no trailing slash
 * @param endpoint path appended to the base URL; always starts with {@code /}
 * @param token bearer token
 * @param pageSize records requested per page
 * @param timeout per-attempt call timeout
 * @param maxRetries attempts per page before giving up
 * @param requiredFields field names every kept record must carry
 * @param dataField name of the record array inside a container object
 * @param maxPayloadBytes largest accepted response body
 * @param maxDepth deepest accepted container nesting; the root container counts as one
 * @param maxBatchRecords most records accepted from one page
 * @param backoffInitial first backoff delay after a failed attempt
 * @param backoffMax cap for the doubling backoff
 * @param rateLimitBudget total {@code Retry-After} waiting tolerated for one page
 * @param userAgent {@code User-Agent} header value
 * @since 0.1.0
 */
public record ApiIngestConfig(
    URI baseUrl,
    String endpoint,
    String token,
    int pageSize,
    Duration timeout,
    int maxRetries,
    Set<String> requiredFields,
    String dataField,
    long maxPayloadBytes,
    int maxDepth,
    int maxBatchRecords,
    Duration backoffInitial,
    Duration backoffMax,
    Duration rateLimitBudget,
    String userAgent) {

  /** Environment variable consulted when no {@code token} option is supplied. */
  public static final String TOKEN_ENV = "INGEST_API_TOKEN";
  /** Default byte limit for one page body (5 MiB). */
  public static final long DEFAULT_MAX_PAYLOAD_BYTES = 5L * 1024 * 1024;
  /** Default nesting-depth limit. */
  public static final int DEFAULT_MAX_DEPTH = 5;
  /** Default record limit for one page. */
  public static final int DEFAULT_MAX_BATCH_RECORDS = 10_000;
  /** Default {@code User-Agent}. */
  public static final String DEFAULT_USER_AGENT = "ingest-pipeline/1.0";
  /** Default required fields. */
  public static final Set<String> DEFAULT_REQUIRED_FIELDS =
      Collections.unmodifiableSet(new LinkedHashSet<>(List.of("sku", "quantity")));

  /**
   * Validates invariants shared by {@link #fromMap(Map)} and direct construction.
   *
   * @throws IllegalArgumentException when a value is out of range or the base URL is not https
   */
  public ApiIngestConfig {
    Objects.requireNonNull(baseUrl, "baseUrl");
    baseUrl = Urls.requireSecure("baseUrl", baseUrl.toString());
    endpoint = normalizeEndpoint(endpoint);
    token = Strings.requirePrintableAscii("token", Objects.requireNonNull(token, "token"), 8_192);
    Numbers.requireRange("pageSize", pageSize, 1, 10_000);
    Objects.requireNonNull(timeout, "timeout");
    Numbers.requireRange("timeoutSeconds", timeout.toSeconds(), 1, 600);
    Numbers.requireRange("maxRetries", maxRetries, 1, 20);
    requiredFields = Collections.unmodifiableSet(
        new LinkedHashSet<>(Objects.requireNonNull(requiredFields, "requiredFields")));
    dataField = Strings.requireNonBlank("dataField", dataField);
    Numbers.requireRange("maxPayloadBytes", maxPayloadBytes, 1, 256L * 1024 * 1024);
    Numbers.requireRange("maxDepth", maxDepth, 1, 64);
    Numbers.requireRange("maxBatchRecords", maxBatchRecords, 1, 1_000_000);
    Objects.requireNonNull(backoffInitial, "backoffInitial");
    Objects.requireNonNull(backoffMax, "backoffMax");
    Objects.requireNonNull(rateLimitBudget, "rateLimitBudget");
    Numbers.requireRange("backoffInitialSeconds", backoffInitial.toSeconds(), 0, 300);
    Numbers.requireRange("backoffMaxSeconds", backoffMax.toSeconds(), backoffInitial.toSeconds(), 3_600);
    Numbers.requireRange("rateLimitBudgetSeconds", rateLimitBudget.toSeconds(), 0, 86_400);
    userAgent = Strings.requirePrintableAscii("userAgent", userAgent, 256);
  }

  /**
   * Creates a configuration from CLI-style key/value pairs, reading the token fallback from the process environment.
   *
   * @param options keys such as {@code baseUrl}, {@code endpoint}, {@code pageSize}
   * @return validated configuration
   * @throws IllegalArgumentException when values are invalid or required settings are missing
   */
  public static ApiIngestConfig fromMap(Map<String, String> options) {
    return fromMap(options, System::getenv);
  }

  /**
   * Creates a configuration from key/value pairs with an explicit environment lookup.
   *
   * @param options keys such as {@code baseUrl}, {@code endpoint}, {@code pageSize}
   * @param env environment lookup used for {@value #TOKEN_ENV}
   * @return validated configuration
   * @throws IllegalArgumentException when values are invalid or required settings are missing
   */
  public static ApiIngestConfig fromMap(Map<String, String> options, UnaryOperator<String> env) {
    Objects.requireNonNull(options, "options");
    Objects.requireNonNull(env, "env");

    String rawBase = options.get("baseUrl");
    if (rawBase == null || rawBase.isBlank()) {
      throw new IllegalArgumentException("baseUrl is required");
    }
    URI baseUrl = Urls.requireSecure("baseUrl", rawBase);

    String token = firstNonBlank(options.get("token"), env.apply(TOKEN_ENV));
    if (token == null) {
      throw new IllegalArgumentException("token is required (token=... or " + TOKEN_ENV + ")");
    }

    String rawFields = options.get("requiredFields");
    Set<String> requiredFields = rawFields == null
        ? DEFAULT_REQUIRED_FIELDS
        : Strings.splitList("requiredFields", rawFields);

    String dataField = firstNonBlank(options.get("dataField"), "data");
    String userAgent = firstNonBlank(options.get("userAgent"), DEFAULT_USER_AGENT);

    return new ApiIngestConfig(
        baseUrl,
        options.getOrDefault("endpoint", "/"),
        token,
        Numbers.parseInt("pageSize", options.get("pageSize"), 100, 1, 10_000),
        Duration.ofSeconds(Numbers.parseLong("timeoutSeconds", options.get("timeoutSeconds"), 30, 1, 600)),
        Numbers.parseInt("maxRetries", options.get("maxRetries"), 3, 1, 20),
        requiredFields,
        dataField,
        Numbers.parseLong(
            "maxPayloadBytes", options.get("maxPayloadBytes"), DEFAULT_MAX_PAYLOAD_BYTES, 1, 256L * 1024 * 1024),
        Numbers.parseInt("maxDepth", options.get("maxDepth"), DEFAULT_MAX_DEPTH, 1, 64),
        Numbers.parseInt(
            "maxBatchRecords", options.get("maxBatchRecords"), DEFAULT_MAX_BATCH_RECORDS, 1, 1_000_000),
        Duration.ofSeconds(
            Numbers.parseLong("backoffInitialSeconds", options.get("backoffInitialSeconds"), 1, 0, 300)),
        Duration.ofSeconds(
            Numbers.parseLong("backoffMaxSeconds", options.get("backoffMaxSeconds"), 30, 0, 3_600)),
        Duration.ofSeconds(
            Numbers.parseLong("rateLimitBudgetSeconds", options.get("rateLimitBudgetSeconds"), 900, 0, 86_400)),
        userAgent);
  }

  /**
   * Returns the URL of the endpoint without pagination parameters.
   *
   * @return base URL joined with the endpoint path
   */
  public String endpointUrl() {
    return baseUrl + endpoint;
  }

  @Override
  public String toString() {
    return "ApiIngestConfig[baseUrl=" + baseUrl
        + ", endpoint=" + endpoint
        + ", token=" + Logs.redact(token)
        + ", pageSize=" + pageSize
        + ", timeout=" + timeout
        + ", maxRetries=" + maxRetries
        + ", requiredFields=" + requiredFields
        + ", dataField=" + dataField
        + ", maxPayloadBytes=" + maxPayloadBytes
        + ", maxDepth=" + maxDepth
        + ", maxBatchRecords=" + maxBatchRecords
        + ", backoffInitial=" + backoffInitial
        + ", backoffMax=" + backoffMax
        + ", rateLimitBudget=" + rateLimitBudget
        + ", userAgent=" + userAgent + "]";
  }

  private static String normalizeEndpoint(String endpoint) {
    if (endpoint == null || endpoint.isBlank()) {
      return "/";
    }
    String trimmed = Strings.requirePrintableAscii("endpoint", endpoint, 2_048);
    if (trimmed.contains("?") || trimmed.contains("#")) {
      throw new IllegalArgumentException("endpoint must not carry a query or fragment");
    }
    return trimmed.startsWith("/") ? trimmed : "/" + trimmed;
  }

  private static String firstNonBlank(String first, String second) {
    if (first != null && !first.isBlank()) {
      return first.trim();
    }
    if (second != null && !second.isBlank()) {
      return second.trim();
    }
    return null;
  }
}
