package ca.gc.cra.ingest.infrastructure.http;

import ca.gc.cra.ingest.application.port.HttpExchangePort;
import ca.gc.cra.ingest.config.ApiIngestConfig;
import ca.gc.cra.ingest.domain.ingest.PageRequest;
import ca.gc.cra.ingest.domain.ingest.RawResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import okio.BufferedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link HttpExchangePort} backed by OkHttp.
 * <p><strong>Why:</strong> One attempt, one call: retries belong to {@code RetryingPageFetcher}, so OkHttp's own
 * connection-failure retry is disabled.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Issue {@code GET {endpoint}?page=n&limit=size} with bearer, accept, and user-agent headers.</li>
 *   <li>Bound every attempt with a call timeout.</li>
 *   <li>Buffer at most {@code maxBodyBytes + 1} bytes so oversized bodies are detected without reading them whole.</li>
 * </ul>
 * <p><strong>Security:</strong> The token is only placed in the {@code Authorization} header and never logged.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; OkHttp clients are thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class OkHttpExchangeAdapter implements HttpExchangePort {
  private static final Logger log = LoggerFactory.getLogger(OkHttpExchangeAdapter.class);

  private final OkHttpClient client;
  private final HttpUrl endpoint;
  private final String authorization;
  private final String userAgent;
  private final long maxBodyBytes;

  /**
   * Creates an adapter.
   *
   * @param endpointUrl absolute endpoint URL without query
   * @param token bearer token
   * @param userAgent value of the {@code User-Agent} header
   * @param timeout per-attempt call timeout
   * @param maxBodyBytes largest accepted body; one extra byte is read to detect overflow
   * @throws IllegalArgumentException if the URL cannot be parsed
   */
  public OkHttpExchangeAdapter(
      String endpointUrl, String token, String userAgent, Duration timeout, long maxBodyBytes) {
    Objects.requireNonNull(endpointUrl, "endpointUrl");
    Objects.requireNonNull(token, "token");
    Objects.requireNonNull(timeout, "timeout");
    HttpUrl parsed = HttpUrl.parse(endpointUrl);
    if (parsed == null) {
      throw new IllegalArgumentException("Invalid endpoint URL: " + endpointUrl);
    }
    if (maxBodyBytes < 1) {
      throw new IllegalArgumentException("maxBodyBytes must be positive");
    }
    this.endpoint = parsed;
    this.authorization = "Bearer " + token;
    this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
    this.maxBodyBytes = maxBodyBytes;
    this.client = new OkHttpClient.Builder()
        .callTimeout(timeout)
        .retryOnConnectionFailure(false)
        .followRedirects(false)
        .build();
  }

  /**
   * Creates an adapter from validated API settings.
   *
   * @param config API settings
   * @return adapter bound to the configured endpoint
   */
  public static OkHttpExchangeAdapter fromConfig(ApiIngestConfig config) {
    return new OkHttpExchangeAdapter(
        config.endpointUrl(), config.token(), config.userAgent(), config.timeout(), config.maxPayloadBytes());
  }

  @Override
  public RawResponse fetch(PageRequest request) throws IOException {
    HttpUrl url = endpoint.newBuilder()
        .addQueryParameter("page", Integer.toString(request.page()))
        .addQueryParameter("limit", Integer.toString(request.pageSize()))
        .build();
    Request httpRequest = new Request.Builder()
        .url(url)
        .get()
        .header("Authorization", authorization)
        .header("Accept", "application/json")
        .header("User-Agent", userAgent)
        .build();

    try (Response response = client.newCall(httpRequest).execute()) {
      ResponseBody body = response.body();
      byte[] bytes = new byte[0];
      long observed = 0;
      if (body != null) {
        BufferedSource source = body.source();
        long limit = maxBodyBytes + 1;
        source.request(limit);
        Buffer buffer = source.getBuffer();
        bytes = buffer.readByteArray(Math.min(buffer.size(), limit));
        observed = Math.max(bytes.length, body.contentLength());
      }
      log.debug("GET {} -> {} ({} bytes)", url.encodedPath(), response.code(), observed);
      return new RawResponse(response.code(), bytes, observed, response.header("Retry-After"));
    }
  }

  @Override
  public void close() {
    client.dispatcher().executorService().shutdown();
    client.connectionPool().evictAll();
  }
}
