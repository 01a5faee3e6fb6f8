package ca.gc.cra.ingest.infrastructure.objectstore;

import ca.gc.cra.ingest.application.port.ObjectStorePort;
import ca.gc.cra.ingest.config.S3IngestConfig;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.S3Object;

/**
 * <strong>What:</strong> {@link ObjectStorePort} backed by the AWS SDK v2 synchronous S3 client.
 * <p><strong>Security:</strong> Static credentials are used only when configured; otherwise the default provider
 * chain resolves them. Secrets are never logged.</p>
 * <p><strong>Thread-safety:</strong> The SDK client is thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class S3ObjectStoreAdapter implements ObjectStorePort {
  private static final Logger log = LoggerFactory.getLogger(S3ObjectStoreAdapter.class);

  private final S3Client client;

  /**
   * Wraps an existing client.
   *
   * @param client S3 client; closed by {@link #close()}
   */
  public S3ObjectStoreAdapter(S3Client client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  /**
   * Builds a client from validated S3 settings.
   *
   * @param config S3 settings
   * @return adapter owning a new client
   */
  public static S3ObjectStoreAdapter fromConfig(S3IngestConfig config) {
    S3ClientBuilder builder = S3Client.builder()
        .region(Region.of(config.region()))
        .forcePathStyle(config.pathStyle());
    if (config.accessKeyId().isPresent() && config.secretAccessKey().isPresent()) {
      builder.credentialsProvider(StaticCredentialsProvider.create(
          AwsBasicCredentials.create(config.accessKeyId().get(), config.secretAccessKey().get())));
    } else {
      builder.credentialsProvider(DefaultCredentialsProvider.create());
    }
    config.endpoint().ifPresent(builder::endpointOverride);
    log.debug("S3 client: region={}, endpoint={}, pathStyle={}",
        config.region(), config.endpoint().map(Object::toString).orElse("default"), config.pathStyle());
    return new S3ObjectStoreAdapter(builder.build());
  }

  @Override
  public Listing list(String bucket, String prefix, String continuationToken) throws IOException {
    ListObjectsV2Request.Builder request = ListObjectsV2Request.builder().bucket(bucket);
    if (prefix != null && !prefix.isEmpty()) {
      request.prefix(prefix);
    }
    if (continuationToken != null) {
      request.continuationToken(continuationToken);
    }
    try {
      ListObjectsV2Response response = client.listObjectsV2(request.build());
      List<String> keys = response.contents().stream().map(S3Object::key).collect(Collectors.toList());
      String next = Boolean.TRUE.equals(response.isTruncated()) ? response.nextContinuationToken() : null;
      return new Listing(keys, next);
    } catch (SdkException ex) {
      throw new IOException("Failed to list s3://" + bucket + "/" + Objects.toString(prefix, ""), ex);
    }
  }

  @Override
  public byte[] read(String bucket, String key) throws IOException {
    GetObjectRequest request = GetObjectRequest.builder().bucket(bucket).key(key).build();
    try {
      return client.getObjectAsBytes(request).asByteArray();
    } catch (SdkException ex) {
      throw new IOException("Failed to read s3://" + bucket + "/" + key, ex);
    }
  }

  @Override
  public void close() {
    client.close();
  }
}
