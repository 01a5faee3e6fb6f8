package ca.gc.cra.ingest.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.util.Map;
import org.junit.jupiter.api.Test;

class S3IngestConfigTest {

  @Test
  void appliesDefaults() {
    S3IngestConfig config = S3IngestConfig.fromMap(Map.of("s3Bucket", "inventory-exports"));

    assertEquals("", config.prefix());
    assertEquals(S3IngestConfig.DEFAULT_REGION, config.region());
    assertTrue(config.accessKeyId().isEmpty());
    assertTrue(config.endpoint().isEmpty());
    assertFalse(config.pathStyle());
  }

  @Test
  void endpointOverrideDefaultsToPathStyle() {
    S3IngestConfig config = S3IngestConfig.fromMap(
        Map.of("s3Bucket", "inventory-exports", "s3Endpoint", "http://localhost:9000"));

    assertEquals(URI.create("http://localhost:9000"), config.endpoint().orElseThrow());
    assertTrue(config.pathStyle());
  }

  @Test
  void explicitPathStyleWins() {
    S3IngestConfig config = S3IngestConfig.fromMap(Map.of(
        "s3Bucket", "inventory-exports", "s3Endpoint", "http://localhost:9000", "s3PathStyle", "false"));

    assertFalse(config.pathStyle());
  }

  @Test
  void requiresValidBucketAndRegion() {
    assertThrows(IllegalArgumentException.class, () -> S3IngestConfig.fromMap(Map.of()));
    assertThrows(IllegalArgumentException.class, () -> S3IngestConfig.fromMap(Map.of("s3Bucket", "Bad_Bucket")));
    assertThrows(IllegalArgumentException.class,
        () -> S3IngestConfig.fromMap(Map.of("s3Bucket", "inventory-exports", "awsRegion", "mars")));
  }

  @Test
  void credentialsMustBePaired() {
    assertThrows(IllegalArgumentException.class,
        () -> S3IngestConfig.fromMap(Map.of("s3Bucket", "inventory-exports", "awsAccessKeyId", "AKIA123")));
  }

  @Test
  void toStringRedactsSecret() {
    S3IngestConfig config = S3IngestConfig.fromMap(Map.of(
        "s3Bucket", "inventory-exports", "awsAccessKeyId", "AKIA123", "awsSecretAccessKey", "very-secret"));

    assertFalse(config.toString().contains("very-secret"));
    assertTrue(config.toString().contains("AKIA123"));
  }

  @Test
  void rejectsNonHttpEndpoint() {
    assertThrows(IllegalArgumentException.class,
        () -> S3IngestConfig.fromMap(Map.of("s3Bucket", "inventory-exports", "s3Endpoint", "ftp://host")));
  }
}
