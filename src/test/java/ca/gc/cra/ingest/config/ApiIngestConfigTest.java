package ca.gc.cra.ingest.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ApiIngestConfigTest {

  @Test
  void appliesDefaults() {
    ApiIngestConfig config = ApiIngestConfig.fromMap(
        Map.of("baseUrl", "https://api.example.test/", "token", "abc"), name -> null);

    assertEquals("https://api.example.test", config.baseUrl().toString());
    assertEquals("/", config.endpoint());
    assertEquals(100, config.pageSize());
    assertEquals(Duration.ofSeconds(30), config.timeout());
    assertEquals(3, config.maxRetries());
    assertEquals(List.of("sku", "quantity"), List.copyOf(config.requiredFields()));
    assertEquals("data", config.dataField());
    assertEquals(5L * 1024 * 1024, config.maxPayloadBytes());
    assertEquals(5, config.maxDepth());
    assertEquals(10_000, config.maxBatchRecords());
    assertEquals(Duration.ofSeconds(1), config.backoffInitial());
    assertEquals(Duration.ofSeconds(30), config.backoffMax());
    assertEquals(Duration.ofMinutes(15), config.rateLimitBudget());
    assertEquals(ApiIngestConfig.DEFAULT_USER_AGENT, config.userAgent());
  }

  @Test
  void joinsBaseUrlAndEndpoint() {
    ApiIngestConfig config = ApiIngestConfig.fromMap(
        Map.of("baseUrl", "https://api.example.test/v2", "endpoint", "inventory", "token", "abc"), name -> null);

    assertEquals("/inventory", config.endpoint());
    assertEquals("https://api.example.test/v2/inventory", config.endpointUrl());
  }

  @Test
  void rejectsPlainHttpBaseUrl() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ApiIngestConfig.fromMap(Map.of("baseUrl", "http://api.example.test", "token", "abc"), name -> null));
    assertTrue(ex.getMessage().contains("https"));
  }

  @Test
  void requiresBaseUrl() {
    assertThrows(IllegalArgumentException.class,
        () -> ApiIngestConfig.fromMap(Map.of("token", "abc"), name -> null));
  }

  @Test
  void tokenFallsBackToEnvironment() {
    ApiIngestConfig config = ApiIngestConfig.fromMap(
        Map.of("baseUrl", "https://api.example.test"),
        name -> ApiIngestConfig.TOKEN_ENV.equals(name) ? "from-env" : null);

    assertEquals("from-env", config.token());
  }

  @Test
  void explicitTokenWinsOverEnvironment() {
    ApiIngestConfig config = ApiIngestConfig.fromMap(
        Map.of("baseUrl", "https://api.example.test", "token", "explicit"), name -> "from-env");

    assertEquals("explicit", config.token());
  }

  @Test
  void missingTokenIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ApiIngestConfig.fromMap(Map.of("baseUrl", "https://api.example.test"), name -> null));
    assertTrue(ex.getMessage().contains(ApiIngestConfig.TOKEN_ENV));
  }

  @Test
  void toStringRedactsToken() {
    ApiIngestConfig config = ApiIngestConfig.fromMap(
        Map.of("baseUrl", "https://api.example.test", "token", "super-secret"), name -> null);

    assertFalse(config.toString().contains("super-secret"));
  }

  @Test
  void parsesRequiredFieldList() {
    ApiIngestConfig config = ApiIngestConfig.fromMap(
        Map.of("baseUrl", "https://api.example.test", "token", "abc", "requiredFields", "id, name,,id"),
        name -> null);

    assertEquals(List.of("id", "name"), List.copyOf(config.requiredFields()));
  }

  @Test
  void emptyRequiredFieldListAcceptsAnyObject() {
    ApiIngestConfig config = ApiIngestConfig.fromMap(
        Map.of("baseUrl", "https://api.example.test", "token", "abc", "requiredFields", ""), name -> null);

    assertTrue(config.requiredFields().isEmpty());
  }

  @Test
  void rejectsOutOfRangeLimits() {
    assertThrows(IllegalArgumentException.class, () -> withOverride("pageSize", "0"));
    assertThrows(IllegalArgumentException.class, () -> withOverride("maxRetries", "0"));
    assertThrows(IllegalArgumentException.class, () -> withOverride("maxDepth", "65"));
    assertThrows(IllegalArgumentException.class, () -> withOverride("timeoutSeconds", "abc"));
    assertThrows(IllegalArgumentException.class, () -> withOverride("endpoint", "/items?x=1"));
  }

  @Test
  void backoffCapMustCoverInitialDelay() {
    Map<String, String> options = new HashMap<>(Map.of("baseUrl", "https://api.example.test", "token", "abc"));
    options.put("backoffInitialSeconds", "10");
    options.put("backoffMaxSeconds", "5");

    assertThrows(IllegalArgumentException.class, () -> ApiIngestConfig.fromMap(options, name -> null));
  }

  private static ApiIngestConfig withOverride(String key, String value) {
    Map<String, String> options = new HashMap<>(Map.of("baseUrl", "https://api.example.test", "token", "abc"));
    options.put(key, value);
    return ApiIngestConfig.fromMap(options, name -> null);
  }
}
