package ca.gc.cra.ingest.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.net.URI;
import org.junit.jupiter.api.Test;

class UrlsTest {

  @Test
  void secureUrlDropsTrailingSlashes() {
    assertEquals(URI.create("https://api.example.test/v1"), Urls.requireSecure("baseUrl", "https://api.example.test/v1//"));
  }

  @Test
  void secureRejectsOtherSchemes() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Urls.requireSecure("baseUrl", "http://api.example.test"));
    assertEquals("baseUrl must use https scheme", ex.getMessage());
  }

  @Test
  void requiresHostAndNoQuery() {
    assertThrows(IllegalArgumentException.class, () -> Urls.requireSecure("baseUrl", "https:///path"));
    assertThrows(IllegalArgumentException.class, () -> Urls.requireSecure("baseUrl", "https://h.test/?a=1"));
    assertThrows(IllegalArgumentException.class, () -> Urls.requireSecure("baseUrl", "not a uri"));
  }

  @Test
  void httpAllowsBothSchemes() {
    assertEquals("http", Urls.requireHttp("otelEndpoint", "http://collector:4317").getScheme());
    assertEquals("https", Urls.requireHttp("otelEndpoint", "https://collector:4317").getScheme());
    assertThrows(IllegalArgumentException.class, () -> Urls.requireHttp("otelEndpoint", "grpc://collector"));
  }
}
