package ca.gc.cra.ingest.validation;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Endpoint validation for the API base URL and object-store endpoint overrides.
 *
 * @since 0.1.0
 */
public final class Urls {
  private Urls() {
    // Utility
  }

  /**
   * Validates that a URL uses {@code https} and names a host.
   *
   * @param name logical parameter name for diagnostics
   * @param raw candidate URL
   * @return parsed URI with any trailing slash removed from the path
   * @throws IllegalArgumentException if the URL is malformed, insecure, or host-less
   */
  public static URI requireSecure(String name, String raw) {
    URI uri = parse(name, raw);
    if (!"https".equals(scheme(uri))) {
      throw new IllegalArgumentException(name + " must use https scheme");
    }
    return stripTrailingSlash(uri);
  }

  /**
   * Validates that a URL uses {@code http} or {@code https} and names a host.
   *
   * @param name logical parameter name for diagnostics
   * @param raw candidate URL
   * @return parsed URI
   * @throws IllegalArgumentException if the URL is malformed, uses another scheme, or is host-less
   */
  public static URI requireHttp(String name, String raw) {
    URI uri = parse(name, raw);
    String scheme = scheme(uri);
    if (!"http".equals(scheme) && !"https".equals(scheme)) {
      throw new IllegalArgumentException(name + " must use http or https scheme");
    }
    return uri;
  }

  private static URI parse(String name, String raw) {
    String trimmed = Strings.requireNonBlank(name, raw);
    URI uri;
    try {
      uri = new URI(trimmed);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(name + " must be a valid URI", ex);
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException(name + " must include a host");
    }
    if (uri.getRawQuery() != null || uri.getRawFragment() != null) {
      throw new IllegalArgumentException(name + " must not carry a query or fragment");
    }
    return uri;
  }

  private static String scheme(URI uri) {
    return uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
  }

  private static URI stripTrailingSlash(URI uri) {
    String text = uri.toString();
    while (text.endsWith("/")) {
      text = text.substring(0, text.length() - 1);
    }
    return URI.create(text);
  }
}
