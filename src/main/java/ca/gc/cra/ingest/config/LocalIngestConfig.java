package ca.gc.cra.ingest.config;

import ca.gc.cra.ingest.validation.Paths;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Settings for ingesting CSV files from a local directory tree.
 * <p><strong>Role:</strong> Configuration aggregate consumed by {@link CompositionRoot#localSource(LocalIngestConfig)}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param directory root directory to scan; absolute and normalized
 * @param format file format; selects which files are read
 * @param recursive whether sub-directories are scanned
 * @param fallbackCharset charset used when a file is not valid UTF-8
 * @since 0.1.0
 */
public record LocalIngestConfig(Path directory, SourceFormat format, boolean recursive, Charset fallbackCharset) {

  /** Default directory scanned when {@code localPath} is absent. */
  public static final String DEFAULT_PATH = "./data/raw";
  /** Default charset for files that are not valid UTF-8. */
  public static final String DEFAULT_FALLBACK_CHARSET = "windows-1252";

  /**
   * Validates components.
   */
  public LocalIngestConfig {
    Objects.requireNonNull(directory, "directory");
    directory = directory.toAbsolutePath().normalize();
    format = Objects.requireNonNullElse(format, SourceFormat.CSV);
    Objects.requireNonNull(fallbackCharset, "fallbackCharset");
  }

  /**
   * Creates a configuration from key/value pairs.
   *
   * @param options keys {@code localPath}, {@code fileType}, {@code recursive}, {@code fallbackCharset}
   * @return validated configuration
   * @throws IllegalArgumentException when a value is invalid
   */
  public static LocalIngestConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String rawPath = options.get("localPath");
    Path directory = Paths.parse("localPath", rawPath == null || rawPath.isBlank() ? DEFAULT_PATH : rawPath);
    return new LocalIngestConfig(
        directory,
        SourceFormat.fromString(options.get("fileType")),
        parseBoolean(options.get("recursive"), true),
        parseCharset(options.get("fallbackCharset")));
  }

  static Charset parseCharset(String value) {
    String name = value == null || value.isBlank() ? DEFAULT_FALLBACK_CHARSET : value.trim();
    try {
      return Charset.forName(name);
    } catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
      throw new IllegalArgumentException("fallbackCharset is not supported: " + name, ex);
    }
  }

  static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String normalized = value.trim();
    if (normalized.equalsIgnoreCase("true")) {
      return true;
    }
    if (normalized.equalsIgnoreCase("false")) {
      return false;
    }
    throw new IllegalArgumentException("expected true or false (was " + normalized + ")");
  }
}
