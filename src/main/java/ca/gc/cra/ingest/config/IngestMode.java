package ca.gc.cra.ingest.config;

import java.util.Locale;

/**
 * <strong>What:</strong> Source kinds the ingestion CLI can run.
 * <p><strong>Role:</strong> Selects the YAML section, the defaults, and the {@code DatasetSource} wired by
 * {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum IngestMode {
  /** Paginated HTTP API. */
  API,
  /** CSV files on the local filesystem. */
  LOCAL,
  /** CSV objects in an S3 bucket. */
  S3;

  /**
   * Parses a mode name case-insensitively.
   *
   * @param value textual representation such as {@code "api"}
   * @return parsed mode
   * @throws IllegalArgumentException if the value is blank or unknown
   */
  public static IngestMode fromString(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("mode must not be blank");
    }
    try {
      return IngestMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown mode: " + value, ex);
    }
  }

  /**
   * Returns the lower-case name used for YAML sections and CLI commands.
   *
   * @return section key such as {@code "s3"}
   */
  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }
}
