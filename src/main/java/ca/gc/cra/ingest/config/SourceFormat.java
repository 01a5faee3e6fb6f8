package ca.gc.cra.ingest.config;

import java.util.Locale;

/**
 * File formats understood by the local and object-store sources.
 *
 * @since 0.1.0
 */
public enum SourceFormat {
  /** Comma-separated values with a header row. */
  CSV("csv");

  private final String extension;

  SourceFormat(String extension) {
    this.extension = extension;
  }

  /**
   * Returns the file-name suffix matched by the sources.
   *
   * @return extension without the dot
   */
  public String extension() {
    return extension;
  }

  /**
   * Indicates whether a file name or object key carries this format's extension.
   *
   * @param name file name or key
   * @return {@code true} when the name ends with {@code .extension}, case-insensitively
   */
  public boolean matches(String name) {
    return name != null && name.toLowerCase(Locale.ROOT).endsWith("." + extension);
  }

  /**
   * Parses a {@code fileType} option.
   *
   * @param value option text; blank selects {@link #CSV}
   * @return parsed format
   * @throws IllegalArgumentException for parquet or any other unsupported type
   */
  public static SourceFormat fromString(String value) {
    if (value == null || value.isBlank()) {
      return CSV;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    if (normalized.startsWith(".")) {
      normalized = normalized.substring(1);
    }
    return switch (normalized) {
      case "csv" -> CSV;
      case "parquet" -> throw new IllegalArgumentException("fileType parquet is not supported; convert to csv");
      default -> throw new IllegalArgumentException("Unsupported fileType: " + value.trim());
    };
  }
}
