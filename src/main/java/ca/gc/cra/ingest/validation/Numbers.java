package ca.gc.cra.ingest.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by CLI and configuration parsing.
 * <p><strong>Why:</strong> Page sizes, timeouts, retry counts, and payload limits are bounded before the pipeline
 * allocates clients or buffers.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses an integer option and checks its range, falling back to a default when blank.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw raw option text; {@code null} or blank selects {@code defaultValue}
   * @param defaultValue value used when the option is absent
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if the text is not an integer or lies outside the range
   */
  public static int parseInt(String name, String raw, int defaultValue, int min, int max) {
    return (int) parseLong(name, raw, defaultValue, min, max);
  }

  /**
   * Parses a long option and checks its range, falling back to a default when blank.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw raw option text; {@code null} or blank selects {@code defaultValue}
   * @param defaultValue value used when the option is absent
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if the text is not an integer or lies outside the range
   */
  public static long parseLong(String name, String raw, long defaultValue, long min, long max) {
    if (raw == null || raw.isBlank()) {
      return requireRange(name, defaultValue, min, max);
    }
    long value;
    try {
      value = Long.parseLong(raw.trim().replace("_", ""));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was " + raw.trim() + ")", ex);
    }
    return requireRange(name, value, min, max);
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
