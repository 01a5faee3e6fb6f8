package ca.gc.cra.ingest.config;

import ca.gc.cra.ingest.validation.Numbers;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and cross-key invariants.
 */
public final class ConfigMerger {
  private static final List<String> SECRET_KEY_MARKERS = List.of("token", "secret", "password");

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * @param mode active ingestion mode
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when cross-key validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      IngestMode mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);

    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (entry.getValue() != null) {
        merged.put(key, entry.getValue());
      }
    }

    if (mode == IngestMode.API && !yamlCopy.getOrDefault("token", "").isBlank() && warn != null) {
      warn.accept("token read from YAML; prefer the " + ApiIngestConfig.TOKEN_ENV + " environment variable");
    }
    validate(mode, merged);
    return Map.copyOf(merged);
  }

  /**
   * Indicates whether a configuration key holds a secret that must never be printed.
   *
   * @param key configuration key
   * @return {@code true} for token and secret keys
   */
  public static boolean isSecretKey(String key) {
    if (key == null) {
      return false;
    }
    String lower = key.toLowerCase(Locale.ROOT);
    for (String marker : SECRET_KEY_MARKERS) {
      if (lower.contains(marker)) {
        return true;
      }
    }
    return false;
  }

  private static void validate(IngestMode mode, Map<String, String> effective) {
    if (mode == IngestMode.API) {
      long initial = Numbers.parseLong(
          "backoffInitialSeconds", effective.get("backoffInitialSeconds"), 1, 0, Long.MAX_VALUE);
      long max = Numbers.parseLong("backoffMaxSeconds", effective.get("backoffMaxSeconds"), 30, 0, Long.MAX_VALUE);
      if (max < initial) {
        throw new IllegalArgumentException("backoffMaxSeconds must be >= backoffInitialSeconds");
      }
    }
    if (mode == IngestMode.S3) {
      boolean hasKey = !trim(effective.get("awsAccessKeyId")).isEmpty();
      boolean hasSecret = !trim(effective.get("awsSecretAccessKey")).isEmpty();
      if (hasKey != hasSecret) {
        throw new IllegalArgumentException("awsAccessKeyId and awsSecretAccessKey must be supplied together");
      }
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
