package ca.gc.cra.ingest.api;

import ca.gc.cra.ingest.config.ConfigMerger;
import ca.gc.cra.ingest.logging.Logs;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Helpers shared by the CLI for YAML paths, boolean switches, and printable plans.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && "true".equals(value.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Renders a configuration map as aligned {@code key : value} lines in key order with secrets redacted.
   */
  static List<String> redactedLines(Map<String, String> effective) {
    Map<String, String> sorted = new TreeMap<>(effective);
    int width = 0;
    for (String key : sorted.keySet()) {
      width = Math.max(width, key.length());
    }
    List<String> lines = new ArrayList<>(sorted.size());
    for (Map.Entry<String, String> entry : sorted.entrySet()) {
      String value = entry.getValue() == null || entry.getValue().isEmpty() ? "<unset>" : entry.getValue();
      if (ConfigMerger.isSecretKey(entry.getKey()) && !"<unset>".equals(value)) {
        value = Logs.redact(value);
      }
      lines.add(String.format(Locale.ROOT, " %-" + width + "s : %s", entry.getKey(), value));
    }
    return lines;
  }
}
