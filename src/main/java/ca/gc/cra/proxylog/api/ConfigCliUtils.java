package ca.gc.cra.proxylog.api;

import java.util.Map;

/**
 * Helpers for mixing CLI flags with YAML/map based configuration.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config=} path so it is not mistaken for an analysis key.
   *
   * @param args mutable CLI map
   * @return trimmed path, or {@code null} when absent
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    if (value != null && !value.isBlank()) {
      return value.trim();
    }
    return null;
  }

  /**
   * Reads a boolean flag value where a YAML key may stand in for a CLI flag ({@code dryRun: true}).
   *
   * @param map effective configuration
   * @param key key to read
   * @return parsed value; {@code false} when absent or blank
   */
  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && !value.isBlank() && Boolean.parseBoolean(value.trim());
  }
}
