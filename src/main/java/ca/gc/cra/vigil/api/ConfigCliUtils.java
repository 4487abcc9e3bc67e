package ca.gc.cra.vigil.api;

import java.util.Map;

/**
 * Helpers for CLI keys that steer configuration loading instead of being configuration themselves.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config} entry.
   *
   * @param args mutable CLI map
   * @return YAML path, or {@code null} when absent
   */
  static String extractConfigPath(Map<String, String> args) {
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }
}
