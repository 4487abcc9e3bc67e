package ca.gc.cra.vigil.config;

import ca.gc.cra.vigil.validation.Numbers;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Typed readers over a flat configuration map. A missing or blank value yields the supplied fallback.
 */
final class ConfigValues {
  private ConfigValues() {}

  static String string(Map<String, String> kv, String key, String fallback) {
    String raw = kv.get(key);
    return raw == null || raw.isBlank() ? fallback : raw.trim();
  }

  static int boundedInt(Map<String, String> kv, String key, int fallback, int min, int max) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return (int) Numbers.requireRange(key, Long.parseLong(raw.trim()), min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was '" + raw + "')", ex);
    }
  }

  static long boundedLong(Map<String, String> kv, String key, long fallback, long min, long max) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Numbers.requireRange(key, Long.parseLong(raw.trim()), min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was '" + raw + "')", ex);
    }
  }

  static double boundedDouble(Map<String, String> kv, String key, double fallback, double min, double max) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Numbers.requireRange(key, Double.parseDouble(raw.trim()), min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a number (was '" + raw + "')", ex);
    }
  }

  static boolean bool(Map<String, String> kv, String key, boolean fallback) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    String value = raw.trim();
    if (value.equalsIgnoreCase("true")) {
      return true;
    }
    if (value.equalsIgnoreCase("false")) {
      return false;
    }
    throw new IllegalArgumentException(key + " must be true or false (was '" + raw + "')");
  }

  static Optional<Path> path(Map<String, String> kv, String key) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String value = raw.trim();
    if (value.startsWith("~/") || value.equals("~")) {
      value = System.getProperty("user.home", ".") + value.substring(1);
    }
    try {
      return Optional.of(Path.of(value).toAbsolutePath().normalize());
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + raw, ex);
    }
  }
}
