package ca.gc.cra.vigil.infrastructure.detect;

import java.util.Locale;

/**
 * Closed set of detector variants selectable through configuration.
 *
 * @since 0.1.0
 */
public enum DetectorKind {
  /** Running-average background subtraction. */
  MOTION("motion"),
  /** Object detection through a pluggable inference engine. */
  NEURAL_NET("neural-net"),
  /** Replays detections recorded in a JSON log. */
  REPLAY_LOG("replay-log");

  private final String configName;

  DetectorKind(String configName) {
    this.configName = configName;
  }

  /**
   * Returns the value used for this variant in configuration files and on the command line.
   *
   * @return configuration name
   */
  public String configName() {
    return configName;
  }

  /**
   * Parses a configuration value. Accepts the configuration name or the constant name, case-insensitively.
   *
   * @param value configuration value
   * @return matching kind
   * @throws IllegalArgumentException if no variant matches
   */
  public static DetectorKind fromString(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("detector must be one of motion, neural-net, replay-log");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    for (DetectorKind kind : values()) {
      if (kind.configName.equals(normalized)) {
        return kind;
      }
    }
    throw new IllegalArgumentException(
        "detector must be one of motion, neural-net, replay-log (was " + value.trim() + ")");
  }
}
