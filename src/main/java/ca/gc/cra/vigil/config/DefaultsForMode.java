package ca.gc.cra.vigil.config;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each VIGIL mode.
 * <p>The defaults are the single source of truth for optional keys; YAML and CLI values override them.</p>
 */
public final class DefaultsForMode {
  /** Mode that feeds a watcher from a live frame buffer. */
  public static final String MODE_LIVE = "live";
  /** Mode that processes a finite source on the calling thread. */
  public static final String MODE_PLAY = "play";

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults for the requested mode merged with the common defaults.
   *
   * @param mode {@code live} or {@code play}
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException for an unknown mode
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case MODE_LIVE -> buildLiveDefaults();
      case MODE_PLAY -> buildPlayDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("name", "vigil");
    map.put("detector", "motion");
    map.put("display", "false");
    map.put("fpsWindow", "20");
    map.put("source", "synthetic");
    map.put("sourceFps", "9.0");
    map.put("synthetic.width", "320");
    map.put("synthetic.height", "240");
    map.put("synthetic.frames", "300");
    map.put("distanceThreshold", "0.1");
    map.put("motion.threshold", "0.04");
    map.put("motion.minArea", "1600");
    map.put("motion.memory", "0.1");
    map.put("motion.fullFrame", "true");
    map.put("motion.cellSize", "8");
    map.put("nn.engine", "");
    map.put("nn.model", "");
    map.put("nn.inputSize", "640");
    map.put("nn.confidence", "0.25");
    map.put("nn.ignore", "");
    map.put("replay.log", "");
    map.put("eventsOut", "log");
    map.put("kafkaBootstrap", "");
    map.put("metricsExporter", "");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildLiveDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("bufferCapacity", "64");
    map.put("heartbeatSeconds", "60");
    map.put("idleWaitMillis", "5");
    map.put("runSeconds", "0");
    map.put("paceMillis", "0");
    return map;
  }

  private static Map<String, String> buildPlayDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("skip", "0");
    map.put("scale", "1.0");
    map.put("sleepMillis", "0");
    map.put("saveFrames", "false");
    map.put("captureDir", defaultCaptureDirectory().toString());
    return map;
  }

  private static Path defaultCaptureDirectory() {
    String userHome = System.getProperty("user.home", ".");
    return Path.of(userHome, ".vigil", "captures");
  }
}
