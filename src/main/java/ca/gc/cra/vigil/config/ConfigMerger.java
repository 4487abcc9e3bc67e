package ca.gc.cra.vigil.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing cross-key rules.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI &gt; YAML &gt; defaults.
   *
   * @param mode active pipeline mode
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
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
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    String eventsOut = trim(effective.get("eventsOut")).toLowerCase(Locale.ROOT);
    if (eventsOut.startsWith("kafka") && trim(effective.get("kafkaBootstrap")).isEmpty()) {
      throw new IllegalArgumentException("kafkaBootstrap is required when eventsOut=kafka:TOPIC");
    }
    String detector = trim(effective.get("detector")).toLowerCase(Locale.ROOT).replace('_', '-');
    if (detector.equals("neural-net") && trim(effective.get("nn.engine")).isEmpty()) {
      throw new IllegalArgumentException("nn.engine is required when detector=neural-net");
    }
    if (detector.equals("replay-log") && trim(effective.get("replay.log")).isEmpty()) {
      throw new IllegalArgumentException("replay.log is required when detector=replay-log");
    }
    if (DefaultsForMode.MODE_PLAY.equalsIgnoreCase(mode)
        && Boolean.parseBoolean(trim(effective.get("saveFrames")))
        && trim(effective.get("captureDir")).isEmpty()) {
      throw new IllegalArgumentException("captureDir is required when saveFrames=true");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
