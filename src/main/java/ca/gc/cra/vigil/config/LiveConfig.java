package ca.gc.cra.vigil.config;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Live mode settings: a producer fills a ring buffer that one watcher consumes.
 *
 * @param pipeline shared settings
 * @param bufferCapacity ring buffer slots
 * @param heartbeat watcher heartbeat interval
 * @param idleWait watcher idle wait bound
 * @param runTime session length; zero runs until the source drains or the process is stopped
 * @param pace pause after each buffered frame; zero writes as fast as the source delivers
 * @since 0.1.0
 */
public record LiveConfig(
    PipelineConfig pipeline, int bufferCapacity, Duration heartbeat, Duration idleWait, Duration runTime,
    Duration pace) {

  /**
   * Validates live settings.
   *
   * @param pipeline shared settings
   * @param bufferCapacity at least two slots
   * @param heartbeat positive interval
   * @param idleWait positive wait bound
   * @param runTime non-negative run time
   * @param pace non-negative pace
   */
  public LiveConfig {
    Objects.requireNonNull(pipeline, "pipeline");
    if (bufferCapacity < 2) {
      throw new IllegalArgumentException("bufferCapacity must be >= 2");
    }
    Objects.requireNonNull(heartbeat, "heartbeat");
    Objects.requireNonNull(idleWait, "idleWait");
    Objects.requireNonNull(runTime, "runTime");
    Objects.requireNonNull(pace, "pace");
  }

  /**
   * Reads live settings from a flat configuration map.
   *
   * @param kv effective configuration
   * @return parsed settings
   */
  public static LiveConfig fromMap(Map<String, String> kv) {
    return new LiveConfig(
        PipelineConfig.fromMap(kv),
        ConfigValues.boundedInt(kv, "bufferCapacity", 64, 2, 65_536),
        Duration.ofSeconds(ConfigValues.boundedLong(kv, "heartbeatSeconds", 60L, 1L, 86_400L)),
        Duration.ofMillis(ConfigValues.boundedLong(kv, "idleWaitMillis", 5L, 1L, 10_000L)),
        Duration.ofSeconds(ConfigValues.boundedLong(kv, "runSeconds", 0L, 0L, 31_536_000L)),
        Duration.ofMillis(ConfigValues.boundedLong(kv, "paceMillis", 0L, 0L, 60_000L)));
  }
}
