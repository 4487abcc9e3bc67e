package ca.gc.cra.vigil.config;

import ca.gc.cra.vigil.application.pipeline.PlaybackUseCase;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Play mode settings: frames are pulled from a finite source and processed on the calling thread.
 *
 * @param pipeline shared settings
 * @param playback skip, scale, sleep, capture, and display tuning
 * @param captureDir capture directory; {@code null} unless frames are saved
 * @since 0.1.0
 */
public record PlaybackConfig(PipelineConfig pipeline, PlaybackUseCase.Settings playback, Path captureDir) {

  /**
   * Validates play settings.
   *
   * @param pipeline shared settings
   * @param playback playback tuning
   * @param captureDir capture directory; required when frames are saved
   */
  public PlaybackConfig {
    Objects.requireNonNull(pipeline, "pipeline");
    Objects.requireNonNull(playback, "playback");
    if (playback.saveFrames() && captureDir == null) {
      throw new IllegalArgumentException("captureDir is required when saveFrames=true");
    }
  }

  /**
   * Reads play settings from a flat configuration map.
   *
   * @param kv effective configuration
   * @return parsed settings
   */
  public static PlaybackConfig fromMap(Map<String, String> kv) {
    PipelineConfig pipeline = PipelineConfig.fromMap(kv);
    boolean saveFrames = ConfigValues.bool(kv, "saveFrames", false);
    PlaybackUseCase.Settings playback = new PlaybackUseCase.Settings(
        ConfigValues.boundedInt(kv, "skip", 0, 0, 10_000),
        ConfigValues.boundedDouble(kv, "scale", 1.0d, 0.01d, 16d),
        Duration.ofMillis(ConfigValues.boundedLong(kv, "sleepMillis", 0L, 0L, 60_000L)),
        saveFrames,
        pipeline.display());
    Path captureDir = saveFrames ? ConfigValues.path(kv, "captureDir").orElse(null) : null;
    return new PlaybackConfig(pipeline, playback, captureDir);
  }
}
