package ca.gc.cra.vigil.infrastructure.detect;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Detector selection plus the options of every variant. Only the options of {@link #kind()} are used.
 *
 * @param kind selected variant
 * @param motion motion detector tuning
 * @param neuralNet neural-net options
 * @param replayLog replay log file; required for {@link DetectorKind#REPLAY_LOG}
 * @since 0.1.0
 */
public record DetectorSettings(
    DetectorKind kind, MotionDetectionStep.Settings motion, NeuralNetDetectionStep.Settings neuralNet, Path replayLog) {
  /**
   * Validates that the selected variant has what it needs.
   *
   * @param kind selected variant
   * @param motion motion tuning; defaulted when {@code null}
   * @param neuralNet neural-net options; required for {@link DetectorKind#NEURAL_NET}
   * @param replayLog replay log; required for {@link DetectorKind#REPLAY_LOG}
   */
  public DetectorSettings {
    Objects.requireNonNull(kind, "kind");
    motion = Objects.requireNonNullElse(motion, MotionDetectionStep.Settings.defaults());
    if (kind == DetectorKind.NEURAL_NET && neuralNet == null) {
      throw new IllegalArgumentException("neural-net detector requires nn.engine");
    }
    if (kind == DetectorKind.REPLAY_LOG && replayLog == null) {
      throw new IllegalArgumentException("replay-log detector requires replay.log");
    }
  }

  /**
   * Returns settings for the default motion detector.
   *
   * @return motion settings with default tuning
   */
  public static DetectorSettings motionDefaults() {
    return new DetectorSettings(DetectorKind.MOTION, MotionDetectionStep.Settings.defaults(), null, null);
  }
}
