package ca.gc.cra.vigil.application.port;

import ca.gc.cra.vigil.domain.detect.ProcessedFrame;
import ca.gc.cra.vigil.domain.frame.Frame;
import java.time.Instant;

/**
 * Variant-specific half of the per-frame contract. Receives a frame already carrying the diagnostic overlay and
 * returns the variant's annotations and detections.
 *
 * @since 0.1.0
 */
public interface DetectionStep extends AutoCloseable {
  /**
   * Runs the variant's detection on one frame.
   *
   * @param timestamp capture timestamp
   * @param frame frame stamped with the diagnostic overlay
   * @return processed frame; must not be {@code null} and must carry a non-null event list
   * @throws Exception if detection fails
   */
  ProcessedFrame detect(Instant timestamp, Frame frame) throws Exception;

  /**
   * Short identifier used as the default watcher name.
   *
   * @return variant name
   */
  String variant();

  /**
   * Releases detector resources such as inference engines.
   *
   * @throws Exception if the release fails
   */
  @Override
  default void close() throws Exception {}
}
