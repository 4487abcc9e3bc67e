package ca.gc.cra.vigil.application.port;

import ca.gc.cra.vigil.domain.detect.ProcessedFrame;
import ca.gc.cra.vigil.domain.frame.Frame;
import java.time.Instant;

/**
 * <strong>What:</strong> The per-frame processing capability every detector variant provides.
 * <p><strong>Why:</strong> Watchers and the playback loop are written against this capability alone, so the
 * detection algorithm can change without touching lifecycle code.</p>
 * <p><strong>Contract:</strong>
 * <ul>
 *   <li>Returns the annotated frame and a finite, ordered event list; an empty list means no detections.</li>
 *   <li>Never returns {@code null}.</li>
 *   <li>Any exception leaves the processor in an untrusted state; watchers stop feeding it.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Called from exactly one thread at a time (the watcher thread or the
 * playback caller). Implementations need not be thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface FrameProcessor {
  /**
   * Processes one frame.
   *
   * @param timestamp capture timestamp of {@code frame}
   * @param frame frame to process; not mutated
   * @return annotated frame and detections
   * @throws Exception if detection fails
   */
  ProcessedFrame processFrame(Instant timestamp, Frame frame) throws Exception;

  /**
   * Name used in logs, overlays, and metrics.
   *
   * @return processor name
   */
  String name();

  /**
   * Returns the most recent frame rate measurement.
   *
   * @return frames per second; {@code 0.0} when the processor does not measure it
   */
  default double fps() {
    return 0d;
  }
}
