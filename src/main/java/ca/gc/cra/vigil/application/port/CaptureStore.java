package ca.gc.cra.vigil.application.port;

import ca.gc.cra.vigil.domain.detect.DetectionEvent;
import ca.gc.cra.vigil.domain.frame.Frame;
import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * Persists frames that produced detections, together with their verbatim event sequence, for later review or
 * training-set assembly.
 *
 * @since 0.1.0
 */
public interface CaptureStore extends Closeable {
  /**
   * Saves one frame and its detections.
   *
   * @param frameNumber playback frame number used in artifact names
   * @param original frame as read from the source
   * @param annotated processed frame with overlays
   * @param events detections reported for the frame
   * @throws IOException if writing fails
   */
  void save(long frameNumber, Frame original, Frame annotated, List<DetectionEvent> events) throws IOException;

  @Override
  default void close() throws IOException {}

  /** Store that discards everything. */
  CaptureStore NONE = (frameNumber, original, annotated, events) -> {};
}
