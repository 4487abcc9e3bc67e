package ca.gc.cra.vigil.application.port;

import ca.gc.cra.vigil.domain.detect.DetectionEvent;
import java.time.Instant;
import java.util.List;

/**
 * Hands per-frame detection events to downstream consumers (logs, message brokers).
 *
 * @since 0.1.0
 */
public interface DetectionEventPublisher extends AutoCloseable {
  /**
   * Publishes the events of one processed frame.
   *
   * @param source watcher or pipeline name
   * @param frameNumber processed-frame sequence number
   * @param timestamp capture timestamp of the frame
   * @param events detections; publishers may skip empty lists
   * @throws Exception if publishing fails
   */
  void publish(String source, long frameNumber, Instant timestamp, List<DetectionEvent> events) throws Exception;

  /**
   * Flushes buffered events.
   *
   * @throws Exception if flushing fails
   */
  default void flush() throws Exception {}

  @Override
  default void close() throws Exception {}

  /** Publisher that discards events. */
  DetectionEventPublisher NO_OP = (source, frameNumber, timestamp, events) -> {};
}
