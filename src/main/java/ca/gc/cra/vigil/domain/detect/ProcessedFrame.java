package ca.gc.cra.vigil.domain.detect;

import ca.gc.cra.vigil.domain.frame.Frame;
import java.util.List;
import java.util.Objects;

/**
 * Result of the per-frame processing contract: the annotated frame and the ordered detection events.
 *
 * @param frame annotated frame
 * @param events detections in detector order; empty when nothing was detected, never {@code null}
 * @since 0.1.0
 */
public record ProcessedFrame(Frame frame, List<DetectionEvent> events) {
  public ProcessedFrame {
    Objects.requireNonNull(frame, "frame");
    events = List.copyOf(Objects.requireNonNull(events, "events"));
  }

  /**
   * Creates a result without detections.
   *
   * @param frame annotated frame
   * @return result carrying an empty event list
   */
  public static ProcessedFrame empty(Frame frame) {
    return new ProcessedFrame(frame, List.of());
  }

  public boolean hasEvents() {
    return !events.isEmpty();
  }
}
