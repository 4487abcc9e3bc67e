package ca.gc.cra.vigil.application.port;

import ca.gc.cra.vigil.domain.detect.DetectionEvent;
import ca.gc.cra.vigil.domain.frame.Frame;
import ca.gc.cra.vigil.domain.track.CollisionAlert;
import ca.gc.cra.vigil.domain.track.TrackedObject;
import java.util.List;

/**
 * <strong>What:</strong> Multi-object tracker consuming the per-frame event stream.
 * <p><strong>Role:</strong> Downstream collaborator treated by pipelines as a two-call black box: one
 * {@link #update(Frame, List)} per processed frame followed by one {@link #detect(Frame)}.</p>
 * <p><strong>Thread-safety:</strong> Called from a single pipeline thread.</p>
 *
 * @since 0.1.0
 */
public interface ObjectTracker {
  /**
   * Associates the frame's detections with tracked identities.
   *
   * @param frame processed frame the detections belong to
   * @param events detections for the frame; may be empty
   */
  void update(Frame frame, List<DetectionEvent> events);

  /**
   * Checks tracked identities for overlaps between different classes.
   *
   * @param frame frame the check applies to
   * @return alerts raised for this frame; empty when none
   */
  List<CollisionAlert> detect(Frame frame);

  /**
   * Returns the identities currently tracked.
   *
   * @return snapshot of live identities
   */
  List<TrackedObject> tracks();

  /** Tracker that ignores all input. */
  ObjectTracker NO_OP = new ObjectTracker() {
    @Override
    public void update(Frame frame, List<DetectionEvent> events) {}

    @Override
    public List<CollisionAlert> detect(Frame frame) {
      return List.of();
    }

    @Override
    public List<TrackedObject> tracks() {
      return List.of();
    }
  };
}
