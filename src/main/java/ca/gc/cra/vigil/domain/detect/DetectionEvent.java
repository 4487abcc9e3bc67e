package ca.gc.cra.vigil.domain.detect;

import java.util.Objects;

/**
 * <strong>What:</strong> One item of interest reported by a detector for a single frame.
 * <p><strong>Role:</strong> Element of the ordered event sequence returned by every frame processor and consumed
 * by trackers, event publishers, and capture stores.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param classId detector class identifier ({@code -1} when the detector has no class taxonomy)
 * @param label human-readable class label
 * @param box bounding region in pixel coordinates
 * @param confidence detection confidence in {@code [0.0, 1.0]}
 * @since 0.1.0
 */
public record DetectionEvent(int classId, String label, BoundingBox box, double confidence) {
  public DetectionEvent {
    label = Objects.requireNonNull(label, "label");
    Objects.requireNonNull(box, "box");
    if (Double.isNaN(confidence) || confidence < 0d || confidence > 1d) {
      throw new IllegalArgumentException("confidence must be within [0.0,1.0] (was " + confidence + ")");
    }
  }

  /**
   * Horizontal centroid normalized by the frame width.
   *
   * @param frameWidth width of the frame the event refers to
   * @return centroid x in {@code [0,1]} for in-frame boxes
   */
  public double normalizedCenterX(int frameWidth) {
    return box.centerX() / frameWidth;
  }

  /**
   * Vertical centroid normalized by the frame height.
   *
   * @param frameHeight height of the frame the event refers to
   * @return centroid y in {@code [0,1]} for in-frame boxes
   */
  public double normalizedCenterY(int frameHeight) {
    return box.centerY() / frameHeight;
  }
}
