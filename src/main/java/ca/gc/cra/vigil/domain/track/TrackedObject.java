package ca.gc.cra.vigil.domain.track;

import ca.gc.cra.vigil.domain.detect.BoundingBox;
import java.util.Objects;

/**
 * Snapshot of one tracked identity.
 *
 * @param id identity assigned when the track was spawned; unique per tracker
 * @param classId detector class of the identity
 * @param label class label
 * @param centerX normalized centroid x
 * @param centerY normalized centroid y
 * @param box last matched bounding region in pixels
 * @param lastSeenFrame tracker frame number of the last matching detection
 * @param hits number of detections associated with the identity
 * @since 0.1.0
 */
public record TrackedObject(
    long id,
    int classId,
    String label,
    double centerX,
    double centerY,
    BoundingBox box,
    long lastSeenFrame,
    int hits) {
  public TrackedObject {
    label = Objects.requireNonNull(label, "label");
    Objects.requireNonNull(box, "box");
  }

  /**
   * Euclidean distance between normalized centroids.
   *
   * @param x normalized x
   * @param y normalized y
   * @return distance in normalized units
   */
  public double distanceTo(double x, double y) {
    double dx = centerX - x;
    double dy = centerY - y;
    return Math.sqrt(dx * dx + dy * dy);
  }
}
