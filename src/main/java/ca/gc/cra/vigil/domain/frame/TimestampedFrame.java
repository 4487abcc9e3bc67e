package ca.gc.cra.vigil.domain.frame;

import java.time.Instant;
import java.util.Objects;

/**
 * Frame paired with its capture timestamp; the unit stored in each frame buffer slot.
 *
 * @param timestamp capture time; strictly increasing per producer
 * @param frame captured frame
 * @since 0.1.0
 */
public record TimestampedFrame(Instant timestamp, Frame frame) {
  public TimestampedFrame {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(frame, "frame");
  }
}
