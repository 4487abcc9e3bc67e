package ca.gc.cra.vigil.application.port;

import ca.gc.cra.vigil.domain.frame.TimestampedFrame;
import java.util.Optional;

/**
 * <strong>What:</strong> Consumer-side view of a fixed-capacity circular frame buffer.
 * <p><strong>Why:</strong> Lets watchers follow a live producer without coupling to how frames are captured.</p>
 * <p><strong>Role:</strong> Domain port implemented by {@code RingFrameBuffer}; consumed by {@code FrameWatcher}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose the fixed capacity and the slot most recently written (the write cursor).</li>
 *   <li>Expose a cumulative count of frames written since creation.</li>
 *   <li>Return slot contents, or empty when a slot has never been written.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must allow one producer and any number of consumers to
 * operate concurrently without consumers ever blocking the producer. A slot write replaces the whole
 * {@link TimestampedFrame}; a consumer may observe a newer frame than the cursor it read, never a torn one.</p>
 * <p><strong>Delivery:</strong> Overwrite-on-wrap. A consumer that falls more than {@link #capacity()} writes
 * behind loses the oldest frames; there is no back-pressure.</p>
 *
 * @since 0.1.0
 */
public interface FrameBufferView {
  /**
   * Returns the number of slots.
   *
   * @return capacity; constant for the buffer's lifetime
   */
  int capacity();

  /**
   * Returns the index of the slot most recently written.
   *
   * @return write cursor in {@code [0, capacity)}
   *
   * <p><strong>Concurrency:</strong> Volatile read; advances by one (mod capacity) per producer write.</p>
   */
  int writeIndex();

  /**
   * Returns the cumulative number of frames written.
   *
   * @return monotonically increasing frame counter
   */
  long frameCount();

  /**
   * Reads the slot at {@code index}.
   *
   * @param index slot index in {@code [0, capacity)}
   * @return slot contents, or empty when the slot has not been written yet
   * @throws IndexOutOfBoundsException if {@code index} is outside the buffer
   */
  Optional<TimestampedFrame> slot(int index);
}
