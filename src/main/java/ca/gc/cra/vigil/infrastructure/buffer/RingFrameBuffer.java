package ca.gc.cra.vigil.infrastructure.buffer;

import ca.gc.cra.vigil.application.port.FrameBufferView;
import ca.gc.cra.vigil.domain.frame.Frame;
import ca.gc.cra.vigil.domain.frame.TimestampedFrame;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReferenceArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed-capacity circular frame buffer written by a single producer and read by any number of watchers.
 * <p>The write cursor starts at {@code capacity - 1} so the first write lands in slot 0. Each write stores the
 * slot first and then publishes the cursor, so a consumer that observes a cursor value also observes the frame
 * written there or a newer one. Slots are replaced whole; readers never see a partially written frame.</p>
 * <p>Writers never wait for readers. When a reader falls more than {@code capacity} writes behind, the oldest
 * frames are overwritten.</p>
 *
 * @since 0.1.0
 */
public final class RingFrameBuffer implements FrameBufferView {
  private static final Logger log = LoggerFactory.getLogger(RingFrameBuffer.class);

  private final AtomicReferenceArray<TimestampedFrame> slots;
  private final AtomicLong frameCount = new AtomicLong();
  private final List<Runnable> writeListeners = new CopyOnWriteArrayList<>();
  private volatile int writeIndex;

  /**
   * Creates an empty buffer.
   *
   * @param capacity number of slots; must be positive
   */
  public RingFrameBuffer(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.slots = new AtomicReferenceArray<>(capacity);
    this.writeIndex = capacity - 1;
  }

  /**
   * Stores a frame in the next slot and advances the write cursor. Must only be called by the producer thread.
   *
   * @param timestamp capture time
   * @param frame frame to store
   * @return slot index written
   */
  public int write(Instant timestamp, Frame frame) {
    return write(new TimestampedFrame(timestamp, frame));
  }

  /**
   * Stores a timestamped frame in the next slot and advances the write cursor.
   *
   * @param entry slot contents
   * @return slot index written
   */
  public int write(TimestampedFrame entry) {
    Objects.requireNonNull(entry, "entry");
    int next = (writeIndex + 1) % slots.length();
    slots.set(next, entry);
    frameCount.incrementAndGet();
    writeIndex = next;
    for (Runnable listener : writeListeners) {
      try {
        listener.run();
      } catch (RuntimeException ex) {
        log.warn("Frame buffer write listener failed", ex);
      }
    }
    return next;
  }

  /**
   * Registers a callback run on the producer thread after every write.
   *
   * @param listener callback; must be fast and must not block
   */
  public void addWriteListener(Runnable listener) {
    writeListeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public void removeWriteListener(Runnable listener) {
    writeListeners.remove(listener);
  }

  @Override
  public int capacity() {
    return slots.length();
  }

  @Override
  public int writeIndex() {
    return writeIndex;
  }

  @Override
  public long frameCount() {
    return frameCount.get();
  }

  @Override
  public Optional<TimestampedFrame> slot(int index) {
    Objects.checkIndex(index, slots.length());
    return Optional.ofNullable(slots.get(index));
  }
}
