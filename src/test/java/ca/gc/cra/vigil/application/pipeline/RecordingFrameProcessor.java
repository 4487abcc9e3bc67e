package ca.gc.cra.vigil.application.pipeline;

import ca.gc.cra.vigil.application.port.FrameProcessor;
import ca.gc.cra.vigil.domain.detect.BoundingBox;
import ca.gc.cra.vigil.domain.detect.DetectionEvent;
import ca.gc.cra.vigil.domain.detect.ProcessedFrame;
import ca.gc.cra.vigil.domain.frame.Frame;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.LongPredicate;

/**
 * Processor double that identifies frames by their epoch-millisecond timestamp and records the order in which
 * they arrive.
 */
final class RecordingFrameProcessor implements FrameProcessor {
  private final List<Long> processed = new CopyOnWriteArrayList<>();
  private final List<Frame> frames = new CopyOnWriteArrayList<>();
  private volatile long failAt = -1;
  private volatile long blockAt = -1;
  private volatile LongPredicate emitsEvent = id -> false;
  private final CountDownLatch blocked = new CountDownLatch(1);
  private final CountDownLatch release = new CountDownLatch(1);

  static Instant stamp(long id) {
    return Instant.ofEpochMilli(id);
  }

  static Frame frame() {
    return Frame.filled(8, 6, 1, 0);
  }

  RecordingFrameProcessor failAt(long id) {
    this.failAt = id;
    return this;
  }

  RecordingFrameProcessor blockAt(long id) {
    this.blockAt = id;
    return this;
  }

  RecordingFrameProcessor emitEventsWhen(LongPredicate predicate) {
    this.emitsEvent = predicate;
    return this;
  }

  boolean awaitBlocked(long timeout, TimeUnit unit) throws InterruptedException {
    return blocked.await(timeout, unit);
  }

  void release() {
    release.countDown();
  }

  List<Long> processed() {
    return List.copyOf(processed);
  }

  List<Frame> frames() {
    return List.copyOf(frames);
  }

  @Override
  public ProcessedFrame processFrame(Instant timestamp, Frame frame) throws Exception {
    long id = timestamp.toEpochMilli();
    if (id == failAt) {
      throw new IllegalStateException("synthetic failure at frame " + id);
    }
    processed.add(id);
    frames.add(frame);
    if (id == blockAt) {
      blocked.countDown();
      if (!release.await(5, TimeUnit.SECONDS)) {
        throw new IllegalStateException("processor was never released");
      }
    }
    if (emitsEvent.test(id)) {
      DetectionEvent event = new DetectionEvent(0, "motion", new BoundingBox(1, 1, 4, 3), 0.9d);
      return new ProcessedFrame(frame, List.of(event));
    }
    return ProcessedFrame.empty(frame);
  }

  @Override
  public String name() {
    return "recording";
  }
}
