package ca.gc.cra.vigil.application.pipeline;

import ca.gc.cra.vigil.application.port.ClockPort;
import ca.gc.cra.vigil.application.port.DetectionEventPublisher;
import ca.gc.cra.vigil.application.port.FrameBufferView;
import ca.gc.cra.vigil.application.port.FrameProcessor;
import ca.gc.cra.vigil.application.port.FrameRenderer;
import ca.gc.cra.vigil.application.port.MetricsPort;
import ca.gc.cra.vigil.application.port.ObjectTracker;
import ca.gc.cra.vigil.domain.detect.ProcessedFrame;
import ca.gc.cra.vigil.domain.frame.Frame;
import ca.gc.cra.vigil.domain.frame.TimestampedFrame;
import ca.gc.cra.vigil.domain.track.CollisionAlert;
import ca.gc.cra.vigil.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Follows a live {@link FrameBufferView} on a dedicated thread and drives every newly written frame through a
 * {@link FrameProcessor}.
 * <p>The catch-up loop advances a private cursor one slot at a time until it meets the buffer's write cursor,
 * skipping slots that have never been written. A consumer that falls more than a full buffer behind silently
 * loses the overwritten frames; recency is preferred over completeness and skipped frames are never replayed.
 * When caught up the loop waits on a condition for at most {@link Settings#idleWait()}; producers shorten that
 * wait by calling {@link #signalFrameAvailable()}.</p>
 * <p>Any exception raised while processing a frame is fatal: it is logged with the watcher name, kept as
 * {@link #failure()}, and the loop exits. Nothing restarts a watcher; instances are not reusable.</p>
 * <p>{@link #stop()} clears the running flag, wakes the loop and joins the thread, so no frame is processed
 * after it returns. An in-flight {@code processFrame} call is never interrupted.</p>
 *
 * @since 0.1.0
 */
public final class FrameWatcher implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(FrameWatcher.class);

  /** Lifecycle states. */
  public enum State {
    STOPPED,
    RUNNING
  }

  private final String name;
  private final FrameBufferView buffer;
  private final FrameProcessor processor;
  private final ObjectTracker tracker;
  private final DetectionEventPublisher publisher;
  private final FrameRenderer renderer;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final Settings settings;

  private final AtomicBoolean running = new AtomicBoolean();
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicReference<Exception> failure = new AtomicReference<>();
  private final AtomicLong framesProcessed = new AtomicLong();
  private final AtomicLong emptySlots = new AtomicLong();
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition frameAvailable = lock.newCondition();

  private volatile Thread thread;
  private volatile int frameIndex;
  private Instant previousTimestamp;
  private long nextHeartbeat;

  private FrameWatcher(Builder builder) {
    this.name = builder.name;
    this.buffer = builder.buffer;
    this.processor = builder.processor;
    this.tracker = builder.tracker;
    this.publisher = builder.publisher;
    this.renderer = builder.renderer;
    this.metrics = builder.metrics;
    this.clock = builder.clock;
    this.settings = builder.settings;
  }

  /**
   * Starts a builder for a watcher over {@code buffer}.
   *
   * @param name watcher name used for the thread, logs, and heartbeat
   * @param buffer buffer to follow
   * @param processor per-frame contract implementation
   * @return builder with no-op collaborators
   */
  public static Builder create(String name, FrameBufferView buffer, FrameProcessor processor) {
    return new Builder(name, buffer, processor);
  }

  /**
   * Starts the watcher thread. The local cursor is aligned with the buffer's write cursor unless
   * {@link Settings#startIndex()} says otherwise, so frames written before start are not replayed.
   *
   * @throws IllegalStateException if this watcher was already started
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Watcher " + name + " already started");
    }
    int start = settings.startIndex() < 0 ? buffer.writeIndex() : settings.startIndex();
    if (start >= buffer.capacity()) {
      throw new IllegalArgumentException(
          "start index " + start + " outside buffer of capacity " + buffer.capacity());
    }
    frameIndex = start;
    running.set(true);
    Thread worker = ExecutorFactories.watcherThreads(name, this::handleCrash).newThread(this::watch);
    thread = worker;
    worker.start();
    log.info("Started watcher {} at slot {} of {}", name, start, buffer.capacity());
  }

  /**
   * Stops the watcher and waits for its thread to exit. Safe to call repeatedly or before {@link #start()}.
   *
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public void stop() throws InterruptedException {
    boolean wasRunning = running.getAndSet(false);
    signalFrameAvailable();
    Thread worker = thread;
    if (worker != null && worker != Thread.currentThread()) {
      worker.join();
    }
    if (wasRunning) {
      log.info("Stopped watcher {} after {} frames", name, framesProcessed.get());
    }
  }

  @Override
  public void close() throws InterruptedException {
    stop();
  }

  /**
   * Wakes the loop if it is waiting for a new frame. Intended as a buffer write listener.
   */
  public void signalFrameAvailable() {
    lock.lock();
    try {
      frameAvailable.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Runs one frame through the watcher's pipeline on the caller's thread, for callers that supply frames
   * directly instead of through the buffer.
   *
   * @param timestamp capture time of the frame
   * @param frame frame to process
   * @return contract result
   * @throws IllegalStateException if the background loop is running
   * @throws Exception if processing fails
   */
  public ProcessedFrame processFrame(Instant timestamp, Frame frame) throws Exception {
    if (running.get()) {
      throw new IllegalStateException("Watcher " + name + " is consuming its buffer");
    }
    return handle(new TimestampedFrame(timestamp, frame));
  }

  public String name() {
    return name;
  }

  public State state() {
    return running.get() ? State.RUNNING : State.STOPPED;
  }

  /**
   * Returns the exception that terminated the loop.
   *
   * @return fatal failure, or empty when the loop has not failed
   */
  public Optional<Exception> failure() {
    return Optional.ofNullable(failure.get());
  }

  /** Returns the slot index most recently examined by the loop. */
  public int frameIndex() {
    return frameIndex;
  }

  public long framesProcessed() {
    return framesProcessed.get();
  }

  public long emptySlotsSkipped() {
    return emptySlots.get();
  }

  private void watch() {
    MDC.put("watcher", name);
    nextHeartbeat = clock.nanoTime() + settings.heartbeatInterval().toNanos();
    try {
      while (running.get()) {
        catchUp();
        maybeHeartbeat();
        awaitFrame();
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      log.warn("Watcher {} interrupted; exiting", name);
    } catch (Exception ex) {
      failure.set(ex);
      metrics.increment("watcher.failure");
      log.error("Exception caught in watcher {} at slot {} after {} frames; watcher terminated",
          name, frameIndex, framesProcessed.get(), ex);
    } finally {
      running.set(false);
      MDC.remove("watcher");
    }
  }

  private void catchUp() throws Exception {
    int capacity = buffer.capacity();
    while (running.get() && frameIndex != buffer.writeIndex()) {
      int next = (frameIndex + 1) % capacity;
      frameIndex = next;
      Optional<TimestampedFrame> slot = buffer.slot(next);
      if (slot.isEmpty()) {
        emptySlots.incrementAndGet();
        metrics.increment("watcher.slots.empty");
        continue;
      }
      handle(slot.get());
      maybeHeartbeat();
    }
  }

  private ProcessedFrame handle(TimestampedFrame slot) throws Exception {
    long startNanos = clock.nanoTime();
    ProcessedFrame result = processor.processFrame(slot.timestamp(), slot.frame());
    if (result == null) {
      throw new IllegalStateException("Processor " + processor.name() + " returned no result");
    }
    previousTimestamp = slot.timestamp();
    long processed = framesProcessed.incrementAndGet();
    metrics.increment("watcher.frames.processed");
    metrics.observe("watcher.process.latencyNanos", clock.nanoTime() - startNanos);
    metrics.observe("watcher.fps", Math.round(processor.fps()));

    tracker.update(result.frame(), result.events());
    List<CollisionAlert> alerts = tracker.detect(result.frame());
    if (!alerts.isEmpty()) {
      metrics.observe("watcher.collisions", alerts.size());
    }
    if (result.hasEvents()) {
      publisher.publish(name, processed, slot.timestamp(), result.events());
    }
    if (settings.display()) {
      render(result.frame());
    }
    return result;
  }

  private void render(Frame frame) {
    try {
      renderer.render(name, frame);
    } catch (Exception ex) {
      metrics.increment("watcher.render.error");
      log.warn("Watcher {} failed to render frame; continuing", name, ex);
    }
  }

  private void maybeHeartbeat() {
    if (!running.get()) {
      return;
    }
    long now = clock.nanoTime();
    if (now - nextHeartbeat >= 0) {
      heartbeat();
      nextHeartbeat = now + settings.heartbeatInterval().toNanos();
    }
  }

  private void heartbeat() {
    long count = buffer.frameCount();
    metrics.observe("watcher.heartbeat", count);
    log.info("{} heartbeat {}", name, String.format("%08d", count));
  }

  private void awaitFrame() throws InterruptedException {
    lock.lock();
    try {
      if (running.get() && frameIndex == buffer.writeIndex()) {
        frameAvailable.awaitNanos(settings.idleWait().toNanos());
      }
    } finally {
      lock.unlock();
    }
  }

  private void handleCrash(Thread t, Throwable throwable) {
    running.set(false);
    Exception ex = throwable instanceof Exception e ? e : new RuntimeException("Watcher crash", throwable);
    failure.compareAndSet(null, ex);
    metrics.increment("watcher.failure");
    log.error("Watcher thread {} threw an uncaught error", t.getName(), throwable);
  }

  Instant previousTimestamp() {
    return previousTimestamp;
  }

  /**
   * Watcher tuning parameters.
   *
   * @param idleWait longest wait when the loop has caught up
   * @param heartbeatInterval wall time between liveness log lines
   * @param display whether processed frames are sent to the renderer
   * @param startIndex initial cursor; negative aligns with the write cursor at start
   */
  public record Settings(Duration idleWait, Duration heartbeatInterval, boolean display, int startIndex) {
    /** Default idle wait. */
    public static final Duration DEFAULT_IDLE_WAIT = Duration.ofMillis(5);
    /** Default heartbeat interval. */
    public static final Duration DEFAULT_HEARTBEAT = Duration.ofSeconds(60);

    /**
     * Normalizes settings, defaulting missing durations.
     *
     * @param idleWait longest wait when caught up
     * @param heartbeatInterval time between heartbeats
     * @param display render flag
     * @param startIndex initial cursor
     */
    public Settings {
      idleWait = Objects.requireNonNullElse(idleWait, DEFAULT_IDLE_WAIT);
      heartbeatInterval = Objects.requireNonNullElse(heartbeatInterval, DEFAULT_HEARTBEAT);
      if (idleWait.isNegative() || idleWait.isZero()) {
        throw new IllegalArgumentException("idleWait must be positive");
      }
      if (heartbeatInterval.isNegative() || heartbeatInterval.isZero()) {
        throw new IllegalArgumentException("heartbeatInterval must be positive");
      }
    }

    /**
     * Returns the default watcher settings.
     *
     * @return 5 ms idle wait, 60 s heartbeat, no display, aligned start
     */
    public static Settings defaults() {
      return new Settings(DEFAULT_IDLE_WAIT, DEFAULT_HEARTBEAT, false, -1);
    }
  }

  /** Builder for {@link FrameWatcher}. */
  public static final class Builder {
    private final String name;
    private final FrameBufferView buffer;
    private final FrameProcessor processor;
    private ObjectTracker tracker = ObjectTracker.NO_OP;
    private DetectionEventPublisher publisher = DetectionEventPublisher.NO_OP;
    private FrameRenderer renderer = FrameRenderer.NONE;
    private MetricsPort metrics = MetricsPort.NO_OP;
    private ClockPort clock = ClockPort.SYSTEM;
    private Settings settings = Settings.defaults();

    private Builder(String name, FrameBufferView buffer, FrameProcessor processor) {
      this.name = Objects.requireNonNull(name, "name");
      this.buffer = Objects.requireNonNull(buffer, "buffer");
      this.processor = Objects.requireNonNull(processor, "processor");
    }

    public Builder tracker(ObjectTracker tracker) {
      this.tracker = Objects.requireNonNull(tracker, "tracker");
      return this;
    }

    public Builder publisher(DetectionEventPublisher publisher) {
      this.publisher = Objects.requireNonNull(publisher, "publisher");
      return this;
    }

    public Builder renderer(FrameRenderer renderer) {
      this.renderer = Objects.requireNonNull(renderer, "renderer");
      return this;
    }

    public Builder metrics(MetricsPort metrics) {
      this.metrics = Objects.requireNonNull(metrics, "metrics");
      return this;
    }

    public Builder clock(ClockPort clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    public Builder settings(Settings settings) {
      this.settings = Objects.requireNonNull(settings, "settings");
      return this;
    }

    /**
     * Shortcut for the idle wait with other settings unchanged.
     *
     * @param idleWait longest wait when caught up
     * @return this builder
     */
    public Builder idleWait(Duration idleWait) {
      this.settings = new Settings(idleWait, settings.heartbeatInterval(), settings.display(), settings.startIndex());
      return this;
    }

    public Builder startIndex(int startIndex) {
      this.settings = new Settings(settings.idleWait(), settings.heartbeatInterval(), settings.display(), startIndex);
      return this;
    }

    public FrameWatcher build() {
      return new FrameWatcher(this);
    }
  }
}
