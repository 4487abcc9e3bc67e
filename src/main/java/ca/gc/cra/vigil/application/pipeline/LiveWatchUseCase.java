package ca.gc.cra.vigil.application.pipeline;

import ca.gc.cra.vigil.application.port.ClockPort;
import ca.gc.cra.vigil.application.port.FrameBufferView;
import ca.gc.cra.vigil.application.port.FrameFeed;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one watcher against a buffer that a background feed keeps filling.
 * <p>The watcher starts first so its cursor aligns with the empty buffer, then the feed starts. The session
 * ends when the run time elapses, when the feed is drained and the watcher has caught up, when
 * {@link #requestStop()} is called, or when either side fails. Both threads are stopped before
 * {@link #run(Duration)} returns. Instances are not reusable.</p>
 *
 * @since 0.1.0
 */
public final class LiveWatchUseCase {
  private static final Logger log = LoggerFactory.getLogger(LiveWatchUseCase.class);
  private static final Duration POLL_INTERVAL = Duration.ofMillis(50);

  private final FrameWatcher watcher;
  private final FrameBufferView buffer;
  private final FrameFeed feed;
  private final ClockPort clock;
  private final CountDownLatch stopRequested = new CountDownLatch(1);
  private final CountDownLatch done = new CountDownLatch(1);
  private boolean ran;

  /**
   * Creates a live session.
   *
   * @param watcher watcher consuming {@code buffer}
   * @param buffer buffer filled by {@code feed}
   * @param feed background writer
   * @param clock monotonic clock used for the run-time budget
   */
  public LiveWatchUseCase(FrameWatcher watcher, FrameBufferView buffer, FrameFeed feed, ClockPort clock) {
    this.watcher = Objects.requireNonNull(watcher, "watcher");
    this.buffer = Objects.requireNonNull(buffer, "buffer");
    this.feed = Objects.requireNonNull(feed, "feed");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Runs the session.
   *
   * @param runTime maximum run time; zero runs until the feed drains or a stop is requested
   * @return session counters
   * @throws Exception the watcher's or feed's fatal failure
   */
  public LiveReport run(Duration runTime) throws Exception {
    Objects.requireNonNull(runTime, "runTime");
    if (runTime.isNegative()) {
      throw new IllegalArgumentException("runTime must not be negative");
    }
    synchronized (this) {
      if (ran) {
        throw new IllegalStateException("Live session already ran");
      }
      ran = true;
    }
    long deadline = clock.nanoTime() + runTime.toNanos();
    LiveReport.EndReason reason;
    watcher.start();
    try {
      feed.start();
      reason = awaitEnd(runTime.isZero() ? Long.MAX_VALUE : deadline, runTime.isZero());
    } finally {
      try {
        feed.stop();
      } finally {
        watcher.stop();
        done.countDown();
      }
    }
    if (reason == LiveReport.EndReason.INTERRUPTED) {
      Thread.currentThread().interrupt();
    }
    Optional<Exception> watcherFailure = watcher.failure();
    Optional<Exception> feedFailure = feed.failure();
    if (watcherFailure.isPresent()) {
      Exception failure = watcherFailure.get();
      feedFailure.ifPresent(failure::addSuppressed);
      throw failure;
    }
    if (feedFailure.isPresent()) {
      throw feedFailure.get();
    }
    LiveReport report = new LiveReport(
        watcher.framesProcessed(), watcher.emptySlotsSkipped(), buffer.frameCount(), reason);
    log.info("Live session {} ended ({}): processed={}, emptySlots={}, written={}",
        watcher.name(), reason, report.framesProcessed(), report.emptySlotsSkipped(), report.framesWritten());
    return report;
  }

  /** Asks a running session to end; returns immediately. */
  public void requestStop() {
    stopRequested.countDown();
  }

  /**
   * Requests a stop and waits for {@link #run(Duration)} to release its threads.
   *
   * @param timeout maximum wait
   * @return {@code true} if the session finished within the timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean stopAndAwait(Duration timeout) throws InterruptedException {
    requestStop();
    return done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  private LiveReport.EndReason awaitEnd(long deadline, boolean unbounded) {
    try {
      while (true) {
        if (stopRequested.await(POLL_INTERVAL.toMillis(), TimeUnit.MILLISECONDS)) {
          return LiveReport.EndReason.STOP_REQUESTED;
        }
        if (watcher.failure().isPresent() || feed.failure().isPresent()) {
          log.warn("Live session {} ending after a failure", watcher.name());
          return LiveReport.EndReason.STOP_REQUESTED;
        }
        if (!unbounded && clock.nanoTime() - deadline >= 0) {
          return LiveReport.EndReason.RUN_TIME_ELAPSED;
        }
        if (feed.awaitFinished(Duration.ZERO) && watcher.frameIndex() == buffer.writeIndex()) {
          return LiveReport.EndReason.FEED_DRAINED;
        }
      }
    } catch (InterruptedException ie) {
      // restored by run() once both threads have been joined
      return LiveReport.EndReason.INTERRUPTED;
    }
  }
}
