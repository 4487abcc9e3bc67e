package ca.gc.cra.vigil.application.pipeline;

import ca.gc.cra.vigil.application.port.CaptureStore;
import ca.gc.cra.vigil.application.port.DetectionEventPublisher;
import ca.gc.cra.vigil.application.port.FrameProcessor;
import ca.gc.cra.vigil.application.port.FrameRenderer;
import ca.gc.cra.vigil.application.port.FrameSource;
import ca.gc.cra.vigil.application.port.MetricsPort;
import ca.gc.cra.vigil.application.port.ObjectTracker;
import ca.gc.cra.vigil.domain.detect.ProcessedFrame;
import ca.gc.cra.vigil.domain.frame.Frame;
import ca.gc.cra.vigil.domain.frame.TimestampedFrame;
import ca.gc.cra.vigil.domain.track.CollisionAlert;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Pulls frames one at a time from a finite {@link FrameSource} and processes them on the caller's thread.
 * <p>Per frame: apply the skip cadence, optionally rescale, run the per-frame contract, feed the tracker,
 * save the frame when it produced events and capture is enabled, render, publish, and optionally sleep.
 * Skipped frames never reach the processor, so they affect neither FPS nor event history.</p>
 * <p>Ends cleanly when the source is exhausted, on {@link #requestStop()}, or when the thread is interrupted.
 * Instances are not reusable; invoke {@link #run()} at most once.</p>
 *
 * @since 0.1.0
 */
public final class PlaybackUseCase {
  private static final Logger log = LoggerFactory.getLogger(PlaybackUseCase.class);
  private static final long EMPTY_POLL_BACKOFF_MILLIS = 5L;

  private final FrameSource source;
  private final FrameProcessor processor;
  private final ObjectTracker tracker;
  private final CaptureStore captureStore;
  private final FrameRenderer renderer;
  private final DetectionEventPublisher publisher;
  private final MetricsPort metrics;
  private final Settings settings;
  private final FrameSkipper skipper;

  private final AtomicBoolean stopRequested = new AtomicBoolean();
  private final AtomicReference<Thread> runThread = new AtomicReference<>();
  private boolean ran;

  /**
   * Creates a playback pipeline.
   *
   * @param source finite frame source
   * @param processor per-frame contract implementation
   * @param tracker tracker fed with each processed frame
   * @param captureStore store used when {@link Settings#saveFrames()} is set
   * @param renderer render sink used when {@link Settings#display()} is set
   * @param publisher event publisher for frames with detections
   * @param metrics metrics sink
   * @param settings playback tuning
   */
  public PlaybackUseCase(
      FrameSource source,
      FrameProcessor processor,
      ObjectTracker tracker,
      CaptureStore captureStore,
      FrameRenderer renderer,
      DetectionEventPublisher publisher,
      MetricsPort metrics,
      Settings settings) {
    this.source = Objects.requireNonNull(source, "source");
    this.processor = Objects.requireNonNull(processor, "processor");
    this.tracker = Objects.requireNonNull(tracker, "tracker");
    this.captureStore = Objects.requireNonNull(captureStore, "captureStore");
    this.renderer = Objects.requireNonNull(renderer, "renderer");
    this.publisher = Objects.requireNonNull(publisher, "publisher");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.skipper = new FrameSkipper(settings.skip());
  }

  /**
   * Runs playback until the source is exhausted or a stop is requested. The source is started here and
   * closed before returning.
   *
   * @return run counters
   * @throws Exception if the source, processor, tracker, capture store, or publisher fails
   */
  public PlaybackReport run() throws Exception {
    if (ran || !runThread.compareAndSet(null, Thread.currentThread())) {
      throw new IllegalStateException("Playback already ran");
    }
    ran = true;
    MDC.put("watcher", processor.name());
    long read = 0;
    long skipped = 0;
    long processed = 0;
    long withEvents = 0;
    long saved = 0;
    long collisions = 0;
    boolean stoppedEarly = false;
    try {
      source.start();
      log.info("Playback {} started (skip={}, scale={}, sleep={} ms, save={})",
          processor.name(), settings.skip(), settings.scale(), settings.sleep().toMillis(), settings.saveFrames());
      try {
        while (true) {
          if (stopRequested.get() || Thread.currentThread().isInterrupted()) {
            stoppedEarly = true;
            break;
          }
          Optional<TimestampedFrame> next;
          try {
            next = source.poll();
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            stoppedEarly = true;
            break;
          }
          if (next.isEmpty()) {
            if (source.isExhausted()) {
              break;
            }
            TimeUnit.MILLISECONDS.sleep(EMPTY_POLL_BACKOFF_MILLIS);
            continue;
          }
          read++;
          if (!skipper.keep()) {
            skipped++;
            metrics.increment("playback.frames.skipped");
            continue;
          }

          TimestampedFrame slot = next.get();
          Frame frame = slot.frame().scaled(settings.scale());
          ProcessedFrame result = processor.processFrame(slot.timestamp(), frame);
          if (result == null) {
            throw new IllegalStateException("Processor " + processor.name() + " returned no result");
          }
          processed++;
          metrics.increment("playback.frames.processed");

          tracker.update(result.frame(), result.events());
          List<CollisionAlert> alerts = tracker.detect(result.frame());
          collisions += alerts.size();

          if (result.hasEvents()) {
            withEvents++;
            if (settings.saveFrames()) {
              captureStore.save(processed, frame, result.frame(), result.events());
              saved++;
              metrics.increment("playback.frames.saved");
            }
            publisher.publish(processor.name(), processed, slot.timestamp(), result.events());
          }
          if (settings.display()) {
            render(result.frame());
          }
          if (!settings.sleep().isZero()) {
            TimeUnit.MILLISECONDS.sleep(settings.sleep().toMillis());
          }
        }
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        stoppedEarly = true;
      }
      publisher.flush();
    } finally {
      try {
        source.close();
      } catch (Exception closeFailure) {
        log.error("Failed to close playback source", closeFailure);
      }
      runThread.set(null);
      MDC.remove("watcher");
    }

    PlaybackReport report =
        new PlaybackReport(read, skipped, processed, withEvents, saved, collisions, stoppedEarly);
    log.info("Playback {} finished: read={}, skipped={}, processed={}, withEvents={}, saved={}, collisions={}{}",
        processor.name(), read, skipped, processed, withEvents, saved, collisions,
        stoppedEarly ? " (stopped)" : "");
    return report;
  }

  /** Requests that playback stop after the frame in progress. */
  public void requestStop() {
    stopRequested.set(true);
  }

  private void render(Frame frame) {
    try {
      renderer.render(processor.name(), frame);
    } catch (Exception ex) {
      metrics.increment("playback.render.error");
      log.warn("Playback failed to render frame; continuing", ex);
    }
  }

  /**
   * Playback tuning.
   *
   * @param skip frames discarded before each kept frame
   * @param scale uniform rescale factor applied before processing
   * @param sleep pause after each processed frame
   * @param saveFrames whether frames with events are written to the capture store
   * @param display whether processed frames are rendered
   */
  public record Settings(int skip, double scale, Duration sleep, boolean saveFrames, boolean display) {
    /**
     * Validates playback settings.
     *
     * @param skip skip count; zero or positive
     * @param scale positive scale factor
     * @param sleep non-negative pause; {@code null} means none
     * @param saveFrames capture flag
     * @param display render flag
     */
    public Settings {
      if (skip < 0) {
        throw new IllegalArgumentException("skip must be >= 0");
      }
      if (!(scale > 0d)) {
        throw new IllegalArgumentException("scale must be positive");
      }
      sleep = Objects.requireNonNullElse(sleep, Duration.ZERO);
      if (sleep.isNegative()) {
        throw new IllegalArgumentException("sleep must not be negative");
      }
    }

    /**
     * Returns settings that process every frame at its original size without pauses.
     *
     * @return default settings
     */
    public static Settings defaults() {
      return new Settings(0, 1.0d, Duration.ZERO, false, false);
    }
  }
}
