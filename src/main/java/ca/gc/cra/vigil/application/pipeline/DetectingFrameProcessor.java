package ca.gc.cra.vigil.application.pipeline;

import ca.gc.cra.vigil.application.port.ClockPort;
import ca.gc.cra.vigil.application.port.DetectionStep;
import ca.gc.cra.vigil.application.port.FrameProcessor;
import ca.gc.cra.vigil.application.port.MetricsPort;
import ca.gc.cra.vigil.domain.detect.ProcessedFrame;
import ca.gc.cra.vigil.domain.frame.Frame;
import ca.gc.cra.vigil.domain.frame.Overlay;
import ca.gc.cra.vigil.domain.frame.Rgb;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implements the steps of the per-frame contract shared by every detector variant, then delegates to the
 * variant's {@link DetectionStep}.
 * <p>For each frame: measures the gap since the previous processed frame, ticks the FPS window, stamps the
 * diagnostic marker and FPS text onto a copy of the frame, runs the detection step, and verifies the step
 * honoured the result contract.</p>
 *
 * @since 0.1.0
 */
public final class DetectingFrameProcessor implements FrameProcessor, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(DetectingFrameProcessor.class);

  static final int MARKER_X = 8;
  static final int MARKER_Y = 12;
  static final int MARKER_RADIUS = 4;
  static final int TEXT_X = 17;
  static final int TEXT_Y = 16;
  static final double TEXT_SCALE = 0.5d;
  private static final Rgb MARKER_COLOR = new Rgb(200, 40, 10);
  private static final Rgb TEXT_COLOR = new Rgb(50, 120, 150);

  private final String name;
  private final DetectionStep step;
  private final FpsCounter fpsCounter;
  private final MetricsPort metrics;
  private final ClockPort clock;

  private Instant previousTimestamp;
  private Duration lastFrameGap = Duration.ZERO;

  /**
   * Creates a processor with the default FPS window.
   *
   * @param name name stamped into the overlay text
   * @param step variant-specific detection
   */
  public DetectingFrameProcessor(String name, DetectionStep step) {
    this(name, step, FpsCounter.DEFAULT_WINDOW, ClockPort.SYSTEM, MetricsPort.NO_OP);
  }

  /**
   * Creates a processor.
   *
   * @param name name stamped into the overlay text
   * @param step variant-specific detection
   * @param fpsWindow frames per FPS measurement window
   * @param clock time source for FPS measurement
   * @param metrics metrics sink
   */
  public DetectingFrameProcessor(
      String name, DetectionStep step, int fpsWindow, ClockPort clock, MetricsPort metrics) {
    this.name = Objects.requireNonNull(name, "name");
    this.step = Objects.requireNonNull(step, "step");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.fpsCounter = new FpsCounter(fpsWindow, clock);
  }

  @Override
  public ProcessedFrame processFrame(Instant timestamp, Frame frame) throws Exception {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(frame, "frame");
    long startNanos = clock.nanoTime();

    if (previousTimestamp != null) {
      lastFrameGap = Duration.between(previousTimestamp, timestamp);
    }
    double fps = fpsCounter.tick();

    Frame stamped = frame
        .withOverlay(new Overlay.Marker(MARKER_X, MARKER_Y, MARKER_RADIUS, MARKER_COLOR, 2))
        .withOverlay(new Overlay.Text(TEXT_X, TEXT_Y, overlayText(fps), TEXT_SCALE, TEXT_COLOR));

    ProcessedFrame result = step.detect(timestamp, stamped);
    if (result == null) {
      throw new IllegalStateException("Detection step " + step.variant() + " returned no result");
    }
    previousTimestamp = timestamp;

    metrics.observe("processor.latencyNanos", clock.nanoTime() - startNanos);
    if (log.isTraceEnabled()) {
      log.trace("{} processed frame at {} with {} events (gap {} ms)",
          name, timestamp, result.events().size(), lastFrameGap.toMillis());
    }
    return result;
  }

  @Override
  public String name() {
    return name;
  }

  /**
   * Returns the rate from the last completed FPS window.
   *
   * @return frames per second
   */
  @Override
  public double fps() {
    return fpsCounter.fps();
  }

  /**
   * Returns the capture-time gap between the two most recently processed frames.
   *
   * @return gap; zero before the second frame
   */
  public Duration lastFrameGap() {
    return lastFrameGap;
  }

  @Override
  public void close() throws Exception {
    step.close();
  }

  DetectionStep step() {
    return step;
  }

  private String overlayText(double fps) {
    return String.format(Locale.ROOT, "%s %.1f FPS", name, fps);
  }
}
