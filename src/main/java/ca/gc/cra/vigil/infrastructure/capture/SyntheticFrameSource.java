package ca.gc.cra.vigil.infrastructure.capture;

import ca.gc.cra.vigil.application.port.ClockPort;
import ca.gc.cra.vigil.application.port.FrameSource;
import ca.gc.cra.vigil.domain.frame.Frame;
import ca.gc.cra.vigil.domain.frame.TimestampedFrame;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Generates frames showing a bright square moving across a dark background.
 * <p>Timestamps advance by exactly {@code 1 / fps} per frame from the clock reading at {@link #start()}, so
 * downstream FPS telemetry is deterministic. A frame limit of zero produces frames indefinitely.</p>
 *
 * @since 0.1.0
 */
public final class SyntheticFrameSource implements FrameSource {
  private static final int BACKGROUND = 16;
  private static final int FOREGROUND = 235;

  private final int width;
  private final int height;
  private final int blockSize;
  private final long frameLimit;
  private final Duration interval;
  private final ClockPort clock;

  private Instant origin;
  private long produced;
  private volatile boolean exhausted;

  /**
   * Creates a synthetic source.
   *
   * @param width frame width in pixels
   * @param height frame height in pixels
   * @param frameLimit frames to produce before exhaustion; zero for unlimited
   * @param fps nominal frame rate used for timestamps; must be positive
   * @param clock clock providing the first timestamp
   */
  public SyntheticFrameSource(int width, int height, long frameLimit, double fps, ClockPort clock) {
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException("frame dimensions must be positive");
    }
    if (frameLimit < 0) {
      throw new IllegalArgumentException("frameLimit must be >= 0");
    }
    if (!(fps > 0d)) {
      throw new IllegalArgumentException("fps must be positive");
    }
    this.width = width;
    this.height = height;
    this.blockSize = Math.max(2, Math.min(width, height) / 6);
    this.frameLimit = frameLimit;
    this.interval = Duration.ofNanos(Math.round(1_000_000_000d / fps));
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void start() {
    origin = Instant.ofEpochMilli(clock.nowMillis());
    produced = 0;
    exhausted = false;
  }

  @Override
  public Optional<TimestampedFrame> poll() {
    if (origin == null || exhausted) {
      return Optional.empty();
    }
    if (frameLimit > 0 && produced >= frameLimit) {
      exhausted = true;
      return Optional.empty();
    }
    long index = produced++;
    Instant timestamp = origin.plus(interval.multipliedBy(index));
    return Optional.of(new TimestampedFrame(timestamp, render(index)));
  }

  @Override
  public boolean isExhausted() {
    return exhausted;
  }

  @Override
  public void close() {
    exhausted = true;
  }

  Frame render(long index) {
    byte[] pixels = new byte[width * height * 3];
    Arrays.fill(pixels, (byte) BACKGROUND);
    int travel = Math.max(1, width - blockSize);
    int left = (int) ((index * 4) % travel);
    int top = (height - blockSize) / 2;
    for (int y = top; y < top + blockSize; y++) {
      for (int x = left; x < left + blockSize; x++) {
        int offset = (y * width + x) * 3;
        pixels[offset] = (byte) FOREGROUND;
        pixels[offset + 1] = (byte) FOREGROUND;
        pixels[offset + 2] = (byte) FOREGROUND;
      }
    }
    return new Frame(width, height, 3, pixels);
  }
}
