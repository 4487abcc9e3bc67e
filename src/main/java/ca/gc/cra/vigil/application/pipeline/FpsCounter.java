package ca.gc.cra.vigil.application.pipeline;

import ca.gc.cra.vigil.application.port.ClockPort;
import java.util.Objects;

/**
 * Rolling frames-per-second measurement over a fixed window of processed frames.
 * <p>The rate is recomputed as {@code window / elapsedSeconds} each time {@code window} frames have been counted
 * and holds its last value in between. Reads {@code 0.0} until the first window completes.</p>
 * <p>Not thread-safe; owned by a single frame processor.</p>
 *
 * @since 0.1.0
 */
public final class FpsCounter {
  /** Default window size in frames. */
  public static final int DEFAULT_WINDOW = 20;

  private final int window;
  private final ClockPort clock;
  private int counter;
  private long windowStartNanos;
  private double fps;

  /**
   * Creates a counter whose first window starts now.
   *
   * @param window frames per measurement window; must be positive
   * @param clock time source for elapsed measurements
   */
  public FpsCounter(int window, ClockPort clock) {
    if (window <= 0) {
      throw new IllegalArgumentException("fps window must be positive (was " + window + ")");
    }
    this.window = window;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.windowStartNanos = clock.nanoTime();
  }

  /**
   * Counts one processed frame.
   *
   * @return the current rate; changes only when this call completes a window
   */
  public double tick() {
    counter++;
    if (counter == window) {
      long now = clock.nanoTime();
      long elapsedNanos = now - windowStartNanos;
      if (elapsedNanos > 0) {
        fps = window / (elapsedNanos / 1_000_000_000d);
      }
      windowStartNanos = now;
      counter = 0;
    }
    return fps;
  }

  /**
   * Returns the rate computed at the end of the last completed window.
   *
   * @return frames per second
   */
  public double fps() {
    return fps;
  }

  public int window() {
    return window;
  }
}
