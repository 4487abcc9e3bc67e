package ca.gc.cra.vigil.application.port;

/**
 * <strong>What:</strong> Time source for frame telemetry, heartbeats, and synthetic timestamps.
 * <p><strong>Why:</strong> FPS windows and heartbeat intervals are measured against this port so tests can drive
 * them deterministically.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.vigil.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Returns a monotonic timestamp for measuring elapsed time.
   *
   * @return nanoseconds from an arbitrary origin
   */
  long nanoTime();

  /** Clock backed by {@link System#currentTimeMillis()} and {@link System#nanoTime()}. */
  ClockPort SYSTEM = new ClockPort() {
    @Override
    public long nowMillis() {
      return System.currentTimeMillis();
    }

    @Override
    public long nanoTime() {
      return System.nanoTime();
    }
  };
}
