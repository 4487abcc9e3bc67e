package ca.gc.cra.vigil.application.pipeline;

import ca.gc.cra.vigil.application.port.ClockPort;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/** Manually advanced clock. */
final class FakeClock implements ClockPort {
  private final AtomicLong nanos = new AtomicLong();

  @Override
  public long nowMillis() {
    return nanos.get() / 1_000_000L;
  }

  @Override
  public long nanoTime() {
    return nanos.get();
  }

  void advance(Duration duration) {
    nanos.addAndGet(duration.toNanos());
  }
}
