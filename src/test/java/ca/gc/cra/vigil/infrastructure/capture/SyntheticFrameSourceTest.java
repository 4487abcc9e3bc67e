package ca.gc.cra.vigil.infrastructure.capture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.vigil.application.port.ClockPort;
import ca.gc.cra.vigil.domain.frame.Frame;
import ca.gc.cra.vigil.domain.frame.TimestampedFrame;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class SyntheticFrameSourceTest {
  private static final ClockPort FIXED = new ClockPort() {
    @Override
    public long nowMillis() {
      return 1_000L;
    }

    @Override
    public long nanoTime() {
      return 0L;
    }
  };

  @Test
  void pollBeforeStartYieldsNothing() {
    SyntheticFrameSource source = new SyntheticFrameSource(60, 30, 2, 10d, FIXED);
    assertTrue(source.poll().isEmpty());
    assertFalse(source.isExhausted());
  }

  @Test
  void producesLimitedFramesWithSteadyTimestamps() {
    SyntheticFrameSource source = new SyntheticFrameSource(60, 30, 3, 10d, FIXED);
    source.start();

    TimestampedFrame first = source.poll().orElseThrow();
    TimestampedFrame second = source.poll().orElseThrow();
    source.poll().orElseThrow();

    assertEquals(Instant.ofEpochMilli(1_000L), first.timestamp());
    assertEquals(Instant.ofEpochMilli(1_100L), second.timestamp());
    assertEquals(60, first.frame().width());
    assertEquals(3, first.frame().channels());
    assertTrue(source.poll().isEmpty());
    assertTrue(source.isExhausted());
  }

  @Test
  void zeroLimitRunsUntilClosed() {
    SyntheticFrameSource source = new SyntheticFrameSource(24, 24, 0, 30d, FIXED);
    source.start();
    for (int i = 0; i < 50; i++) {
      assertTrue(source.poll().isPresent());
    }
    source.close();
    assertTrue(source.poll().isEmpty());
    assertTrue(source.isExhausted());
  }

  @Test
  void blockMovesFourPixelsPerFrame() {
    SyntheticFrameSource source = new SyntheticFrameSource(60, 30, 0, 10d, FIXED);
    Frame first = source.render(0);
    Frame second = source.render(1);
    int row = 15;

    assertEquals(235, first.sample(0, row, 0));
    assertEquals(16, first.sample(10, row, 0));
    assertEquals(16, second.sample(0, row, 0));
    assertEquals(235, second.sample(4, row, 0));
    assertEquals(235, second.sample(8, row, 0));
    assertEquals(16, second.sample(9, row, 0));
  }

  @Test
  void rejectsInvalidSettings() {
    assertThrows(IllegalArgumentException.class, () -> new SyntheticFrameSource(0, 10, 1, 10d, FIXED));
    assertThrows(IllegalArgumentException.class, () -> new SyntheticFrameSource(10, 10, -1, 10d, FIXED));
    assertThrows(IllegalArgumentException.class, () -> new SyntheticFrameSource(10, 10, 1, 0d, FIXED));
  }
}
