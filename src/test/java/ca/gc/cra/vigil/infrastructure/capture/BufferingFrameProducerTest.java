package ca.gc.cra.vigil.infrastructure.capture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.vigil.application.port.ClockPort;
import ca.gc.cra.vigil.application.port.FrameSource;
import ca.gc.cra.vigil.domain.frame.Frame;
import ca.gc.cra.vigil.domain.frame.TimestampedFrame;
import ca.gc.cra.vigil.infrastructure.buffer.RingFrameBuffer;
import ca.gc.cra.vigil.testutil.RecordingMetricsPort;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class BufferingFrameProducerTest {

  @Test
  void fillsBufferUntilSourceIsExhausted() throws Exception {
    RingFrameBuffer buffer = new RingFrameBuffer(4);
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    SyntheticFrameSource source = new SyntheticFrameSource(24, 24, 6, 30d, ClockPort.SYSTEM);
    BufferingFrameProducer producer =
        new BufferingFrameProducer("feed", source, buffer, Duration.ZERO, metrics);

    producer.start();

    assertTrue(producer.awaitFinished(Duration.ofSeconds(5)));
    assertEquals(6L, buffer.frameCount());
    assertEquals(1, buffer.writeIndex());
    assertEquals(6, metrics.count("producer.frames.written"));
    assertTrue(producer.failure().isEmpty());
    assertTrue(source.isExhausted());
    producer.close();
  }

  @Test
  void sourceFailureIsRecordedAndSourceClosed() throws Exception {
    RingFrameBuffer buffer = new RingFrameBuffer(4);
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    FailingSource source = new FailingSource(2);
    BufferingFrameProducer producer = new BufferingFrameProducer("feed", source, buffer, null, metrics);

    producer.start();

    assertTrue(producer.awaitFinished(Duration.ofSeconds(5)));
    assertEquals(2L, buffer.frameCount());
    Exception failure = producer.failure().orElseThrow();
    assertSame(IOException.class, failure.getClass());
    assertEquals(1, metrics.count("producer.failure"));
    assertTrue(source.closed.get());
  }

  @Test
  void stopInterruptsUnlimitedSource() throws Exception {
    RingFrameBuffer buffer = new RingFrameBuffer(8);
    SyntheticFrameSource source = new SyntheticFrameSource(16, 16, 0, 30d, ClockPort.SYSTEM);
    BufferingFrameProducer producer =
        new BufferingFrameProducer("feed", source, buffer, Duration.ofMillis(1), new RecordingMetricsPort());

    producer.start();
    long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
    while (buffer.frameCount() < 3 && System.nanoTime() < deadline) {
      Thread.sleep(1);
    }
    producer.stop();

    assertTrue(producer.awaitFinished(Duration.ofSeconds(1)));
    assertTrue(buffer.frameCount() >= 3);
    assertTrue(producer.failure().isEmpty());
  }

  @Test
  void startsOnlyOnce() throws Exception {
    BufferingFrameProducer producer = new BufferingFrameProducer(
        "feed", new FailingSource(0), new RingFrameBuffer(2), Duration.ZERO, new RecordingMetricsPort());
    producer.start();
    assertThrows(IllegalStateException.class, producer::start);
    producer.close();
  }

  @Test
  void restartingAFinishedProducerLeavesItStopped() throws Exception {
    BufferingFrameProducer producer = new BufferingFrameProducer(
        "feed", new FailingSource(1), new RingFrameBuffer(2), Duration.ZERO, new RecordingMetricsPort());
    producer.start();
    assertTrue(producer.awaitFinished(Duration.ofSeconds(5)));
    assertFalse(producer.isRunning());

    assertThrows(IllegalStateException.class, producer::start);
    assertFalse(producer.isRunning());
    producer.close();
  }

  private static final class FailingSource implements FrameSource {
    private final int framesBeforeFailure;
    private final AtomicBoolean closed = new AtomicBoolean();
    private int served;

    FailingSource(int framesBeforeFailure) {
      this.framesBeforeFailure = framesBeforeFailure;
    }

    @Override
    public void start() {
      served = 0;
    }

    @Override
    public Optional<TimestampedFrame> poll() throws IOException {
      if (served >= framesBeforeFailure) {
        throw new IOException("camera unplugged");
      }
      served++;
      return Optional.of(new TimestampedFrame(Instant.ofEpochMilli(served), Frame.filled(4, 4, 1, served)));
    }

    @Override
    public void close() {
      closed.set(true);
    }
  }
}
