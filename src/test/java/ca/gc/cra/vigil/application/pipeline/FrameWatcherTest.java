package ca.gc.cra.vigil.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import ca.gc.cra.vigil.application.port.DetectionEventPublisher;
import ca.gc.cra.vigil.application.port.FrameProcessor;
import ca.gc.cra.vigil.application.port.FrameRenderer;
import ca.gc.cra.vigil.domain.detect.DetectionEvent;
import ca.gc.cra.vigil.domain.detect.ProcessedFrame;
import ca.gc.cra.vigil.domain.frame.Frame;
import ca.gc.cra.vigil.infrastructure.buffer.RingFrameBuffer;
import ca.gc.cra.vigil.testutil.RecordingMetricsPort;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.stream.LongStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class FrameWatcherTest {
  private static final Duration TIMEOUT = Duration.ofSeconds(5);

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private FrameWatcher watcher;

  @BeforeEach
  void setUpLogger() {
    logger = (Logger) LoggerFactory.getLogger(FrameWatcher.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() throws InterruptedException {
    if (watcher != null) {
      watcher.stop();
    }
    logger.detachAppender(appender);
    appender.stop();
  }

  @Test
  void deliversEveryFrameInOrderAcrossWrap() throws Exception {
    RingFrameBuffer buffer = new RingFrameBuffer(8);
    RecordingFrameProcessor processor = new RecordingFrameProcessor();
    watcher = FrameWatcher.create("cam-order", buffer, processor).build();
    buffer.addWriteListener(watcher::signalFrameAvailable);
    watcher.start();

    for (long id = 0; id < 5; id++) {
      buffer.write(RecordingFrameProcessor.stamp(id), RecordingFrameProcessor.frame());
    }
    awaitCondition(() -> processor.processed().size() == 5);

    for (long id = 5; id < 11; id++) {
      buffer.write(RecordingFrameProcessor.stamp(id), RecordingFrameProcessor.frame());
      awaitCondition(() -> watcher.frameIndex() == buffer.writeIndex());
    }
    awaitCondition(() -> processor.processed().size() == 11);

    assertEquals(LongStream.range(0, 11).boxed().toList(), processor.processed());
    assertEquals(11, watcher.framesProcessed());
    assertEquals(buffer.writeIndex(), watcher.frameIndex());
  }

  @Test
  void lappedConsumerSkipsOverwrittenFramesAndNeverReplays() throws Exception {
    RingFrameBuffer buffer = new RingFrameBuffer(8);
    RecordingFrameProcessor processor = new RecordingFrameProcessor().blockAt(0);
    watcher = FrameWatcher.create("cam-lapped", buffer, processor).build();
    buffer.addWriteListener(watcher::signalFrameAvailable);
    watcher.start();

    buffer.write(RecordingFrameProcessor.stamp(0), RecordingFrameProcessor.frame());
    assertTrue(processor.awaitBlocked(5, TimeUnit.SECONDS));
    for (long id = 1; id <= 20; id++) {
      buffer.write(RecordingFrameProcessor.stamp(id), RecordingFrameProcessor.frame());
    }
    processor.release();

    awaitCondition(() -> watcher.frameIndex() == buffer.writeIndex() && processor.processed().size() == 5);
    assertEquals(List.of(0L, 17L, 18L, 19L, 20L), processor.processed());
  }

  @Test
  void alignsWithWriteCursorOnStart() throws Exception {
    RingFrameBuffer buffer = new RingFrameBuffer(8);
    for (long id = 0; id < 3; id++) {
      buffer.write(RecordingFrameProcessor.stamp(id), RecordingFrameProcessor.frame());
    }
    RecordingFrameProcessor processor = new RecordingFrameProcessor();
    watcher = FrameWatcher.create("cam-align", buffer, processor).build();
    watcher.start();
    assertEquals(2, watcher.frameIndex());

    buffer.write(RecordingFrameProcessor.stamp(3), RecordingFrameProcessor.frame());
    awaitCondition(() -> processor.processed().size() == 1);
    assertEquals(List.of(3L), processor.processed());
  }

  @Test
  void fullBufferThenSingleWrapProcessesOnlyTheNewFrame() throws Exception {
    RingFrameBuffer buffer = new RingFrameBuffer(8);
    for (long id = 0; id < 8; id++) {
      buffer.write(RecordingFrameProcessor.stamp(id), RecordingFrameProcessor.frame());
    }
    assertEquals(7, buffer.writeIndex());
    RecordingFrameProcessor processor = new RecordingFrameProcessor();
    watcher = FrameWatcher.create("cam-wrap", buffer, processor).build();
    buffer.addWriteListener(watcher::signalFrameAvailable);
    watcher.start();
    TimeUnit.MILLISECONDS.sleep(30);
    assertTrue(processor.processed().isEmpty());

    buffer.write(RecordingFrameProcessor.stamp(8), RecordingFrameProcessor.frame());
    assertEquals(0, buffer.writeIndex());
    awaitCondition(() -> watcher.frameIndex() == 0 && processor.processed().size() == 1);
    assertEquals(List.of(8L), processor.processed());
  }

  @Test
  void skipsSlotsThatWereNeverWritten() throws Exception {
    RingFrameBuffer buffer = new RingFrameBuffer(8);
    for (long id = 0; id < 3; id++) {
      buffer.write(RecordingFrameProcessor.stamp(id), RecordingFrameProcessor.frame());
    }
    RecordingFrameProcessor processor = new RecordingFrameProcessor();
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    watcher = FrameWatcher.create("cam-empty", buffer, processor)
        .metrics(metrics)
        .startIndex(5)
        .build();
    watcher.start();

    awaitCondition(() -> processor.processed().size() == 3);
    assertEquals(List.of(0L, 1L, 2L), processor.processed());
    assertEquals(2, watcher.emptySlotsSkipped());
    assertEquals(2, metrics.count("watcher.slots.empty"));
    assertEquals(3, metrics.count("watcher.frames.processed"));
  }

  @Test
  void failureStopsTheLoopBeforeTheNextFrame() throws Exception {
    RingFrameBuffer buffer = new RingFrameBuffer(64);
    RecordingFrameProcessor processor = new RecordingFrameProcessor().failAt(42);
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    watcher = FrameWatcher.create("cam-fail", buffer, processor).metrics(metrics).build();
    buffer.addWriteListener(watcher::signalFrameAvailable);
    watcher.start();

    for (long id = 0; id <= 50; id++) {
      buffer.write(RecordingFrameProcessor.stamp(id), RecordingFrameProcessor.frame());
    }
    awaitCondition(() -> watcher.failure().isPresent());
    TimeUnit.MILLISECONDS.sleep(50);

    assertEquals(FrameWatcher.State.STOPPED, watcher.state());
    assertEquals(LongStream.range(0, 42).boxed().toList(), processor.processed());
    assertFalse(processor.processed().contains(43L));
    assertTrue(watcher.failure().orElseThrow() instanceof IllegalStateException);
    assertEquals(1, metrics.count("watcher.failure"));

    List<ILoggingEvent> errors = new ArrayList<>();
    for (ILoggingEvent event : logged()) {
      if (event.getLevel() == Level.ERROR) {
        errors.add(event);
      }
    }
    assertEquals(1, errors.size());
    assertTrue(errors.get(0).getFormattedMessage().contains("cam-fail"));
    assertTrue(errors.get(0).getThrowableProxy().getMessage().contains("frame 42"));
  }

  @Test
  void stopIsIdempotentAndNoFrameIsProcessedAfterItReturns() throws Exception {
    RingFrameBuffer buffer = new RingFrameBuffer(16);
    RecordingFrameProcessor processor = new RecordingFrameProcessor();
    watcher = FrameWatcher.create("cam-stop", buffer, processor).build();
    watcher.stop();
    buffer.addWriteListener(watcher::signalFrameAvailable);
    watcher.start();
    assertEquals(FrameWatcher.State.RUNNING, watcher.state());

    buffer.write(RecordingFrameProcessor.stamp(1), RecordingFrameProcessor.frame());
    awaitCondition(() -> processor.processed().size() == 1);
    watcher.stop();
    watcher.stop();
    assertEquals(FrameWatcher.State.STOPPED, watcher.state());

    buffer.write(RecordingFrameProcessor.stamp(2), RecordingFrameProcessor.frame());
    TimeUnit.MILLISECONDS.sleep(50);
    assertEquals(List.of(1L), processor.processed());
    assertTrue(watcher.failure().isEmpty());
  }

  @Test
  void startTwiceIsRejected() {
    RingFrameBuffer buffer = new RingFrameBuffer(4);
    watcher = FrameWatcher.create("cam-twice", buffer, new RecordingFrameProcessor()).build();
    watcher.start();
    assertThrows(IllegalStateException.class, watcher::start);
  }

  @Test
  void startIndexOutsideBufferIsRejected() {
    RingFrameBuffer buffer = new RingFrameBuffer(4);
    FrameWatcher outOfRange = FrameWatcher.create("cam-range", buffer, new RecordingFrameProcessor())
        .startIndex(4)
        .build();
    assertThrows(IllegalArgumentException.class, outOfRange::start);
  }

  @Test
  void heartbeatLogsZeroPaddedFrameCount() throws Exception {
    RingFrameBuffer buffer = new RingFrameBuffer(8);
    for (long id = 0; id < 3; id++) {
      buffer.write(RecordingFrameProcessor.stamp(id), RecordingFrameProcessor.frame());
    }
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    watcher = FrameWatcher.create("cam-beat", buffer, new RecordingFrameProcessor())
        .metrics(metrics)
        .settings(new FrameWatcher.Settings(Duration.ofMillis(2), Duration.ofMillis(10), false, -1))
        .build();
    watcher.start();

    awaitCondition(() -> logged().stream()
        .anyMatch(event -> event.getFormattedMessage().equals("cam-beat heartbeat 00000003")));
    assertTrue(metrics.observed("watcher.heartbeat").contains(3L));
  }

  @Test
  void heartbeatKeepsFiringWhileTheWatcherNeverCatchesUp() throws Exception {
    RingFrameBuffer buffer = new RingFrameBuffer(8);
    buffer.write(RecordingFrameProcessor.stamp(0), RecordingFrameProcessor.frame());
    FrameProcessor chasing = new FrameProcessor() {
      private long next = 1;

      @Override
      public ProcessedFrame processFrame(Instant timestamp, Frame frame) throws Exception {
        TimeUnit.MILLISECONDS.sleep(2);
        buffer.write(RecordingFrameProcessor.stamp(next++), RecordingFrameProcessor.frame());
        return new ProcessedFrame(frame, List.of());
      }

      @Override
      public String name() {
        return "chasing";
      }
    };
    watcher = FrameWatcher.create("cam-busy", buffer, chasing)
        .settings(new FrameWatcher.Settings(Duration.ofMillis(5), Duration.ofMillis(20), false, 7))
        .build();
    watcher.start();

    awaitCondition(() -> heartbeats("cam-busy") > 0);
    assertEquals(FrameWatcher.State.RUNNING, watcher.state());
    watcher.stop();

    long afterStop = heartbeats("cam-busy");
    TimeUnit.MILLISECONDS.sleep(50);
    assertEquals(afterStop, heartbeats("cam-busy"));
  }

  @Test
  void recordsTheFrameRateReportedByAnyProcessor() throws Exception {
    RingFrameBuffer buffer = new RingFrameBuffer(8);
    FrameProcessor measured = new FrameProcessor() {
      @Override
      public ProcessedFrame processFrame(Instant timestamp, Frame frame) {
        return new ProcessedFrame(frame, List.of());
      }

      @Override
      public String name() {
        return "measured";
      }

      @Override
      public double fps() {
        return 12.4d;
      }
    };
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    watcher = FrameWatcher.create("cam-fps", buffer, measured).metrics(metrics).build();
    buffer.addWriteListener(watcher::signalFrameAvailable);
    watcher.start();

    buffer.write(RecordingFrameProcessor.stamp(0), RecordingFrameProcessor.frame());
    awaitCondition(() -> watcher.framesProcessed() == 1);
    assertEquals(List.of(12L), metrics.observed("watcher.fps"));
  }

  @Test
  void publishesEventsAndRendersWhenDisplayEnabled() throws Exception {
    RingFrameBuffer buffer = new RingFrameBuffer(8);
    RecordingFrameProcessor processor = new RecordingFrameProcessor().emitEventsWhen(id -> id % 2 == 0);
    List<Long> publishedFrames = new CopyOnWriteArrayList<>();
    List<String> publishedSources = new CopyOnWriteArrayList<>();
    DetectionEventPublisher publisher = (source, frameNumber, timestamp, events) -> {
      publishedSources.add(source);
      publishedFrames.add(frameNumber);
    };
    AtomicInteger rendered = new AtomicInteger();
    FrameRenderer renderer = (window, frame) -> rendered.incrementAndGet();
    watcher = FrameWatcher.create("cam-out", buffer, processor)
        .publisher(publisher)
        .renderer(renderer)
        .settings(new FrameWatcher.Settings(null, null, true, -1))
        .build();
    buffer.addWriteListener(watcher::signalFrameAvailable);
    watcher.start();

    for (long id = 0; id < 4; id++) {
      buffer.write(RecordingFrameProcessor.stamp(id), RecordingFrameProcessor.frame());
    }
    awaitCondition(() -> processor.processed().size() == 4);
    watcher.stop();

    assertEquals(List.of(1L, 3L), publishedFrames);
    assertEquals(List.of("cam-out", "cam-out"), publishedSources);
    assertEquals(4, rendered.get());
  }

  @Test
  void rendererFailureDoesNotStopTheWatcher() throws Exception {
    RingFrameBuffer buffer = new RingFrameBuffer(8);
    RecordingFrameProcessor processor = new RecordingFrameProcessor();
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    FrameRenderer broken = (window, frame) -> {
      throw new IllegalStateException("no window");
    };
    watcher = FrameWatcher.create("cam-render", buffer, processor)
        .renderer(broken)
        .metrics(metrics)
        .settings(new FrameWatcher.Settings(null, null, true, -1))
        .build();
    buffer.addWriteListener(watcher::signalFrameAvailable);
    watcher.start();

    buffer.write(RecordingFrameProcessor.stamp(0), RecordingFrameProcessor.frame());
    buffer.write(RecordingFrameProcessor.stamp(1), RecordingFrameProcessor.frame());
    awaitCondition(() -> processor.processed().size() == 2);

    assertEquals(FrameWatcher.State.RUNNING, watcher.state());
    assertTrue(watcher.failure().isEmpty());
    assertEquals(2, metrics.count("watcher.render.error"));
  }

  @Test
  void processFrameRunsOnCallerThreadOnlyWhileStopped() throws Exception {
    RingFrameBuffer buffer = new RingFrameBuffer(4);
    RecordingFrameProcessor processor = new RecordingFrameProcessor().emitEventsWhen(id -> true);
    List<List<DetectionEvent>> published = new CopyOnWriteArrayList<>();
    watcher = FrameWatcher.create("cam-direct", buffer, processor)
        .publisher((source, frameNumber, timestamp, events) -> published.add(events))
        .build();

    Instant timestamp = RecordingFrameProcessor.stamp(7);
    ProcessedFrame result = watcher.processFrame(timestamp, RecordingFrameProcessor.frame());
    assertEquals(1, result.events().size());
    assertEquals(1, published.size());
    assertSame(timestamp, watcher.previousTimestamp());

    watcher.start();
    assertThrows(IllegalStateException.class,
        () -> watcher.processFrame(timestamp, RecordingFrameProcessor.frame()));
  }

  private long heartbeats(String source) {
    return logged().stream()
        .filter(event -> event.getFormattedMessage().startsWith(source + " heartbeat "))
        .count();
  }

  private List<ILoggingEvent> logged() {
    synchronized (appender) {
      return List.copyOf(appender.list);
    }
  }

  private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + TIMEOUT.toNanos();
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() - deadline > 0) {
        fail("condition not met within " + TIMEOUT);
      }
      TimeUnit.MILLISECONDS.sleep(2);
    }
  }
}
