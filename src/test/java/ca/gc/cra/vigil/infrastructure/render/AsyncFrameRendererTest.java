package ca.gc.cra.vigil.infrastructure.render;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.vigil.application.port.FrameRenderer;
import ca.gc.cra.vigil.domain.frame.Frame;
import ca.gc.cra.vigil.testutil.RecordingMetricsPort;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class AsyncFrameRendererTest {

  @Test
  void slowDisplayKeepsOnlyLatestFrame() throws Exception {
    CountDownLatch firstStarted = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    List<Integer> drawn = new CopyOnWriteArrayList<>();
    FrameRenderer slow = (window, frame) -> {
      firstStarted.countDown();
      release.await(5, TimeUnit.SECONDS);
      drawn.add(frame.width());
    };
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    AsyncFrameRenderer renderer = new AsyncFrameRenderer("cam-1", slow, metrics);

    renderer.render("cam-1", Frame.filled(1, 1, 1, 0));
    assertTrue(firstStarted.await(5, TimeUnit.SECONDS));
    renderer.render("cam-1", Frame.filled(2, 1, 1, 0));
    renderer.render("cam-1", Frame.filled(3, 1, 1, 0));
    release.countDown();

    awaitCount(metrics, "render.frames.drawn", 2);
    renderer.close();

    assertEquals(List.of(1, 3), drawn);
    assertEquals(1, metrics.count("render.frames.dropped"));
  }

  @Test
  void failingDisplayIsCountedAndRendererKeepsDrawing() throws Exception {
    AtomicBoolean fail = new AtomicBoolean(true);
    AtomicBoolean delegateClosed = new AtomicBoolean();
    FrameRenderer flaky = new FrameRenderer() {
      @Override
      public void render(String windowName, Frame frame) {
        if (fail.getAndSet(false)) {
          throw new IllegalStateException("display lost");
        }
      }

      @Override
      public void close() {
        delegateClosed.set(true);
      }
    };
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    AsyncFrameRenderer renderer = new AsyncFrameRenderer("cam-2", flaky, metrics);

    renderer.render("cam-2", Frame.filled(1, 1, 1, 0));
    awaitCount(metrics, "render.error", 1);
    renderer.render("cam-2", Frame.filled(1, 1, 1, 0));
    awaitCount(metrics, "render.frames.drawn", 1);
    renderer.close();

    assertTrue(delegateClosed.get());
    renderer.render("cam-2", Frame.filled(1, 1, 1, 0));
    assertEquals(1, metrics.count("render.frames.drawn"));
  }

  @Test
  void busyDisplayIsNotClosedWhileDrawing() throws Exception {
    CountDownLatch drawing = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    AtomicBoolean delegateClosed = new AtomicBoolean();
    FrameRenderer stuck = new FrameRenderer() {
      @Override
      public void render(String windowName, Frame frame) throws Exception {
        drawing.countDown();
        release.await(5, TimeUnit.SECONDS);
      }

      @Override
      public void close() {
        delegateClosed.set(true);
      }
    };
    AsyncFrameRenderer renderer =
        new AsyncFrameRenderer("cam-3", stuck, new RecordingMetricsPort(), Duration.ofMillis(50));

    renderer.render("cam-3", Frame.filled(1, 1, 1, 0));
    assertTrue(drawing.await(5, TimeUnit.SECONDS));
    try {
      renderer.close();
      assertFalse(delegateClosed.get());
    } finally {
      release.countDown();
    }
  }

  @Test
  void loggingRendererCountsFrames() {
    LoggingFrameRenderer renderer = new LoggingFrameRenderer();
    renderer.render("cam", Frame.filled(2, 2, 3, 0));
    renderer.render("cam", Frame.filled(2, 2, 3, 0));
    assertEquals(2L, renderer.rendered());
  }

  private static void awaitCount(RecordingMetricsPort metrics, String key, int expected) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (metrics.count(key) < expected && System.nanoTime() < deadline) {
      Thread.sleep(2);
    }
    assertEquals(expected, metrics.count(key), key);
  }
}
