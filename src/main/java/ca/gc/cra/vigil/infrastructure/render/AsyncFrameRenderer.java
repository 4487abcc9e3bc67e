package ca.gc.cra.vigil.infrastructure.render;

import ca.gc.cra.vigil.application.port.FrameRenderer;
import ca.gc.cra.vigil.application.port.MetricsPort;
import ca.gc.cra.vigil.domain.frame.Frame;
import ca.gc.cra.vigil.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decorator that moves rendering onto a background daemon thread.
 * <p>{@link #render(String, Frame)} only publishes the frame into a one-slot hand-off and returns; a frame that
 * has not been drawn yet is replaced by the newer one. Failures of the delegate are logged at WARN and counted,
 * never reported to the caller.</p>
 *
 * @since 0.1.0
 */
public final class AsyncFrameRenderer implements FrameRenderer {
  private static final Logger log = LoggerFactory.getLogger(AsyncFrameRenderer.class);
  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(2);

  private final FrameRenderer delegate;
  private final MetricsPort metrics;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition pendingChanged = lock.newCondition();
  private final Thread thread;
  private final Duration closeTimeout;

  private Pending pending;
  private boolean closed;

  /**
   * Creates the decorator and starts its thread.
   *
   * @param name name used for the render thread
   * @param delegate renderer invoked on the background thread
   * @param metrics metrics sink
   */
  public AsyncFrameRenderer(String name, FrameRenderer delegate, MetricsPort metrics) {
    this(name, delegate, metrics, CLOSE_TIMEOUT);
  }

  AsyncFrameRenderer(String name, FrameRenderer delegate, MetricsPort metrics, Duration closeTimeout) {
    this.closeTimeout = Objects.requireNonNull(closeTimeout, "closeTimeout");
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.thread = ExecutorFactories.renderThreads(name, (t, ex) ->
        log.error("Render thread {} crashed", t.getName(), ex)).newThread(this::drain);
    this.thread.start();
  }

  @Override
  public void render(String windowName, Frame frame) {
    Objects.requireNonNull(frame, "frame");
    lock.lock();
    try {
      if (closed) {
        return;
      }
      if (pending != null) {
        metrics.increment("render.frames.dropped");
      }
      pending = new Pending(windowName, frame);
      pendingChanged.signalAll();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void close() throws Exception {
    lock.lock();
    try {
      closed = true;
      pendingChanged.signalAll();
    } finally {
      lock.unlock();
    }
    thread.join(closeTimeout.toMillis());
    if (thread.isAlive()) {
      // delegate is still inside render()
      log.warn("Render thread {} still busy after {} ms; display left open",
          thread.getName(), closeTimeout.toMillis());
      return;
    }
    delegate.close();
  }

  private void drain() {
    while (true) {
      Pending next;
      lock.lock();
      try {
        while (pending == null && !closed) {
          pendingChanged.await(100, TimeUnit.MILLISECONDS);
        }
        if (closed) {
          return;
        }
        next = pending;
        pending = null;
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        return;
      } finally {
        lock.unlock();
      }
      try {
        delegate.render(next.windowName(), next.frame());
        metrics.increment("render.frames.drawn");
      } catch (Exception ex) {
        metrics.increment("render.error");
        log.warn("Rendering to window {} failed; frame dropped", next.windowName(), ex);
      }
    }
  }

  private record Pending(String windowName, Frame frame) {}
}
