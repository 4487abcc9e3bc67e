package ca.gc.cra.vigil.infrastructure.capture;

import ca.gc.cra.vigil.application.port.FrameFeed;
import ca.gc.cra.vigil.application.port.FrameSource;
import ca.gc.cra.vigil.application.port.MetricsPort;
import ca.gc.cra.vigil.domain.frame.TimestampedFrame;
import ca.gc.cra.vigil.infrastructure.buffer.RingFrameBuffer;
import ca.gc.cra.vigil.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains a {@link FrameSource} into a {@link RingFrameBuffer} on its own thread.
 * <p>The producer never waits for consumers. An optional pace inserts a fixed pause after each write so finite
 * sources play back at a live-like rate. The thread ends when the source is exhausted, fails, or
 * {@link #stop()} is called; the source is closed on exit.</p>
 *
 * @since 0.1.0
 */
public final class BufferingFrameProducer implements FrameFeed, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(BufferingFrameProducer.class);
  private static final long EMPTY_POLL_BACKOFF_MILLIS = 2L;

  private final String name;
  private final FrameSource source;
  private final RingFrameBuffer buffer;
  private final Duration pace;
  private final MetricsPort metrics;

  private final AtomicBoolean running = new AtomicBoolean();
  private final AtomicReference<Exception> failure = new AtomicReference<>();
  private final CountDownLatch finished = new CountDownLatch(1);
  private volatile Thread thread;

  /**
   * Creates a producer.
   *
   * @param name name used for the producer thread and logs
   * @param source frame source; started by this producer
   * @param buffer buffer to fill
   * @param pace pause after each write; zero for none
   * @param metrics metrics sink
   */
  public BufferingFrameProducer(
      String name, FrameSource source, RingFrameBuffer buffer, Duration pace, MetricsPort metrics) {
    this.name = Objects.requireNonNull(name, "name");
    this.source = Objects.requireNonNull(source, "source");
    this.buffer = Objects.requireNonNull(buffer, "buffer");
    this.pace = Objects.requireNonNullElse(pace, Duration.ZERO);
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Starts the producer thread.
   *
   * @throws IllegalStateException if already started
   */
  @Override
  public synchronized void start() {
    if (thread != null || !running.compareAndSet(false, true)) {
      throw new IllegalStateException("Producer " + name + " already started");
    }
    Thread worker = ExecutorFactories.producerThreads(name, this::handleCrash).newThread(this::produce);
    thread = worker;
    worker.start();
  }

  /**
   * Stops the producer and waits for its thread to exit.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  @Override
  public void stop() throws InterruptedException {
    running.set(false);
    Thread worker = thread;
    if (worker != null && worker != Thread.currentThread()) {
      worker.interrupt();
      worker.join();
    }
  }

  @Override
  public void close() throws InterruptedException {
    stop();
  }

  /**
   * Waits for the source to be drained.
   *
   * @param timeout maximum wait
   * @return {@code true} if the producer finished within the timeout
   * @throws InterruptedException if interrupted while waiting
   */
  @Override
  public boolean awaitFinished(Duration timeout) throws InterruptedException {
    return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  @Override
  public Optional<Exception> failure() {
    return Optional.ofNullable(failure.get());
  }

  boolean isRunning() {
    return running.get();
  }

  private void produce() {
    long written = 0;
    try {
      source.start();
      log.info("Producer {} started filling buffer of {} slots", name, buffer.capacity());
      while (running.get()) {
        Optional<TimestampedFrame> next = source.poll();
        if (next.isEmpty()) {
          if (source.isExhausted()) {
            log.info("Producer {} source exhausted after {} frames", name, written);
            break;
          }
          TimeUnit.MILLISECONDS.sleep(EMPTY_POLL_BACKOFF_MILLIS);
          continue;
        }
        buffer.write(next.get());
        written++;
        metrics.increment("producer.frames.written");
        if (!pace.isZero()) {
          TimeUnit.NANOSECONDS.sleep(pace.toNanos());
        }
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    } catch (Exception ex) {
      failure.set(ex);
      metrics.increment("producer.failure");
      log.error("Producer {} failed after {} frames", name, written, ex);
    } finally {
      running.set(false);
      try {
        source.close();
      } catch (Exception closeFailure) {
        log.warn("Producer {} failed to close its source", name, closeFailure);
      }
      finished.countDown();
    }
  }

  private void handleCrash(Thread t, Throwable throwable) {
    Exception ex = throwable instanceof Exception e ? e : new RuntimeException("Producer crash", throwable);
    failure.compareAndSet(null, ex);
    log.error("Producer thread {} threw an uncaught error", t.getName(), throwable);
  }
}
