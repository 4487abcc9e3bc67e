package ca.gc.cra.vigil.application.port;

import java.time.Duration;
import java.util.Optional;

/**
 * Background writer that fills a frame buffer from some source.
 *
 * @since 0.1.0
 */
public interface FrameFeed {
  /** Starts writing frames on a background thread. */
  void start();

  /**
   * Waits for the feed to run out of frames.
   *
   * @param timeout maximum wait
   * @return {@code true} if the feed has finished
   * @throws InterruptedException if interrupted while waiting
   */
  boolean awaitFinished(Duration timeout) throws InterruptedException;

  /**
   * Returns the exception that ended the feed early, if any.
   *
   * @return feed failure
   */
  Optional<Exception> failure();

  /**
   * Stops the feed and waits for its thread to exit.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  void stop() throws InterruptedException;
}
