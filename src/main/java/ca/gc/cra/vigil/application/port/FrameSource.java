package ca.gc.cra.vigil.application.port;

import ca.gc.cra.vigil.domain.frame.TimestampedFrame;
import java.util.Optional;

/**
 * <strong>What:</strong> Port that supplies frames to a producer thread or the synchronous playback loop.
 * <p><strong>Role:</strong> Implemented by adapters such as {@code ImageDirectoryFrameSource} and
 * {@code SyntheticFrameSource}; decoding and capture details stay behind this port.</p>
 * <p><strong>Thread-safety:</strong> Implementations expect single-threaded polling.</p>
 *
 * @implNote Callers must invoke {@link #start()} before polling and always call {@link #close()}.
 * @since 0.1.0
 */
public interface FrameSource extends AutoCloseable {
  /**
   * Opens the underlying source.
   *
   * @throws Exception if the source cannot be opened
   */
  void start() throws Exception;

  /**
   * Retrieves the next frame.
   *
   * @return next frame, or empty when none is currently available or the source is exhausted
   * @throws Exception if reading or decoding fails
   */
  Optional<TimestampedFrame> poll() throws Exception;

  /**
   * Indicates whether the source will deliver no further frames.
   *
   * @return {@code true} once the source is drained
   */
  default boolean isExhausted() {
    return false;
  }

  /**
   * Releases resources held by the source.
   *
   * @throws Exception if shutdown fails
   */
  @Override
  void close() throws Exception;
}
