package ca.gc.cra.vigil.application.port;

import ca.gc.cra.vigil.domain.frame.Frame;

/**
 * Sink that displays processed frames. Rendering is best effort; pipelines isolate render failures from
 * frame processing.
 *
 * @since 0.1.0
 */
public interface FrameRenderer extends AutoCloseable {
  /**
   * Displays a frame in the named window.
   *
   * @param windowName display window identifier
   * @param frame frame to render, overlays included
   * @throws Exception if rendering fails
   */
  void render(String windowName, Frame frame) throws Exception;

  @Override
  default void close() throws Exception {}

  /** Renderer that discards frames. */
  FrameRenderer NONE = (windowName, frame) -> {};
}
