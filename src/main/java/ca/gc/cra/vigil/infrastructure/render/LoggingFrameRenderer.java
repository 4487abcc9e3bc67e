package ca.gc.cra.vigil.infrastructure.render;

import ca.gc.cra.vigil.application.port.FrameRenderer;
import ca.gc.cra.vigil.domain.frame.Frame;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renderer for headless hosts that describes each frame at DEBUG instead of drawing it.
 *
 * @since 0.1.0
 */
public final class LoggingFrameRenderer implements FrameRenderer {
  private static final Logger log = LoggerFactory.getLogger(LoggingFrameRenderer.class);

  private final AtomicLong rendered = new AtomicLong();

  @Override
  public void render(String windowName, Frame frame) {
    long count = rendered.incrementAndGet();
    if (log.isDebugEnabled()) {
      log.debug("[{}] frame {} {}x{} with {} overlays", windowName, count, frame.width(), frame.height(),
          frame.overlays().size());
    }
  }

  public long rendered() {
    return rendered.get();
  }
}
