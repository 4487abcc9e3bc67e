package ca.gc.cra.vigil.application.pipeline;

/**
 * Frame-skip cadence for synchronous playback.
 * <p>Discards {@code skipCount} frames and then keeps one, so exactly one of every {@code skipCount + 1} offered
 * frames is kept. A skip count of zero keeps every frame. Tuning constants elsewhere assume this cadence.</p>
 *
 * @since 0.1.0
 */
public final class FrameSkipper {
  private final int skipCount;
  private int skipCounter;

  /**
   * Creates a skipper.
   *
   * @param skipCount frames to discard before each kept frame; must be zero or positive
   */
  public FrameSkipper(int skipCount) {
    if (skipCount < 0) {
      throw new IllegalArgumentException("skip count must be >= 0 (was " + skipCount + ")");
    }
    this.skipCount = skipCount;
  }

  /**
   * Offers the next frame.
   *
   * @return {@code true} when the frame should be processed
   */
  public boolean keep() {
    if (skipCounter < skipCount) {
      skipCounter++;
      return false;
    }
    skipCounter = 0;
    return true;
  }

  public int skipCount() {
    return skipCount;
  }
}
