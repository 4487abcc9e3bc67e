package ca.gc.cra.vigil.domain.frame;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable video frame holding interleaved pixel bytes and a display list of overlays.
 * <p><strong>Why:</strong> A frame is produced once and read by the producer, any number of watchers, renderers,
 * and capture stores; immutability lets slots be replaced wholesale without locking.</p>
 * <p><strong>Layout:</strong> Row-major, {@code channels} bytes per pixel. Three-channel frames are BGR ordered;
 * single-channel frames are grayscale.</p>
 * <p><strong>Thread-safety:</strong> Immutable; overlay stamping returns a new instance sharing the pixel buffer.</p>
 *
 * @since 0.1.0
 */
public final class Frame {
  private final int width;
  private final int height;
  private final int channels;
  private final byte[] pixels;
  private final List<Overlay> overlays;

  /**
   * Creates a frame from a pixel buffer. The buffer is copied.
   *
   * @param width frame width in pixels; must be positive
   * @param height frame height in pixels; must be positive
   * @param channels bytes per pixel; 1 (gray) or 3 (BGR)
   * @param pixels pixel bytes of length {@code width * height * channels}
   * @throws IllegalArgumentException if the dimensions and buffer length disagree
   */
  public Frame(int width, int height, int channels, byte[] pixels) {
    this(width, height, channels, Objects.requireNonNull(pixels, "pixels").clone(), List.of(), true);
  }

  private Frame(int width, int height, int channels, byte[] pixels, List<Overlay> overlays, boolean validate) {
    if (validate) {
      if (width <= 0 || height <= 0) {
        throw new IllegalArgumentException("frame dimensions must be positive (was " + width + "x" + height + ")");
      }
      if (channels != 1 && channels != 3) {
        throw new IllegalArgumentException("channels must be 1 or 3 (was " + channels + ")");
      }
      long expected = (long) width * height * channels;
      if (pixels.length != expected) {
        throw new IllegalArgumentException(
            "pixel buffer length " + pixels.length + " does not match " + width + "x" + height + "x" + channels);
      }
    }
    this.width = width;
    this.height = height;
    this.channels = channels;
    this.pixels = pixels;
    this.overlays = overlays;
  }

  /**
   * Creates a uniformly filled frame.
   *
   * @param width frame width
   * @param height frame height
   * @param channels bytes per pixel
   * @param value fill value for every byte
   * @return new frame
   */
  public static Frame filled(int width, int height, int channels, int value) {
    byte[] data = new byte[bufferLength(width, height, channels)];
    Arrays.fill(data, (byte) value);
    return new Frame(width, height, channels, data, List.of(), true);
  }

  private static int bufferLength(int width, int height, int channels) {
    long length = (long) width * height * channels;
    if (width <= 0 || height <= 0 || channels <= 0 || length > Integer.MAX_VALUE) {
      throw new IllegalArgumentException(
          "cannot allocate a " + width + "x" + height + "x" + channels + " frame");
    }
    return (int) length;
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }

  public int channels() {
    return channels;
  }

  /**
   * Returns the backing pixel buffer.
   *
   * @return pixel bytes; callers must not mutate
   */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Frames are copied on construction; detectors read the canonical buffer on the hot path without per-frame copies.")
  public byte[] pixels() {
    return pixels;
  }

  /**
   * Reads a single channel value as an unsigned int.
   *
   * @param x column
   * @param y row
   * @param channel channel index
   * @return value in {@code [0, 255]}
   */
  public int sample(int x, int y, int channel) {
    return pixels[(y * width + x) * channels + channel] & 0xFF;
  }

  /**
   * Computes the luma of a pixel using integer BT.601 weights.
   *
   * @param x column
   * @param y row
   * @return gray value in {@code [0, 255]}
   */
  public int luma(int x, int y) {
    if (channels == 1) {
      return sample(x, y, 0);
    }
    int b = sample(x, y, 0);
    int g = sample(x, y, 1);
    int r = sample(x, y, 2);
    return (r * 299 + g * 587 + b * 114) / 1000;
  }

  /**
   * Returns the overlays stamped onto this frame in drawing order.
   *
   * @return immutable overlay list
   */
  public List<Overlay> overlays() {
    return overlays;
  }

  /**
   * Returns a copy of this frame with the supplied overlay appended.
   *
   * @param overlay overlay to stamp
   * @return new frame sharing pixel data
   */
  public Frame withOverlay(Overlay overlay) {
    Objects.requireNonNull(overlay, "overlay");
    List<Overlay> next = new ArrayList<>(overlays.size() + 1);
    next.addAll(overlays);
    next.add(overlay);
    return new Frame(width, height, channels, pixels, Collections.unmodifiableList(next), false);
  }

  /**
   * Returns a copy of this frame with the supplied overlays appended.
   *
   * @param additional overlays to stamp in order
   * @return new frame sharing pixel data
   */
  public Frame withOverlays(List<Overlay> additional) {
    if (additional == null || additional.isEmpty()) {
      return this;
    }
    List<Overlay> next = new ArrayList<>(overlays.size() + additional.size());
    next.addAll(overlays);
    for (Overlay overlay : additional) {
      next.add(Objects.requireNonNull(overlay, "overlay"));
    }
    return new Frame(width, height, channels, pixels, Collections.unmodifiableList(next), false);
  }

  /**
   * Returns a frame with identical pixels and no overlays.
   *
   * @return overlay-free frame
   */
  public Frame withoutOverlays() {
    if (overlays.isEmpty()) {
      return this;
    }
    return new Frame(width, height, channels, pixels, List.of(), false);
  }

  /**
   * Rescales the frame uniformly using nearest-neighbour sampling. Overlays are dropped.
   *
   * @param factor scale factor; must be positive
   * @return this frame when {@code factor == 1.0}, otherwise a resized copy
   */
  public Frame scaled(double factor) {
    if (!(factor > 0d)) {
      throw new IllegalArgumentException("scale factor must be positive (was " + factor + ")");
    }
    if (factor == 1.0d) {
      return this;
    }
    int targetWidth = Math.max(1, (int) (width * factor));
    int targetHeight = Math.max(1, (int) (height * factor));
    byte[] out = new byte[bufferLength(targetWidth, targetHeight, channels)];
    for (int ty = 0; ty < targetHeight; ty++) {
      int sy = Math.min(height - 1, (int) (ty / factor));
      for (int tx = 0; tx < targetWidth; tx++) {
        int sx = Math.min(width - 1, (int) (tx / factor));
        System.arraycopy(pixels, (sy * width + sx) * channels, out, (ty * targetWidth + tx) * channels, channels);
      }
    }
    return new Frame(targetWidth, targetHeight, channels, out, List.of(), false);
  }

  @Override
  public String toString() {
    return "Frame[" + width + "x" + height + "x" + channels + ", overlays=" + overlays.size() + "]";
  }
}
