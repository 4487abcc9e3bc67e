package ca.gc.cra.vigil.domain.detect;

import ca.gc.cra.vigil.domain.frame.Rgb;
import java.util.Objects;

/**
 * Display and tracking metadata for one detector class.
 *
 * @param label class label (e.g. {@code forklift})
 * @param color overlay colour
 * @param verticalOffset label placement offset as a fraction of box height
 * @param memoryFrames frames a tracked identity of this class survives without a matching detection
 * @since 0.1.0
 */
public record ClassMetadata(String label, Rgb color, double verticalOffset, int memoryFrames) {
  /** Default identity memory window in frames. */
  public static final int DEFAULT_MEMORY_FRAMES = 10;

  public ClassMetadata {
    label = Objects.requireNonNull(label, "label");
    color = Objects.requireNonNullElse(color, Rgb.WHITE);
    if (memoryFrames < 0) {
      throw new IllegalArgumentException("memoryFrames must be >= 0 (was " + memoryFrames + ")");
    }
  }

  /**
   * Metadata for an unlisted class.
   *
   * @param label class label
   * @return metadata with default colour and memory window
   */
  public static ClassMetadata unlisted(String label) {
    return new ClassMetadata(label, Rgb.WHITE, 0d, DEFAULT_MEMORY_FRAMES);
  }
}
