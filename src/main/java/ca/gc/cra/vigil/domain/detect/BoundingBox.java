package ca.gc.cra.vigil.domain.detect;

/**
 * Axis-aligned bounding region in pixel coordinates.
 *
 * @param x left column
 * @param y top row
 * @param width region width; non-negative
 * @param height region height; non-negative
 * @since 0.1.0
 */
public record BoundingBox(int x, int y, int width, int height) {
  public BoundingBox {
    if (width < 0 || height < 0) {
      throw new IllegalArgumentException("bounding box size must be non-negative");
    }
  }

  /**
   * Creates a box from corner coordinates.
   *
   * @param x1 left column
   * @param y1 top row
   * @param x2 right column (exclusive)
   * @param y2 bottom row (exclusive)
   * @return box spanning the corners
   */
  public static BoundingBox fromCorners(int x1, int y1, int x2, int y2) {
    int left = Math.min(x1, x2);
    int top = Math.min(y1, y2);
    return new BoundingBox(left, top, Math.abs(x2 - x1), Math.abs(y2 - y1));
  }

  public int area() {
    return width * height;
  }

  public double centerX() {
    return x + width / 2.0d;
  }

  public double centerY() {
    return y + height / 2.0d;
  }

  /**
   * Tests whether two regions share any pixel area.
   *
   * @param other region to compare
   * @return {@code true} when the interiors overlap
   */
  public boolean overlaps(BoundingBox other) {
    return x < other.x + other.width
        && other.x < x + width
        && y < other.y + other.height
        && other.y < y + height;
  }
}
