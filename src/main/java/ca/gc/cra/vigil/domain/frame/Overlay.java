package ca.gc.cra.vigil.domain.frame;

import java.util.Objects;

/**
 * Drawing instruction stamped onto a {@link Frame}. Renderers and capture stores rasterize overlays; the core
 * pipeline only records them.
 *
 * @since 0.1.0
 */
public interface Overlay {

  /**
   * Colour used to draw the overlay.
   *
   * @return overlay colour
   */
  Rgb color();

  /**
   * Circle outline centred on a point.
   *
   * @param x centre column
   * @param y centre row
   * @param radius radius in pixels
   * @param color outline colour
   * @param thickness line thickness in pixels
   */
  record Marker(int x, int y, int radius, Rgb color, int thickness) implements Overlay {
    public Marker {
      Objects.requireNonNull(color, "color");
      radius = Math.max(0, radius);
      thickness = Math.max(1, thickness);
    }
  }

  /**
   * Axis-aligned rectangle outline.
   *
   * @param x left column
   * @param y top row
   * @param width rectangle width
   * @param height rectangle height
   * @param color outline colour
   * @param thickness line thickness in pixels
   */
  record Box(int x, int y, int width, int height, Rgb color, int thickness) implements Overlay {
    public Box {
      Objects.requireNonNull(color, "color");
      thickness = Math.max(1, thickness);
    }
  }

  /**
   * Text label anchored at its baseline origin.
   *
   * @param x origin column
   * @param y origin row (baseline)
   * @param text label text
   * @param scale relative font scale
   * @param color text colour
   */
  record Text(int x, int y, String text, double scale, Rgb color) implements Overlay {
    public Text {
      text = Objects.requireNonNull(text, "text");
      Objects.requireNonNull(color, "color");
    }
  }
}
