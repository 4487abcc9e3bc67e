package ca.gc.cra.vigil.infrastructure.image;

import ca.gc.cra.vigil.domain.frame.Frame;
import ca.gc.cra.vigil.domain.frame.Overlay;
import ca.gc.cra.vigil.domain.frame.Rgb;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.util.Objects;

/**
 * Conversions between {@link Frame} and {@link BufferedImage}, plus overlay rasterization.
 * <p>Three-channel frames map to {@link BufferedImage#TYPE_3BYTE_BGR}, whose raster already uses BGR byte order;
 * single-channel frames map to {@link BufferedImage#TYPE_BYTE_GRAY}.</p>
 *
 * @since 0.1.0
 */
public final class FrameImages {
  private static final int BASE_FONT_SIZE = 24;

  private FrameImages() {}

  /**
   * Converts any image into a three-channel frame.
   *
   * @param image source image
   * @return BGR frame with no overlays
   */
  public static Frame fromImage(BufferedImage image) {
    Objects.requireNonNull(image, "image");
    BufferedImage bgr = image;
    if (image.getType() != BufferedImage.TYPE_3BYTE_BGR) {
      bgr = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
      Graphics2D g = bgr.createGraphics();
      try {
        g.drawImage(image, 0, 0, null);
      } finally {
        g.dispose();
      }
    }
    byte[] data = ((DataBufferByte) bgr.getRaster().getDataBuffer()).getData();
    return new Frame(bgr.getWidth(), bgr.getHeight(), 3, data);
  }

  /**
   * Copies a frame's pixels into a new image. Overlays are ignored.
   *
   * @param frame source frame
   * @return new image
   */
  public static BufferedImage toImage(Frame frame) {
    Objects.requireNonNull(frame, "frame");
    int type = frame.channels() == 1 ? BufferedImage.TYPE_BYTE_GRAY : BufferedImage.TYPE_3BYTE_BGR;
    BufferedImage image = new BufferedImage(frame.width(), frame.height(), type);
    byte[] target = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
    System.arraycopy(frame.pixels(), 0, target, 0, target.length);
    return image;
  }

  /**
   * Copies a frame's pixels into a new three-channel image and draws its overlays on top.
   *
   * @param frame source frame
   * @return annotated image
   */
  public static BufferedImage toAnnotatedImage(Frame frame) {
    BufferedImage base = toImage(frame);
    BufferedImage image = base;
    if (base.getType() != BufferedImage.TYPE_3BYTE_BGR) {
      image = new BufferedImage(frame.width(), frame.height(), BufferedImage.TYPE_3BYTE_BGR);
      Graphics2D copy = image.createGraphics();
      try {
        copy.drawImage(base, 0, 0, null);
      } finally {
        copy.dispose();
      }
    }
    if (frame.overlays().isEmpty()) {
      return image;
    }
    Graphics2D g = image.createGraphics();
    try {
      g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
      for (Overlay overlay : frame.overlays()) {
        draw(g, overlay);
      }
    } finally {
      g.dispose();
    }
    return image;
  }

  private static void draw(Graphics2D g, Overlay overlay) {
    g.setColor(toColor(overlay.color()));
    if (overlay instanceof Overlay.Marker marker) {
      g.setStroke(new BasicStroke(marker.thickness()));
      int r = marker.radius();
      g.drawOval(marker.x() - r, marker.y() - r, r * 2, r * 2);
    } else if (overlay instanceof Overlay.Box box) {
      g.setStroke(new BasicStroke(box.thickness()));
      g.drawRect(box.x(), box.y(), box.width(), box.height());
    } else if (overlay instanceof Overlay.Text text) {
      float size = (float) Math.max(6d, BASE_FONT_SIZE * text.scale());
      g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 1).deriveFont(size));
      g.drawString(text.text(), text.x(), text.y());
    }
  }

  private static Color toColor(Rgb rgb) {
    return new Color(rgb.red(), rgb.green(), rgb.blue());
  }
}
