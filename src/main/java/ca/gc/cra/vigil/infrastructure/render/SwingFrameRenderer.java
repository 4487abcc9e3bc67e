package ca.gc.cra.vigil.infrastructure.render;

import ca.gc.cra.vigil.application.port.FrameRenderer;
import ca.gc.cra.vigil.domain.frame.Frame;
import ca.gc.cra.vigil.infrastructure.image.FrameImages;
import java.awt.GraphicsEnvironment;
import java.awt.HeadlessException;
import java.awt.image.BufferedImage;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import javax.swing.ImageIcon;
import javax.swing.JFrame;
import javax.swing.JLabel;
import javax.swing.SwingUtilities;
import javax.swing.WindowConstants;

/**
 * Renders frames into one Swing window per window name.
 * <p>Overlays are rasterized off the event dispatch thread; only the icon swap runs on it.</p>
 *
 * @since 0.1.0
 */
public final class SwingFrameRenderer implements FrameRenderer {
  private final Map<String, Window> windows = new ConcurrentHashMap<>();

  /**
   * Creates a renderer.
   *
   * @throws HeadlessException if the JVM has no display
   */
  public SwingFrameRenderer() {
    if (GraphicsEnvironment.isHeadless()) {
      throw new HeadlessException("No display available for on-screen rendering");
    }
  }

  @Override
  public void render(String windowName, Frame frame) {
    BufferedImage image = FrameImages.toAnnotatedImage(frame);
    Window window = windows.computeIfAbsent(windowName, Window::new);
    SwingUtilities.invokeLater(() -> window.show(image));
  }

  @Override
  public void close() {
    for (Window window : windows.values()) {
      SwingUtilities.invokeLater(window::dispose);
    }
    windows.clear();
  }

  private static final class Window {
    private final String title;
    private JFrame frame;
    private JLabel label;

    Window(String title) {
      this.title = title;
    }

    void show(BufferedImage image) {
      if (frame == null) {
        frame = new JFrame(title);
        frame.setDefaultCloseOperation(WindowConstants.DISPOSE_ON_CLOSE);
        label = new JLabel(new ImageIcon(image));
        frame.getContentPane().add(label);
        frame.pack();
        frame.setVisible(true);
        return;
      }
      label.setIcon(new ImageIcon(image));
      if (frame.getWidth() < image.getWidth() || frame.getHeight() < image.getHeight()) {
        frame.pack();
      }
    }

    void dispose() {
      if (frame != null) {
        frame.dispose();
      }
    }
  }
}
