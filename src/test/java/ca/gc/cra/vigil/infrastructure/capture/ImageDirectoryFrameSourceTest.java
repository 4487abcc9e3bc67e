package ca.gc.cra.vigil.infrastructure.capture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.vigil.application.port.ClockPort;
import ca.gc.cra.vigil.domain.frame.TimestampedFrame;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ImageDirectoryFrameSourceTest {
  private static final ClockPort EPOCH = new ClockPort() {
    @Override
    public long nowMillis() {
      return 0L;
    }

    @Override
    public long nanoTime() {
      return 0L;
    }
  };

  @TempDir Path dir;

  @Test
  void readsImagesInNameOrderAndIgnoresOtherFiles() throws IOException {
    writeImage("b.png", 20, 10);
    writeImage("a.png", 10, 5);
    writeImage("c.bmp", 30, 15);
    Files.writeString(dir.resolve("notes.txt"), "not a frame");

    ImageDirectoryFrameSource source = new ImageDirectoryFrameSource(dir, 4d, EPOCH);
    source.start();

    TimestampedFrame first = source.poll().orElseThrow();
    TimestampedFrame second = source.poll().orElseThrow();
    TimestampedFrame third = source.poll().orElseThrow();

    assertEquals(10, first.frame().width());
    assertEquals(20, second.frame().width());
    assertEquals(30, third.frame().width());
    assertEquals(3, first.frame().channels());
    assertEquals(Instant.EPOCH, first.timestamp());
    assertEquals(Instant.ofEpochMilli(250), second.timestamp());
    assertTrue(source.poll().isEmpty());
    assertTrue(source.isExhausted());
  }

  @Test
  void unreadableImageIsSkipped() throws IOException {
    Files.write(dir.resolve("a.png"), new byte[] {1, 2, 3});
    writeImage("b.png", 8, 8);

    ImageDirectoryFrameSource source = new ImageDirectoryFrameSource(dir, 10d, EPOCH);
    source.start();

    assertEquals(8, source.poll().orElseThrow().frame().width());
    assertTrue(source.poll().isEmpty());
  }

  @Test
  void emptyDirectoryIsExhaustedImmediately() throws IOException {
    ImageDirectoryFrameSource source = new ImageDirectoryFrameSource(dir, 10d, EPOCH);
    source.start();
    assertTrue(source.isExhausted());
    assertTrue(source.poll().isEmpty());
  }

  @Test
  void missingDirectoryIsRejectedOnStart() {
    ImageDirectoryFrameSource source = new ImageDirectoryFrameSource(dir.resolve("missing"), 10d, EPOCH);
    assertThrows(IllegalArgumentException.class, source::start);
  }

  private void writeImage(String name, int width, int height) throws IOException {
    BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    image.setRGB(0, 0, 0xFF0000);
    ImageIO.write(image, name.substring(name.lastIndexOf('.') + 1), dir.resolve(name).toFile());
  }
}
