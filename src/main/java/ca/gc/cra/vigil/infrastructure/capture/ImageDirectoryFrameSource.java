package ca.gc.cra.vigil.infrastructure.capture;

import ca.gc.cra.vigil.application.port.ClockPort;
import ca.gc.cra.vigil.application.port.FrameSource;
import ca.gc.cra.vigil.domain.frame.TimestampedFrame;
import ca.gc.cra.vigil.infrastructure.image.FrameImages;
import ca.gc.cra.vigil.validation.Paths;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import javax.imageio.ImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link FrameSource} that replays a directory of still images as a video.
 * <p><strong>Why:</strong> Lets playback and live modes run against recorded footage exported frame by frame.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>List PNG, JPEG, and BMP files in file-name order at {@link #start()}.</li>
 *   <li>Decode one file per {@link #poll()} with {@link ImageIO}.</li>
 *   <li>Assign timestamps {@code 1 / fps} apart starting from the clock reading at start.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; poll from a single thread.</p>
 *
 * @since 0.1.0
 */
public final class ImageDirectoryFrameSource implements FrameSource {
  private static final Logger log = LoggerFactory.getLogger(ImageDirectoryFrameSource.class);
  private static final Set<String> EXTENSIONS = Set.of("png", "jpg", "jpeg", "bmp");

  private final Path directory;
  private final Duration interval;
  private final ClockPort clock;

  private List<Path> files;
  private int position;
  private Instant origin;
  private volatile boolean exhausted;

  /**
   * Creates a directory source. The directory is listed when the source starts.
   *
   * @param directory directory holding image files
   * @param fps nominal frame rate used for timestamps; must be positive
   * @param clock clock providing the first timestamp
   */
  public ImageDirectoryFrameSource(Path directory, double fps, ClockPort clock) {
    this.directory = Objects.requireNonNull(directory, "directory");
    if (!(fps > 0d)) {
      throw new IllegalArgumentException("fps must be positive");
    }
    this.interval = Duration.ofNanos(Math.round(1_000_000_000d / fps));
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void start() throws IOException {
    if (files != null) {
      return;
    }
    Path dir = Paths.validateReadableDir(directory);
    try (Stream<Path> entries = Files.list(dir)) {
      files = entries
          .filter(Files::isRegularFile)
          .filter(ImageDirectoryFrameSource::isImage)
          .sorted()
          .collect(Collectors.toList());
    }
    position = 0;
    origin = Instant.ofEpochMilli(clock.nowMillis());
    exhausted = files.isEmpty();
    log.info("Image directory source opened {} with {} frames", dir, files.size());
  }

  @Override
  public Optional<TimestampedFrame> poll() throws IOException {
    if (files == null || exhausted) {
      return Optional.empty();
    }
    while (position < files.size()) {
      Path file = files.get(position);
      int index = position++;
      BufferedImage image = ImageIO.read(file.toFile());
      if (image == null) {
        log.warn("Skipping {}; no image reader accepts it", file.getFileName());
        continue;
      }
      Instant timestamp = origin.plus(interval.multipliedBy(index));
      return Optional.of(new TimestampedFrame(timestamp, FrameImages.fromImage(image)));
    }
    exhausted = true;
    return Optional.empty();
  }

  @Override
  public boolean isExhausted() {
    return exhausted;
  }

  @Override
  public void close() {
    if (files != null && !exhausted) {
      log.info("Image directory source closed after {} of {} frames", position, files.size());
    }
    exhausted = true;
  }

  private static boolean isImage(Path path) {
    String name = path.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 && EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
  }
}
