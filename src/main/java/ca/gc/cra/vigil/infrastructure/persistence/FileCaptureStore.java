package ca.gc.cra.vigil.infrastructure.persistence;

import ca.gc.cra.vigil.application.port.CaptureStore;
import ca.gc.cra.vigil.domain.detect.DetectionEvent;
import ca.gc.cra.vigil.domain.frame.Frame;
import ca.gc.cra.vigil.infrastructure.image.FrameImages;
import ca.gc.cra.vigil.validation.Paths;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import javax.imageio.ImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link CaptureStore} writing training-set artifacts to a directory.
 * <p><strong>Layout:</strong> For frame {@code n}: {@code frame_n.png} (frame as read),
 * {@code frame_n.bb.png} (overlays drawn), and {@code frame_n.json} (the event array). On close, every saved
 * frame's events are also written to {@code detection_events.json} in the replay-log format
 * {@code {"frames":{"n":[...]}}}, so a capture session can be replayed with the replay-log detector.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; call from the pipeline thread.</p>
 *
 * @since 0.1.0
 */
public final class FileCaptureStore implements CaptureStore {
  private static final Logger log = LoggerFactory.getLogger(FileCaptureStore.class);
  static final String EVENT_LOG_NAME = "detection_events.json";

  private final Path directory;
  private final JsonFactory jsonFactory = new JsonFactory();
  private final Map<Long, List<DetectionEvent>> saved = new TreeMap<>();
  private boolean closed;

  /**
   * Creates a store, creating the directory when missing.
   *
   * @param directory output directory
   * @throws IllegalArgumentException if the directory is not writable
   */
  public FileCaptureStore(Path directory) {
    this.directory = Paths.validateWritableDir(Objects.requireNonNull(directory, "directory"));
  }

  @Override
  public void save(long frameNumber, Frame original, Frame annotated, List<DetectionEvent> events)
      throws IOException {
    if (closed) {
      throw new IllegalStateException("Capture store closed");
    }
    String base = "frame_" + frameNumber;
    writePng(FrameImages.toImage(original), directory.resolve(base + ".png"));
    writePng(FrameImages.toAnnotatedImage(annotated), directory.resolve(base + ".bb.png"));
    try (JsonGenerator gen = jsonFactory.createGenerator(directory.resolve(base + ".json").toFile(), JsonEncoding.UTF8)) {
      gen.useDefaultPrettyPrinter();
      DetectionEventJson.writeEvents(gen, events);
    }
    saved.put(frameNumber, List.copyOf(events));
    log.debug("Saved frame {} with {} events to {}", frameNumber, events.size(), directory);
  }

  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    if (saved.isEmpty()) {
      return;
    }
    Path eventLog = directory.resolve(EVENT_LOG_NAME);
    try (JsonGenerator gen = jsonFactory.createGenerator(eventLog.toFile(), JsonEncoding.UTF8)) {
      gen.writeStartObject();
      gen.writeObjectFieldStart("frames");
      for (Map.Entry<Long, List<DetectionEvent>> entry : saved.entrySet()) {
        gen.writeFieldName(Long.toString(entry.getKey()));
        DetectionEventJson.writeEvents(gen, entry.getValue());
      }
      gen.writeEndObject();
      gen.writeEndObject();
    }
    log.info("Wrote {} captured frames to {}", saved.size(), directory);
  }

  public Path directory() {
    return directory;
  }

  private static void writePng(BufferedImage image, Path target) throws IOException {
    if (!ImageIO.write(image, "png", target.toFile())) {
      throw new IOException("No PNG writer available for " + target);
    }
  }
}
