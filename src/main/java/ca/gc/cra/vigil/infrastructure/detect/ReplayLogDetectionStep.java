package ca.gc.cra.vigil.infrastructure.detect;

import ca.gc.cra.vigil.application.port.DetectionStep;
import ca.gc.cra.vigil.domain.detect.ClassCatalog;
import ca.gc.cra.vigil.domain.detect.DetectionEvent;
import ca.gc.cra.vigil.domain.detect.ProcessedFrame;
import ca.gc.cra.vigil.domain.frame.Frame;
import ca.gc.cra.vigil.domain.frame.Overlay;
import ca.gc.cra.vigil.infrastructure.persistence.DetectionEventJson;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays detections recorded in a JSON log instead of running a detector.
 * <p>The log maps processed frame numbers (starting at 1) to event arrays:
 * {@code {"frames":{"1":[...],"7":[...]}}}. The n-th call to {@link #detect(Instant, Frame)} returns the events
 * recorded for frame n, or none when the frame is absent.</p>
 *
 * @since 0.1.0
 */
public final class ReplayLogDetectionStep implements DetectionStep {
  private static final Logger log = LoggerFactory.getLogger(ReplayLogDetectionStep.class);
  private static final JsonFactory JSON = new JsonFactory();

  private final Map<Long, List<DetectionEvent>> framesToEvents;
  private final ClassCatalog catalog;
  private long frameNumber;

  /**
   * Creates a replay step over already loaded events.
   *
   * @param framesToEvents events keyed by frame number
   * @param catalog class colours for drawn boxes
   */
  public ReplayLogDetectionStep(Map<Long, List<DetectionEvent>> framesToEvents, ClassCatalog catalog) {
    Map<Long, List<DetectionEvent>> copy = new HashMap<>();
    Objects.requireNonNull(framesToEvents, "framesToEvents")
        .forEach((frame, events) -> copy.put(frame, List.copyOf(events)));
    this.framesToEvents = Map.copyOf(copy);
    this.catalog = Objects.requireNonNull(catalog, "catalog");
  }

  /**
   * Loads a replay log from disk.
   *
   * @param path JSON log file
   * @param catalog class colours for drawn boxes
   * @return replay step
   * @throws IOException if the file cannot be read or is malformed
   */
  public static ReplayLogDetectionStep load(Path path, ClassCatalog catalog) throws IOException {
    Map<Long, List<DetectionEvent>> events = new HashMap<>();
    try (JsonParser parser = JSON.createParser(path.toFile())) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        throw new IOException("Replay log " + path + " must be a JSON object");
      }
      while (parser.nextToken() != JsonToken.END_OBJECT) {
        String field = parser.getCurrentName();
        JsonToken value = parser.nextToken();
        if (!"frames".equals(field)) {
          if (value == JsonToken.START_OBJECT || value == JsonToken.START_ARRAY) {
            parser.skipChildren();
          }
          continue;
        }
        if (value != JsonToken.START_OBJECT) {
          throw new IOException("Replay log " + path + " field 'frames' must be an object");
        }
        while (parser.nextToken() != JsonToken.END_OBJECT) {
          String key = parser.getCurrentName();
          parser.nextToken();
          long frame;
          try {
            frame = Long.parseLong(key);
          } catch (NumberFormatException ex) {
            throw new IOException("Replay log frame key must be numeric (was " + key + ")", ex);
          }
          events.put(frame, new ArrayList<>(DetectionEventJson.readEvents(parser)));
        }
      }
    }
    log.info("Loaded replay log {} with {} frames of events", path, events.size());
    return new ReplayLogDetectionStep(events, catalog);
  }

  @Override
  public ProcessedFrame detect(Instant timestamp, Frame frame) {
    frameNumber++;
    List<DetectionEvent> events = framesToEvents.getOrDefault(frameNumber, List.of());
    if (events.isEmpty()) {
      return ProcessedFrame.empty(frame);
    }
    List<Overlay> overlays = new ArrayList<>(events.size());
    for (DetectionEvent event : events) {
      overlays.add(new Overlay.Box(event.box().x(), event.box().y(), event.box().width(), event.box().height(),
          catalog.resolve(event.classId(), event.label()).color(), 2));
    }
    return new ProcessedFrame(frame.withOverlays(overlays), events);
  }

  @Override
  public String variant() {
    return DetectorKind.REPLAY_LOG.configName();
  }

  int recordedFrames() {
    return framesToEvents.size();
  }
}
