package ca.gc.cra.vigil.infrastructure.detect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.vigil.domain.detect.BoundingBox;
import ca.gc.cra.vigil.domain.detect.ClassCatalog;
import ca.gc.cra.vigil.domain.detect.DetectionEvent;
import ca.gc.cra.vigil.domain.detect.ProcessedFrame;
import ca.gc.cra.vigil.domain.frame.Frame;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ReplayLogDetectionStepTest {

  @TempDir Path tempDir;

  @Test
  void replaysRecordedEventsByOneBasedFrameNumber() throws IOException {
    Path log = Files.writeString(tempDir.resolve("detection_events.json"), """
        {
          "source": "cam-1",
          "frames": {
            "2": [
              {"classId": 3, "label": "truck", "confidence": 0.75,
               "box": {"x": 5, "y": 6, "width": 7, "height": 8}}
            ],
            "4": []
          }
        }
        """);

    ReplayLogDetectionStep step = ReplayLogDetectionStep.load(log, ClassCatalog.empty());
    Frame frame = Frame.filled(20, 20, 3, 0);

    assertEquals(2, step.recordedFrames());
    assertFalse(step.detect(Instant.EPOCH, frame).hasEvents());
    ProcessedFrame second = step.detect(Instant.EPOCH, frame);
    assertEquals(1, second.events().size());
    DetectionEvent event = second.events().get(0);
    assertEquals(new DetectionEvent(3, "truck", new BoundingBox(5, 6, 7, 8), 0.75d), event);
    assertEquals(1, second.frame().overlays().size());
    assertFalse(step.detect(Instant.EPOCH, frame).hasEvents());
    assertFalse(step.detect(Instant.EPOCH, frame).hasEvents());
    assertEquals("replay-log", step.variant());
  }

  @Test
  void rejectsNonNumericFrameKeys() throws IOException {
    Path log = Files.writeString(tempDir.resolve("bad.json"), "{\"frames\": {\"first\": []}}");
    IOException ex = assertThrows(IOException.class, () -> ReplayLogDetectionStep.load(log, ClassCatalog.empty()));
    assertTrue(ex.getMessage().contains("first"));
  }

  @Test
  void rejectsNonObjectDocument() throws IOException {
    Path log = Files.writeString(tempDir.resolve("array.json"), "[]");
    assertThrows(IOException.class, () -> ReplayLogDetectionStep.load(log, ClassCatalog.empty()));
  }
}
