package ca.gc.cra.vigil.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.vigil.domain.detect.BoundingBox;
import ca.gc.cra.vigil.domain.detect.DetectionEvent;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;

class DetectionEventJsonTest {
  private final JsonFactory json = new JsonFactory();

  @Test
  void readsEventsIgnoringUnknownFields() throws IOException {
    String text = "[{\"classId\":1,\"label\":\"bike\",\"confidence\":0.6,\"trackId\":9,"
        + "\"extra\":{\"a\":[1,2]},\"box\":{\"x\":1,\"y\":2,\"width\":3,\"height\":4,\"z\":0}}]";
    try (JsonParser parser = json.createParser(text)) {
      parser.nextToken();
      List<DetectionEvent> events = DetectionEventJson.readEvents(parser);
      assertEquals(List.of(new DetectionEvent(1, "bike", new BoundingBox(1, 2, 3, 4), 0.6d)), events);
    }
  }

  @Test
  void missingBoxIsRejected() throws IOException {
    try (JsonParser parser = json.createParser("[{\"classId\":1,\"label\":\"bike\",\"confidence\":0.6}]")) {
      parser.nextToken();
      IOException ex = assertThrows(IOException.class, () -> DetectionEventJson.readEvents(parser));
      assertTrue(ex.getMessage().contains("missing its box"));
    }
  }

  @Test
  void invalidConfidenceBecomesIoException() throws IOException {
    String text = "[{\"confidence\":2.5,\"box\":{\"x\":0,\"y\":0,\"width\":1,\"height\":1}}]";
    try (JsonParser parser = json.createParser(text)) {
      parser.nextToken();
      assertThrows(IOException.class, () -> DetectionEventJson.readEvents(parser));
    }
  }

  @Test
  void parserMustBePositionedOnArray() throws IOException {
    try (JsonParser parser = json.createParser("{}")) {
      parser.nextToken();
      assertThrows(IOException.class, () -> DetectionEventJson.readEvents(parser));
    }
  }
}
