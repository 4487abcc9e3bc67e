package ca.gc.cra.vigil.infrastructure.persistence;

import ca.gc.cra.vigil.domain.detect.BoundingBox;
import ca.gc.cra.vigil.domain.detect.DetectionEvent;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Streaming JSON codec for detection event sequences.
 * <p>Each event is written as
 * {@code {"classId":0,"label":"forklift","confidence":0.91,"box":{"x":10,"y":20,"width":30,"height":40}}}.
 * Capture metadata, replay logs, and published events share this shape.</p>
 *
 * @since 0.1.0
 */
public final class DetectionEventJson {
  private DetectionEventJson() {}

  /**
   * Writes events as a JSON array at the generator's current position.
   *
   * @param gen target generator
   * @param events events in order
   * @throws IOException if the generator fails
   */
  public static void writeEvents(JsonGenerator gen, List<DetectionEvent> events) throws IOException {
    gen.writeStartArray();
    for (DetectionEvent event : events) {
      gen.writeStartObject();
      gen.writeNumberField("classId", event.classId());
      gen.writeStringField("label", event.label());
      gen.writeNumberField("confidence", event.confidence());
      BoundingBox box = event.box();
      gen.writeObjectFieldStart("box");
      gen.writeNumberField("x", box.x());
      gen.writeNumberField("y", box.y());
      gen.writeNumberField("width", box.width());
      gen.writeNumberField("height", box.height());
      gen.writeEndObject();
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  /**
   * Reads a JSON array of events. The parser must be positioned on {@link JsonToken#START_ARRAY}.
   *
   * @param parser source parser
   * @return events in document order
   * @throws IOException if the document is malformed
   */
  public static List<DetectionEvent> readEvents(JsonParser parser) throws IOException {
    if (parser.currentToken() != JsonToken.START_ARRAY) {
      throw new IOException("Expected event array at " + parser.getCurrentLocation());
    }
    List<DetectionEvent> events = new ArrayList<>();
    while (parser.nextToken() != JsonToken.END_ARRAY) {
      if (parser.currentToken() != JsonToken.START_OBJECT) {
        throw new IOException("Expected event object at " + parser.getCurrentLocation());
      }
      events.add(readEvent(parser));
    }
    return events;
  }

  private static DetectionEvent readEvent(JsonParser parser) throws IOException {
    int classId = 0;
    String label = "";
    double confidence = 0d;
    BoundingBox box = null;
    while (parser.nextToken() != JsonToken.END_OBJECT) {
      String field = parser.getCurrentName();
      JsonToken value = parser.nextToken();
      switch (field) {
        case "classId" -> classId = parser.getIntValue();
        case "label" -> label = parser.getText();
        case "confidence" -> confidence = parser.getDoubleValue();
        case "box" -> box = readBox(parser);
        default -> {
          if (value == JsonToken.START_OBJECT || value == JsonToken.START_ARRAY) {
            parser.skipChildren();
          }
        }
      }
    }
    if (box == null) {
      throw new IOException("Detection event is missing its box near " + parser.getCurrentLocation());
    }
    try {
      return new DetectionEvent(classId, label, box, confidence);
    } catch (IllegalArgumentException ex) {
      throw new IOException("Invalid detection event near " + parser.getCurrentLocation() + ": " + ex.getMessage(), ex);
    }
  }

  private static BoundingBox readBox(JsonParser parser) throws IOException {
    if (parser.currentToken() != JsonToken.START_OBJECT) {
      throw new IOException("Expected box object at " + parser.getCurrentLocation());
    }
    int x = 0;
    int y = 0;
    int width = 0;
    int height = 0;
    while (parser.nextToken() != JsonToken.END_OBJECT) {
      String field = parser.getCurrentName();
      parser.nextToken();
      switch (field) {
        case "x" -> x = parser.getIntValue();
        case "y" -> y = parser.getIntValue();
        case "width" -> width = parser.getIntValue();
        case "height" -> height = parser.getIntValue();
        default -> parser.skipChildren();
      }
    }
    return new BoundingBox(x, y, width, height);
  }
}
