package ca.gc.cra.vigil.domain.detect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.vigil.domain.frame.Rgb;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BoundingBoxTest {

  @Test
  void fromCornersNormalizesOrder() {
    BoundingBox box = BoundingBox.fromCorners(30, 40, 10, 20);
    assertEquals(new BoundingBox(10, 20, 20, 20), box);
    assertEquals(400, box.area());
    assertEquals(20.0d, box.centerX());
    assertEquals(30.0d, box.centerY());
  }

  @Test
  void overlapRequiresSharedArea() {
    BoundingBox a = new BoundingBox(0, 0, 10, 10);
    assertTrue(a.overlaps(new BoundingBox(5, 5, 10, 10)));
    assertFalse(a.overlaps(new BoundingBox(10, 0, 5, 5)), "touching edges do not overlap");
    assertFalse(a.overlaps(new BoundingBox(20, 20, 5, 5)));
  }

  @Test
  void eventRejectsConfidenceOutsideUnitRange() {
    BoundingBox box = new BoundingBox(0, 0, 1, 1);
    assertThrows(IllegalArgumentException.class, () -> new DetectionEvent(0, "car", box, 1.5d));
    assertThrows(IllegalArgumentException.class, () -> new DetectionEvent(0, "car", box, Double.NaN));
    assertThrows(IllegalArgumentException.class, () -> new BoundingBox(0, 0, -1, 1));
  }

  @Test
  void catalogFallsBackToUnlistedClass() {
    ClassCatalog catalog = ClassCatalog.of(Map.of(2, new ClassMetadata("car", new Rgb(0, 0, 255), 0.2d, 5)));

    assertEquals("car", catalog.resolve(2, "ignored").label());
    ClassMetadata unlisted = catalog.resolve(7, "truck");
    assertEquals("truck", unlisted.label());
    assertEquals(ClassMetadata.DEFAULT_MEMORY_FRAMES, unlisted.memoryFrames());
    assertEquals(Rgb.WHITE, unlisted.color());
    assertEquals(2, catalog.idFor("car").orElseThrow());
    assertTrue(ClassCatalog.of(Map.of()).isEmpty());
  }
}
