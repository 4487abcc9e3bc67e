package ca.gc.cra.vigil.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.vigil.domain.detect.ClassCatalog;
import ca.gc.cra.vigil.domain.detect.ClassMetadata;
import ca.gc.cra.vigil.domain.frame.Rgb;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ClassCatalogsTest {

  @Test
  void readsClassesFromDottedKeys() {
    ClassCatalog catalog = ClassCatalogs.fromMap(Map.of(
        "classes.0.label", "person",
        "classes.0.color", "255, 0, 0",
        "classes.0.memoryFrames", "30",
        "classes.2.label", "car",
        "classes.2.verticalOffset", "-0.25",
        "detector", "motion"));

    ClassMetadata person = catalog.lookup(0).orElseThrow();
    assertEquals("person", person.label());
    assertEquals(new Rgb(255, 0, 0), person.color());
    assertEquals(30, person.memoryFrames());

    ClassMetadata car = catalog.lookup(2).orElseThrow();
    assertEquals(Rgb.WHITE, car.color());
    assertEquals(-0.25d, car.verticalOffset(), 1e-9);
    assertEquals(ClassMetadata.DEFAULT_MEMORY_FRAMES, car.memoryFrames());
    assertEquals(Optional.of(2), catalog.idFor("car"));
  }

  @Test
  void noClassKeysGivesEmptyCatalog() {
    assertTrue(ClassCatalogs.fromMap(Map.of("name", "vigil")).isEmpty());
  }

  @Test
  void labelIsRequired() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ClassCatalogs.fromMap(Map.of("classes.3.color", "1,2,3")));
    assertTrue(ex.getMessage().contains("classes.3.label"));
  }

  @Test
  void malformedKeysAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> ClassCatalogs.fromMap(Map.of("classes.label", "x")));
    assertThrows(IllegalArgumentException.class, () -> ClassCatalogs.fromMap(Map.of("classes.car.label", "x")));
    assertThrows(IllegalArgumentException.class, () -> ClassCatalogs.fromMap(Map.of("classes.-1.label", "x")));
    assertThrows(IllegalArgumentException.class, () -> ClassCatalogs.fromMap(Map.of("classes.1.size", "x")));
  }

  @Test
  void valuesAreRangeChecked() {
    assertThrows(IllegalArgumentException.class, () -> ClassCatalogs.fromMap(Map.of(
        "classes.1.label", "dog", "classes.1.verticalOffset", "1.5")));
    assertThrows(IllegalArgumentException.class, () -> ClassCatalogs.fromMap(Map.of(
        "classes.1.label", "dog", "classes.1.memoryFrames", "-1")));
    assertThrows(IllegalArgumentException.class, () -> ClassCatalogs.fromMap(Map.of(
        "classes.1.label", "dog", "classes.1.color", "red")));
  }
}
