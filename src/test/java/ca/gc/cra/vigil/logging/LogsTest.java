package ca.gc.cra.vigil.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesPassThrough() {
    assertEquals("cam-1", Logs.truncate("cam-1", 16));
    assertEquals("<null>", Logs.truncate(null, 16));
  }

  @Test
  void longValuesAreCutOnCharacterBoundaries() {
    assertEquals("abc... (truncated, 3 of 6)", Logs.truncate("abcdef", 3));
    assertEquals("é... (truncated, 3 of 4)", Logs.truncate("éé", 3));
  }

  @Test
  void rejectsNonPositiveLimit() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }
}
