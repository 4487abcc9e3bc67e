package ca.gc.cra.vigil.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class FrameSkipperTest {

  @Test
  void zeroSkipKeepsEveryFrame() {
    FrameSkipper skipper = new FrameSkipper(0);
    for (int i = 0; i < 10; i++) {
      assertTrue(skipper.keep());
    }
  }

  @Test
  void keepsOneOfEverySkipPlusOneFrames() {
    FrameSkipper skipper = new FrameSkipper(2);
    List<Integer> kept = new ArrayList<>();
    for (int i = 0; i < 12; i++) {
      if (skipper.keep()) {
        kept.add(i);
      }
    }
    assertEquals(List.of(2, 5, 8, 11), kept);
  }

  @Test
  void rejectsNegativeSkip() {
    assertThrows(IllegalArgumentException.class, () -> new FrameSkipper(-1));
  }
}
