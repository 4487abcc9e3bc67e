package ca.gc.cra.vigil.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValues() {
    CliInput input = CliInput.parse(new String[] {"skip=2", "--Dry-Run", "--display", "--scale=0.5", " "});

    assertArrayEquals(new String[] {"skip=2", "--scale=0.5"}, input.keyValueArgs());
    assertTrue(input.hasFlag("--dry-run"));
    assertTrue(input.hasFlag("--display"));
    assertFalse(input.help());
    assertFalse(input.verbose());
  }

  @Test
  void recognisesHelpAndVerbose() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertTrue(CliInput.parse(new String[] {"--debug"}).verbose());
    assertFalse(CliInput.parse(null).help());
  }

  @Test
  void flagOverridesMapToConfigKeys() {
    CliInput input = CliInput.parse(new String[] {"--save-frames", "--display"});

    assertEquals(Map.of("saveFrames", "true", "display", "true"), input.flagOverrides());
  }

  @Test
  void reportsUnknownFlags() {
    CliInput input = CliInput.parse(new String[] {"--dry-run", "--display", "--fast"});

    assertEquals(List.of("--fast"), input.unknownFlags(Set.of("--dry-run")));
  }

  @Test
  void keyValueArgsAreCopied() {
    CliInput input = CliInput.parse(new String[] {"skip=2"});
    input.keyValueArgs()[0] = "skip=9";

    assertEquals("skip=2", input.keyValueArgs()[0]);
  }
}
