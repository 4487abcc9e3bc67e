package ca.gc.cra.vigil.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Splits raw CLI arguments into switches ({@code --display}) and {@code key=value} pairs.
 * <p>Switches that stand for configuration keys are reported by {@link #flagOverrides()}, so
 * {@code --display} behaves exactly like {@code display=true}.</p>
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");
  private static final Map<String, String> FLAG_KEYS = Map.of(
      "--display", "display",
      "--save-frames", "saveFrames");

  private final String[] keyValueArgs;
  private final Set<String> flags;
  private final boolean help;
  private final boolean verbose;

  private CliInput(String[] keyValueArgs, Set<String> flags, boolean help, boolean verbose) {
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
    this.help = help;
    this.verbose = verbose;
  }

  /**
   * Parses raw arguments.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed arguments
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(new String[0], Set.of(), false, false);
    }
    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    boolean help = false;
    boolean verbose = false;
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        help = true;
      } else if (VERBOSE_FLAGS.contains(lower)) {
        verbose = true;
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
      } else {
        kv.add(arg);
      }
    }
    return new CliInput(kv.toArray(String[]::new), Set.copyOf(flags), help, verbose);
  }

  /**
   * Returns a copy of the non-switch arguments in their original order.
   *
   * @return {@code key=value} arguments, plus any bare words such as a subcommand
   */
  public String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  public boolean help() {
    return help;
  }

  public boolean verbose() {
    return verbose;
  }

  /**
   * Checks whether a switch such as {@code --dry-run} was given.
   *
   * @param flag switch to query (case-insensitive)
   * @return {@code true} if present
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Returns configuration overrides implied by switches, e.g. {@code display=true} for {@code --display}.
   *
   * @return mutable map of overrides
   */
  public Map<String, String> flagOverrides() {
    Map<String, String> overrides = new LinkedHashMap<>();
    FLAG_KEYS.forEach((flag, key) -> {
      if (flags.contains(flag)) {
        overrides.put(key, "true");
      }
    });
    return overrides;
  }

  /**
   * Returns switches that neither this class nor the caller recognises.
   *
   * @param known switches the caller handles itself
   * @return unknown switches in input order
   */
  public List<String> unknownFlags(Set<String> known) {
    List<String> unknown = new ArrayList<>();
    for (String flag : flags) {
      if (!FLAG_KEYS.containsKey(flag) && !known.contains(flag)) {
        unknown.add(flag);
      }
    }
    return unknown;
  }
}
