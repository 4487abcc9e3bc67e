package ca.gc.cra.vigil.config;

import ca.gc.cra.vigil.domain.detect.ClassCatalog;
import ca.gc.cra.vigil.domain.detect.ClassMetadata;
import ca.gc.cra.vigil.domain.frame.Rgb;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Builds a {@link ClassCatalog} from flattened {@code classes.<id>.<field>} keys.
 * <p>Fields: {@code label} (required), {@code color} as {@code r,g,b}, {@code verticalOffset}, and
 * {@code memoryFrames}.</p>
 */
public final class ClassCatalogs {
  private static final String PREFIX = "classes.";
  private static final Set<String> FIELDS = Set.of("label", "color", "verticalOffset", "memoryFrames");

  private ClassCatalogs() {}

  /**
   * Parses every {@code classes.*} entry of {@code kv}.
   *
   * @param kv flat configuration
   * @return catalog, empty when no class is configured
   * @throws IllegalArgumentException for malformed ids, unknown fields, or invalid values
   */
  public static ClassCatalog fromMap(Map<String, String> kv) {
    Map<Integer, Map<String, String>> byId = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : kv.entrySet()) {
      String key = entry.getKey();
      if (!key.startsWith(PREFIX)) {
        continue;
      }
      String rest = key.substring(PREFIX.length());
      int dot = rest.indexOf('.');
      if (dot <= 0 || dot == rest.length() - 1) {
        throw new IllegalArgumentException("class keys must look like classes.<id>.<field> (was " + key + ")");
      }
      int id;
      try {
        id = Integer.parseInt(rest.substring(0, dot));
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("class id must be an integer in " + key, ex);
      }
      if (id < 0) {
        throw new IllegalArgumentException("class id must be >= 0 in " + key);
      }
      String field = rest.substring(dot + 1);
      if (!FIELDS.contains(field)) {
        throw new IllegalArgumentException("unknown class field " + field + " in " + key);
      }
      byId.computeIfAbsent(id, ignored -> new LinkedHashMap<>()).put(field, entry.getValue());
    }

    Map<Integer, ClassMetadata> classes = new LinkedHashMap<>();
    for (Map.Entry<Integer, Map<String, String>> entry : byId.entrySet()) {
      String prefix = PREFIX + entry.getKey() + '.';
      Map<String, String> fields = entry.getValue();
      String label = ConfigValues.string(fields, "label", null);
      if (label == null) {
        throw new IllegalArgumentException(prefix + "label is required");
      }
      String colour = ConfigValues.string(fields, "color", null);
      Rgb rgb = colour == null ? Rgb.WHITE : Rgb.parse(colour);
      double offset = ConfigValues.boundedDouble(fields, "verticalOffset", 0d, -1d, 1d);
      int memory = ConfigValues.boundedInt(
          fields, "memoryFrames", ClassMetadata.DEFAULT_MEMORY_FRAMES, 0, 100_000);
      classes.put(entry.getKey(), new ClassMetadata(label, rgb, offset, memory));
    }
    return ClassCatalog.of(classes);
  }
}
