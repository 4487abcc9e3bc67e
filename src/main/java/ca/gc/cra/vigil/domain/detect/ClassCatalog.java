package ca.gc.cra.vigil.domain.detect;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable mapping from detector class id to {@link ClassMetadata}.
 *
 * @since 0.1.0
 */
public final class ClassCatalog {
  private static final ClassCatalog EMPTY = new ClassCatalog(Map.of());

  private final Map<Integer, ClassMetadata> classes;

  private ClassCatalog(Map<Integer, ClassMetadata> classes) {
    this.classes = classes;
  }

  /**
   * Creates a catalog from the supplied entries.
   *
   * @param classes class id to metadata
   * @return immutable catalog
   */
  public static ClassCatalog of(Map<Integer, ClassMetadata> classes) {
    Objects.requireNonNull(classes, "classes");
    return classes.isEmpty() ? EMPTY : new ClassCatalog(Map.copyOf(classes));
  }

  public static ClassCatalog empty() {
    return EMPTY;
  }

  public Optional<ClassMetadata> lookup(int classId) {
    return Optional.ofNullable(classes.get(classId));
  }

  /**
   * Resolves metadata, falling back to an unlisted entry labelled with {@code fallbackLabel}.
   *
   * @param classId detector class id
   * @param fallbackLabel label used when the id is not catalogued
   * @return metadata; never {@code null}
   */
  public ClassMetadata resolve(int classId, String fallbackLabel) {
    ClassMetadata metadata = classes.get(classId);
    return metadata != null ? metadata : ClassMetadata.unlisted(fallbackLabel);
  }

  /**
   * Finds the class id registered for a label.
   *
   * @param label class label (case-sensitive)
   * @return class id when present
   */
  public Optional<Integer> idFor(String label) {
    for (Map.Entry<Integer, ClassMetadata> entry : classes.entrySet()) {
      if (entry.getValue().label().equals(label)) {
        return Optional.of(entry.getKey());
      }
    }
    return Optional.empty();
  }

  public Map<Integer, ClassMetadata> asMap() {
    return classes;
  }

  public boolean isEmpty() {
    return classes.isEmpty();
  }

  @Override
  public String toString() {
    return "ClassCatalog" + new TreeMap<>(classes);
  }
}
