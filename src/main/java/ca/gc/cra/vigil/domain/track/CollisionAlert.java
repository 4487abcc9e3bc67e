package ca.gc.cra.vigil.domain.track;

import java.util.Objects;

/**
 * Overlap between two tracked identities of different classes.
 *
 * @param first first identity
 * @param second second identity
 * @param frameNumber tracker frame number the overlap was observed on
 * @since 0.1.0
 */
public record CollisionAlert(TrackedObject first, TrackedObject second, long frameNumber) {
  public CollisionAlert {
    Objects.requireNonNull(first, "first");
    Objects.requireNonNull(second, "second");
  }
}
