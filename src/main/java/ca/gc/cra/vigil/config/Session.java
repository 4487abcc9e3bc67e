package ca.gc.cra.vigil.config;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * A wired use case plus the adapters it owns. Closing the session closes the adapters in reverse creation
 * order; the first failure is rethrown with later ones suppressed.
 *
 * @param <T> use case type
 * @since 0.1.0
 */
public final class Session<T> implements AutoCloseable {
  private final T useCase;
  private final Deque<AutoCloseable> resources;

  Session(T useCase, Deque<AutoCloseable> resources) {
    this.useCase = Objects.requireNonNull(useCase, "useCase");
    this.resources = new ArrayDeque<>(resources);
  }

  public T useCase() {
    return useCase;
  }

  @Override
  public void close() throws Exception {
    Exception first = null;
    while (!resources.isEmpty()) {
      AutoCloseable resource = resources.pop();
      try {
        resource.close();
      } catch (Exception ex) {
        if (first == null) {
          first = ex;
        } else {
          first.addSuppressed(ex);
        }
      }
    }
    if (first != null) {
      throw first;
    }
  }
}
