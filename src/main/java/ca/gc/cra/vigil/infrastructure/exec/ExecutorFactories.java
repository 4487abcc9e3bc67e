package ca.gc.cra.vigil.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the named threads used by VIGIL watchers and renderers.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a thread factory for watcher loops. Threads are non-daemon so a running watcher keeps the JVM alive
   * until it is stopped.
   *
   * @param watcherName watcher name appended to the {@code watcher-} prefix
   * @param handler uncaught exception handler installed on each thread; may be {@code null}
   * @return configured thread factory
   */
  public static ThreadFactory watcherThreads(String watcherName, UncaughtExceptionHandler handler) {
    String threadName = "watcher-" + ((watcherName == null || watcherName.isBlank()) ? "anonymous" : watcherName);
    return named(threadName, false, handler);
  }

  /**
   * Builds a thread factory for frame producers feeding a shared buffer.
   *
   * @param sourceName source name appended to the {@code producer-} prefix
   * @param handler uncaught exception handler installed on each thread; may be {@code null}
   * @return configured thread factory
   */
  public static ThreadFactory producerThreads(String sourceName, UncaughtExceptionHandler handler) {
    String threadName = "producer-" + ((sourceName == null || sourceName.isBlank()) ? "source" : sourceName);
    return named(threadName, false, handler);
  }

  /**
   * Builds a thread factory for background rendering. Threads are daemon so an open display never blocks exit.
   *
   * @param windowName window name appended to the {@code render-} prefix
   * @param handler uncaught exception handler installed on each thread; may be {@code null}
   * @return configured thread factory
   */
  public static ThreadFactory renderThreads(String windowName, UncaughtExceptionHandler handler) {
    String threadName = "render-" + ((windowName == null || windowName.isBlank()) ? "window" : windowName);
    return named(threadName, true, handler);
  }

  private static ThreadFactory named(String baseName, boolean daemon, UncaughtExceptionHandler handler) {
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      int n = index.getAndIncrement();
      thread.setName(n == 0 ? baseName : baseName + "-" + n);
      thread.setDaemon(daemon);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }
}
