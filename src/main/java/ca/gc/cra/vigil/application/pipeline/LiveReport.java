package ca.gc.cra.vigil.application.pipeline;

/**
 * Outcome of one live session.
 *
 * @param framesProcessed frames handled by the watcher
 * @param emptySlotsSkipped empty buffer slots passed over
 * @param framesWritten frames written to the buffer
 * @param reason why the session ended
 * @since 0.1.0
 */
public record LiveReport(long framesProcessed, long emptySlotsSkipped, long framesWritten, EndReason reason) {
  /** Why a live session ended. */
  public enum EndReason {
    /** The configured run time elapsed. */
    RUN_TIME_ELAPSED,
    /** The feed ran dry and the watcher caught up with it. */
    FEED_DRAINED,
    /** A stop was requested, for example by a shutdown hook. */
    STOP_REQUESTED,
    /** The calling thread was interrupted. */
    INTERRUPTED
  }
}
