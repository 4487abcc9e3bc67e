package ca.gc.cra.vigil.application.pipeline;

/**
 * Counters reported when a synchronous playback run ends.
 *
 * @param framesRead frames pulled from the source
 * @param framesSkipped frames discarded by the skip cadence
 * @param framesProcessed frames passed through the per-frame contract
 * @param framesWithEvents processed frames that produced at least one event
 * @param framesSaved frames written to the capture store
 * @param collisions collision alerts raised by the tracker
 * @param stoppedEarly {@code true} when the run ended on a stop request rather than source exhaustion
 * @since 0.1.0
 */
public record PlaybackReport(
    long framesRead,
    long framesSkipped,
    long framesProcessed,
    long framesWithEvents,
    long framesSaved,
    long collisions,
    boolean stoppedEarly) {}
