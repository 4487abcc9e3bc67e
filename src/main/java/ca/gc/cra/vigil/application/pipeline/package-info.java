/**
 * Application pipelines that drive the per-frame processing contract.
 * <p>{@link ca.gc.cra.vigil.application.pipeline.FrameWatcher} follows a live circular buffer on its own
 * thread; {@link ca.gc.cra.vigil.application.pipeline.PlaybackUseCase} pulls frames from a finite source on
 * the caller's thread. Both depend only on the {@link ca.gc.cra.vigil.application.port.FrameProcessor}
 * capability, never on a concrete detector.</p>
 * <p>Watcher threads follow the {@code watcher-<name>} naming convention and tag log lines with the MDC key
 * {@code watcher}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.vigil.application.pipeline;
