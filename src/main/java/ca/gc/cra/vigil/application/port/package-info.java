/**
 * <strong>Purpose:</strong> Ports connecting the frame-watching core to sources, detectors, trackers, and sinks.
 * <p><strong>Pipeline role:</strong> Watchers and playback depend only on these interfaces; adapters live in
 * {@code infrastructure} and {@code adapter}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.vigil.application.port;
