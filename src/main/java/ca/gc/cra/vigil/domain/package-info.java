/**
 * <strong>Purpose:</strong> Core VIGIL domain model: frames, overlays, detections, and tracked objects.
 * <p><strong>Pipeline role:</strong> Shared vocabulary between frame sources, watchers, detectors, and trackers.
 * <p><strong>Concurrency:</strong> Value types are immutable and safe to hand across producer and watcher threads.
 *
 * @since 0.1.0
 */
package ca.gc.cra.vigil.domain;
