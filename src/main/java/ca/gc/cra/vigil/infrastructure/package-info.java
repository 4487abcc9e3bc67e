/**
 * Infrastructure adapters implementing VIGIL application ports.
 * <p><strong>Role:</strong> Buffers, frame sources, detectors, tracking, persistence, rendering, and telemetry.</p>
 */
package ca.gc.cra.vigil.infrastructure;
