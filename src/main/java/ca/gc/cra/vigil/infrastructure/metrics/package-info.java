/**
 * OpenTelemetry bridge for {@link ca.gc.cra.vigil.application.port.MetricsPort}.
 * <p>Instruments are created per metric key and are safe for concurrent updates from any pipeline thread.
 * Exported names fall under the {@code watcher.*}, {@code producer.*}, {@code playback.*},
 * {@code tracker.*}, {@code render.*}, and {@code events.*} families.</p>
 */
package ca.gc.cra.vigil.infrastructure.metrics;
