/**
 * Kafka adapter that publishes per-frame detection records.
 * <p><strong>Role:</strong> Adapter layer on the sink side; implements
 * {@link ca.gc.cra.vigil.application.port.DetectionEventPublisher}.</p>
 * <p><strong>Concurrency:</strong> The producer is thread-safe; watchers may share one publisher.</p>
 * <p><strong>Metrics:</strong> Emits {@code events.kafka.sent} and {@code events.kafka.error} counters.</p>
 */
package ca.gc.cra.vigil.adapter.kafka;
