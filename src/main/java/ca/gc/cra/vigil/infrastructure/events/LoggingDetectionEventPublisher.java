package ca.gc.cra.vigil.infrastructure.events;

import ca.gc.cra.vigil.application.port.DetectionEventPublisher;
import ca.gc.cra.vigil.application.port.MetricsPort;
import ca.gc.cra.vigil.domain.detect.BoundingBox;
import ca.gc.cra.vigil.domain.detect.DetectionEvent;
import ca.gc.cra.vigil.logging.Logs;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Emits detection events to structured logs and increments metrics counters.
 *
 * @since 0.1.0
 */
public final class LoggingDetectionEventPublisher implements DetectionEventPublisher {
  private static final Logger log = LoggerFactory.getLogger(LoggingDetectionEventPublisher.class);

  private static final int MAX_LABEL_BYTES = 64;

  private final MetricsPort metrics;

  /**
   * Creates a logging publisher.
   *
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   */
  public LoggingDetectionEventPublisher(MetricsPort metrics) {
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /** Creates a logging publisher without metrics. */
  public LoggingDetectionEventPublisher() {
    this(MetricsPort.NO_OP);
  }

  @Override
  public void publish(String source, long frameNumber, Instant timestamp, List<DetectionEvent> events) {
    Objects.requireNonNull(events, "events");
    for (DetectionEvent event : events) {
      metrics.increment("events.emitted");
      BoundingBox box = event.box();
      StringJoiner joiner = new StringJoiner(", ");
      joiner.add("source=" + source);
      joiner.add("frame=" + frameNumber);
      joiner.add("ts=" + timestamp);
      joiner.add("class=" + event.classId());
      joiner.add("label=" + Logs.truncate(event.label(), MAX_LABEL_BYTES));
      joiner.add(String.format(Locale.ROOT, "confidence=%.3f", event.confidence()));
      joiner.add("box=" + box.x() + ',' + box.y() + ',' + box.width() + ',' + box.height());
      log.info("detection.event {}", joiner);
    }
  }
}
