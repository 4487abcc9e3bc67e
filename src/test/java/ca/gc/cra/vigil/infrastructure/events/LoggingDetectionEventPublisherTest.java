package ca.gc.cra.vigil.infrastructure.events;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.vigil.domain.detect.BoundingBox;
import ca.gc.cra.vigil.domain.detect.DetectionEvent;
import ca.gc.cra.vigil.testutil.RecordingMetricsPort;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingDetectionEventPublisherTest {

  @Test
  void logsOneLinePerEventAndCountsThem() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    LoggingDetectionEventPublisher publisher = new LoggingDetectionEventPublisher(metrics);

    Logger logger = (Logger) LoggerFactory.getLogger(LoggingDetectionEventPublisher.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    boolean originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender.start();
    logger.addAppender(appender);

    try {
      publisher.publish("cam-1", 3L, Instant.parse("2024-01-01T00:00:00Z"), List.of(
          new DetectionEvent(0, "motion", new BoundingBox(1, 2, 3, 4), 0.5d),
          new DetectionEvent(2, "car", new BoundingBox(5, 6, 7, 8), 0.91234d)));
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(originalAdditive);
      appender.stop();
    }

    assertEquals(2, metrics.count("events.emitted"));
    List<ILoggingEvent> events = appender.list;
    assertEquals(2, events.size());
    assertEquals("detection.event source=cam-1, frame=3, ts=2024-01-01T00:00:00Z, class=2, label=car, "
        + "confidence=0.912, box=5,6,7,8", events.get(1).getFormattedMessage());
  }
}
