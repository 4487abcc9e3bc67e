package ca.gc.cra.vigil.adapter.kafka;

import ca.gc.cra.vigil.application.port.DetectionEventPublisher;
import ca.gc.cra.vigil.application.port.MetricsPort;
import ca.gc.cra.vigil.domain.detect.DetectionEvent;
import ca.gc.cra.vigil.infrastructure.persistence.DetectionEventJson;
import ca.gc.cra.vigil.validation.Strings;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes each frame's detection events to Kafka as one JSON record keyed by watcher name.
 * <p>Records look like {@code {"schemaVersion":1,"source":"cam-1","frame":42,"timestamp":"...",
 * "events":[...],"pipeline":{"host":"..."}}}. Sends are asynchronous; broker failures are logged and
 * counted.</p>
 *
 * @since 0.1.0
 */
public final class KafkaDetectionEventPublisher implements DetectionEventPublisher {
  private static final Logger log = LoggerFactory.getLogger(KafkaDetectionEventPublisher.class);
  private static final int SCHEMA_VERSION = 1;

  private final Producer<String, byte[]> producer;
  private final String topic;
  private final MetricsPort metrics;
  private final JsonFactory jsonFactory = new JsonFactory();
  private final String hostName;

  /**
   * Creates a publisher using the supplied Kafka bootstrap servers.
   *
   * @param bootstrapServers kafka bootstrap servers
   * @param topic topic receiving detection records
   * @param metrics metrics sink
   */
  public KafkaDetectionEventPublisher(String bootstrapServers, String topic, MetricsPort metrics) {
    this(createProducer(bootstrapServers), topic, metrics);
  }

  KafkaDetectionEventPublisher(Producer<String, byte[]> producer, String topic, MetricsPort metrics) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.topic = Strings.sanitizeTopic("topic", topic);
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.hostName = resolveHostName();
  }

  @Override
  public void publish(String source, long frameNumber, Instant timestamp, List<DetectionEvent> events)
      throws IOException {
    byte[] payload = serialize(source, frameNumber, timestamp, events);
    producer.send(new ProducerRecord<>(topic, source, payload), (metadata, ex) -> {
      if (ex != null) {
        metrics.increment("events.kafka.error");
        log.error("Kafka publish failure for topic {} frame {}", topic, frameNumber, ex);
      }
    });
    metrics.increment("events.kafka.sent");
  }

  @Override
  public void flush() {
    producer.flush();
  }

  @Override
  public void close() {
    try {
      producer.flush();
    } catch (Exception ex) {
      log.warn("Kafka producer flush failed during shutdown", ex);
    } finally {
      producer.close();
    }
  }

  private byte[] serialize(String source, long frameNumber, Instant timestamp, List<DetectionEvent> events)
      throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream(256 + events.size() * 128);
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeNumberField("schemaVersion", SCHEMA_VERSION);
      gen.writeStringField("source", source);
      gen.writeNumberField("frame", frameNumber);
      gen.writeStringField("timestamp", timestamp.toString());
      gen.writeFieldName("events");
      DetectionEventJson.writeEvents(gen, events);
      if (hostName != null && !hostName.isBlank()) {
        gen.writeObjectFieldStart("pipeline");
        gen.writeStringField("host", hostName);
        gen.writeEndObject();
      }
      gen.writeEndObject();
    }
    return out.toByteArray();
  }

  private static Producer<String, byte[]> createProducer(String bootstrapServers) {
    String servers = Strings.requireNonBlank("bootstrapServers", bootstrapServers);
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, servers);
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    return new KafkaProducer<>(props);
  }

  private static String resolveHostName() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.warn("Unable to resolve local hostname for pipeline metadata", ex);
      return null;
    }
  }
}
