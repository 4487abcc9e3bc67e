package ca.gc.cra.vigil.config;

import ca.gc.cra.vigil.validation.Strings;
import java.util.Locale;
import java.util.Objects;

/**
 * Where detection events go: {@code log}, {@code kafka:TOPIC}, or {@code none}.
 *
 * @param kind output kind
 * @param topic Kafka topic; {@code null} unless {@code kind} is {@link Kind#KAFKA}
 * @since 0.1.0
 */
public record EventsOutput(Kind kind, String topic) {
  private static final String KAFKA_PREFIX = "kafka:";

  /** Output kinds. */
  public enum Kind {
    LOG,
    KAFKA,
    NONE
  }

  /**
   * Validates the pairing of kind and topic.
   *
   * @param kind output kind
   * @param topic topic for Kafka output
   */
  public EventsOutput {
    Objects.requireNonNull(kind, "kind");
    if (kind == Kind.KAFKA) {
      topic = Strings.sanitizeTopic("eventsOut", topic);
    } else {
      topic = null;
    }
  }

  /**
   * Parses an {@code eventsOut} value.
   *
   * @param raw {@code log}, {@code none}, or {@code kafka:TOPIC}; blank means {@code log}
   * @return parsed output
   * @throws IllegalArgumentException for any other value
   */
  public static EventsOutput parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return new EventsOutput(Kind.LOG, null);
    }
    String value = raw.trim();
    String lower = value.toLowerCase(Locale.ROOT);
    if (lower.equals("log")) {
      return new EventsOutput(Kind.LOG, null);
    }
    if (lower.equals("none")) {
      return new EventsOutput(Kind.NONE, null);
    }
    if (lower.startsWith(KAFKA_PREFIX)) {
      return new EventsOutput(Kind.KAFKA, value.substring(KAFKA_PREFIX.length()));
    }
    throw new IllegalArgumentException("eventsOut must be log, none, or kafka:TOPIC (was '" + raw + "')");
  }

  @Override
  public String toString() {
    return kind == Kind.KAFKA ? KAFKA_PREFIX + topic : kind.name().toLowerCase(Locale.ROOT);
  }
}
