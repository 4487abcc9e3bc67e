package ca.gc.cra.vigil.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Network endpoint validation for broker and collector addresses.
 *
 * @since 0.1.0
 */
public final class Net {
  private static final Pattern HOSTNAME =
      Pattern.compile("^(?=.{1,253}$)[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?(?:\\.[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?)*$");
  private static final Pattern IPV6_LITERAL = Pattern.compile("^[0-9A-Fa-f:.]+$");

  private Net() {
    // Utility
  }

  /**
   * Validates a {@code host:port} pair. IPv6 literals must be bracketed.
   *
   * @param value candidate endpoint
   * @return normalized {@code host:port}
   * @throws IllegalArgumentException if the host or port is malformed
   */
  public static String validateHostPort(String value) {
    String sanitized = Strings.requireNonBlank("host:port", value);
    String host;
    String port;
    if (sanitized.startsWith("[")) {
      int close = sanitized.indexOf(']');
      if (close < 0 || close + 1 >= sanitized.length() || sanitized.charAt(close + 1) != ':') {
        throw new IllegalArgumentException("host:port must use [IPv6]:PORT format (was " + sanitized + ")");
      }
      host = sanitized.substring(1, close);
      port = sanitized.substring(close + 2);
      if (host.isEmpty() || !IPV6_LITERAL.matcher(host).matches()) {
        throw new IllegalArgumentException("invalid IPv6 literal: " + host);
      }
      host = '[' + host + ']';
    } else {
      int colon = sanitized.lastIndexOf(':');
      if (colon <= 0 || colon == sanitized.length() - 1) {
        throw new IllegalArgumentException("host:port must use HOST:PORT format (was " + sanitized + ")");
      }
      host = sanitized.substring(0, colon);
      port = sanitized.substring(colon + 1);
      if (host.indexOf(':') >= 0) {
        throw new IllegalArgumentException("IPv6 host must be wrapped in [ ]");
      }
      if (!HOSTNAME.matcher(host).matches()) {
        throw new IllegalArgumentException("invalid hostname: " + host);
      }
    }
    int parsed;
    try {
      parsed = Integer.parseInt(port);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("port must be numeric (was " + port + ")", ex);
    }
    Numbers.requireRange("port", parsed, 1, 65535);
    return host + ':' + parsed;
  }

  /**
   * Validates a comma-separated Kafka bootstrap list.
   *
   * @param csv one or more {@code host:port} entries
   * @return normalized list joined with commas
   * @throws IllegalArgumentException if any entry is invalid
   */
  public static String validateBootstrapServers(String csv) {
    String sanitized = Strings.requireNonBlank("kafkaBootstrap", csv);
    List<String> normalized = new ArrayList<>();
    for (String entry : sanitized.split(",")) {
      if (!entry.isBlank()) {
        normalized.add(validateHostPort(entry.trim()));
      }
    }
    if (normalized.isEmpty()) {
      throw new IllegalArgumentException("kafkaBootstrap must list at least one host:port");
    }
    return String.join(",", normalized);
  }
}
