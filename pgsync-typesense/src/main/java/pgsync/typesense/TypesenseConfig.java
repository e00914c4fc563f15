package pgsync.typesense;

import java.time.Duration;
import java.util.Locale;

/**
 * Connection settings for one Typesense node.
 *
 * @param host              server host name
 * @param port              server port, {@code 8108} by default
 * @param protocol          {@code http} or {@code https}
 * @param apiKey            admin API key sent with every request
 * @param connectionTimeout connect and response timeout
 */
public record TypesenseConfig(String host, int port, String protocol, String apiKey, Duration connectionTimeout) {
  public static final int DEFAULT_PORT = 8108;
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

  public TypesenseConfig {
    if (host == null || host.isBlank()) {
      throw new IllegalArgumentException("Typesense host must not be empty");
    }
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalArgumentException("Typesense API key must not be empty");
    }
    if (port <= 0 || port > 65535) {
      throw new IllegalArgumentException("Invalid Typesense port: " + port);
    }
    protocol = protocol == null ? "http" : protocol.toLowerCase(Locale.ROOT);
    if (!protocol.equals("http") && !protocol.equals("https")) {
      throw new IllegalArgumentException("Typesense protocol must be http or https, got: " + protocol);
    }
    connectionTimeout = connectionTimeout == null ? DEFAULT_TIMEOUT : connectionTimeout;
    if (connectionTimeout.isNegative() || connectionTimeout.isZero()) {
      throw new IllegalArgumentException("connectionTimeout must be > 0");
    }
  }

  public static TypesenseConfig of(String host, String apiKey) {
    return new TypesenseConfig(host, DEFAULT_PORT, "http", apiKey, DEFAULT_TIMEOUT);
  }

  public String baseUrl() {
    return protocol + "://" + host + ":" + port;
  }

  @Override
  public String toString() {
    // no API key
    return "TypesenseConfig{" + baseUrl() + ", timeout=" + connectionTimeout + "}";
  }
}
