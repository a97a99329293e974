package io.dataflow.nats;

import io.nats.client.impl.Headers;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * Configuration of a NATS output endpoint.
 *
 * <p>Every record is published to a single subject. Static headers are attached to every record.
 * The JetStream section is required by the fault-tolerant endpoint and ignored by the plain one.
 *
 * <pre>{@code
 * NatsOutputConfig config = NatsOutputConfig.builder("orders.out")
 *     .setConnectOptions(ConnectOptions.builder().setServerUrl(url).build())
 *     .addHeader("content-type", "application/json")
 *     .setJetStream(JetStreamConfig.builder("orders_out").build())
 *     .build();
 * }</pre>
 */
public class NatsOutputConfig {

  private final ConnectOptions connectOptions;
  private final String subject;
  private final Map<String, String> headers;
  private final Optional<JetStreamConfig> jetStream;

  private NatsOutputConfig(
      ConnectOptions connectOptions,
      String subject,
      Map<String, String> headers,
      Optional<JetStreamConfig> jetStream) {
    this.connectOptions = connectOptions;
    this.subject = subject;
    this.headers = headers;
    this.jetStream = jetStream;
  }

  public ConnectOptions connectOptions() {
    return connectOptions;
  }

  /** Returns the subject every record is published to. */
  public String subject() {
    return subject;
  }

  /**
   * Returns the headers attached to every record, in insertion order.
   *
   * @return an unmodifiable header map
   */
  public Map<String, String> headers() {
    return headers;
  }

  public Optional<JetStreamConfig> jetStream() {
    return jetStream;
  }

  public static NatsOutputConfigBuilder builder(@Nonnull String subject) {
    return new NatsOutputConfigBuilder(subject);
  }

  @Override
  public String toString() {
    return "NatsOutputConfig{subject="
        + subject
        + ", "
        + connectOptions
        + ", headers="
        + headers.keySet()
        + ", jetStream="
        + jetStream.orElse(null)
        + "}";
  }

  /** Builder for {@link NatsOutputConfig}. */
  public static class NatsOutputConfigBuilder {
    private final String subject;
    private ConnectOptions connectOptions = ConnectOptions.getDefault();
    private final Map<String, String> headers = new LinkedHashMap<>();
    private Optional<JetStreamConfig> jetStream = Optional.empty();

    private NatsOutputConfigBuilder(String subject) {
      this.subject = Objects.requireNonNull(subject, "subject cannot be null");
    }

    public NatsOutputConfigBuilder setConnectOptions(@Nonnull ConnectOptions connectOptions) {
      this.connectOptions = Objects.requireNonNull(connectOptions, "connectOptions cannot be null");
      return this;
    }

    public NatsOutputConfigBuilder addHeader(@Nonnull String name, @Nonnull String value) {
      headers.put(
          Objects.requireNonNull(name, "header name cannot be null"),
          Objects.requireNonNull(value, "header value cannot be null"));
      return this;
    }

    public NatsOutputConfigBuilder setHeaders(@Nonnull Map<String, String> headers) {
      this.headers.clear();
      for (Map.Entry<String, String> entry : headers.entrySet()) {
        addHeader(entry.getKey(), entry.getValue());
      }
      return this;
    }

    public NatsOutputConfigBuilder setJetStream(@Nonnull JetStreamConfig jetStream) {
      this.jetStream = Optional.of(jetStream);
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return the output configuration
     * @throws IllegalArgumentException if the subject is blank or contains whitespace, or a static
     *     header is not a legal NATS header (printable ASCII name and value)
     */
    public NatsOutputConfig build() {
      if (subject.trim().isEmpty()) {
        throw new IllegalArgumentException("subject cannot be empty");
      }
      for (int i = 0; i < subject.length(); i++) {
        if (Character.isWhitespace(subject.charAt(i))) {
          throw new IllegalArgumentException("subject cannot contain whitespace: '" + subject + "'");
        }
      }
      Headers natsHeaders = new Headers();
      for (Map.Entry<String, String> header : headers.entrySet()) {
        try {
          natsHeaders.put(header.getKey(), header.getValue());
        } catch (IllegalArgumentException e) {
          throw new IllegalArgumentException(
              "Invalid static header '"
                  + header.getKey()
                  + "': NATS header names and values must be printable ASCII ("
                  + e.getMessage()
                  + ")",
              e);
        }
      }
      return new NatsOutputConfig(
          connectOptions,
          subject,
          Collections.unmodifiableMap(new LinkedHashMap<>(headers)),
          jetStream);
    }
  }
}
