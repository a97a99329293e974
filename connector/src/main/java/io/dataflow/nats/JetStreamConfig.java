package io.dataflow.nats;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * JetStream settings for the fault-tolerant output endpoint.
 *
 * <p>The stream named here is created on first connect if it does not exist, with the endpoint's
 * subject as its only subject filter and whichever retention bounds are set. An existing stream is
 * used as is.
 *
 * <pre>{@code
 * JetStreamConfig jetStream = JetStreamConfig.builder("orders_out")
 *     .setMaxAge(Duration.ofDays(7))
 *     .setMaxBytes(10L * 1024 * 1024 * 1024)
 *     .build();
 * }</pre>
 */
public class JetStreamConfig {

  /** Default time to wait for each publish acknowledgment. */
  public static final int DEFAULT_PUBLISH_ACK_TIMEOUT_MS = 30000;

  private final String streamName;
  private final boolean enableFaultTolerance;
  private final Optional<Duration> maxAge;
  private final Optional<Long> maxBytes;
  private final Optional<Long> maxMessages;
  private final int publishAckTimeoutMs;

  private JetStreamConfig(
      String streamName,
      boolean enableFaultTolerance,
      Optional<Duration> maxAge,
      Optional<Long> maxBytes,
      Optional<Long> maxMessages,
      int publishAckTimeoutMs) {
    this.streamName = streamName;
    this.enableFaultTolerance = enableFaultTolerance;
    this.maxAge = maxAge;
    this.maxBytes = maxBytes;
    this.maxMessages = maxMessages;
    this.publishAckTimeoutMs = publishAckTimeoutMs;
  }

  public String streamName() {
    return streamName;
  }

  /**
   * Returns whether fault tolerance is enabled.
   *
   * <p>A fault-tolerant endpoint refuses a configuration where this is false.
   *
   * @return true if fault tolerance is enabled
   */
  public boolean enableFaultTolerance() {
    return enableFaultTolerance;
  }

  /** Returns the maximum age of messages kept by a newly created stream. */
  public Optional<Duration> maxAge() {
    return maxAge;
  }

  /** Returns the maximum total size of a newly created stream. */
  public Optional<Long> maxBytes() {
    return maxBytes;
  }

  /** Returns the maximum number of messages kept by a newly created stream. */
  public Optional<Long> maxMessages() {
    return maxMessages;
  }

  /**
   * Returns the time to wait for the server to acknowledge each published record.
   *
   * @return the acknowledgment timeout in milliseconds
   */
  public int publishAckTimeoutMs() {
    return publishAckTimeoutMs;
  }

  /**
   * Returns a new builder.
   *
   * @param streamName the JetStream stream name
   * @return a new builder
   */
  public static JetStreamConfigBuilder builder(@Nonnull String streamName) {
    return new JetStreamConfigBuilder(streamName);
  }

  public JetStreamConfigBuilder toBuilder() {
    JetStreamConfigBuilder builder =
        new JetStreamConfigBuilder(streamName)
            .setEnableFaultTolerance(enableFaultTolerance)
            .setPublishAckTimeoutMs(publishAckTimeoutMs);
    maxAge.ifPresent(builder::setMaxAge);
    maxBytes.ifPresent(builder::setMaxBytes);
    maxMessages.ifPresent(builder::setMaxMessages);
    return builder;
  }

  @Override
  public String toString() {
    return "JetStreamConfig{streamName="
        + streamName
        + ", enableFaultTolerance="
        + enableFaultTolerance
        + ", maxAge="
        + maxAge.orElse(null)
        + ", maxBytes="
        + maxBytes.orElse(null)
        + ", maxMessages="
        + maxMessages.orElse(null)
        + "}";
  }

  /** Builder for {@link JetStreamConfig}. */
  public static class JetStreamConfigBuilder {
    private final String streamName;
    private boolean enableFaultTolerance = true;
    private Optional<Duration> maxAge = Optional.empty();
    private Optional<Long> maxBytes = Optional.empty();
    private Optional<Long> maxMessages = Optional.empty();
    private int publishAckTimeoutMs = DEFAULT_PUBLISH_ACK_TIMEOUT_MS;

    private JetStreamConfigBuilder(String streamName) {
      this.streamName = Objects.requireNonNull(streamName, "streamName cannot be null");
    }

    public JetStreamConfigBuilder setEnableFaultTolerance(boolean enableFaultTolerance) {
      this.enableFaultTolerance = enableFaultTolerance;
      return this;
    }

    public JetStreamConfigBuilder setMaxAge(@Nonnull Duration maxAge) {
      this.maxAge = Optional.of(maxAge);
      return this;
    }

    public JetStreamConfigBuilder setMaxBytes(long maxBytes) {
      this.maxBytes = Optional.of(maxBytes);
      return this;
    }

    public JetStreamConfigBuilder setMaxMessages(long maxMessages) {
      this.maxMessages = Optional.of(maxMessages);
      return this;
    }

    public JetStreamConfigBuilder setPublishAckTimeoutMs(int publishAckTimeoutMs) {
      this.publishAckTimeoutMs = publishAckTimeoutMs;
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return the JetStream configuration
     * @throws IllegalArgumentException if the stream name is blank, a retention bound is not
     *     positive, or the acknowledgment timeout is not positive
     */
    public JetStreamConfig build() {
      if (streamName.trim().isEmpty()) {
        throw new IllegalArgumentException("streamName cannot be empty");
      }
      if (maxAge.isPresent() && (maxAge.get().isNegative() || maxAge.get().isZero())) {
        throw new IllegalArgumentException("maxAge must be positive");
      }
      if (maxBytes.isPresent() && maxBytes.get() <= 0) {
        throw new IllegalArgumentException("maxBytes must be positive");
      }
      if (maxMessages.isPresent() && maxMessages.get() <= 0) {
        throw new IllegalArgumentException("maxMessages must be positive");
      }
      if (publishAckTimeoutMs <= 0) {
        throw new IllegalArgumentException("publishAckTimeoutMs must be positive");
      }
      return new JetStreamConfig(
          streamName, enableFaultTolerance, maxAge, maxBytes, maxMessages, publishAckTimeoutMs);
    }
  }
}
