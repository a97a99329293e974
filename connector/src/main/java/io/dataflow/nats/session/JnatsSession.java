package io.dataflow.nats.session;

import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.MessageInfo;
import io.nats.client.api.PublishAck;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.api.StreamInfo;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link NatsSession} backed by a jnats {@link Connection}. */
final class JnatsSession implements NatsSession {
  private static final Logger logger = LoggerFactory.getLogger(JnatsSession.class);

  // JetStream API error codes.
  static final int STREAM_NOT_FOUND = 10059;
  static final int NO_MESSAGE_FOUND = 10037;

  private final Connection connection;
  private JetStream jetStream;
  private JetStreamManagement management;

  JnatsSession(Connection connection) {
    this.connection = connection;
  }

  @Override
  public void publish(String subject, Headers headers, byte[] payload) {
    connection.publish(subject, headers, payload);
  }

  @Override
  public Optional<StreamDescriptor> findStream(String streamName) throws IOException {
    try {
      StreamInfo info = management().getStreamInfo(streamName);
      return Optional.of(toDescriptor(info.getConfiguration()));
    } catch (JetStreamApiException e) {
      if (e.getApiErrorCode() == STREAM_NOT_FOUND) {
        return Optional.empty();
      }
      throw new IOException("Failed to look up stream '" + streamName + "'", e);
    }
  }

  @Override
  public void createStream(StreamDescriptor descriptor) throws IOException {
    StreamConfiguration.Builder builder =
        StreamConfiguration.builder()
            .name(descriptor.name())
            .subjects(descriptor.subjects());
    descriptor.maxAge().ifPresent(builder::maxAge);
    descriptor.maxBytes().ifPresent(builder::maxBytes);
    descriptor.maxMessages().ifPresent(builder::maxMessages);
    try {
      management().addStream(builder.build());
    } catch (JetStreamApiException e) {
      throw new IOException("Failed to create stream '" + descriptor.name() + "'", e);
    }
  }

  @Override
  public Optional<StoredMessage> lastMessage(String streamName, String subject)
      throws IOException {
    try {
      MessageInfo info = management().getLastMessage(streamName, subject);
      return Optional.of(
          new StoredMessage(
              info.getSubject(),
              info.getHeaders(),
              info.getData() == null ? new byte[0] : info.getData(),
              info.getSeq()));
    } catch (JetStreamApiException e) {
      if (e.getApiErrorCode() == NO_MESSAGE_FOUND) {
        return Optional.empty();
      }
      throw new IOException(
          "Failed to read last message for '" + subject + "' from stream '" + streamName + "'", e);
    }
  }

  @Override
  public CompletableFuture<Long> publishDurable(String subject, Headers headers, byte[] payload) {
    try {
      return jetStream().publishAsync(subject, headers, payload).thenApply(PublishAck::getSeqno);
    } catch (IOException | RuntimeException e) {
      CompletableFuture<Long> failed = new CompletableFuture<>();
      failed.completeExceptionally(e);
      return failed;
    }
  }

  @Override
  public void close() {
    try {
      connection.close();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.warn("Interrupted while closing NATS connection");
    }
  }

  private JetStreamManagement management() throws IOException {
    if (management == null) {
      management = connection.jetStreamManagement();
    }
    return management;
  }

  private JetStream jetStream() throws IOException {
    if (jetStream == null) {
      jetStream = connection.jetStream();
    }
    return jetStream;
  }

  static StreamDescriptor toDescriptor(StreamConfiguration config) {
    Duration maxAge = config.getMaxAge();
    return new StreamDescriptor(
        config.getName(),
        config.getSubjects(),
        maxAge == null || maxAge.isZero() ? Optional.empty() : Optional.of(maxAge),
        config.getMaxBytes() > 0 ? Optional.of(config.getMaxBytes()) : Optional.empty(),
        config.getMaxMsgs() > 0 ? Optional.of(config.getMaxMsgs()) : Optional.empty());
  }
}
