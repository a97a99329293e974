package io.dataflow.nats.session;

import io.nats.client.impl.Headers;
import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import javax.annotation.Nonnull;

/**
 * A connected NATS session exposing the operations the output endpoints need.
 *
 * <p>Sessions are created by {@link NatsSessionFactory} and owned by exactly one endpoint.
 */
public interface NatsSession extends AutoCloseable {

  /**
   * Publishes a message over core NATS without waiting for any acknowledgment.
   *
   * @param subject the subject
   * @param headers the message headers, possibly empty
   * @param payload the message body
   */
  void publish(@Nonnull String subject, @Nonnull Headers headers, @Nonnull byte[] payload);

  /**
   * Looks up a JetStream stream by name.
   *
   * @param streamName the stream name
   * @return the stream, or empty if the server has no stream with that name
   * @throws IOException if the lookup fails for any other reason
   */
  Optional<StreamDescriptor> findStream(@Nonnull String streamName) throws IOException;

  /**
   * Creates a JetStream stream.
   *
   * @param descriptor the stream to create
   * @throws IOException if the server rejects or fails the request
   */
  void createStream(@Nonnull StreamDescriptor descriptor) throws IOException;

  /**
   * Reads the most recent message stored in a stream for a subject.
   *
   * @param streamName the stream name
   * @param subject the exact subject
   * @return the last message, or empty if the stream holds none for the subject
   * @throws IOException if the query fails for any other reason
   */
  Optional<StoredMessage> lastMessage(@Nonnull String streamName, @Nonnull String subject)
      throws IOException;

  /**
   * Publishes a message to JetStream.
   *
   * <p>The returned future completes with the stream sequence number once the server has stored
   * the message, or exceptionally if the publish is rejected.
   *
   * @param subject the subject
   * @param headers the message headers
   * @param payload the message body
   * @return a future for the publish acknowledgment
   */
  CompletableFuture<Long> publishDurable(
      @Nonnull String subject, @Nonnull Headers headers, @Nonnull byte[] payload);

  /** Closes the underlying connection. */
  @Override
  void close();
}
