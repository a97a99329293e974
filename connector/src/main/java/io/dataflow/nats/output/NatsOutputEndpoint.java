package io.dataflow.nats.output;

import io.dataflow.nats.NatsOutputConfig;
import io.dataflow.nats.common.ConnectionException;
import io.dataflow.nats.common.ProtocolSequenceException;
import io.dataflow.nats.common.PublishException;
import io.dataflow.nats.common.encoding.KeyValueEncoder;
import io.dataflow.nats.common.transport.AsyncErrorCallback;
import io.dataflow.nats.common.transport.Header;
import io.dataflow.nats.common.transport.OutputEndpoint;
import io.dataflow.nats.session.NatsSession;
import io.dataflow.nats.session.NatsSessionFactory;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Output endpoint publishing over core NATS.
 *
 * <p>Every push is published immediately, without buffering or acknowledgment. Batches are ignored
 * and no position headers are written, so a restarted engine may duplicate or lose records.
 */
public class NatsOutputEndpoint implements OutputEndpoint {
  private static final Logger logger = LoggerFactory.getLogger(NatsOutputEndpoint.class);

  private final NatsOutputConfig config;
  private final NatsSessionFactory sessionFactory;
  @Nullable private NatsSession session;

  public NatsOutputEndpoint(
      @Nonnull NatsOutputConfig config, @Nonnull NatsSessionFactory sessionFactory) {
    this.config = Objects.requireNonNull(config, "config cannot be null");
    this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory cannot be null");
  }

  @Override
  public void connect(@Nonnull AsyncErrorCallback asyncErrorCallback) {
    Objects.requireNonNull(asyncErrorCallback, "asyncErrorCallback cannot be null");
    if (session != null) {
      throw new ProtocolSequenceException("connect() called on a connected endpoint");
    }
    try {
      session = sessionFactory.open(config.connectOptions(), asyncErrorCallback);
    } catch (IOException e) {
      throw new ConnectionException(
          "Failed to connect to " + config.connectOptions().serverUrl() + ": " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ConnectionException(
          "Interrupted while connecting to " + config.connectOptions().serverUrl(), e);
    }
    logger.info("Connected output to {}", config.subject());
  }

  @Override
  public int maxBufferSizeBytes() {
    return NatsFtOutputEndpoint.MAX_BUFFER_SIZE_BYTES;
  }

  @Override
  public void batchStart(long step) {}

  @Override
  public void pushBuffer(@Nonnull byte[] buffer) {
    Objects.requireNonNull(buffer, "buffer cannot be null");
    publish(buffer, Collections.<Header>emptyList());
  }

  @Override
  public void pushKey(@Nullable byte[] key, @Nullable byte[] value, @Nonnull List<Header> headers) {
    Objects.requireNonNull(headers, "headers cannot be null");
    if (session == null) {
      throw new ProtocolSequenceException("pushKey() called before connect()");
    }
    publish(KeyValueEncoder.encode(key, value), headers);
  }

  @Override
  public void batchEnd() {}

  @Override
  public boolean isFaultTolerant() {
    return false;
  }

  @Override
  public void close() {
    if (session != null) {
      session.close();
      session = null;
    }
  }

  private void publish(byte[] payload, List<Header> callerHeaders) {
    if (session == null) {
      throw new ProtocolSequenceException("push called before connect()");
    }
    try {
      session.publish(
          config.subject(), RecordHeaders.build(config.headers(), callerHeaders, null), payload);
    } catch (IllegalStateException e) {
      throw new PublishException("Failed to publish to " + config.subject(), 0, e);
    }
  }
}
