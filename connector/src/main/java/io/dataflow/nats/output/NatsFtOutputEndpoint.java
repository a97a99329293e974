package io.dataflow.nats.output;

import io.dataflow.nats.JetStreamConfig;
import io.dataflow.nats.NatsOutputConfig;
import io.dataflow.nats.common.ConfigurationException;
import io.dataflow.nats.common.ConnectionException;
import io.dataflow.nats.common.ConnectorException;
import io.dataflow.nats.common.ProtocolSequenceException;
import io.dataflow.nats.common.PublishException;
import io.dataflow.nats.common.encoding.KeyValueEncoder;
import io.dataflow.nats.common.transport.AsyncErrorCallback;
import io.dataflow.nats.common.transport.Header;
import io.dataflow.nats.common.transport.OutputEndpoint;
import io.dataflow.nats.session.NatsSession;
import io.dataflow.nats.session.NatsSessionFactory;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fault-tolerant output endpoint backed by a JetStream stream.
 *
 * <p>Records pushed during a batch are buffered and published on {@code batchEnd}, each one
 * acknowledged before the next is sent. Every record carries its step and substep in the {@link
 * RecordHeaders#STEP_HEADER} and {@link RecordHeaders#SUBSTEP_HEADER} headers. On connect the
 * endpoint reads the last stored record back from the stream and expects the engine to continue at
 * the step after it, so a restarted engine neither duplicates nor skips batches.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * NatsFtOutputEndpoint endpoint = new NatsFtOutputEndpoint(config, new NatsSessionFactory());
 * endpoint.connect((fatal, error) -> log(error));
 *
 * long step = endpoint.getResumeStep();
 * endpoint.batchStart(step);
 * endpoint.pushKey(key, value, Collections.emptyList());
 * endpoint.batchEnd();
 * }</pre>
 *
 * <p>Not thread-safe. A failed {@code batchEnd} releases the session and returns the endpoint to
 * {@link EndpointState#NEW}; call {@code connect} again to re-resolve the resume step.
 */
public class NatsFtOutputEndpoint implements OutputEndpoint {
  private static final Logger logger = LoggerFactory.getLogger(NatsFtOutputEndpoint.class);

  /** Advisory batch size for the engine. */
  public static final int MAX_BUFFER_SIZE_BYTES = 1_000_000;

  private final NatsOutputConfig config;
  private final NatsSessionFactory sessionFactory;
  private final String subject;
  private final Map<String, String> staticHeaders;
  private final StreamProvisioner provisioner;
  private final ResumePositionResolver resolver;
  private final BatchPublisher publisher;
  private final RecordBuffer buffer = new RecordBuffer();

  private EndpointState state = EndpointState.NEW;
  @Nullable private NatsSession session;

  // Step resolved by the last connect.
  private long resumeStep;

  // Step of the last acknowledged batch, valid in BATCH_CLOSED.
  private long lastClosedStep;

  // Position the next pushed record receives, valid in BATCH_OPEN.
  @Nullable private OutputPosition nextPosition;

  /**
   * Creates an endpoint.
   *
   * @param config the output configuration; must carry a JetStream section with fault tolerance
   *     enabled
   * @param sessionFactory factory for the NATS session opened on connect
   * @throws ConfigurationException if the JetStream section is missing or disables fault tolerance
   */
  public NatsFtOutputEndpoint(
      @Nonnull NatsOutputConfig config, @Nonnull NatsSessionFactory sessionFactory) {
    this.config = Objects.requireNonNull(config, "config cannot be null");
    this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory cannot be null");

    Optional<JetStreamConfig> jetStream = config.jetStream();
    if (!jetStream.isPresent()) {
      throw new ConfigurationException(
          "JetStream configuration required for fault-tolerant output to " + config.subject());
    }
    if (!jetStream.get().enableFaultTolerance()) {
      throw new ConfigurationException(
          "Fault tolerance must be enabled in the JetStream configuration of stream "
              + jetStream.get().streamName());
    }

    this.subject = config.subject();
    this.staticHeaders = config.headers();
    this.provisioner = new StreamProvisioner(jetStream.get(), subject);
    this.resolver = new ResumePositionResolver(jetStream.get().streamName(), subject);
    this.publisher = new BatchPublisher(subject, jetStream.get().publishAckTimeoutMs());
  }

  // ==================== Lifecycle ====================

  @Override
  public void connect(@Nonnull AsyncErrorCallback asyncErrorCallback) {
    Objects.requireNonNull(asyncErrorCallback, "asyncErrorCallback cannot be null");
    if (state != EndpointState.NEW) {
      throw new ProtocolSequenceException("connect() called in state " + state);
    }

    NatsSession opened = openSession(asyncErrorCallback);
    boolean connected = false;
    try {
      provisioner.ensureStream(opened);
      long step = resolver.resolve(opened);
      this.session = opened;
      this.resumeStep = step;
      this.nextPosition = null;
      buffer.clear();
      transition(EndpointState.CONNECTED);
      connected = true;
      logger.info(
          "Connected fault-tolerant output to {} (stream {}), resume step {}",
          subject,
          provisioner.desired().name(),
          Long.toUnsignedString(step));
    } catch (IOException e) {
      throw new ConnectionException(
          "Failed to prepare stream " + provisioner.desired().name() + ": " + e.getMessage(), e);
    } catch (ConnectorException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ConnectionException(
          "Session failed while preparing stream "
              + provisioner.desired().name()
              + ": "
              + e.getMessage(),
          e);
    } finally {
      if (!connected) {
        opened.close();
      }
    }
  }

  @Override
  public void close() {
    if (session != null) {
      logger.debug("Closing session for {}", subject);
      session.close();
      session = null;
    }
    buffer.clear();
    nextPosition = null;
    state = EndpointState.NEW;
  }

  // ==================== Batches ====================

  @Override
  public void batchStart(long step) {
    long expected;
    switch (state) {
      case CONNECTED:
        expected = resumeStep;
        break;
      case BATCH_CLOSED:
        expected = lastClosedStep + 1;
        break;
      default:
        throw new ProtocolSequenceException("batchStart() called in state " + state);
    }
    if (step != expected) {
      throw new ProtocolSequenceException(
          "Expected step "
              + Long.toUnsignedString(expected)
              + " but batchStart() was called with step "
              + Long.toUnsignedString(step));
    }

    buffer.clear();
    nextPosition = OutputPosition.first(step);
    transition(EndpointState.BATCH_OPEN);
  }

  @Override
  public void batchEnd() {
    requireBatchOpen("batchEnd");
    OutputPosition position = nextPosition;
    int count = buffer.size();
    long bytes = buffer.totalBytes();

    try {
      publisher.flush(session, buffer);
    } catch (PublishException e) {
      logger.error(
          "Flush of step {} failed after {} of {} records: {}",
          Long.toUnsignedString(position.step()),
          e.getAcknowledgedCount(),
          count,
          e.getMessage());
      close();
      throw e;
    }

    lastClosedStep = position.step();
    nextPosition = null;
    transition(EndpointState.BATCH_CLOSED);
    logger.info(
        "Step {} committed: {} records, {} bytes",
        Long.toUnsignedString(lastClosedStep),
        count,
        bytes);
  }

  // ==================== Records ====================

  @Override
  public void pushBuffer(@Nonnull byte[] buffer) {
    Objects.requireNonNull(buffer, "buffer cannot be null");
    requireBatchOpen("pushBuffer");
    append(buffer.clone(), Collections.<Header>emptyList());
  }

  @Override
  public void pushKey(@Nullable byte[] key, @Nullable byte[] value, @Nonnull List<Header> headers) {
    Objects.requireNonNull(headers, "headers cannot be null");
    requireBatchOpen("pushKey");
    append(KeyValueEncoder.encode(key, value), headers);
  }

  private void append(byte[] payload, List<Header> callerHeaders) {
    Headers headers = RecordHeaders.build(staticHeaders, callerHeaders, nextPosition);
    buffer.append(new BufferedRecord(nextPosition, payload, headers));
    nextPosition = nextPosition.nextSubstep();
  }

  // ==================== Accessors ====================

  @Override
  public int maxBufferSizeBytes() {
    return MAX_BUFFER_SIZE_BYTES;
  }

  @Override
  public boolean isFaultTolerant() {
    return true;
  }

  public EndpointState getState() {
    return state;
  }

  /**
   * Returns the step the engine must start with after the last connect.
   *
   * @throws IllegalStateException if the endpoint is not connected
   */
  public long getResumeStep() {
    if (state == EndpointState.NEW) {
      throw new IllegalStateException("Endpoint is not connected");
    }
    return resumeStep;
  }

  /**
   * Returns the step the next {@code batchStart} must carry, or empty if no batch may be opened
   * now.
   */
  public Optional<Long> getNextExpectedStep() {
    switch (state) {
      case CONNECTED:
        return Optional.of(resumeStep);
      case BATCH_CLOSED:
        return Optional.of(lastClosedStep + 1);
      default:
        return Optional.empty();
    }
  }

  /** Returns the position the next pushed record would receive, if a batch is open. */
  public Optional<OutputPosition> getNextPosition() {
    return Optional.ofNullable(nextPosition);
  }

  /** Returns the number of records buffered in the open batch. */
  public int bufferedCount() {
    return buffer.size();
  }

  // ==================== Internals ====================

  private NatsSession openSession(AsyncErrorCallback callback) {
    try {
      return sessionFactory.open(config.connectOptions(), callback);
    } catch (IOException e) {
      throw new ConnectionException(
          "Failed to connect to " + config.connectOptions().serverUrl() + ": " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ConnectionException(
          "Interrupted while connecting to " + config.connectOptions().serverUrl(), e);
    }
  }

  private void requireBatchOpen(String operation) {
    if (state != EndpointState.BATCH_OPEN) {
      throw new ProtocolSequenceException(operation + "() called in state " + state);
    }
  }

  private void transition(EndpointState next) {
    logger.debug("{}: {} -> {}", subject, state, next);
    state = next;
  }
}
