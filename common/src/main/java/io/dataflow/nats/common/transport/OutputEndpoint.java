package io.dataflow.nats.common.transport;

import io.dataflow.nats.common.ConnectionException;
import io.dataflow.nats.common.EncodingException;
import io.dataflow.nats.common.ProtocolSequenceException;
import io.dataflow.nats.common.PublishException;
import java.util.List;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * An output transport driven by the embedding dataflow engine.
 *
 * <p>The engine calls the operations from a single thread, one at a time, in this order:
 *
 * <pre>
 * connect → (batchStart(step) → (pushBuffer | pushKey)* → batchEnd)*
 * </pre>
 *
 * <p>Each batch carries the engine's checkpoint step; steps increase by exactly one from batch to
 * batch. A fault-tolerant endpoint enforces this order and rejects anything else with {@link
 * ProtocolSequenceException}. A non-fault-tolerant endpoint treats batches as no-ops.
 *
 * <p>All operations block until their network work has completed. Implementations do no internal
 * locking; concurrent calls are not supported.
 */
public interface OutputEndpoint extends AutoCloseable {

  /**
   * Establishes the transport session.
   *
   * @param asyncErrorCallback receives errors detected outside the synchronous call path
   * @throws ConnectionException if the session cannot be established
   * @throws ProtocolSequenceException if the endpoint is already connected
   */
  void connect(@Nonnull AsyncErrorCallback asyncErrorCallback);

  /**
   * Returns an advisory upper bound for the bytes the engine should push per batch.
   *
   * @return the advisory buffer size in bytes
   */
  int maxBufferSizeBytes();

  /**
   * Opens the batch for the given step.
   *
   * @param step the engine checkpoint step, treated as unsigned
   * @throws ProtocolSequenceException if no batch may be opened now or the step is not the expected
   *     one
   */
  void batchStart(long step);

  /**
   * Pushes an already encoded record.
   *
   * @param buffer the record payload
   * @throws ProtocolSequenceException if no batch is open
   */
  void pushBuffer(@Nonnull byte[] buffer);

  /**
   * Pushes a key/value record with per-record headers.
   *
   * @param key the record key, or null
   * @param value the record value, or null
   * @param headers per-record headers, layered over statically configured ones; values must be
   *     valid UTF-8, and transports that only carry ASCII headers (NATS) also require printable
   *     ASCII
   * @throws ProtocolSequenceException if no batch is open
   * @throws EncodingException if both key and value are null, text is not valid UTF-8, or a header
   *     cannot be carried by the transport
   */
  void pushKey(@Nullable byte[] key, @Nullable byte[] value, @Nonnull List<Header> headers);

  /**
   * Closes the current batch, making its records durable where the endpoint supports it.
   *
   * @throws ProtocolSequenceException if no batch is open
   * @throws PublishException if a record could not be published or acknowledged
   */
  void batchEnd();

  /** Returns true if the endpoint resumes exactly after a restart. */
  boolean isFaultTolerant();

  /** Releases the transport session. Safe to call more than once. */
  @Override
  void close();
}
