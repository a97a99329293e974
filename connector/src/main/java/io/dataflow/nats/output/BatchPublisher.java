package io.dataflow.nats.output;

import io.dataflow.nats.common.AcknowledgmentException;
import io.dataflow.nats.common.PublishException;
import io.dataflow.nats.session.NatsSession;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes the buffered records of a batch to JetStream, one at a time.
 *
 * <p>Each record is acknowledged before the next one is sent, so the stream always holds a prefix
 * of the batch. The first failure stops the flush. The buffer is empty afterwards in every case.
 */
final class BatchPublisher {
  private static final Logger logger = LoggerFactory.getLogger(BatchPublisher.class);

  private final String subject;
  private final long ackTimeoutMs;

  BatchPublisher(String subject, long ackTimeoutMs) {
    this.subject = subject;
    this.ackTimeoutMs = ackTimeoutMs;
  }

  /**
   * Flushes the buffer.
   *
   * @param session the connected session
   * @param buffer the records to publish, in order
   * @return the number of records published
   * @throws AcknowledgmentException if an acknowledgment did not arrive in time
   * @throws PublishException if a record was rejected or could not be sent
   */
  int flush(NatsSession session, RecordBuffer buffer) {
    int acknowledged = 0;
    try {
      for (BufferedRecord record : buffer.records()) {
        long sequence = awaitAck(session, record, acknowledged);
        acknowledged++;
        if (logger.isDebugEnabled()) {
          logger.debug("Record {} stored at sequence {}", record.position, sequence);
        }
      }
      return acknowledged;
    } finally {
      buffer.clear();
    }
  }

  private long awaitAck(NatsSession session, BufferedRecord record, int acknowledged) {
    try {
      return session
          .publishDurable(subject, record.headers, record.payload)
          .get(ackTimeoutMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      throw new AcknowledgmentException(
          "No acknowledgment for record " + record.position + " within " + ackTimeoutMs + " ms",
          acknowledged,
          e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AcknowledgmentException(
          "Interrupted while waiting for acknowledgment of record " + record.position,
          acknowledged,
          e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      if (cause instanceof TimeoutException) {
        throw new AcknowledgmentException(
            "Acknowledgment timed out for record " + record.position, acknowledged, cause);
      }
      throw new PublishException(
          "Failed to publish record " + record.position + ": " + cause.getMessage(),
          acknowledged,
          cause);
    } catch (RuntimeException e) {
      throw new PublishException(
          "Failed to publish record " + record.position + ": " + e.getMessage(), acknowledged, e);
    }
  }
}
