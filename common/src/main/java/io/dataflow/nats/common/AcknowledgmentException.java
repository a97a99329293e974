package io.dataflow.nats.common;

/**
 * A {@link PublishException} raised when a record was sent but its acknowledgment did not arrive in
 * time, or the wait for it was interrupted.
 *
 * <p>Whether the record itself became durable is unknown; only the durable log can tell after a
 * reconnect.
 */
public class AcknowledgmentException extends PublishException {

  public AcknowledgmentException(String message, int acknowledgedCount, Throwable cause) {
    super(message, acknowledgedCount, cause);
  }
}
