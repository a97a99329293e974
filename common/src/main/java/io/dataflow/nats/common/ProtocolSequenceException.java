package io.dataflow.nats.common;

/**
 * Thrown when a lifecycle operation is called from a state that does not permit it, or when a batch
 * is started for a step other than the one the endpoint expects.
 *
 * <p>Indicates a bug in the caller; the endpoint state is left unchanged.
 */
public class ProtocolSequenceException extends NonRetriableException {

  public ProtocolSequenceException(String message) {
    super(message);
  }
}
