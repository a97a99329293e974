package io.dataflow.nats.common;

/**
 * Thrown when a record cannot be encoded: a key, value or header that must be UTF-8 text is not,
 * or a record has neither key nor value.
 *
 * <p>Scoped to the single offending call. The record is not buffered and consumes no position.
 */
public class EncodingException extends NonRetriableException {

  public EncodingException(String message) {
    super(message);
  }

  public EncodingException(String message, Throwable cause) {
    super(message, cause);
  }
}
