package io.dataflow.nats.common;

/**
 * Thrown when a record buffered for the current batch could not be published.
 *
 * <p>The remainder of the flush is abandoned. Records acknowledged before the failure stay durably
 * committed; the remaining ones are discarded. A consistent resume point is only re-established by
 * a fresh {@code connect}.
 */
public class PublishException extends ConnectorException {

  private final int acknowledgedCount;

  /**
   * Constructs a new PublishException.
   *
   * @param message the detail message
   * @param acknowledgedCount number of records of the failed flush that were acknowledged
   * @param cause the cause of the exception
   */
  public PublishException(String message, int acknowledgedCount, Throwable cause) {
    super(message, cause);
    this.acknowledgedCount = acknowledgedCount;
  }

  /**
   * Returns how many records of the failed flush were durably acknowledged before the failure.
   *
   * @return the acknowledged record count
   */
  public int getAcknowledgedCount() {
    return acknowledgedCount;
  }
}
