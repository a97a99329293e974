package io.dataflow.nats.common;

/**
 * An exception that indicates a non-retriable error has occurred.
 *
 * <p>This exception is thrown when the error is permanent and cannot be resolved by repeating the
 * call. Common causes include:
 *
 * <ul>
 *   <li>Missing or contradictory endpoint configuration
 *   <li>Lifecycle operations called out of order or with an unexpected step
 *   <li>Keys, values or headers that are not valid text
 * </ul>
 *
 * <p>Contrast with {@link ConnectorException} which indicates an error the embedding engine can
 * recover from by reconnecting.
 *
 * @see ConnectorException
 */
public class NonRetriableException extends ConnectorException {

  /**
   * Constructs a new NonRetriableException with the specified detail message.
   *
   * @param message the detail message
   */
  public NonRetriableException(String message) {
    super(message);
  }

  /**
   * Constructs a new NonRetriableException with the specified detail message and cause.
   *
   * @param message the detail message
   * @param cause the cause of the exception
   */
  public NonRetriableException(String message, Throwable cause) {
    super(message, cause);
  }
}
