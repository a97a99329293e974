package io.dataflow.nats.common;

/**
 * Base exception class for all output connector errors.
 *
 * <p>This is an unchecked exception (extends {@link RuntimeException}). Every failure of an output
 * endpoint operation surfaces as a subclass of this type; nothing is reported through return codes.
 *
 * <p>The connector throws two families of exceptions:
 *
 * <ul>
 *   <li>{@link ConnectorException} - Errors the embedding engine may recover from by calling
 *       {@code connect} again (network issues, publish failures)
 *   <li>{@link NonRetriableException} - Errors caused by configuration or by the caller driving the
 *       endpoint out of order; retrying the same call cannot succeed
 * </ul>
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * try {
 *     endpoint.batchEnd();
 * } catch (NonRetriableException e) {
 *     // Caller bug or bad configuration - do not retry
 *     throw e;
 * } catch (ConnectorException e) {
 *     // Reconnect; the resume step is re-read from the durable log
 *     endpoint.connect(callback);
 * }
 * }</pre>
 */
public class ConnectorException extends RuntimeException {

  /**
   * Constructs a new ConnectorException with the specified detail message.
   *
   * @param message the detail message
   */
  public ConnectorException(String message) {
    super(message);
  }

  /**
   * Constructs a new ConnectorException with the specified detail message and cause.
   *
   * @param message the detail message
   * @param cause the cause of the exception
   */
  public ConnectorException(String message, Throwable cause) {
    super(message, cause);
  }
}
