package io.dataflow.nats.common;

/**
 * Thrown when {@code connect} cannot establish a usable session: the server is unreachable,
 * authentication is rejected, or the stream cannot be provisioned or queried.
 *
 * <p>Fatal for the attempt. The endpoint stays unconnected and the caller may call {@code connect}
 * again; there is no internal retry loop.
 */
public class ConnectionException extends ConnectorException {

  public ConnectionException(String message) {
    super(message);
  }

  public ConnectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
