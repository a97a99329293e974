package io.dataflow.nats.common;

/**
 * Thrown when an endpoint is constructed from a configuration it cannot work with.
 *
 * <p>Raised at construction time, so an endpoint that fails with this exception never exists.
 */
public class ConfigurationException extends NonRetriableException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
