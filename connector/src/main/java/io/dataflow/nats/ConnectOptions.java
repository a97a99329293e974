package io.dataflow.nats;

import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * Connection settings for the NATS server.
 *
 * <p>Use the builder pattern to create instances:
 *
 * <pre>{@code
 * ConnectOptions options = ConnectOptions.builder()
 *     .setServerUrl("nats://nats-1:4222")
 *     .setAuth(Auth.token(token))
 *     .setConnectionTimeoutMs(5000)
 *     .build();
 * }</pre>
 */
public class ConnectOptions {

  /** Server used when none is configured. */
  public static final String DEFAULT_SERVER_URL = "nats://localhost:4222";

  private final String serverUrl;
  private final Auth auth;
  private final int connectionTimeoutMs;
  private final Optional<String> connectionName;

  private ConnectOptions(
      String serverUrl, Auth auth, int connectionTimeoutMs, Optional<String> connectionName) {
    this.serverUrl = serverUrl;
    this.auth = auth;
    this.connectionTimeoutMs = connectionTimeoutMs;
    this.connectionName = connectionName;
  }

  /** Returns the server URL, e.g. {@code nats://localhost:4222}. */
  public String serverUrl() {
    return serverUrl;
  }

  public Auth auth() {
    return auth;
  }

  /**
   * Returns the maximum time to wait for the initial connection.
   *
   * @return the connection timeout in milliseconds
   */
  public int connectionTimeoutMs() {
    return connectionTimeoutMs;
  }

  /** Returns the client name reported to the server, if set. */
  public Optional<String> connectionName() {
    return connectionName;
  }

  /**
   * Returns the default connection options: local server, no authentication, 10s timeout.
   *
   * @return the default options
   */
  public static ConnectOptions getDefault() {
    return builder().build();
  }

  public static ConnectOptionsBuilder builder() {
    return new ConnectOptionsBuilder();
  }

  @Override
  public String toString() {
    return "ConnectOptions{serverUrl=" + serverUrl + ", auth=" + auth + "}";
  }

  /** Builder for {@link ConnectOptions}. */
  public static class ConnectOptionsBuilder {
    private String serverUrl = DEFAULT_SERVER_URL;
    private Auth auth = Auth.none();
    private int connectionTimeoutMs = 10000;
    private Optional<String> connectionName = Optional.empty();

    private ConnectOptionsBuilder() {}

    public ConnectOptionsBuilder setServerUrl(@Nonnull String serverUrl) {
      this.serverUrl = Objects.requireNonNull(serverUrl, "serverUrl cannot be null");
      return this;
    }

    public ConnectOptionsBuilder setAuth(@Nonnull Auth auth) {
      this.auth = Objects.requireNonNull(auth, "auth cannot be null");
      return this;
    }

    /**
     * Sets the maximum time to wait for the initial connection.
     *
     * @param connectionTimeoutMs the timeout in milliseconds, must be positive
     * @return this builder for method chaining
     */
    public ConnectOptionsBuilder setConnectionTimeoutMs(int connectionTimeoutMs) {
      this.connectionTimeoutMs = connectionTimeoutMs;
      return this;
    }

    public ConnectOptionsBuilder setConnectionName(@Nonnull String connectionName) {
      this.connectionName = Optional.of(connectionName);
      return this;
    }

    /**
     * Builds the options.
     *
     * @return the connection options
     * @throws IllegalArgumentException if the server URL is blank or the timeout is not positive
     */
    public ConnectOptions build() {
      if (serverUrl.trim().isEmpty()) {
        throw new IllegalArgumentException("serverUrl cannot be empty");
      }
      if (connectionTimeoutMs <= 0) {
        throw new IllegalArgumentException("connectionTimeoutMs must be positive");
      }
      return new ConnectOptions(serverUrl, auth, connectionTimeoutMs, connectionName);
    }
  }
}
