package io.dataflow.nats.session;

import io.dataflow.nats.Auth;
import io.dataflow.nats.ConnectOptions;
import io.dataflow.nats.common.transport.AsyncErrorCallback;
import io.nats.client.Connection;
import io.nats.client.ErrorListener;
import io.nats.client.Nats;
import io.nats.client.Options;
import java.io.IOException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for NATS sessions.
 *
 * <p>Translates {@link ConnectOptions} into jnats {@link Options} and opens a connection. Errors
 * the client reports on its own threads after the connection is up are forwarded to the supplied
 * {@link AsyncErrorCallback} as non-fatal.
 */
public class NatsSessionFactory {
  private static final Logger logger = LoggerFactory.getLogger(NatsSessionFactory.class);

  /**
   * Opens a session.
   *
   * @param options the connection options
   * @param asyncErrorCallback receives transport errors reported after connect
   * @return a connected session
   * @throws IOException if the server cannot be reached or rejects the connection
   * @throws InterruptedException if interrupted while connecting
   */
  public NatsSession open(ConnectOptions options, AsyncErrorCallback asyncErrorCallback)
      throws IOException, InterruptedException {
    logger.debug("Connecting to {}", options.serverUrl());
    Connection connection = Nats.connect(buildOptions(options, asyncErrorCallback));
    logger.info(
        "Connected to {} as {}",
        connection.getConnectedUrl(),
        options.connectionName().orElse("<unnamed>"));
    return new JnatsSession(connection);
  }

  /**
   * Builds jnats options.
   *
   * @param options the connection options
   * @param asyncErrorCallback receives transport errors reported after connect
   * @return the client options
   */
  Options buildOptions(ConnectOptions options, AsyncErrorCallback asyncErrorCallback) {
    Options.Builder builder =
        new Options.Builder()
            .server(options.serverUrl())
            .connectionTimeout(Duration.ofMillis(options.connectionTimeoutMs()))
            .errorListener(new CallbackErrorListener(asyncErrorCallback));
    if (options.connectionName().isPresent()) {
      builder.connectionName(options.connectionName().get());
    }

    Auth auth = options.auth();
    switch (auth.kind()) {
      case TOKEN:
        builder.token(auth.token().get().toCharArray());
        break;
      case USER_PASSWORD:
        builder.userInfo(auth.user().get(), auth.password().get());
        break;
      case CREDENTIALS_FILE:
        builder.authHandler(Nats.credentials(auth.credentialsFile().get()));
        break;
      case NONE:
      default:
        break;
    }
    return builder.build();
  }

  /** Forwards client-side errors to the engine callback. */
  static final class CallbackErrorListener implements ErrorListener {
    private final AsyncErrorCallback callback;

    CallbackErrorListener(AsyncErrorCallback callback) {
      this.callback = callback;
    }

    @Override
    public void errorOccurred(Connection conn, String error) {
      logger.warn("NATS server reported error: {}", error);
      callback.onError(false, new IOException(error));
    }

    @Override
    public void exceptionOccurred(Connection conn, Exception exp) {
      logger.warn("NATS client error: {}", exp.getMessage());
      callback.onError(false, exp);
    }
  }
}
