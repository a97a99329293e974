package io.dataflow.nats.common.transport;

import javax.annotation.Nonnull;

/**
 * Receives errors that an endpoint detects outside of a synchronous call, for example a transport
 * error reported by the client library's background threads.
 *
 * <p>Registered once per endpoint through {@link OutputEndpoint#connect(AsyncErrorCallback)} and
 * held for the endpoint's lifetime.
 */
@FunctionalInterface
public interface AsyncErrorCallback {

  /**
   * Invoked when an asynchronous error occurs.
   *
   * @param fatal true if the endpoint can no longer make progress
   * @param error the error
   */
  void onError(boolean fatal, @Nonnull Throwable error);
}
