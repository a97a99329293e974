package io.dataflow.nats.output;

import io.dataflow.nats.JetStreamConfig;
import io.dataflow.nats.session.NatsSession;
import io.dataflow.nats.session.StreamDescriptor;
import java.io.IOException;
import java.util.Collections;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Makes sure the output stream exists.
 *
 * <p>An existing stream is never modified. If its subjects or retention differ from the configured
 * ones, the difference is logged and the stream is used as it is.
 */
final class StreamProvisioner {
  private static final Logger logger = LoggerFactory.getLogger(StreamProvisioner.class);

  private final StreamDescriptor desired;

  StreamProvisioner(JetStreamConfig config, String subject) {
    this.desired =
        new StreamDescriptor(
            config.streamName(),
            Collections.singletonList(subject),
            config.maxAge(),
            config.maxBytes(),
            config.maxMessages());
  }

  StreamDescriptor desired() {
    return desired;
  }

  /**
   * Creates the stream unless it already exists.
   *
   * @param session the connected session
   * @return true if the stream was created
   * @throws IOException if the lookup or creation fails
   */
  boolean ensureStream(NatsSession session) throws IOException {
    Optional<StreamDescriptor> existing = session.findStream(desired.name());
    if (existing.isPresent()) {
      warnOnDrift(existing.get());
      logger.debug("Using existing stream {}", desired.name());
      return false;
    }
    session.createStream(desired);
    logger.info("Created stream {} for subjects {}", desired.name(), desired.subjects());
    return true;
  }

  private void warnOnDrift(StreamDescriptor actual) {
    if (!actual.subjects().containsAll(desired.subjects())) {
      logger.warn(
          "Stream {} captures {} but records are published to {}",
          actual.name(),
          actual.subjects(),
          desired.subjects());
    }
    if (desired.maxAge().isPresent() && !desired.maxAge().equals(actual.maxAge())) {
      logger.warn(
          "Stream {} has max age {}, configured {}; leaving it unchanged",
          actual.name(),
          actual.maxAge().orElse(null),
          desired.maxAge().get());
    }
    if (desired.maxBytes().isPresent() && !desired.maxBytes().equals(actual.maxBytes())) {
      logger.warn(
          "Stream {} has max bytes {}, configured {}; leaving it unchanged",
          actual.name(),
          actual.maxBytes().orElse(null),
          desired.maxBytes().get());
    }
    if (desired.maxMessages().isPresent() && !desired.maxMessages().equals(actual.maxMessages())) {
      logger.warn(
          "Stream {} has max messages {}, configured {}; leaving it unchanged",
          actual.name(),
          actual.maxMessages().orElse(null),
          desired.maxMessages().get());
    }
  }
}
