package io.dataflow.nats.output;

import io.dataflow.nats.common.ConnectionException;
import io.dataflow.nats.session.NatsSession;
import io.dataflow.nats.session.StoredMessage;
import java.io.IOException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Determines the step to resume at by reading the last record stored for the output subject.
 *
 * <p>The stream is the only record of progress: the resume step is one past the step of the last
 * stored record, or 0 when there is none or its step cannot be read.
 */
final class ResumePositionResolver {
  private static final Logger logger = LoggerFactory.getLogger(ResumePositionResolver.class);

  // 2^64 - 1 as an unsigned step.
  static final long MAX_STEP = -1L;

  private final String streamName;
  private final String subject;

  ResumePositionResolver(String streamName, String subject) {
    this.streamName = streamName;
    this.subject = subject;
  }

  /**
   * Resolves the resume step.
   *
   * @param session the connected session
   * @return the first step the engine must send, unsigned
   * @throws IOException if the stream cannot be queried
   * @throws ConnectionException if the last stored step is the largest representable step
   */
  long resolve(NatsSession session) throws IOException {
    Optional<StoredMessage> last = session.lastMessage(streamName, subject);
    if (!last.isPresent()) {
      logger.info("No records for {} in stream {}, starting at step 0", subject, streamName);
      return 0L;
    }

    StoredMessage message = last.get();
    Long step = RecordHeaders.readStep(message.headers());
    if (step == null) {
      logger.warn(
          "Last record for {} (sequence {}) has no readable {} header, starting at step 0",
          subject,
          message.sequence(),
          RecordHeaders.STEP_HEADER);
      return 0L;
    }

    if (step == MAX_STEP) {
      throw new ConnectionException(
          "Last record for "
              + subject
              + " in stream "
              + streamName
              + " carries the maximum step "
              + Long.toUnsignedString(step)
              + "; no step can follow it");
    }

    long resumeStep = step + 1;
    logger.info(
        "Last stored step for {} is {}, resuming at step {}",
        subject,
        Long.toUnsignedString(step),
        Long.toUnsignedString(resumeStep));
    return resumeStep;
  }
}
