package io.dataflow.nats.session;

import io.nats.client.impl.Headers;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** A message read back from a JetStream stream. */
public final class StoredMessage {

  private final String subject;
  @Nullable private final Headers headers;
  private final byte[] data;
  private final long sequence;

  public StoredMessage(
      @Nonnull String subject, @Nullable Headers headers, @Nonnull byte[] data, long sequence) {
    this.subject = Objects.requireNonNull(subject, "subject cannot be null");
    this.headers = headers;
    this.data = Objects.requireNonNull(data, "data cannot be null");
    this.sequence = sequence;
  }

  public String subject() {
    return subject;
  }

  /** Returns the message headers, or null if the message has none. */
  @Nullable public Headers headers() {
    return headers;
  }

  public byte[] data() {
    return data;
  }

  /** Returns the stream sequence number assigned by the server. */
  public long sequence() {
    return sequence;
  }
}
