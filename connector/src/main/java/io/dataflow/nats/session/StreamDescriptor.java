package io.dataflow.nats.session;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * A JetStream stream as the connector sees it: a name, the subjects it captures and its retention
 * bounds. An absent bound means the server default applies.
 */
public final class StreamDescriptor {

  private final String name;
  private final List<String> subjects;
  private final Optional<Duration> maxAge;
  private final Optional<Long> maxBytes;
  private final Optional<Long> maxMessages;

  public StreamDescriptor(
      @Nonnull String name,
      @Nonnull List<String> subjects,
      @Nonnull Optional<Duration> maxAge,
      @Nonnull Optional<Long> maxBytes,
      @Nonnull Optional<Long> maxMessages) {
    this.name = Objects.requireNonNull(name, "name cannot be null");
    this.subjects = Collections.unmodifiableList(new ArrayList<>(subjects));
    this.maxAge = Objects.requireNonNull(maxAge, "maxAge cannot be null");
    this.maxBytes = Objects.requireNonNull(maxBytes, "maxBytes cannot be null");
    this.maxMessages = Objects.requireNonNull(maxMessages, "maxMessages cannot be null");
  }

  public String name() {
    return name;
  }

  public List<String> subjects() {
    return subjects;
  }

  public Optional<Duration> maxAge() {
    return maxAge;
  }

  public Optional<Long> maxBytes() {
    return maxBytes;
  }

  public Optional<Long> maxMessages() {
    return maxMessages;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof StreamDescriptor)) return false;
    StreamDescriptor other = (StreamDescriptor) o;
    return name.equals(other.name)
        && subjects.equals(other.subjects)
        && maxAge.equals(other.maxAge)
        && maxBytes.equals(other.maxBytes)
        && maxMessages.equals(other.maxMessages);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, subjects, maxAge, maxBytes, maxMessages);
  }

  @Override
  public String toString() {
    return "StreamDescriptor{name="
        + name
        + ", subjects="
        + subjects
        + ", maxAge="
        + maxAge.orElse(null)
        + ", maxBytes="
        + maxBytes.orElse(null)
        + ", maxMessages="
        + maxMessages.orElse(null)
        + "}";
  }
}
