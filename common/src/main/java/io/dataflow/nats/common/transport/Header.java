package io.dataflow.nats.common.transport;

import java.util.Arrays;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A per-record header supplied by the engine together with a key/value pair.
 *
 * <p>The value is optional; a header without a value is not written to the record.
 */
public final class Header {

  private final String name;
  @Nullable private final byte[] value;

  private Header(String name, @Nullable byte[] value) {
    this.name = name;
    this.value = value;
  }

  /**
   * Creates a header.
   *
   * @param name the header name
   * @param value the raw header value, or null
   * @return a new header
   */
  @Nonnull
  public static Header of(@Nonnull String name, @Nullable byte[] value) {
    Objects.requireNonNull(name, "name cannot be null");
    return new Header(name, value == null ? null : value.clone());
  }

  @Nonnull
  public String name() {
    return name;
  }

  /** Returns a copy of the raw value, or null if the header has none. */
  @Nullable public byte[] value() {
    return value == null ? null : value.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Header)) return false;
    Header other = (Header) o;
    return name.equals(other.name) && Arrays.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return 31 * name.hashCode() + Arrays.hashCode(value);
  }

  @Override
  public String toString() {
    return "Header{" + name + (value == null ? "" : ", " + value.length + " bytes") + "}";
  }
}
