package io.dataflow.nats.output;

import io.dataflow.nats.common.EncodingException;
import io.dataflow.nats.common.encoding.KeyValueEncoder;
import io.dataflow.nats.common.transport.Header;
import io.nats.client.impl.Headers;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Builds the NATS headers of an output record.
 *
 * <p>Layers are applied in order: statically configured headers, caller headers (replacing static
 * ones of the same name), then the reserved position headers. Reserved headers always win.
 *
 * <p>NATS carries header names and values as printable ASCII. A caller value must decode as UTF-8
 * and must then be printable ASCII as well; anything else is rejected with {@link
 * EncodingException}.
 */
public final class RecordHeaders {

  /** Header carrying the record's step as unsigned decimal text. */
  public static final String STEP_HEADER = "Output-Step";

  /** Header carrying the record's substep as unsigned decimal text. */
  public static final String SUBSTEP_HEADER = "Output-Substep";

  private RecordHeaders() {}

  /**
   * Builds a header set.
   *
   * @param staticHeaders headers configured for every record
   * @param callerHeaders per-record headers; entries without a value are skipped
   * @param position the record position, or null to omit the reserved headers
   * @return the headers
   * @throws EncodingException if a caller value is not valid UTF-8, or a name or value is not a
   *     legal NATS header (printable ASCII)
   */
  public static Headers build(
      Map<String, String> staticHeaders,
      List<Header> callerHeaders,
      @Nullable OutputPosition position) {
    Headers headers = new Headers();
    for (Map.Entry<String, String> entry : staticHeaders.entrySet()) {
      put(headers, entry.getKey(), entry.getValue());
    }
    for (Header header : callerHeaders) {
      byte[] value = header.value();
      if (value == null) {
        continue;
      }
      String text = KeyValueEncoder.decodeUtf8(value, "Header '" + header.name() + "'");
      put(headers, header.name(), text);
    }
    if (position != null) {
      headers.put(STEP_HEADER, Long.toUnsignedString(position.step()));
      headers.put(SUBSTEP_HEADER, Long.toUnsignedString(position.substep()));
    }
    return headers;
  }

  /**
   * Reads the step from a record's headers.
   *
   * @param headers the record headers, possibly null
   * @return the step, or null if the header is absent or not an unsigned decimal number
   */
  @Nullable public static Long readStep(@Nullable Headers headers) {
    if (headers == null) {
      return null;
    }
    String text = headers.getFirst(STEP_HEADER);
    if (text == null) {
      return null;
    }
    try {
      return Long.parseUnsignedLong(text.trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static void put(Headers headers, String name, String value) {
    try {
      headers.put(name, value);
    } catch (IllegalArgumentException e) {
      throw new EncodingException(
          "Invalid header '"
              + name
              + "': NATS header names and values must be printable ASCII ("
              + e.getMessage()
              + ")",
          e);
    }
  }
}
