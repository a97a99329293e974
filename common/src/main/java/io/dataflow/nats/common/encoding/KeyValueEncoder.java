package io.dataflow.nats.common.encoding;

import io.dataflow.nats.common.EncodingException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Turns an optional key and an optional value into a single record payload.
 *
 * <table>
 *   <caption>Encoding rules</caption>
 *   <tr><th>key</th><th>value</th><th>payload</th></tr>
 *   <tr><td>present</td><td>present</td><td>{@code "<key>:<value>"}</td></tr>
 *   <tr><td>present</td><td>absent</td><td>{@code "<key>:"} (deletion marker)</td></tr>
 *   <tr><td>absent</td><td>present</td><td>the value bytes, unchanged</td></tr>
 *   <tr><td>absent</td><td>absent</td><td>{@link EncodingException}</td></tr>
 * </table>
 *
 * <p>Whenever the key is present both parts are embedded as text and must be valid UTF-8.
 */
public final class KeyValueEncoder {

  private static final char SEPARATOR = ':';

  private KeyValueEncoder() {}

  /**
   * Encodes a key/value pair.
   *
   * @param key the key, or null
   * @param value the value, or null
   * @return the payload bytes
   * @throws EncodingException if both are null or a text part is not valid UTF-8
   */
  @Nonnull
  public static byte[] encode(@Nullable byte[] key, @Nullable byte[] value) {
    if (key == null && value == null) {
      throw new EncodingException("Both key and value cannot be null");
    }
    if (key == null) {
      return value.clone();
    }
    StringBuilder sb = new StringBuilder();
    sb.append(decodeUtf8(key, "Key")).append(SEPARATOR);
    if (value != null) {
      sb.append(decodeUtf8(value, "Value"));
    }
    return sb.toString().getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Strictly decodes UTF-8, rejecting malformed input instead of substituting replacement
   * characters.
   *
   * @param bytes the bytes to decode
   * @param what name of the decoded item, used in the error message
   * @return the decoded text
   * @throws EncodingException if the bytes are not valid UTF-8
   */
  @Nonnull
  public static String decodeUtf8(@Nonnull byte[] bytes, @Nonnull String what) {
    try {
      return StandardCharsets.UTF_8
          .newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes))
          .toString();
    } catch (CharacterCodingException e) {
      throw new EncodingException(what + " is not valid UTF-8", e);
    }
  }
}
