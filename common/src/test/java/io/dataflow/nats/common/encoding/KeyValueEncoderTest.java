package io.dataflow.nats.common.encoding;

import static org.junit.jupiter.api.Assertions.*;

import io.dataflow.nats.common.EncodingException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

/** Tests for the key/value payload encoding table. */
class KeyValueEncoderTest {

  private static byte[] utf8(String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }

  @Test
  void testKeyAndValue() {
    assertArrayEquals(utf8("k:v"), KeyValueEncoder.encode(utf8("k"), utf8("v")));
  }

  @Test
  void testKeyOnlyIsDeletionMarker() {
    assertArrayEquals(utf8("k:"), KeyValueEncoder.encode(utf8("k"), null));
  }

  @Test
  void testValueOnlyIsRawBytes() {
    byte[] value = {(byte) 0xff, 0x00, (byte) 0xfe};
    byte[] payload = KeyValueEncoder.encode(null, value);

    assertArrayEquals(value, payload);
    assertNotSame(value, payload);
  }

  @Test
  void testNeitherKeyNorValue() {
    EncodingException e =
        assertThrows(EncodingException.class, () -> KeyValueEncoder.encode(null, null));
    assertTrue(e.getMessage().contains("Both key and value"));
  }

  @Test
  void testNonUtf8KeyRejected() {
    byte[] badKey = {(byte) 0xc3, 0x28};
    EncodingException e =
        assertThrows(EncodingException.class, () -> KeyValueEncoder.encode(badKey, utf8("v")));
    assertTrue(e.getMessage().startsWith("Key"));
  }

  @Test
  void testNonUtf8ValueRejectedWhenKeyPresent() {
    byte[] badValue = {(byte) 0xe2, (byte) 0x82};
    EncodingException e =
        assertThrows(EncodingException.class, () -> KeyValueEncoder.encode(utf8("k"), badValue));
    assertTrue(e.getMessage().startsWith("Value"));
  }

  @Test
  void testMultibyteTextPreserved() {
    assertArrayEquals(utf8("clé:värde"), KeyValueEncoder.encode(utf8("clé"), utf8("värde")));
  }

  @Test
  void testEmptyKeyAndValue() {
    assertArrayEquals(utf8(":"), KeyValueEncoder.encode(new byte[0], new byte[0]));
  }

  @Test
  void testDecodeUtf8() {
    assertEquals("abc", KeyValueEncoder.decodeUtf8(utf8("abc"), "Header"));
    assertThrows(
        EncodingException.class, () -> KeyValueEncoder.decodeUtf8(new byte[] {(byte) 0x80}, "x"));
  }
}
