package io.dataflow.nats.common.transport;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class HeaderTest {

  @Test
  void testValueIsCopied() {
    byte[] raw = "json".getBytes(StandardCharsets.UTF_8);
    Header header = Header.of("content-type", raw);
    raw[0] = 'X';

    assertArrayEquals("json".getBytes(StandardCharsets.UTF_8), header.value());
  }

  @Test
  void testAbsentValue() {
    Header header = Header.of("trace", null);

    assertEquals("trace", header.name());
    assertNull(header.value());
  }

  @Test
  void testEquality() {
    assertEquals(Header.of("a", new byte[] {1}), Header.of("a", new byte[] {1}));
    assertNotEquals(Header.of("a", new byte[] {1}), Header.of("a", null));
  }

  @Test
  void testNullNameRejected() {
    assertThrows(NullPointerException.class, () -> Header.of(null, null));
  }
}
