package io.dataflow.nats.output;

import static org.junit.jupiter.api.Assertions.*;

import io.dataflow.nats.common.EncodingException;
import io.dataflow.nats.common.transport.Header;
import io.nats.client.impl.Headers;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link RecordHeaders}. */
public class RecordHeadersTest {

  @Test
  public void testStaticHeadersOnly() {
    Map<String, String> staticHeaders = new LinkedHashMap<>();
    staticHeaders.put("a", "1");
    staticHeaders.put("b", "2");

    Headers headers = RecordHeaders.build(staticHeaders, Collections.emptyList(), null);

    assertEquals("1", headers.getFirst("a"));
    assertEquals("2", headers.getFirst("b"));
    assertFalse(headers.containsKey(RecordHeaders.STEP_HEADER));
    assertFalse(headers.containsKey(RecordHeaders.SUBSTEP_HEADER));
  }

  @Test
  public void testCallerHeadersOverrideStatic() {
    Map<String, String> staticHeaders = Collections.singletonMap("a", "static");

    Headers headers =
        RecordHeaders.build(
            staticHeaders,
            Arrays.asList(
                Header.of("a", bytes("caller")), Header.of("none", null), Header.of("c", bytes("3"))),
            null);

    assertEquals(Collections.singletonList("caller"), headers.get("a"));
    assertFalse(headers.containsKey("none"));
    assertEquals("3", headers.getFirst("c"));
  }

  @Test
  public void testReservedHeadersCannotBeOverridden() {
    Map<String, String> staticHeaders =
        Collections.singletonMap(RecordHeaders.SUBSTEP_HEADER, "static");

    Headers headers =
        RecordHeaders.build(
            staticHeaders,
            Collections.singletonList(Header.of(RecordHeaders.STEP_HEADER, bytes("caller"))),
            new OutputPosition(12, 3));

    assertEquals(Collections.singletonList("12"), headers.get(RecordHeaders.STEP_HEADER));
    assertEquals(Collections.singletonList("3"), headers.get(RecordHeaders.SUBSTEP_HEADER));
  }

  @Test
  public void testInvalidHeaders() {
    assertThrows(
        EncodingException.class,
        () ->
            RecordHeaders.build(
                Collections.<String, String>emptyMap(),
                Collections.singletonList(Header.of("k", new byte[] {(byte) 0xc0, (byte) 0x80})),
                null));
    assertThrows(
        EncodingException.class,
        () ->
            RecordHeaders.build(
                Collections.singletonMap("with space", "v"), Collections.emptyList(), null));
    assertThrows(
        EncodingException.class,
        () ->
            RecordHeaders.build(
                Collections.<String, String>emptyMap(),
                Collections.singletonList(Header.of("", bytes("v"))),
                null));
  }

  @Test
  public void testNonAsciiUtf8ValueIsRejectedWithAsciiHint() {
    EncodingException exception =
        assertThrows(
            EncodingException.class,
            () ->
                RecordHeaders.build(
                    Collections.<String, String>emptyMap(),
                    Collections.singletonList(Header.of("city", bytes("Zürich"))),
                    null));

    assertTrue(exception.getMessage().contains("'city'"));
    assertTrue(exception.getMessage().contains("printable ASCII"));
  }

  @Test
  public void testReadStep() {
    Headers headers = new Headers();
    assertNull(RecordHeaders.readStep(null));
    assertNull(RecordHeaders.readStep(headers));

    headers.put(RecordHeaders.STEP_HEADER, "41");
    assertEquals(Long.valueOf(41), RecordHeaders.readStep(headers));

    headers.put(RecordHeaders.STEP_HEADER, "18446744073709551615");
    assertEquals(Long.valueOf(-1L), RecordHeaders.readStep(headers));

    headers.put(RecordHeaders.STEP_HEADER, "4x");
    assertNull(RecordHeaders.readStep(headers));
  }

  private static byte[] bytes(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }
}
