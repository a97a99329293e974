package io.dataflow.nats.output;

import static org.junit.jupiter.api.Assertions.*;

import io.dataflow.nats.NatsOutputConfig;
import io.dataflow.nats.common.EncodingException;
import io.dataflow.nats.common.ProtocolSequenceException;
import io.dataflow.nats.session.StoredMessage;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for the core NATS endpoint without fault tolerance. */
public class NatsOutputEndpointTest extends BaseOutputTest {

  private NatsOutputConfig plainConfig() {
    return NatsOutputConfig.builder(SUBJECT).addHeader("source", "engine").build();
  }

  @Test
  public void testBatchesAreNoOpsInAnyState() {
    NatsOutputEndpoint endpoint = new NatsOutputEndpoint(plainConfig(), sessionFactory);

    endpoint.batchStart(42);
    endpoint.batchEnd();
    endpoint.batchEnd();
    endpoint.connect(errorCallback);
    endpoint.batchStart(0);
    endpoint.batchStart(0);
    endpoint.batchEnd();

    assertFalse(endpoint.isFaultTolerant());
    assertEquals(1_000_000, endpoint.maxBufferSizeBytes());
    assertTrue(server.corePublished().isEmpty());
  }

  @Test
  public void testPushBeforeConnectFails() {
    NatsOutputEndpoint endpoint = new NatsOutputEndpoint(plainConfig(), sessionFactory);

    assertThrows(ProtocolSequenceException.class, () -> endpoint.pushBuffer(utf8("a")));
    assertThrows(
        ProtocolSequenceException.class,
        () -> endpoint.pushKey(utf8("k"), utf8("v"), Collections.emptyList()));
  }

  @Test
  public void testPushPublishesImmediately() {
    NatsOutputEndpoint endpoint = new NatsOutputEndpoint(plainConfig(), sessionFactory);
    endpoint.connect(errorCallback);

    endpoint.pushBuffer(utf8("a"));
    assertEquals(1, server.corePublished().size());
    endpoint.pushKey(utf8("k"), utf8("v"), Collections.singletonList(header("trace", "t1")));

    List<StoredMessage> published = server.corePublished();
    assertEquals(2, published.size());
    assertEquals(SUBJECT, published.get(0).subject());
    assertEquals("a", payload(published.get(0)));
    assertEquals("k:v", payload(published.get(1)));
    assertEquals("engine", published.get(1).headers().getFirst("source"));
    assertEquals("t1", published.get(1).headers().getFirst("trace"));
    assertFalse(published.get(1).headers().containsKey(RecordHeaders.STEP_HEADER));
    assertFalse(published.get(1).headers().containsKey(RecordHeaders.SUBSTEP_HEADER));
  }

  @Test
  public void testEncodingErrorsPropagate() {
    NatsOutputEndpoint endpoint = new NatsOutputEndpoint(plainConfig(), sessionFactory);
    endpoint.connect(errorCallback);

    assertThrows(
        EncodingException.class, () -> endpoint.pushKey(null, null, Collections.emptyList()));
    assertTrue(server.corePublished().isEmpty());
  }

  @Test
  public void testDoesNotTouchJetStream() {
    NatsOutputEndpoint endpoint = new NatsOutputEndpoint(plainConfig(), sessionFactory);
    endpoint.connect(errorCallback);
    endpoint.pushBuffer(utf8("a"));

    assertFalse(server.stream(STREAM).isPresent());
    assertEquals(0, server.createStreamCalls());
  }

  @Test
  public void testConnectTwiceFailsAndCloseAllowsReconnect() {
    NatsOutputEndpoint endpoint = new NatsOutputEndpoint(plainConfig(), sessionFactory);
    endpoint.connect(errorCallback);

    assertThrows(ProtocolSequenceException.class, () -> endpoint.connect(errorCallback));

    endpoint.close();
    endpoint.close();
    assertTrue(server.allSessionsClosed());
    assertThrows(ProtocolSequenceException.class, () -> endpoint.pushBuffer(utf8("a")));

    endpoint.connect(errorCallback);
    endpoint.pushBuffer(utf8("a"));
    assertEquals(1, server.corePublished().size());
  }
}
