package io.dataflow.nats.output;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import io.dataflow.nats.common.AcknowledgmentException;
import io.dataflow.nats.common.PublishException;
import io.dataflow.nats.session.NatsSession;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/** Tests for publishing buffered records with per-record acknowledgment. */
@ExtendWith(MockitoExtension.class)
public class BatchPublisherTest {

  @Mock private NatsSession session;

  private BatchPublisher publisher;
  private RecordBuffer buffer;
  private BufferedRecord first;
  private BufferedRecord second;

  @BeforeEach
  public void setUp() {
    publisher = new BatchPublisher("out", 100);
    buffer = new RecordBuffer();
    first = record(0, "a");
    second = record(1, "bb");
    buffer.append(first);
    buffer.append(second);
  }

  @Test
  public void testPublishesInOrderAndClearsBuffer() {
    when(session.publishDurable(eq("out"), any(Headers.class), any(byte[].class)))
        .thenReturn(CompletableFuture.completedFuture(10L))
        .thenReturn(CompletableFuture.completedFuture(11L));

    assertEquals(3L, buffer.totalBytes());
    assertEquals(2, publisher.flush(session, buffer));

    InOrder inOrder = inOrder(session);
    inOrder.verify(session).publishDurable("out", first.headers, first.payload);
    inOrder.verify(session).publishDurable("out", second.headers, second.payload);
    assertEquals(0, buffer.size());
    assertEquals(0L, buffer.totalBytes());
  }

  @Test
  public void testNextRecordWaitsForPreviousAcknowledgment() {
    CompletableFuture<Long> pending = new CompletableFuture<>();
    when(session.publishDurable(eq("out"), any(Headers.class), any(byte[].class)))
        .thenReturn(pending);

    assertThrows(AcknowledgmentException.class, () -> publisher.flush(session, buffer));

    verify(session, times(1)).publishDurable(any(), any(), any());
    assertEquals(0, buffer.size());
  }

  @Test
  public void testRejectedPublishStopsFlush() {
    CompletableFuture<Long> rejected = new CompletableFuture<>();
    rejected.completeExceptionally(new IOException("wrong last sequence"));
    when(session.publishDurable(eq("out"), any(Headers.class), any(byte[].class)))
        .thenReturn(rejected);

    PublishException exception =
        assertThrows(PublishException.class, () -> publisher.flush(session, buffer));

    assertFalse(exception instanceof AcknowledgmentException);
    assertEquals(0, exception.getAcknowledgedCount());
    assertTrue(exception.getCause() instanceof IOException);
    verify(session, times(1)).publishDurable(any(), any(), any());
  }

  @Test
  public void testClientTimeoutIsAcknowledgmentFailure() {
    CompletableFuture<Long> timedOut = new CompletableFuture<>();
    timedOut.completeExceptionally(new TimeoutException("no response"));
    when(session.publishDurable(eq("out"), any(Headers.class), any(byte[].class)))
        .thenReturn(CompletableFuture.completedFuture(1L))
        .thenReturn(timedOut);

    AcknowledgmentException exception =
        assertThrows(AcknowledgmentException.class, () -> publisher.flush(session, buffer));

    assertEquals(1, exception.getAcknowledgedCount());
  }

  @Test
  public void testSynchronousSendFailureIsPublishFailure() {
    when(session.publishDurable(eq("out"), any(Headers.class), any(byte[].class)))
        .thenThrow(new IllegalStateException("Connection closed"));

    PublishException exception =
        assertThrows(PublishException.class, () -> publisher.flush(session, buffer));

    assertEquals(0, exception.getAcknowledgedCount());
    assertEquals(0, buffer.size());
  }

  @Test
  public void testEmptyBufferPublishesNothing() {
    buffer.clear();

    assertEquals(0, publisher.flush(session, buffer));
    verifyNoInteractions(session);
  }

  private static BufferedRecord record(long substep, String payload) {
    OutputPosition position = new OutputPosition(3, substep);
    return new BufferedRecord(
        position,
        payload.getBytes(StandardCharsets.UTF_8),
        RecordHeaders.build(
            Collections.<String, String>emptyMap(),
            Collections.emptyList(),
            position));
  }
}
