package io.dataflow.nats.output;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;

import io.dataflow.nats.ConnectOptions;
import io.dataflow.nats.JetStreamConfig;
import io.dataflow.nats.MockedJetStreamServer;
import io.dataflow.nats.NatsOutputConfig;
import io.dataflow.nats.common.transport.AsyncErrorCallback;
import io.dataflow.nats.common.transport.Header;
import io.dataflow.nats.session.NatsSessionFactory;
import io.dataflow.nats.session.StoredMessage;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Base test class for output endpoint tests.
 *
 * <p>Wires a mocked session factory to an in-memory JetStream server.
 */
@ExtendWith(MockitoExtension.class)
public abstract class BaseOutputTest {

  protected static final String SUBJECT = "orders.out";
  protected static final String STREAM = "ORDERS_OUT";

  protected MockedJetStreamServer server;
  protected NatsSessionFactory sessionFactory;
  protected List<Throwable> asyncErrors;
  protected AsyncErrorCallback errorCallback;

  @BeforeEach
  public void setUp() throws Exception {
    server = new MockedJetStreamServer();
    asyncErrors = new ArrayList<>();
    errorCallback = (fatal, error) -> asyncErrors.add(error);

    sessionFactory = mock(NatsSessionFactory.class);
    lenient()
        .when(sessionFactory.open(any(ConnectOptions.class), any(AsyncErrorCallback.class)))
        .thenAnswer(invocation -> server.openSession());
  }

  @AfterEach
  public void tearDown() {
    if (server != null) {
      server.destroy();
    }
    server = null;
    sessionFactory = null;
  }

  protected JetStreamConfig.JetStreamConfigBuilder jetStream() {
    return JetStreamConfig.builder(STREAM).setPublishAckTimeoutMs(200);
  }

  protected NatsOutputConfig config() {
    return NatsOutputConfig.builder(SUBJECT).setJetStream(jetStream().build()).build();
  }

  protected NatsFtOutputEndpoint connectedEndpoint() {
    return connectedEndpoint(config());
  }

  protected NatsFtOutputEndpoint connectedEndpoint(NatsOutputConfig config) {
    NatsFtOutputEndpoint endpoint = new NatsFtOutputEndpoint(config, sessionFactory);
    endpoint.connect(errorCallback);
    return endpoint;
  }

  protected static byte[] utf8(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }

  protected static Header header(String name, String value) {
    return Header.of(name, value == null ? null : utf8(value));
  }

  protected static String payload(StoredMessage message) {
    return new String(message.data(), StandardCharsets.UTF_8);
  }

  protected static String step(StoredMessage message) {
    return message.headers().getFirst(RecordHeaders.STEP_HEADER);
  }

  protected static String substep(StoredMessage message) {
    return message.headers().getFirst(RecordHeaders.SUBSTEP_HEADER);
  }
}
