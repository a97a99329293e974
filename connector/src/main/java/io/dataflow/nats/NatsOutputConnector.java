package io.dataflow.nats;

import io.dataflow.nats.common.ConfigurationException;
import io.dataflow.nats.common.transport.OutputEndpoint;
import io.dataflow.nats.output.NatsFtOutputEndpoint;
import io.dataflow.nats.output.NatsOutputEndpoint;
import io.dataflow.nats.session.NatsSessionFactory;
import java.util.Objects;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The main entry point for creating NATS output endpoints.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * NatsOutputConnector connector = NatsOutputConnector.builder().build();
 *
 * OutputEndpoint endpoint = connector.createOutputEndpoint(config, true);
 * endpoint.connect(errorCallback);
 * }</pre>
 */
public class NatsOutputConnector {
  private static final Logger logger = LoggerFactory.getLogger(NatsOutputConnector.class);

  /** The current version of the connector. */
  public static final String VERSION = "0.1.0";

  private final NatsSessionFactory sessionFactory;

  /** Creates a connector with the default session factory. */
  public NatsOutputConnector() {
    this(new NatsSessionFactory());
  }

  /**
   * Creates a connector with a custom session factory.
   *
   * <p>This constructor is package-private and intended for use by {@link
   * NatsOutputConnectorBuilder}.
   */
  NatsOutputConnector(@Nonnull NatsSessionFactory sessionFactory) {
    this.sessionFactory = sessionFactory;
  }

  @Nonnull
  public static NatsOutputConnectorBuilder builder() {
    return new NatsOutputConnectorBuilder();
  }

  /**
   * Creates an output endpoint.
   *
   * @param config the output configuration
   * @param faultTolerant whether the engine requires exactly-once resume
   * @return a fault-tolerant JetStream endpoint, or a core NATS endpoint
   * @throws ConfigurationException if a fault-tolerant endpoint is requested without a JetStream
   *     section that enables fault tolerance
   */
  @Nonnull
  public OutputEndpoint createOutputEndpoint(
      @Nonnull NatsOutputConfig config, boolean faultTolerant) {
    Objects.requireNonNull(config, "config cannot be null");
    if (faultTolerant) {
      return createFaultTolerantEndpoint(config);
    }
    logger.debug("Creating core NATS output endpoint for {}", config.subject());
    return new NatsOutputEndpoint(config, sessionFactory);
  }

  /**
   * Creates a fault-tolerant output endpoint.
   *
   * @param config the output configuration, with JetStream enabled
   * @return the endpoint
   * @throws ConfigurationException if the JetStream section is missing or disables fault tolerance
   */
  @Nonnull
  public NatsFtOutputEndpoint createFaultTolerantEndpoint(@Nonnull NatsOutputConfig config) {
    Objects.requireNonNull(config, "config cannot be null");
    logger.debug("Creating fault-tolerant output endpoint for {}", config.subject());
    return new NatsFtOutputEndpoint(config, sessionFactory);
  }
}
