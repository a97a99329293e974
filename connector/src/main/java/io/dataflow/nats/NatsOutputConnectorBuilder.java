package io.dataflow.nats;

import io.dataflow.nats.session.NatsSessionFactory;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * Builder for {@link NatsOutputConnector} instances.
 *
 * @see NatsOutputConnector#builder()
 */
public final class NatsOutputConnectorBuilder {
  private Optional<NatsSessionFactory> sessionFactory = Optional.empty();

  NatsOutputConnectorBuilder() {}

  /**
   * Sets a custom session factory.
   *
   * <p>This is primarily used for testing.
   *
   * @param sessionFactory the session factory to use
   * @return this builder for method chaining
   */
  @Nonnull
  NatsOutputConnectorBuilder sessionFactory(@Nonnull NatsSessionFactory sessionFactory) {
    this.sessionFactory =
        Optional.of(Objects.requireNonNull(sessionFactory, "sessionFactory cannot be null"));
    return this;
  }

  @Nonnull
  public NatsOutputConnector build() {
    return new NatsOutputConnector(sessionFactory.orElseGet(NatsSessionFactory::new));
  }
}
